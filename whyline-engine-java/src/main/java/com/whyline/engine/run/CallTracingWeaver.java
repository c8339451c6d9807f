package com.whyline.engine.run;

import com.whyline.recorder.CallAdvice;
import net.bytebuddy.ByteBuddy;
import net.bytebuddy.asm.Advice;
import net.bytebuddy.description.type.TypeDescription;
import net.bytebuddy.dynamic.ClassFileLocator;
import net.bytebuddy.pool.TypePool;

import java.util.LinkedHashMap;
import java.util.Map;

import static net.bytebuddy.matcher.ElementMatchers.*;

/**
 * Weaves {@link CallAdvice} into compiled program classes so that every method entry
 * also produces a bytecode-level {@code call} event. Constructors, abstract, native and
 * synthetic methods (lambda bodies among them) are left alone.
 */
public class CallTracingWeaver {

    public Map<String, byte[]> weave(Map<String, byte[]> classes, ClassLoader dependencies) {
        ClassFileLocator locator = new ClassFileLocator.Compound(
            new ClassFileLocator.Simple(classes),
            ClassFileLocator.ForClassLoader.of(dependencies));
        TypePool pool = TypePool.Default.of(locator);

        Map<String, byte[]> woven = new LinkedHashMap<>();
        for (Map.Entry<String, byte[]> entry : classes.entrySet()) {
            TypeDescription type = pool.describe(entry.getKey()).resolve();
            if (type.isAnnotation()) {
                woven.put(entry.getKey(), entry.getValue());
                continue;
            }
            byte[] bytes = new ByteBuddy()
                .redefine(type, locator)
                .visit(Advice.to(CallAdvice.class).on(
                    isMethod()
                        .and(not(isAbstract()))
                        .and(not(isNative()))
                        .and(not(isSynthetic()))))
                .make()
                .getBytes();
            woven.put(entry.getKey(), bytes);
        }
        return woven;
    }
}
