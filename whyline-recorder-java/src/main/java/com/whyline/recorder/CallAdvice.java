package com.whyline.recorder;

import net.bytebuddy.asm.Advice;

/**
 * ByteBuddy advice woven into compiled program classes to emit a {@code call} event on
 * every method entry. Inlined into foreign classes, so it only calls public API.
 */
public class CallAdvice {

    @Advice.OnMethodEnter
    public static void onEnter(
            @Advice.Origin Class<?> type,
            @Advice.Origin("#m") String method,
            @Advice.AllArguments(readOnly = true) Object[] args) {
        CallTracing.record(type, method, args);
    }
}
