package com.whyline.engine.instrument;

import org.eclipse.jdt.core.dom.AbstractTypeDeclaration;
import org.eclipse.jdt.core.dom.CompilationUnit;
import org.eclipse.jdt.core.dom.MethodDeclaration;
import org.eclipse.jdt.core.dom.Modifier;

import java.util.ArrayList;
import java.util.List;

/**
 * A program ready for instrumentation: scripts already wrapped into a class, bodies
 * braced, parsed without errors.
 *
 * @param fileName       name recorded in events
 * @param originalText   the runnable, uninstrumented program (scripts wrapped)
 * @param normalizedText {@code originalText} with braced bodies, same line numbering
 * @param unit           parse of {@code normalizedText}
 * @param script         whether the input was a statement script
 * @param scriptClassName synthetic class wrapping the script, {@code null} otherwise
 * @param bindingNames   names of the script's input bindings
 */
public record PreparedSource(
        String fileName,
        String originalText,
        String normalizedText,
        CompilationUnit unit,
        boolean script,
        String scriptClassName,
        List<String> bindingNames) {

    public String packageName() {
        return unit.getPackage() == null ? "" : unit.getPackage().getName().getFullyQualifiedName();
    }

    public List<String> topLevelTypeNames() {
        List<String> names = new ArrayList<>();
        for (Object type : unit.types()) {
            names.add(((AbstractTypeDeclaration) type).getName().getIdentifier());
        }
        return names;
    }

    /** Binary name of the type whose {@code main} runs the program. */
    public String entryTypeName() {
        AbstractTypeDeclaration entry = null;
        for (Object t : unit.types()) {
            AbstractTypeDeclaration type = (AbstractTypeDeclaration) t;
            if (declaresMain(type)) {
                entry = type;
                break;
            }
        }
        if (entry == null) entry = primaryType();
        return entry == null ? null : qualify(entry.getName().getIdentifier());
    }

    /** Path javac expects for this unit, e.g. {@code com/acme/Calc.java}. */
    public String compilationUnitPath() {
        AbstractTypeDeclaration primary = primaryType();
        String simpleName = primary == null ? "package-info" : primary.getName().getIdentifier();
        String pkg = packageName();
        return (pkg.isEmpty() ? "" : pkg.replace('.', '/') + "/") + simpleName + ".java";
    }

    private AbstractTypeDeclaration primaryType() {
        AbstractTypeDeclaration first = null;
        for (Object t : unit.types()) {
            AbstractTypeDeclaration type = (AbstractTypeDeclaration) t;
            if (Modifier.isPublic(type.getModifiers())) return type;
            if (first == null) first = type;
        }
        return first;
    }

    private String qualify(String simpleName) {
        String pkg = packageName();
        return pkg.isEmpty() ? simpleName : pkg + "." + simpleName;
    }

    private static boolean declaresMain(AbstractTypeDeclaration type) {
        for (Object declaration : type.bodyDeclarations()) {
            if (declaration instanceof MethodDeclaration method
                && method.getName().getIdentifier().equals("main")
                && Modifier.isStatic(method.getModifiers())
                && method.parameters().size() == 1) {
                return true;
            }
        }
        return false;
    }
}
