package com.whyline.engine.instrument;

import java.util.Map;

/**
 * Turns a statement script into a compilable class without moving any statement to
 * another line: leading import and comment lines stay where they are, and the class and
 * {@code main} headers are spliced onto the first statement line.
 *
 * The synthetic class also declares {@code __whylineBindings}, which the instrumented
 * {@code main} fills with its locals on completion, plus one public static field per
 * input binding.
 */
public final class ScriptWrapper {

    public static final String BINDINGS_FIELD = "__whylineBindings";

    private ScriptWrapper() {}

    public static String wrap(String script, String className, Map<String, String> bindingTypes) {
        StringBuilder header = new StringBuilder()
            .append("public class ").append(className).append(" { ")
            .append("public static java.util.Map<String, Object> ").append(BINDINGS_FIELD).append("; ");
        for (Map.Entry<String, String> binding : bindingTypes.entrySet()) {
            header.append("public static ").append(binding.getValue()).append(' ')
                .append(binding.getKey()).append("; ");
        }
        header.append("public static void main(String[] args) throws Throwable { ");

        String[] lines = script.split("\n", -1);
        StringBuilder out = new StringBuilder(script.length() + header.length() + 8);
        boolean opened = false;
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (!opened && !isPreamble(line)) {
                out.append(header);
                opened = true;
            }
            out.append(line);
            if (i < lines.length - 1) out.append('\n');
        }
        if (!opened) out.append('\n').append(header);
        out.append("\n}\n}\n");
        return out.toString();
    }

    /** Class name for a script file: its base name, capitalized, suffixed with "Script". */
    public static String classNameFor(String fileName) {
        String base = fileName == null ? "" : fileName;
        base = base.substring(Math.max(base.lastIndexOf('/'), base.lastIndexOf('\\')) + 1);
        int dot = base.indexOf('.');
        if (dot >= 0) base = base.substring(0, dot);
        StringBuilder name = new StringBuilder();
        for (char c : base.toCharArray()) {
            if (name.length() == 0 ? Character.isJavaIdentifierStart(c) : Character.isJavaIdentifierPart(c)) {
                name.append(name.length() == 0 ? Character.toUpperCase(c) : c);
            }
        }
        return name.length() == 0 ? "WhylineScript" : name + "Script";
    }

    private static boolean isPreamble(String line) {
        String t = line.trim();
        return t.isEmpty() || t.startsWith("import ") || t.startsWith("//");
    }
}
