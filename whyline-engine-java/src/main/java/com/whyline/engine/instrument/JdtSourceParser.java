package com.whyline.engine.instrument;

import org.eclipse.jdt.core.JavaCore;
import org.eclipse.jdt.core.compiler.IProblem;
import org.eclipse.jdt.core.dom.AST;
import org.eclipse.jdt.core.dom.ASTParser;
import org.eclipse.jdt.core.dom.CompilationUnit;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Wrapper around Eclipse JDT's ASTParser.
 * Parses a single Java 17 source text without binding resolution: the rewriter works on
 * syntax only and never needs the program's classpath.
 */
public class JdtSourceParser {

    /** Parses {@code source}; syntax problems are left on the returned unit. */
    public CompilationUnit parse(String source) {
        ASTParser parser = ASTParser.newParser(AST.JLS17);
        parser.setKind(ASTParser.K_COMPILATION_UNIT);
        parser.setSource(source.toCharArray());
        parser.setCompilerOptions(compilerOptions());
        parser.setResolveBindings(false);
        return (CompilationUnit) parser.createAST(null);
    }

    /**
     * Parses {@code source} and rejects it if it has any syntax error.
     *
     * @throws SourceParseException carrying the first error's line
     */
    public CompilationUnit parseStrict(String source, String fileName) {
        CompilationUnit unit = parse(source);
        List<IProblem> errors = errors(unit);
        if (!errors.isEmpty()) {
            throw SourceParseException.from(fileName, errors);
        }
        return unit;
    }

    static List<IProblem> errors(CompilationUnit unit) {
        return Arrays.stream(unit.getProblems())
            .filter(IProblem::isError)
            .collect(Collectors.toList());
    }

    static Map<String, String> compilerOptions() {
        Map<String, String> options = JavaCore.getOptions();
        JavaCore.setComplianceOptions(JavaCore.VERSION_17, options);
        return options;
    }

    /** The source text is not syntactically valid Java. */
    public static class SourceParseException extends RuntimeException {
        private final String fileName;
        private final int line;

        public SourceParseException(String fileName, int line, String message) {
            super(fileName + ":" + line + ": " + message);
            this.fileName = fileName;
            this.line = line;
        }

        static SourceParseException from(String fileName, List<IProblem> errors) {
            IProblem first = errors.get(0);
            String message = errors.size() == 1
                ? first.getMessage()
                : first.getMessage() + " (and " + (errors.size() - 1) + " more)";
            return new SourceParseException(fileName, first.getSourceLineNumber(), message);
        }

        public String getFileName() { return fileName; }
        public int getLine() { return line; }
    }
}
