package com.whyline.engine.instrument;

import com.whyline.engine.instrument.JdtSourceParser.SourceParseException;
import org.eclipse.jdt.core.compiler.IProblem;
import org.eclipse.jdt.core.dom.CompilationUnit;
import org.eclipse.jdt.core.dom.rewrite.ASTRewrite;
import org.eclipse.jface.text.BadLocationException;
import org.eclipse.jface.text.Document;
import org.eclipse.text.edits.MalformedTreeException;
import org.eclipse.text.edits.TextEdit;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Rewrites Java source so that running it records trace events.
 *
 * Input is either a compilation unit or a plain statement script. Scripts are wrapped
 * into a synthetic class first. Inserted calls carry the input line of the construct
 * they observe as a literal, so events report input lines however the rewritten text
 * is laid out.
 */
public class SourceInstrumenter {

    private final JdtSourceParser parser = new JdtSourceParser();

    /** Instrumented text of {@code source}. */
    public String instrumentSource(String source, String fileName) {
        return instrument(source, fileName).text();
    }

    public InstrumentedSource instrument(String source, String fileName) {
        return instrument(prepare(source, fileName, Map.of()));
    }

    public InstrumentedSource instrument(PreparedSource prepared) {
        InstrumentingVisitor visitor = new InstrumentingVisitor(prepared.unit(), prepared.normalizedText(),
            prepared.fileName(), prepared.scriptClassName(), prepared.bindingNames());
        prepared.unit().accept(visitor);
        String text = apply(visitor.rewrite(), prepared.normalizedText(), prepared.fileName());

        List<IProblem> errors = JdtSourceParser.errors(parser.parse(text));
        if (!errors.isEmpty()) {
            IProblem first = errors.get(0);
            throw new InstrumentationFinalizeException(prepared.fileName() + ":" + first.getSourceLineNumber()
                + ": instrumented source does not parse: " + first.getMessage());
        }
        return new InstrumentedSource(prepared, text, visitor.probeCount());
    }

    /**
     * Parses {@code source}, deciding between compilation unit and script.
     *
     * @param scriptBindingTypes input bindings declared on a script class, name to Java type
     * @throws SourceParseException if the text is neither
     */
    public PreparedSource prepare(String source, String fileName, Map<String, String> scriptBindingTypes) {
        CompilationUnit unit = parser.parse(source);
        List<IProblem> errors = JdtSourceParser.errors(unit);
        if (errors.isEmpty() && !unit.types().isEmpty()) {
            String normalized = BlockBodyNormalizer.normalize(source, unit);
            return new PreparedSource(fileName, source, normalized, parser.parseStrict(normalized, fileName),
                false, null, List.of());
        }

        String className = ScriptWrapper.classNameFor(fileName);
        String wrapped = ScriptWrapper.wrap(source, className, scriptBindingTypes);
        CompilationUnit scriptUnit = parser.parse(wrapped);
        List<IProblem> scriptErrors = JdtSourceParser.errors(scriptUnit);
        if (!scriptErrors.isEmpty()) {
            // a unit that declares types failed as a unit; report that failure
            throw SourceParseException.from(fileName, unit.types().isEmpty() ? scriptErrors : errors);
        }
        String normalized = BlockBodyNormalizer.normalize(wrapped, scriptUnit);
        return new PreparedSource(fileName, wrapped, normalized, parser.parseStrict(normalized, fileName),
            true, className, new ArrayList<>(scriptBindingTypes.keySet()));
    }

    private static String apply(ASTRewrite rewrite, String source, String fileName) {
        Document document = new Document(source);
        try {
            TextEdit edits = rewrite.rewriteAST(document, JdtSourceParser.compilerOptions());
            edits.apply(document);
        } catch (BadLocationException | MalformedTreeException | IllegalArgumentException e) {
            throw new InstrumentationFinalizeException("Could not finalize instrumented source of " + fileName, e);
        }
        return document.get();
    }

    /** The rewritten tree could not be turned back into valid source text. */
    public static class InstrumentationFinalizeException extends RuntimeException {
        public InstrumentationFinalizeException(String message) { super(message); }
        public InstrumentationFinalizeException(String message, Throwable cause) { super(message, cause); }
    }
}
