package com.whyline.engine.instrument;

import com.whyline.recorder.EventKind;
import org.eclipse.jdt.core.dom.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the recorder calls the rewriter inserts. Every call has the shape
 * <pre>
 *   __whyline.frame(self, "local", local, ...).recordEvent(probeId, "File.java", line, "kind", key, value, ...);
 * </pre>
 * Each call gets a fresh probe id. Nodes are created per call: a node may only appear
 * once in the rewritten tree.
 */
final class ProbeCallFactory {

    static final String RECORDER_FIELD = "__whyline";
    static final String RECORDER_TYPE = "com.whyline.recorder.TraceRecorder";

    private final AST ast;
    private final String fileName;
    private int probeCount;

    ProbeCallFactory(AST ast, String fileName) {
        this.ast = ast;
        this.fileName = fileName;
    }

    int probeCount() {
        return probeCount;
    }

    /** {@code private static final TraceRecorder __whyline = TraceRecorder.bind(Type.class);} */
    FieldDeclaration recorderField(String typeName) {
        VariableDeclarationFragment fragment = ast.newVariableDeclarationFragment();
        fragment.setName(ast.newSimpleName(RECORDER_FIELD));
        fragment.setInitializer(bindCall(typeName));
        FieldDeclaration field = ast.newFieldDeclaration(fragment);
        field.setType(ast.newSimpleType(ast.newName(RECORDER_TYPE)));
        field.modifiers().addAll(ast.newModifiers(Modifier.PRIVATE | Modifier.STATIC | Modifier.FINAL));
        return field;
    }

    /** Top-level classes and records carry the recorder field; other types bind inline. */
    static boolean holdsRecorderField(AbstractTypeDeclaration type) {
        return (type instanceof TypeDeclaration t && !t.isInterface()) || type instanceof RecordDeclaration;
    }

    Map<String, Expression> payload() {
        return new LinkedHashMap<>();
    }

    /** A complete recording statement for an event of {@code kind} at {@code line}. */
    ExpressionStatement event(ASTNode at, List<String> locals, int line, EventKind kind, Map<String, Expression> payload) {
        MethodInvocation record = ast.newMethodInvocation();
        record.setExpression(frame(at, locals));
        record.setName(ast.newSimpleName("recordEvent"));
        addProbeArguments(record, line, kind.wireName());
        for (Map.Entry<String, Expression> entry : payload.entrySet()) {
            record.arguments().add(string(entry.getKey()));
            record.arguments().add(entry.getValue());
        }
        return ast.newExpressionStatement(record);
    }

    /** {@code frame(...).recordReturn(probe, file, line, function, value)}, evaluating to {@code value}. */
    MethodInvocation recordReturn(ASTNode at, List<String> locals, int line, String function, Expression value) {
        MethodInvocation record = ast.newMethodInvocation();
        record.setExpression(frame(at, locals));
        record.setName(ast.newSimpleName("recordReturn"));
        addProbeArguments(record, line, function);
        record.arguments().add(value);
        return record;
    }

    /** {@code TraceRecorder.bindings("a", a, ...)}. */
    MethodInvocation bindingsCall(List<String> names) {
        MethodInvocation call = ast.newMethodInvocation();
        call.setExpression(ast.newName(RECORDER_TYPE));
        call.setName(ast.newSimpleName("bindings"));
        addNamePairs(call, names);
        return call;
    }

    /** {@code java.util.List.of("a", "b")}. */
    Expression stringList(List<String> values) {
        MethodInvocation call = ast.newMethodInvocation();
        call.setExpression(ast.newName("java.util.List"));
        call.setName(ast.newSimpleName("of"));
        for (String value : values) call.arguments().add(string(value));
        return call;
    }

    /** {@code java.util.Arrays.asList(new java.lang.Object[]{a, b})}, reading each name. */
    Expression argumentList(List<String> names) {
        ArrayInitializer initializer = ast.newArrayInitializer();
        for (String name : names) initializer.expressions().add(ast.newSimpleName(name));
        ArrayCreation array = ast.newArrayCreation();
        array.setType(ast.newArrayType(ast.newSimpleType(ast.newName("java.lang.Object"))));
        array.setInitializer(initializer);
        MethodInvocation call = ast.newMethodInvocation();
        call.setExpression(ast.newName("java.util.Arrays"));
        call.setName(ast.newSimpleName("asList"));
        call.arguments().add(array);
        return call;
    }

    StringLiteral string(String value) {
        StringLiteral literal = ast.newStringLiteral();
        literal.setLiteralValue(value);
        return literal;
    }

    BooleanLiteral bool(boolean value) {
        return ast.newBooleanLiteral(value);
    }

    private MethodInvocation frame(ASTNode at, List<String> locals) {
        MethodInvocation frame = ast.newMethodInvocation();
        frame.setExpression(recorderReference(at));
        frame.setName(ast.newSimpleName("frame"));
        frame.arguments().add(isInstanceContext(at) ? ast.newThisExpression() : ast.newNullLiteral());
        addNamePairs(frame, locals);
        return frame;
    }

    private void addNamePairs(MethodInvocation call, List<String> names) {
        for (String name : names) {
            call.arguments().add(string(name));
            call.arguments().add(ast.newSimpleName(name));
        }
    }

    private void addProbeArguments(MethodInvocation call, int line, String last) {
        call.arguments().add(ast.newNumberLiteral(Integer.toString(++probeCount)));
        call.arguments().add(string(fileName));
        call.arguments().add(ast.newNumberLiteral(Integer.toString(line)));
        call.arguments().add(string(last));
    }

    private Expression recorderReference(ASTNode at) {
        AbstractTypeDeclaration top = topLevelType(at);
        if (top == null || holdsRecorderField(top)) {
            return ast.newSimpleName(RECORDER_FIELD);
        }
        return bindCall(top.getName().getIdentifier());
    }

    private MethodInvocation bindCall(String typeName) {
        TypeLiteral owner = ast.newTypeLiteral();
        owner.setType(ast.newSimpleType(ast.newSimpleName(typeName)));
        MethodInvocation bind = ast.newMethodInvocation();
        bind.setExpression(ast.newName(RECORDER_TYPE));
        bind.setName(ast.newSimpleName("bind"));
        bind.arguments().add(owner);
        return bind;
    }

    static AbstractTypeDeclaration topLevelType(ASTNode node) {
        for (ASTNode n = node; n != null; n = n.getParent()) {
            if (n instanceof AbstractTypeDeclaration type && n.getParent() instanceof CompilationUnit) {
                return type;
            }
        }
        return null;
    }

    /** Whether {@code this} is available at {@code node}. */
    static boolean isInstanceContext(ASTNode node) {
        for (ASTNode n = node.getParent(); n != null; n = n.getParent()) {
            if (n instanceof MethodDeclaration method) {
                return !Modifier.isStatic(method.getModifiers());
            }
            if (n instanceof Initializer initializer) {
                return !Modifier.isStatic(initializer.getModifiers());
            }
            if (n instanceof FieldDeclaration field) {
                boolean interfaceConstant = field.getParent() instanceof TypeDeclaration t && t.isInterface();
                return !interfaceConstant && !Modifier.isStatic(field.getModifiers());
            }
            if (n instanceof AnonymousClassDeclaration) {
                return true;
            }
            if (n instanceof AbstractTypeDeclaration) {
                return false;
            }
        }
        return false;
    }
}
