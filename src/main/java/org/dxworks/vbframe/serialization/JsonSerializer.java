package org.dxworks.vbframe.serialization;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.StreamWriteConstraints;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import org.dxworks.vbframe.SourceFile;
import org.dxworks.vbframe.diagnostics.Diagnostic;
import org.dxworks.vbframe.ir.BindingStatus;
import org.dxworks.vbframe.ir.ControlElementNode;
import org.dxworks.vbframe.ir.DeclarationNode;
import org.dxworks.vbframe.ir.ErrorNode;
import org.dxworks.vbframe.ir.EventBindingNode;
import org.dxworks.vbframe.ir.ExpressionNode;
import org.dxworks.vbframe.ir.IrNode;
import org.dxworks.vbframe.ir.IrVisitor;
import org.dxworks.vbframe.ir.ModuleNode;
import org.dxworks.vbframe.ir.ProcedureNode;
import org.dxworks.vbframe.ir.SemanticInfo;
import org.dxworks.vbframe.ir.SourceSpan;
import org.dxworks.vbframe.ir.StatementNode;
import org.dxworks.vbframe.ir.TriviaNode;
import org.dxworks.vbframe.ir.TypeRef;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Writes per-file envelopes as JSON with a fixed field order.
 * <p>
 * Every node starts with {@code kind}, then {@code span}, {@code id} and {@code role}, then the fields of its
 * variant in declaration order, then the shared tail ({@code text}, trivia, {@code semanticInfo},
 * {@code children}). Variant fields are always written, as {@code null} when absent, so each node kind has a
 * stable field set. Output ends with a single newline in both pretty and compact mode.
 */
public class JsonSerializer {

    /**
     * Deepest JSON nesting written. Each IR level costs two (node object and children array), so long
     * operator chains need far more than Jackson's default of 1000.
     */
    static final int MAX_NESTING_DEPTH = 200_000;

    private static final JsonFactory FACTORY = JsonFactory.builder()
            .disable(StreamWriteFeature.AUTO_CLOSE_TARGET)
            .streamWriteConstraints(StreamWriteConstraints.builder().maxNestingDepth(MAX_NESTING_DEPTH).build())
            .build();

    private final SerializerOptions options;

    public JsonSerializer(SerializerOptions options) {
        this.options = options;
    }

    public SerializerOptions getOptions() {
        return options;
    }

    /**
     * Serializes one file. {@code module} is null for files that failed before a tree could be built.
     */
    public byte[] serialize(SourceFile source, ModuleNode module, List<Diagnostic> diagnostics) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try {
            write(source, module, diagnostics, buffer);
        } catch (IOException e) {
            throw new UncheckedIOException("In-memory serialization failed", e);
        }
        return buffer.toByteArray();
    }

    /**
     * Streams one envelope into {@code out}. The stream is flushed but not closed.
     */
    public void write(SourceFile source, ModuleNode module, List<Diagnostic> diagnostics, OutputStream out)
            throws IOException {
        try (JsonGenerator gen = createGenerator(out)) {
            writeEnvelope(gen, source, module, diagnostics);
        }
        out.write('\n');
        out.flush();
    }

    JsonGenerator createGenerator(OutputStream out) throws IOException {
        JsonGenerator gen = FACTORY.createGenerator(out);
        if (options.isPrettyPrint()) {
            DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
            gen.setPrettyPrinter(new DefaultPrettyPrinter()
                    .withObjectIndenter(indenter)
                    .withArrayIndenter(indenter));
        }
        return gen;
    }

    void writeEnvelope(JsonGenerator gen, SourceFile source, ModuleNode module, List<Diagnostic> diagnostics)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("schemaVersion", options.getSchemaVersion().getValue());
        gen.writeFieldName("source");
        writeSource(gen, source);
        gen.writeFieldName("body");
        if (module == null) {
            gen.writeNull();
        } else {
            writeNode(gen, module);
        }
        gen.writeFieldName("diagnostics");
        writeDiagnostics(gen, diagnostics);
        gen.writeEndObject();
    }

    void writeSource(JsonGenerator gen, SourceFile source) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("path", source.getPath());
        gen.writeStringField("checksum", source.getChecksum());
        gen.writeStringField("encoding", source.getEncoding());
        gen.writeStringField("moduleKind", source.getModuleKind().getName());
        gen.writeEndObject();
    }

    void writeDiagnostics(JsonGenerator gen, List<Diagnostic> diagnostics) throws IOException {
        gen.writeStartArray();
        for (Diagnostic d : diagnostics) {
            gen.writeStartObject();
            gen.writeStringField("severity", d.getSeverity().getName());
            gen.writeStringField("code", d.getCode());
            gen.writeStringField("message", d.getMessage());
            gen.writeFieldName("span");
            writeSpan(gen, d.getSpan());
            gen.writeStringField("stage", d.getStage().getName());
            if (d.getHint() != null) {
                gen.writeStringField("hint", d.getHint());
            }
            if (!d.getRelatedSpans().isEmpty()) {
                gen.writeArrayFieldStart("related");
                for (SourceSpan span : d.getRelatedSpans()) {
                    writeSpan(gen, span);
                }
                gen.writeEndArray();
            }
            gen.writeEndObject();
        }
        gen.writeEndArray();
    }

    void writeNode(JsonGenerator gen, IrNode node) throws IOException {
        try {
            node.accept(new NodeWriter(gen));
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private static void writeSpan(JsonGenerator gen, SourceSpan span) throws IOException {
        gen.writeStartObject();
        gen.writeFieldName("start");
        writePosition(gen, span.getStartLine(), span.getStartColumn(), span.getStartOffset());
        gen.writeFieldName("end");
        writePosition(gen, span.getEndLine(), span.getEndColumn(), span.getEndOffset());
        gen.writeEndObject();
    }

    private static void writePosition(JsonGenerator gen, int line, int column, int offset) throws IOException {
        gen.writeStartObject();
        gen.writeNumberField("line", line);
        gen.writeNumberField("column", column);
        gen.writeNumberField("offset", offset);
        gen.writeEndObject();
    }

    private static void writeNullableString(JsonGenerator gen, String field, String value) throws IOException {
        if (value == null) {
            gen.writeNullField(field);
        } else {
            gen.writeStringField(field, value);
        }
    }

    private static void writeStrings(JsonGenerator gen, String field, List<String> values) throws IOException {
        gen.writeArrayFieldStart(field);
        for (String value : values) {
            gen.writeString(value);
        }
        gen.writeEndArray();
    }

    private static void writeType(JsonGenerator gen, TypeRef type) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("category", type.getCategory().getName());
        if (type.getName() != null) {
            gen.writeStringField("name", type.getName());
        }
        if (type.getElementType() != null) {
            gen.writeFieldName("elementType");
            writeType(gen, type.getElementType());
        }
        gen.writeEndObject();
    }

    private static void writeSemanticInfo(JsonGenerator gen, SemanticInfo info) throws IOException {
        gen.writeStartObject();
        if (info.getType() != null) {
            gen.writeFieldName("type");
            writeType(gen, info.getType());
        }
        if (info.getParentControlId() != null) {
            gen.writeStringField("parentControlId", info.getParentControlId());
        }
        if (info.getChildControlIds() != null) {
            writeStrings(gen, "childControlIds", info.getChildControlIds());
        }
        BindingStatus status = info.getBindingStatus();
        if (status != null) {
            gen.writeObjectFieldStart("binding");
            gen.writeStringField("status", status.getName());
            writeNullableString(gen, "targetId", info.getBindingTargetId());
            gen.writeEndObject();
        }
        if (info.getResourceRef() != null) {
            gen.writeStringField("resourceRef", info.getResourceRef());
        }
        gen.writeEndObject();
    }

    /**
     * Writes one node and, recursively, its subtree. I/O failures travel as {@link UncheckedIOException}
     * because visitor methods cannot declare checked exceptions.
     */
    private final class NodeWriter implements IrVisitor<Void> {

        private final JsonGenerator gen;

        NodeWriter(JsonGenerator gen) {
            this.gen = gen;
        }

        @Override
        public Void visitModule(ModuleNode node) {
            return write(node, () -> {
                gen.writeStringField("moduleKind", node.getModuleKind().getName());
                writeNullableString(gen, "name", node.getName());
                writeNullableString(gen, "version", node.getVersion());
                gen.writeBooleanField("privateModule", node.isPrivateModule());
                writeStrings(gen, "options", node.getOptions());
            });
        }

        @Override
        public Void visitDeclaration(DeclarationNode node) {
            return write(node, () -> {
                gen.writeStringField("declarationKind", node.getDeclarationKind().getName());
                writeNullableString(gen, "name", node.getName());
                writeNullableString(gen, "visibility", node.getVisibility());
                writeStrings(gen, "modifiers", node.getModifiers());
                writeNullableString(gen, "declaredType", node.getDeclaredType());
                gen.writeBooleanField("array", node.isArray());
                writeNullableString(gen, "library", node.getLibrary());
                writeNullableString(gen, "alias", node.getAlias());
            });
        }

        @Override
        public Void visitProcedure(ProcedureNode node) {
            return write(node, () -> {
                gen.writeStringField("procedureKind", node.getProcedureKind().getName());
                writeNullableString(gen, "name", node.getName());
                writeNullableString(gen, "visibility", node.getVisibility());
                writeStrings(gen, "modifiers", node.getModifiers());
                writeNullableString(gen, "returnType", node.getReturnType());
            });
        }

        @Override
        public Void visitStatement(StatementNode node) {
            return write(node, () -> {
                gen.writeStringField("statementKind", node.getStatementKind().getName());
                writeNullableString(gen, "name", node.getName());
                writeNullableString(gen, "value", node.getValue());
            });
        }

        @Override
        public Void visitExpression(ExpressionNode node) {
            return write(node, () -> {
                gen.writeStringField("expressionKind", node.getExpressionKind().getName());
                writeNullableString(gen, "operator", node.getOperator());
                writeNullableString(gen, "name", node.getName());
                writeNullableString(gen, "literalType", node.getLiteralType());
            });
        }

        @Override
        public Void visitControlElement(ControlElementNode node) {
            return write(node, () -> {
                writeNullableString(gen, "controlType", node.getControlType());
                writeNullableString(gen, "name", node.getName());
                if (node.getIndex() == null) {
                    gen.writeNullField("index");
                } else {
                    gen.writeNumberField("index", node.getIndex());
                }
            });
        }

        @Override
        public Void visitEventBinding(EventBindingNode node) {
            return write(node, () -> {
                writeNullableString(gen, "procedureId", node.getProcedureId());
                writeNullableString(gen, "sourceName", node.getSourceName());
                writeNullableString(gen, "eventName", node.getEventName());
            });
        }

        @Override
        public Void visitTrivia(TriviaNode node) {
            return write(node, () -> {
                gen.writeStringField("triviaKind", node.getTriviaKind().getName());
                gen.writeNumberField("lineCount", node.getLineCount());
            });
        }

        @Override
        public Void visitError(ErrorNode node) {
            return write(node, () -> writeNullableString(gen, "construct", node.getConstruct()));
        }

        private Void write(IrNode node, FieldWriter fields) {
            try {
                gen.writeStartObject();
                gen.writeStringField("kind", node.getKind().getName());
                gen.writeFieldName("span");
                writeSpan(gen, node.getSpan());
                gen.writeStringField("id", node.getId());
                if (node.getRole() != null) {
                    gen.writeStringField("role", node.getRole());
                }
                fields.write();
                if (options.isIncludeSourceText()) {
                    gen.writeStringField("text", node.getText());
                }
                writeTrivia("leadingTrivia", node.getLeadingTrivia());
                writeTrivia("trailingTrivia", node.getTrailingTrivia());
                if (node.getSemanticInfo() != null) {
                    gen.writeFieldName("semanticInfo");
                    writeSemanticInfo(gen, node.getSemanticInfo());
                }
                gen.writeArrayFieldStart("children");
                for (IrNode child : node.getChildren()) {
                    child.accept(this);
                }
                gen.writeEndArray();
                gen.writeEndObject();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            return null;
        }

        private void writeTrivia(String field, List<TriviaNode> trivia) throws IOException {
            if (trivia.isEmpty()) {
                return;
            }
            gen.writeArrayFieldStart(field);
            for (TriviaNode t : trivia) {
                t.accept(this);
            }
            gen.writeEndArray();
        }
    }

    @FunctionalInterface
    private interface FieldWriter {
        void write() throws IOException;
    }
}
