package org.dxworks.vbframe.ir;

import java.util.List;

/**
 * Executable statements, module directives and designer properties.
 * <p>
 * {@code name} and {@code value} carry the kind-specific scalars: the option or attribute name, the
 * label of a GoTo, the target of an Exit, the property name and its verbatim value, and so on.
 */
public final class StatementNode extends IrNode {

    public enum Kind {
        VERSION("version"),
        OBJECT_REFERENCE("objectReference"),
        CLASS_HEADER("classHeader"),
        PROPERTY("property"),
        PROPERTY_GROUP("propertyGroup"),
        ATTRIBUTE("attribute"),
        OPTION("option"),
        LABEL("label"),
        IF("if"),
        ELSE_IF("elseIf"),
        ELSE("else"),
        SELECT_CASE("selectCase"),
        CASE("case"),
        FOR("for"),
        FOR_EACH("forEach"),
        DO_LOOP("doLoop"),
        WHILE_WEND("whileWend"),
        WITH("with"),
        EXIT("exit"),
        GOTO("goto"),
        GOSUB("gosub"),
        RETURN("return"),
        ON_ERROR("onError"),
        RESUME("resume"),
        REDIM("redim"),
        RAISE_EVENT("raiseEvent"),
        ASSIGNMENT("assignment"),
        CALL("call"),
        END("end"),
        STOP("stop");

        private final String name;

        Kind(String name) {
            this.name = name;
        }

        public String getName() {
            return name;
        }
    }

    private final Kind statementKind;
    private final String name;
    private final String value;

    public StatementNode(String id, SourceSpan span, String text, List<? extends IrNode> children,
                         Kind statementKind, String name, String value) {
        super(id, span, text, children);
        this.statementKind = statementKind;
        this.name = name;
        this.value = value;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.STATEMENT;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitStatement(this);
    }

    public Kind getStatementKind() {
        return statementKind;
    }

    public String getName() {
        return name;
    }

    public String getValue() {
        return value;
    }
}
