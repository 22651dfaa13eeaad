package org.dxworks.vbframe.ir;

import java.util.List;

/**
 * Expressions keep identifiers, operators and literals exactly as written (casing and literal
 * formatting included); the normalized literal category is recorded in {@code literalType}.
 */
public final class ExpressionNode extends IrNode {

    public enum Kind {
        LITERAL("literal"),
        IDENTIFIER("identifier"),
        ME("me"),
        MEMBER_ACCESS("memberAccess"),
        DICTIONARY_ACCESS("dictionaryAccess"),
        WITH_MEMBER_ACCESS("withMemberAccess"),
        WITH_DICTIONARY_ACCESS("withDictionaryAccess"),
        INDEX_OR_CALL("indexOrCall"),
        BINARY("binary"),
        UNARY("unary"),
        PARENTHESIZED("parenthesized"),
        NEW("new"),
        TYPE_OF("typeOf"),
        NAMED_ARGUMENT("namedArgument"),
        RANGE("range");

        private final String name;

        Kind(String name) {
            this.name = name;
        }

        public String getName() {
            return name;
        }
    }

    private final Kind expressionKind;
    private final String operator;
    private final String name;
    private final String literalType;

    public ExpressionNode(String id, SourceSpan span, String text, List<? extends IrNode> children,
                          Kind expressionKind, String operator, String name, String literalType) {
        super(id, span, text, children);
        this.expressionKind = expressionKind;
        this.operator = operator;
        this.name = name;
        this.literalType = literalType;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.EXPRESSION;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitExpression(this);
    }

    public Kind getExpressionKind() {
        return expressionKind;
    }

    public String getOperator() {
        return operator;
    }

    public String getName() {
        return name;
    }

    public String getLiteralType() {
        return literalType;
    }
}
