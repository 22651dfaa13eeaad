package org.dxworks.vbframe.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Base of the IR tree. A node owns its children (source order), carries the verbatim source slice it
 * covers, and may hold leading/trailing trivia. Cross references between nodes are kept as ids, never
 * as object references, so the structure stays a tree.
 * <p>
 * The structure is fixed at construction; only trivia attachment (by the builder) and
 * {@link #setSemanticInfo(SemanticInfo)} (by the enricher) change a node afterwards.
 */
public abstract sealed class IrNode
        permits ModuleNode, DeclarationNode, ProcedureNode, StatementNode, ExpressionNode,
                ControlElementNode, EventBindingNode, TriviaNode, ErrorNode {

    private final String id;
    private final SourceSpan span;
    private final String text;
    private final List<IrNode> children;
    private final List<TriviaNode> leadingTrivia = new ArrayList<>();
    private final List<TriviaNode> trailingTrivia = new ArrayList<>();
    private String role;
    private SemanticInfo semanticInfo;

    protected IrNode(String id, SourceSpan span, String text, List<? extends IrNode> children) {
        this.id = Objects.requireNonNull(id, "id");
        this.span = Objects.requireNonNull(span, "span");
        this.text = text == null ? "" : text;
        this.children = children == null ? List.of() : List.copyOf(children);
    }

    public abstract NodeKind getKind();

    public abstract <R> R accept(IrVisitor<R> visitor);

    public String getId() {
        return id;
    }

    public SourceSpan getSpan() {
        return span;
    }

    public String getText() {
        return text;
    }

    public List<IrNode> getChildren() {
        return children;
    }

    /**
     * Position of this node inside its parent ("condition", "body", "argument", ...), or null.
     */
    public String getRole() {
        return role;
    }

    public IrNode withRole(String role) {
        this.role = role;
        return this;
    }

    public List<TriviaNode> getLeadingTrivia() {
        return Collections.unmodifiableList(leadingTrivia);
    }

    public List<TriviaNode> getTrailingTrivia() {
        return Collections.unmodifiableList(trailingTrivia);
    }

    public void addLeadingTrivia(TriviaNode trivia) {
        leadingTrivia.add(trivia);
    }

    public void addTrailingTrivia(TriviaNode trivia) {
        trailingTrivia.add(trivia);
    }

    /**
     * Annotations written by the semantic enricher; null until enrichment ran.
     */
    public SemanticInfo getSemanticInfo() {
        return semanticInfo;
    }

    public void setSemanticInfo(SemanticInfo semanticInfo) {
        this.semanticInfo = semanticInfo;
    }

    @Override
    public String toString() {
        return getKind().getName() + "[" + id + " " + span + "]";
    }
}
