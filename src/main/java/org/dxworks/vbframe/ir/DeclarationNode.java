package org.dxworks.vbframe.ir;

import java.util.List;

/**
 * Variables, constants, parameters, user types, enums, external procedures, events and
 * {@code Implements} clauses. List kinds group the declarators of one {@code Dim}/{@code Const} line.
 */
public final class DeclarationNode extends IrNode {

    public enum Kind {
        VARIABLE_LIST("variableList"),
        CONSTANT_LIST("constantList"),
        VARIABLE("variable"),
        CONSTANT("constant"),
        PARAMETER("parameter"),
        TYPE("type"),
        TYPE_MEMBER("typeMember"),
        ENUM("enum"),
        ENUM_MEMBER("enumMember"),
        EXTERNAL_PROCEDURE("externalProcedure"),
        EVENT("event"),
        IMPLEMENTS("implements");

        private final String name;

        Kind(String name) {
            this.name = name;
        }

        public String getName() {
            return name;
        }
    }

    private final Kind declarationKind;
    private final String name;
    private final String visibility;
    private final List<String> modifiers;
    private final String declaredType;
    private final boolean array;
    private final String library;
    private final String alias;

    public DeclarationNode(String id, SourceSpan span, String text, List<? extends IrNode> children,
                           Kind declarationKind, String name, String visibility, List<String> modifiers,
                           String declaredType, boolean array, String library, String alias) {
        super(id, span, text, children);
        this.declarationKind = declarationKind;
        this.name = name;
        this.visibility = visibility;
        this.modifiers = modifiers == null ? List.of() : List.copyOf(modifiers);
        this.declaredType = declaredType;
        this.array = array;
        this.library = library;
        this.alias = alias;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.DECLARATION;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitDeclaration(this);
    }

    public Kind getDeclarationKind() {
        return declarationKind;
    }

    public String getName() {
        return name;
    }

    public String getVisibility() {
        return visibility;
    }

    public List<String> getModifiers() {
        return modifiers;
    }

    /**
     * Type exactly as written after {@code As}, or null when no type clause was given.
     */
    public String getDeclaredType() {
        return declaredType;
    }

    public boolean isArray() {
        return array;
    }

    public String getLibrary() {
        return library;
    }

    public String getAlias() {
        return alias;
    }

    public boolean hasModifier(String modifier) {
        for (String m : modifiers) {
            if (m.equalsIgnoreCase(modifier)) {
                return true;
            }
        }
        return false;
    }
}
