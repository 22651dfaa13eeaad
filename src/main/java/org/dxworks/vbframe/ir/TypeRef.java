package org.dxworks.vbframe.ir;

import java.util.Objects;

/**
 * Normalized type hint. {@link Category#UNRESOLVED} is a valid terminal state for types this tool cannot
 * know about, such as ActiveX controls or classes from other modules.
 */
public final class TypeRef {

    public enum Category {
        PRIMITIVE("primitive"),
        USER_DEFINED("userDefined"),
        ARRAY_OF("arrayOf"),
        OBJECT_REFERENCE("objectReference"),
        UNRESOLVED("unresolved");

        private final String name;

        Category(String name) {
            this.name = name;
        }

        public String getName() {
            return name;
        }
    }

    private final Category category;
    private final String name;
    private final TypeRef elementType;

    private TypeRef(Category category, String name, TypeRef elementType) {
        this.category = category;
        this.name = name;
        this.elementType = elementType;
    }

    public static TypeRef primitive(String name) {
        return new TypeRef(Category.PRIMITIVE, name, null);
    }

    public static TypeRef userDefined(String name) {
        return new TypeRef(Category.USER_DEFINED, name, null);
    }

    public static TypeRef objectReference(String name) {
        return new TypeRef(Category.OBJECT_REFERENCE, name, null);
    }

    public static TypeRef unresolved(String name) {
        return new TypeRef(Category.UNRESOLVED, name, null);
    }

    public static TypeRef arrayOf(TypeRef element) {
        return new TypeRef(Category.ARRAY_OF, null, Objects.requireNonNull(element, "element"));
    }

    public Category getCategory() {
        return category;
    }

    /**
     * Canonical name (e.g. {@code Integer}, {@code VB.TextBox}); null for arrays.
     */
    public String getName() {
        return name;
    }

    public TypeRef getElementType() {
        return elementType;
    }

    public boolean isUnresolved() {
        return category == Category.UNRESOLVED
                || (elementType != null && elementType.isUnresolved());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeRef)) return false;
        TypeRef typeRef = (TypeRef) o;
        return category == typeRef.category
                && Objects.equals(name, typeRef.name)
                && Objects.equals(elementType, typeRef.elementType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(category, name, elementType);
    }

    @Override
    public String toString() {
        return category == Category.ARRAY_OF ? elementType + "()" : category.getName() + ":" + name;
    }
}
