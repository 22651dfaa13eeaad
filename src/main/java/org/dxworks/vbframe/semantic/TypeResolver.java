package org.dxworks.vbframe.semantic;

import org.dxworks.vbframe.ir.TypeRef;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Maps declared type names onto {@link TypeRef}s. Primitive names are normalized to their canonical
 * spelling; types declared in the module ({@code Type}, {@code Enum}) are user defined; intrinsic object
 * types are object references. Anything else, including types of referenced libraries, stays unresolved.
 */
public class TypeResolver {

    private static final Map<String, String> PRIMITIVES = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private static final Map<Character, String> SUFFIXES = Map.of(
            '%', "Integer", '&', "Long", '!', "Single", '#', "Double", '@', "Currency", '$', "String");
    private static final Set<String> OBJECT_TYPES = Set.of("object", "collection", "form", "control", "controls",
            "forms", "printer", "screen", "clipboard", "app", "errobject", "stdfont", "stdpicture", "ipicturedisp",
            "ifontdisp", "iunknown");

    static {
        for (String name : new String[]{"Boolean", "Byte", "Integer", "Long", "Single", "Double", "Currency",
                "Decimal", "Date", "String", "Variant", "LongLong", "LongPtr", "Any"}) {
            PRIMITIVES.put(name, name);
        }
    }

    private final Set<String> userTypes;

    /**
     * @param userTypes names of the {@code Type} and {@code Enum} declarations of the module, lower-cased
     */
    public TypeResolver(Set<String> userTypes) {
        this.userTypes = userTypes;
    }

    /**
     * Type of a declared name. Without an explicit clause the type comes from the name's type suffix
     * character, defaulting to {@code Variant}.
     */
    public TypeRef resolve(String declaredType, String declaredName, boolean array) {
        TypeRef element = declaredType != null ? resolveName(declaredType) : implicitType(declaredName);
        return array ? TypeRef.arrayOf(element) : element;
    }

    public TypeRef resolveName(String typeName) {
        String primitive = PRIMITIVES.get(typeName);
        if (primitive != null) {
            return TypeRef.primitive(primitive);
        }
        String lower = typeName.toLowerCase(Locale.ROOT);
        if (userTypes.contains(lower)) {
            return TypeRef.userDefined(typeName);
        }
        if (OBJECT_TYPES.contains(lower) || KnownEvents.isKnownType(typeName)) {
            return TypeRef.objectReference(typeName);
        }
        return TypeRef.unresolved(typeName);
    }

    public static TypeRef implicitType(String declaredName) {
        if (declaredName != null && !declaredName.isEmpty()) {
            String suffixed = SUFFIXES.get(declaredName.charAt(declaredName.length() - 1));
            if (suffixed != null) {
                return TypeRef.primitive(suffixed);
            }
        }
        return TypeRef.primitive("Variant");
    }

    /**
     * Type of a constant without an explicit clause, taken from its literal category.
     */
    public static TypeRef literalType(String literalType, String declaredName) {
        if (literalType == null) {
            return implicitType(declaredName);
        }
        switch (literalType) {
            case "string":
                return TypeRef.primitive("String");
            case "integer":
            case "hex":
            case "octal":
                return TypeRef.primitive("Integer");
            case "double":
                return TypeRef.primitive("Double");
            case "date":
                return TypeRef.primitive("Date");
            case "boolean":
                return TypeRef.primitive("Boolean");
            default:
                return implicitType(declaredName);
        }
    }
}
