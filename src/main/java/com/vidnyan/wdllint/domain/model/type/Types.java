package com.vidnyan.wdllint.domain.model.type;

/**
 * Shorthand factories for non-optional types; use {@link #optional(WdlType)} to quantify.
 */
public final class Types {

    private Types() {
    }

    public static AnyType any() {
        return new AnyType(false);
    }

    public static BooleanType bool() {
        return new BooleanType(false);
    }

    public static IntType integer() {
        return new IntType(false);
    }

    public static FloatType floating() {
        return new FloatType(false);
    }

    public static StringType string() {
        return new StringType(false);
    }

    public static FileType file() {
        return new FileType(false);
    }

    public static ArrayType array(WdlType itemType) {
        return new ArrayType(itemType, false, false);
    }

    public static ArrayType nonemptyArray(WdlType itemType) {
        return new ArrayType(itemType, true, false);
    }

    public static MapType map(WdlType keyType, WdlType valueType) {
        return new MapType(keyType, valueType, false);
    }

    public static PairType pair(WdlType leftType, WdlType rightType) {
        return new PairType(leftType, rightType, false);
    }

    public static StructInstanceType struct(String typeName) {
        return new StructInstanceType(typeName, false);
    }

    public static WdlType optional(WdlType type) {
        return type.withOptional(true);
    }
}
