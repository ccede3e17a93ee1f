package com.vidnyan.wdllint.domain.lint;

import com.vidnyan.wdllint.domain.model.type.AnyType;
import com.vidnyan.wdllint.domain.model.type.ArrayType;
import com.vidnyan.wdllint.domain.model.type.MapType;
import com.vidnyan.wdllint.domain.model.type.PairType;
import com.vidnyan.wdllint.domain.model.type.Types;
import com.vidnyan.wdllint.domain.model.type.WdlType;

/**
 * Type predicates shared by the coercion rules.
 */
public final class Coercions {

    private static final WdlType ARRAY_OF_ANY = Types.array(Types.any());

    private Coercions() {
    }

    /**
     * Whether assigning {@code fromType} to {@code toType} implies coercing something to
     * {@code baseTo}, looking through matching Array, Map and Pair structure.
     *
     * @param extraFrom another source type tolerated besides {@code baseTo} itself, or null
     */
    public static boolean compoundCoercion(WdlType toType, WdlType fromType,
                                           Class<? extends WdlType> baseTo,
                                           Class<? extends WdlType> extraFrom) {
        if (toType instanceof ArrayType to && fromType instanceof ArrayType from) {
            return compoundCoercion(to.getItemType(), from.getItemType(), baseTo, extraFrom);
        }
        if (toType instanceof MapType to && fromType instanceof MapType from) {
            return compoundCoercion(to.getKeyType(), from.getKeyType(), baseTo, extraFrom)
                    || compoundCoercion(to.getValueType(), from.getValueType(), baseTo, extraFrom);
        }
        if (toType instanceof PairType to && fromType instanceof PairType from) {
            return compoundCoercion(to.getLeftType(), from.getLeftType(), baseTo, extraFrom)
                    || compoundCoercion(to.getRightType(), from.getRightType(), baseTo, extraFrom);
        }
        if (baseTo.isInstance(toType)) {
            boolean tolerated = baseTo.isInstance(fromType)
                    || fromType instanceof AnyType
                    || (extraFrom != null && extraFrom.isInstance(fromType));
            return !tolerated;
        }
        return false;
    }

    public static boolean compoundCoercion(WdlType toType, WdlType fromType, Class<? extends WdlType> baseTo) {
        return compoundCoercion(toType, fromType, baseTo, null);
    }

    /**
     * Array nesting depth: 0 for a non-array, 2 for {@code Array[Array[Int]]}.
     */
    public static int arrayLevels(WdlType type) {
        int levels = 0;
        WdlType current = type;
        while (current instanceof ArrayType array) {
            levels++;
            current = array.getItemType();
        }
        return levels;
    }

    /**
     * Whether {@code exprType} is implicitly promoted to an array to fit {@code valueType}.
     * {@code Any} and {@code Array[Any]} (None, empty literal) are never counted.
     */
    public static boolean isArrayCoercion(WdlType valueType, WdlType exprType) {
        return valueType instanceof ArrayType
                && arrayLevels(valueType) > arrayLevels(exprType)
                && !(exprType instanceof AnyType)
                && !exprType.equals(ARRAY_OF_ANY);
    }

    /**
     * Whether a possibly-empty array flows where {@code Array[T]+} is expected, at the top
     * level or nested inside Array, Map or Pair types.
     */
    public static boolean isNonemptyCoercion(WdlType valueType, WdlType exprType) {
        if (valueType instanceof ArrayType value && exprType instanceof ArrayType expr) {
            return (value.isNonempty() && !expr.isNonempty())
                    || isNonemptyCoercion(value.getItemType(), expr.getItemType());
        }
        if (valueType instanceof MapType value && exprType instanceof MapType expr) {
            return isNonemptyCoercion(value.getKeyType(), expr.getKeyType())
                    || isNonemptyCoercion(value.getValueType(), expr.getValueType());
        }
        if (valueType instanceof PairType value && exprType instanceof PairType expr) {
            return isNonemptyCoercion(value.getLeftType(), expr.getLeftType())
                    || isNonemptyCoercion(value.getRightType(), expr.getRightType());
        }
        return false;
    }
}
