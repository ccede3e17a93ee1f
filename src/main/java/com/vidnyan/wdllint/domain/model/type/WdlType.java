package com.vidnyan.wdllint.domain.model.type;

/**
 * A WDL value type as resolved by the type checker.
 * <p>
 * Types are immutable. Two types are equal when they render to the same WDL syntax, so
 * {@code Array[Int]} and {@code Array[Int]+} are different types.
 */
public abstract class WdlType {

    private final boolean optional;

    protected WdlType(boolean optional) {
        this.optional = optional;
    }

    public boolean isOptional() {
        return optional;
    }

    /**
     * The same type with the given optional quantifier.
     */
    public abstract WdlType withOptional(boolean optional);

    /**
     * WDL name without the optional quantifier, e.g. {@code Array[String]+}.
     */
    protected abstract String baseName();

    /**
     * Whether a value of this type may be implicitly coerced to {@code target}.
     *
     * @param target          the expected type
     * @param checkQuantifier when true, an optional value does not coerce to a non-optional type
     */
    public boolean coerces(WdlType target, boolean checkQuantifier) {
        if (target instanceof ArrayType array && coerces(array.getItemType(), checkQuantifier)) {
            // T to Array[T]
            return true;
        }
        return (getClass() == target.getClass() || target instanceof AnyType)
                && checkOptional(target, checkQuantifier);
    }

    protected boolean checkOptional(WdlType target, boolean checkQuantifier) {
        return !(checkQuantifier && optional && !target.isOptional());
    }

    @Override
    public String toString() {
        return baseName() + (optional ? "?" : "");
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof WdlType && toString().equals(o.toString());
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }
}
