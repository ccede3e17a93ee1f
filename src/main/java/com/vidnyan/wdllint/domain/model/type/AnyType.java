package com.vidnyan.wdllint.domain.model.type;

/**
 * Type of values the type checker cannot constrain, e.g. {@code None} or the items of an
 * empty array literal. Coerces to every type.
 */
public final class AnyType extends WdlType {

    public AnyType(boolean optional) {
        super(optional);
    }

    @Override
    public AnyType withOptional(boolean optional) {
        return new AnyType(optional);
    }

    @Override
    protected String baseName() {
        return "Any";
    }

    @Override
    public boolean coerces(WdlType target, boolean checkQuantifier) {
        return true;
    }
}
