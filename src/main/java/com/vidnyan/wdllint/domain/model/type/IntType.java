package com.vidnyan.wdllint.domain.model.type;

public final class IntType extends WdlType {

    public IntType(boolean optional) {
        super(optional);
    }

    @Override
    public IntType withOptional(boolean optional) {
        return new IntType(optional);
    }

    @Override
    protected String baseName() {
        return "Int";
    }

    @Override
    public boolean coerces(WdlType target, boolean checkQuantifier) {
        if (target instanceof FloatType || target instanceof StringType) {
            return checkOptional(target, checkQuantifier);
        }
        return super.coerces(target, checkQuantifier);
    }
}
