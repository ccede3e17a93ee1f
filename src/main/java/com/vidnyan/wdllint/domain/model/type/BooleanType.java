package com.vidnyan.wdllint.domain.model.type;

public final class BooleanType extends WdlType {

    public BooleanType(boolean optional) {
        super(optional);
    }

    @Override
    public BooleanType withOptional(boolean optional) {
        return new BooleanType(optional);
    }

    @Override
    protected String baseName() {
        return "Boolean";
    }

    @Override
    public boolean coerces(WdlType target, boolean checkQuantifier) {
        if (target instanceof StringType) {
            return checkOptional(target, checkQuantifier);
        }
        return super.coerces(target, checkQuantifier);
    }
}
