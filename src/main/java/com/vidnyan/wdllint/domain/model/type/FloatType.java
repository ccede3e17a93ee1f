package com.vidnyan.wdllint.domain.model.type;

public final class FloatType extends WdlType {

    public FloatType(boolean optional) {
        super(optional);
    }

    @Override
    public FloatType withOptional(boolean optional) {
        return new FloatType(optional);
    }

    @Override
    protected String baseName() {
        return "Float";
    }

    @Override
    public boolean coerces(WdlType target, boolean checkQuantifier) {
        if (target instanceof StringType) {
            return checkOptional(target, checkQuantifier);
        }
        return super.coerces(target, checkQuantifier);
    }
}
