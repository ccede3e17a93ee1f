package com.vidnyan.wdllint.domain.model.type;

public final class StringType extends WdlType {

    public StringType(boolean optional) {
        super(optional);
    }

    @Override
    public StringType withOptional(boolean optional) {
        return new StringType(optional);
    }

    @Override
    protected String baseName() {
        return "String";
    }

    @Override
    public boolean coerces(WdlType target, boolean checkQuantifier) {
        if (target instanceof FileType) {
            return checkOptional(target, checkQuantifier);
        }
        return super.coerces(target, checkQuantifier);
    }
}
