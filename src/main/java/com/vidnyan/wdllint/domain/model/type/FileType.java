package com.vidnyan.wdllint.domain.model.type;

public final class FileType extends WdlType {

    public FileType(boolean optional) {
        super(optional);
    }

    @Override
    public FileType withOptional(boolean optional) {
        return new FileType(optional);
    }

    @Override
    protected String baseName() {
        return "File";
    }

    @Override
    public boolean coerces(WdlType target, boolean checkQuantifier) {
        if (target instanceof StringType) {
            return checkOptional(target, checkQuantifier);
        }
        return super.coerces(target, checkQuantifier);
    }
}
