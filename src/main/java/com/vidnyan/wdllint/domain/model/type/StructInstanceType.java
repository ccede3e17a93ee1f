package com.vidnyan.wdllint.domain.model.type;

import lombok.Getter;

/**
 * Value of a user-defined struct type, referred to by the struct's name.
 */
@Getter
public final class StructInstanceType extends WdlType {

    private final String typeName;

    public StructInstanceType(String typeName, boolean optional) {
        super(optional);
        this.typeName = typeName;
    }

    @Override
    public StructInstanceType withOptional(boolean optional) {
        return new StructInstanceType(typeName, optional);
    }

    @Override
    protected String baseName() {
        return typeName;
    }

    @Override
    public boolean coerces(WdlType target, boolean checkQuantifier) {
        if (target instanceof StructInstanceType struct) {
            return typeName.equals(struct.getTypeName()) && checkOptional(target, checkQuantifier);
        }
        return super.coerces(target, checkQuantifier);
    }
}
