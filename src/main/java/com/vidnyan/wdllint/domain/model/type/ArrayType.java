package com.vidnyan.wdllint.domain.model.type;

import lombok.Getter;

/**
 * {@code Array[T]}, or {@code Array[T]+} when declared nonempty.
 */
@Getter
public final class ArrayType extends WdlType {

    private final WdlType itemType;
    private final boolean nonempty;

    public ArrayType(WdlType itemType, boolean nonempty, boolean optional) {
        super(optional);
        this.itemType = itemType;
        this.nonempty = nonempty;
    }

    @Override
    public ArrayType withOptional(boolean optional) {
        return new ArrayType(itemType, nonempty, optional);
    }

    @Override
    protected String baseName() {
        return "Array[" + itemType + "]" + (nonempty ? "+" : "");
    }

    @Override
    public boolean coerces(WdlType target, boolean checkQuantifier) {
        if (target instanceof ArrayType array) {
            return itemType.coerces(array.getItemType(), checkQuantifier)
                    && checkOptional(target, checkQuantifier);
        }
        return super.coerces(target, checkQuantifier);
    }
}
