package com.vidnyan.wdllint.domain.model.type;

import lombok.Getter;

@Getter
public final class PairType extends WdlType {

    private final WdlType leftType;
    private final WdlType rightType;

    public PairType(WdlType leftType, WdlType rightType, boolean optional) {
        super(optional);
        this.leftType = leftType;
        this.rightType = rightType;
    }

    @Override
    public PairType withOptional(boolean optional) {
        return new PairType(leftType, rightType, optional);
    }

    @Override
    protected String baseName() {
        return "Pair[" + leftType + "," + rightType + "]";
    }

    @Override
    public boolean coerces(WdlType target, boolean checkQuantifier) {
        if (target instanceof PairType pair) {
            return leftType.coerces(pair.getLeftType(), checkQuantifier)
                    && rightType.coerces(pair.getRightType(), checkQuantifier)
                    && checkOptional(target, checkQuantifier);
        }
        return super.coerces(target, checkQuantifier);
    }
}
