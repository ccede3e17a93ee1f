package com.vidnyan.wdllint.domain.model.type;

import lombok.Getter;

@Getter
public final class MapType extends WdlType {

    private final WdlType keyType;
    private final WdlType valueType;

    public MapType(WdlType keyType, WdlType valueType, boolean optional) {
        super(optional);
        this.keyType = keyType;
        this.valueType = valueType;
    }

    @Override
    public MapType withOptional(boolean optional) {
        return new MapType(keyType, valueType, optional);
    }

    @Override
    protected String baseName() {
        return "Map[" + keyType + "," + valueType + "]";
    }

    @Override
    public boolean coerces(WdlType target, boolean checkQuantifier) {
        if (target instanceof MapType map) {
            return keyType.coerces(map.getKeyType(), checkQuantifier)
                    && valueType.coerces(map.getValueType(), checkQuantifier)
                    && checkOptional(target, checkQuantifier);
        }
        return super.coerces(target, checkQuantifier);
    }
}
