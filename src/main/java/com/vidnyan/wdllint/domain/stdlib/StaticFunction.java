package com.vidnyan.wdllint.domain.stdlib;

import com.vidnyan.wdllint.domain.model.type.WdlType;

import java.util.List;

/**
 * Standard library function with a fixed signature.
 */
public record StaticFunction(
    String name,
    List<WdlType> argumentTypes,
    WdlType returnType
) {
}
