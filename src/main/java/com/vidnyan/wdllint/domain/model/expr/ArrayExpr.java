package com.vidnyan.wdllint.domain.model.expr;

import com.vidnyan.wdllint.domain.model.SourceNode;
import com.vidnyan.wdllint.domain.model.SourcePosition;
import com.vidnyan.wdllint.domain.model.type.WdlType;
import lombok.Getter;

import java.util.List;

/**
 * Array literal {@code [a, b, ...]}.
 */
@Getter
public class ArrayExpr extends Expression {

    private final List<Expression> items;

    public ArrayExpr(SourcePosition pos, WdlType type, List<Expression> items) {
        super(pos, type);
        this.items = List.copyOf(items);
    }

    @Override
    public List<? extends SourceNode> children() {
        return items;
    }
}
