package com.vidnyan.wdllint.domain.model.expr;

import com.vidnyan.wdllint.domain.model.SourceNode;
import com.vidnyan.wdllint.domain.model.SourcePosition;
import com.vidnyan.wdllint.domain.model.type.Types;
import lombok.Getter;

import java.util.List;

/**
 * Interpolation {@code ~{expr}} / {@code ${expr}} inside a string or command. Its position
 * spans the interpolated expression.
 */
@Getter
public class Placeholder extends Expression implements StringExpr.Part {

    private final Expression expr;

    public Placeholder(SourcePosition pos, Expression expr) {
        super(pos, Types.string());
        this.expr = expr;
    }

    @Override
    public List<? extends SourceNode> children() {
        return List.of(expr);
    }
}
