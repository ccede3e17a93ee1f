package com.vidnyan.wdllint.domain.model.expr;

import com.vidnyan.wdllint.domain.model.SourceNode;
import com.vidnyan.wdllint.domain.model.SourcePosition;
import com.vidnyan.wdllint.domain.model.type.WdlType;
import lombok.Getter;

import java.util.List;

@Getter
public class PairExpr extends Expression {

    private final Expression left;
    private final Expression right;

    public PairExpr(SourcePosition pos, WdlType type, Expression left, Expression right) {
        super(pos, type);
        this.left = left;
        this.right = right;
    }

    @Override
    public List<? extends SourceNode> children() {
        return List.of(left, right);
    }
}
