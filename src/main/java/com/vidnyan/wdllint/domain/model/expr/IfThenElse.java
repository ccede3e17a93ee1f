package com.vidnyan.wdllint.domain.model.expr;

import com.vidnyan.wdllint.domain.model.SourceNode;
import com.vidnyan.wdllint.domain.model.SourcePosition;
import com.vidnyan.wdllint.domain.model.type.WdlType;
import lombok.Getter;

import java.util.List;

@Getter
public class IfThenElse extends Expression {

    private final Expression condition;
    private final Expression consequent;
    private final Expression alternative;

    public IfThenElse(SourcePosition pos, WdlType type, Expression condition,
                      Expression consequent, Expression alternative) {
        super(pos, type);
        this.condition = condition;
        this.consequent = consequent;
        this.alternative = alternative;
    }

    @Override
    public List<? extends SourceNode> children() {
        return List.of(condition, consequent, alternative);
    }
}
