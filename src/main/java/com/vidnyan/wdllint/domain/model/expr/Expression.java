package com.vidnyan.wdllint.domain.model.expr;

import com.vidnyan.wdllint.domain.model.NodeVisitor;
import com.vidnyan.wdllint.domain.model.SourceNode;
import com.vidnyan.wdllint.domain.model.SourcePosition;
import com.vidnyan.wdllint.domain.model.type.WdlType;
import lombok.Getter;

/**
 * Base of all expressions. {@code type} is the type inferred by the type checker.
 */
@Getter
public abstract class Expression extends SourceNode {

    private final WdlType type;

    protected Expression(SourcePosition pos, WdlType type) {
        super(pos);
        this.type = type;
    }

    @Override
    public void accept(NodeVisitor visitor) {
        visitor.expression(this);
    }
}
