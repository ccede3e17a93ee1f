package com.vidnyan.wdllint.domain.model.tree;

import com.vidnyan.wdllint.domain.model.NodeVisitor;
import com.vidnyan.wdllint.domain.model.SourcePosition;
import com.vidnyan.wdllint.domain.model.expr.Expression;
import lombok.Getter;

import java.util.List;

/**
 * {@code scatter (variable in expr) { elements }}.
 */
@Getter
public class Scatter extends WorkflowSection {

    private final String variable;

    public Scatter(SourcePosition pos, String variable, Expression expr, List<WorkflowNode> elements) {
        super(pos, expr, elements);
        this.variable = variable;
    }

    @Override
    public void accept(NodeVisitor visitor) {
        visitor.scatter(this);
    }
}
