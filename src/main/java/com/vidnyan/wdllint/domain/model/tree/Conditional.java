package com.vidnyan.wdllint.domain.model.tree;

import com.vidnyan.wdllint.domain.model.NodeVisitor;
import com.vidnyan.wdllint.domain.model.SourcePosition;
import com.vidnyan.wdllint.domain.model.expr.Expression;

import java.util.List;

/**
 * {@code if (expr) { elements }}.
 */
public class Conditional extends WorkflowSection {

    public Conditional(SourcePosition pos, Expression expr, List<WorkflowNode> elements) {
        super(pos, expr, elements);
    }

    @Override
    public void accept(NodeVisitor visitor) {
        visitor.conditional(this);
    }
}
