package com.vidnyan.wdllint.domain.model.tree;

import com.vidnyan.wdllint.domain.model.SourceNode;
import com.vidnyan.wdllint.domain.model.SourcePosition;
import com.vidnyan.wdllint.domain.model.expr.Expression;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * Workflow section governed by an expression: {@link Scatter} or {@link Conditional}.
 */
@Getter
public abstract class WorkflowSection extends WorkflowNode {

    private final Expression expr;
    private final List<WorkflowNode> elements;

    protected WorkflowSection(SourcePosition pos, Expression expr, List<WorkflowNode> elements) {
        super(pos);
        this.expr = expr;
        this.elements = List.copyOf(elements);
    }

    @Override
    public List<? extends SourceNode> children() {
        List<SourceNode> children = new ArrayList<>();
        children.add(expr);
        children.addAll(elements);
        return children;
    }
}
