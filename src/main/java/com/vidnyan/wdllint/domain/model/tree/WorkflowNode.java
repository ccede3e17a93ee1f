package com.vidnyan.wdllint.domain.model.tree;

import com.vidnyan.wdllint.domain.model.SourcePosition;

/**
 * Element of a workflow body: {@link Decl}, {@link Call}, {@link Scatter} or {@link Conditional}.
 */
public abstract class WorkflowNode extends TreeNode {

    protected WorkflowNode(SourcePosition pos) {
        super(pos);
    }
}
