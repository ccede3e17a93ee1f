package com.vidnyan.wdllint.domain.model;

import com.vidnyan.wdllint.domain.model.tree.TreeNode;
import lombok.Getter;
import lombok.Setter;

import java.util.List;

/**
 * Base of every syntax tree node: tree nodes (document, workflow, task, ...) and expressions.
 * <p>
 * {@code parent} is a non-owning back reference filled in by the parent-linking pass. For an
 * expression it is the nearest enclosing tree node, never another expression.
 */
@Getter
public abstract class SourceNode {

    private final SourcePosition pos;

    @Setter
    private TreeNode parent;

    protected SourceNode(SourcePosition pos) {
        this.pos = pos;
    }

    /**
     * The node's children in traversal order.
     */
    public abstract List<? extends SourceNode> children();

    /**
     * Double-dispatch into the visitor hook matching this node's kind.
     */
    public abstract void accept(NodeVisitor visitor);
}
