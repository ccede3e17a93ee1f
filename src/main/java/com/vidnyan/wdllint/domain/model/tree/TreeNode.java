package com.vidnyan.wdllint.domain.model.tree;

import com.vidnyan.wdllint.domain.model.Diagnostic;
import com.vidnyan.wdllint.domain.model.SourceNode;
import com.vidnyan.wdllint.domain.model.SourcePosition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A structural node of the tree. Only tree nodes carry diagnostics.
 */
public abstract class TreeNode extends SourceNode {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    protected TreeNode(SourcePosition pos) {
        super(pos);
    }

    /**
     * Diagnostics attached to this node, in the order they were added.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public void addDiagnostic(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }
}
