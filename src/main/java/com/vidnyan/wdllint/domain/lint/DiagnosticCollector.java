package com.vidnyan.wdllint.domain.lint;

import com.vidnyan.wdllint.domain.model.Diagnostic;
import com.vidnyan.wdllint.domain.model.SourceNode;
import com.vidnyan.wdllint.domain.model.tree.TreeNode;
import com.vidnyan.wdllint.domain.walker.Walker;

import java.util.ArrayList;
import java.util.List;

/**
 * Preorder flattening of the diagnostics attached throughout a tree, imported documents
 * included.
 */
class DiagnosticCollector extends Walker {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    DiagnosticCollector() {
        super(true, true);
    }

    @Override
    public void visit(SourceNode node) {
        if (node instanceof TreeNode treeNode) {
            diagnostics.addAll(treeNode.getDiagnostics());
        }
        super.visit(node);
    }

    List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
