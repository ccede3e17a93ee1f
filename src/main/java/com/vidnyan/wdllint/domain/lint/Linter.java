package com.vidnyan.wdllint.domain.lint;

import com.vidnyan.wdllint.domain.model.Diagnostic;
import com.vidnyan.wdllint.domain.model.LintContractViolation;
import com.vidnyan.wdllint.domain.model.SourcePosition;
import com.vidnyan.wdllint.domain.model.tree.TreeNode;
import com.vidnyan.wdllint.domain.walker.Walker;

/**
 * Base class for lint rules.
 * <p>
 * A rule is a {@link Walker} that attaches {@link Diagnostic}s to tree nodes. Findings about
 * an expression attach to the expression's parent tree node, optionally with the
 * expression's own position. Rules are auto-descend unless they pass {@code false} to the
 * constructor to control descent themselves.
 */
public abstract class Linter extends Walker implements AutoCloseable {

    private final LintContext context;

    protected Linter(LintContext context) {
        this(true, context);
    }

    protected Linter(boolean autoDescend, LintContext context) {
        super(autoDescend, context.descendImports());
        this.context = context;
    }

    protected LintContext getContext() {
        return context;
    }

    /**
     * Get the rule name used to tag diagnostics.
     */
    public String getName() {
        return getClass().getSimpleName();
    }

    protected void add(TreeNode node, String message) {
        if (node == null) {
            throw new LintContractViolation(getName() + " finding has no tree node to attach to: " + message);
        }
        add(node, message, node.getPos());
    }

    protected void add(TreeNode node, String message, SourcePosition position) {
        if (node == null) {
            throw new LintContractViolation(getName() + " finding has no tree node to attach to: " + message);
        }
        node.addDiagnostic(new Diagnostic(position, getName(), message));
    }

    /**
     * Release resources held by this instance. Nothing by default.
     */
    @Override
    public void close() {
    }
}
