package com.vidnyan.wdllint.domain.walker;

import com.vidnyan.wdllint.domain.model.LintContractViolation;
import com.vidnyan.wdllint.domain.model.NodeVisitor;
import com.vidnyan.wdllint.domain.model.SourceNode;
import com.vidnyan.wdllint.domain.model.expr.Expression;
import com.vidnyan.wdllint.domain.model.tree.Call;
import com.vidnyan.wdllint.domain.model.tree.Conditional;
import com.vidnyan.wdllint.domain.model.tree.Decl;
import com.vidnyan.wdllint.domain.model.tree.Document;
import com.vidnyan.wdllint.domain.model.tree.Scatter;
import com.vidnyan.wdllint.domain.model.tree.StructTypeDef;
import com.vidnyan.wdllint.domain.model.tree.Task;
import com.vidnyan.wdllint.domain.model.tree.Workflow;

/**
 * Base class for traversals of the WDL syntax tree.
 * <p>
 * {@link #visit(SourceNode)} invokes the hook matching the node's kind ({@link #document},
 * {@link #workflow}, {@link #call}, ...). Two recursion disciplines are available, fixed per
 * instance:
 * <ul>
 *   <li><b>auto-descend</b>: {@code visit} recurses into every child right after the hook
 *       (preorder); hooks must not recurse themselves.</li>
 *   <li><b>manual-descend</b>: {@code visit} does not recurse. The default hooks call
 *       {@link #descend(SourceNode)}; an overriding hook calls {@code super} at the point it
 *       wants the children visited, visits only selected children, or prunes the subtree by
 *       doing neither.</li>
 * </ul>
 * Imported documents are children of the importing document and are only entered when
 * {@code descendImports} is set.
 *
 * <pre>{@code
 * class UnconditionalCallNames extends Walker {
 *     UnconditionalCallNames() { super(false, true); }
 *     public void conditional(Conditional obj) { }   // prune
 *     public void call(Call obj) { names.add(obj.getName()); }
 * }
 * }</pre>
 */
public abstract class Walker implements NodeVisitor {

    private final boolean autoDescend;
    private final boolean descendImports;

    protected Walker(boolean autoDescend, boolean descendImports) {
        this.autoDescend = autoDescend;
        this.descendImports = descendImports;
    }

    public boolean isAutoDescend() {
        return autoDescend;
    }

    public boolean isDescendImports() {
        return descendImports;
    }

    /**
     * Dispatch {@code node} to its hook, then recurse into its children if auto-descending.
     */
    public void visit(SourceNode node) {
        if (node == null) {
            throw new LintContractViolation("null node reached dispatch in " + getClass().getSimpleName());
        }
        node.accept(this);
        if (autoDescend) {
            visitChildren(node);
        }
    }

    /**
     * Recurse into the children of {@code node}. No-op under auto-descend, where the
     * dispatcher already does it.
     */
    protected void descend(SourceNode node) {
        if (!autoDescend) {
            visitChildren(node);
        }
    }

    private void visitChildren(SourceNode node) {
        for (SourceNode child : node.children()) {
            if (!(child instanceof Document) || descendImports) {
                visit(child);
            }
        }
    }

    @Override
    public void document(Document obj) {
        descend(obj);
    }

    @Override
    public void workflow(Workflow obj) {
        descend(obj);
    }

    @Override
    public void call(Call obj) {
        descend(obj);
    }

    @Override
    public void scatter(Scatter obj) {
        descend(obj);
    }

    @Override
    public void conditional(Conditional obj) {
        descend(obj);
    }

    @Override
    public void decl(Decl obj) {
        descend(obj);
    }

    @Override
    public void task(Task obj) {
        descend(obj);
    }

    @Override
    public void structTypeDef(StructTypeDef obj) {
        descend(obj);
    }

    @Override
    public void expression(Expression obj) {
        descend(obj);
    }
}
