package com.vidnyan.wdllint.domain.lint;

import com.vidnyan.wdllint.domain.model.LintContractViolation;
import com.vidnyan.wdllint.domain.model.SourceNode;
import com.vidnyan.wdllint.domain.model.tree.Call;
import com.vidnyan.wdllint.domain.model.tree.Decl;
import com.vidnyan.wdllint.domain.model.tree.Document;
import com.vidnyan.wdllint.domain.model.tree.Executable;
import com.vidnyan.wdllint.domain.model.tree.Workflow;

/**
 * Lookups along {@code parent} links. All require the parent-linking pass to have run.
 */
public final class TreeNavigation {

    private TreeNavigation() {
    }

    /**
     * The task or workflow containing {@code node} (or {@code node} itself), or null.
     */
    public static Executable parentExecutable(SourceNode node) {
        SourceNode current = node;
        while (current != null && !(current instanceof Executable)) {
            current = current.getParent();
        }
        return (Executable) current;
    }

    public static Executable enclosingExecutable(SourceNode node) {
        Executable executable = parentExecutable(node);
        if (executable == null) {
            throw new LintContractViolation("no enclosing task or workflow for node at " + node.getPos().format());
        }
        return executable;
    }

    public static Document enclosingDocument(SourceNode node) {
        SourceNode current = node;
        while (current != null && !(current instanceof Document)) {
            current = current.getParent();
        }
        if (current == null) {
            throw new LintContractViolation("no enclosing document for node at " + node.getPos().format());
        }
        return (Document) current;
    }

    public static Workflow enclosingWorkflow(SourceNode node) {
        SourceNode current = node;
        while (current != null && !(current instanceof Workflow)) {
            current = current.getParent();
        }
        if (current == null) {
            throw new LintContractViolation("no enclosing workflow for node at " + node.getPos().format());
        }
        return (Workflow) current;
    }

    /**
     * The callee input declaration a call input binds.
     *
     * @throws LintContractViolation if the call is unresolved or the callee has no such input
     */
    public static Decl findInputDecl(Call call, String name) {
        Executable callee = call.getCallee();
        if (callee == null) {
            throw new LintContractViolation("call " + call.getName() + " has no resolved callee");
        }
        return callee.availableInputs().stream()
                .filter(decl -> decl.getName().equals(name))
                .findFirst()
                .orElseThrow(() -> new LintContractViolation(
                        "call " + call.getName() + " binds unknown input " + name + " of " + callee.getName()));
    }
}
