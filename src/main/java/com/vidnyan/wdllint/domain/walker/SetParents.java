package com.vidnyan.wdllint.domain.walker;

import com.vidnyan.wdllint.domain.model.LintContractViolation;
import com.vidnyan.wdllint.domain.model.expr.Expression;
import com.vidnyan.wdllint.domain.model.tree.Call;
import com.vidnyan.wdllint.domain.model.tree.Conditional;
import com.vidnyan.wdllint.domain.model.tree.Decl;
import com.vidnyan.wdllint.domain.model.tree.Document;
import com.vidnyan.wdllint.domain.model.tree.DocumentImport;
import com.vidnyan.wdllint.domain.model.tree.Scatter;
import com.vidnyan.wdllint.domain.model.tree.StructTypeDef;
import com.vidnyan.wdllint.domain.model.tree.Task;
import com.vidnyan.wdllint.domain.model.tree.TreeNode;
import com.vidnyan.wdllint.domain.model.tree.Workflow;
import com.vidnyan.wdllint.domain.model.tree.WorkflowNode;
import com.vidnyan.wdllint.domain.model.tree.WorkflowSection;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sets {@code parent} on every node:
 * <ul>
 *   <li>Document: the importing document, null at top level</li>
 *   <li>Workflow, Task, StructTypeDef: the containing document</li>
 *   <li>Call, Scatter, Conditional: the containing workflow, scatter or conditional</li>
 *   <li>Decl: the containing task, workflow, scatter or conditional</li>
 *   <li>Expression: the innermost enclosing Decl, Call, Scatter, Conditional or Task</li>
 * </ul>
 * Always descends into imports, since call marking needs imported documents linked.
 */
public class SetParents extends Walker {

    private final Deque<TreeNode> parentStack = new ArrayDeque<>();

    public SetParents() {
        super(false, true);
    }

    @Override
    public void document(Document obj) {
        super.document(obj);
        obj.setParent(null);
        for (DocumentImport imp : obj.getImports()) {
            imp.doc().setParent(obj);
        }
        for (StructTypeDef struct : obj.getStructTypedefs()) {
            struct.setParent(obj);
        }
        for (Task task : obj.getTasks()) {
            task.setParent(obj);
        }
        if (obj.getWorkflow() != null) {
            obj.getWorkflow().setParent(obj);
        }
    }

    @Override
    public void workflow(Workflow obj) {
        super.workflow(obj);
        if (obj.getInputs() != null) {
            obj.getInputs().forEach(decl -> decl.setParent(obj));
        }
        obj.getElements().forEach(element -> element.setParent(obj));
        if (obj.getOutputs() != null) {
            obj.getOutputs().forEach(decl -> decl.setParent(obj));
        }
    }

    @Override
    public void call(Call obj) {
        parentStack.push(obj);
        super.call(obj);
        parentStack.pop();
    }

    @Override
    public void scatter(Scatter obj) {
        visitSection(obj);
    }

    @Override
    public void conditional(Conditional obj) {
        visitSection(obj);
    }

    private void visitSection(WorkflowSection obj) {
        parentStack.push(obj);
        descend(obj);
        parentStack.pop();
        for (WorkflowNode element : obj.getElements()) {
            element.setParent(obj);
        }
    }

    @Override
    public void task(Task obj) {
        parentStack.push(obj);
        super.task(obj);
        parentStack.pop();
        if (obj.getInputs() != null) {
            obj.getInputs().forEach(decl -> decl.setParent(obj));
        }
        obj.getPostinputs().forEach(decl -> decl.setParent(obj));
        obj.getOutputs().forEach(decl -> decl.setParent(obj));
    }

    @Override
    public void decl(Decl obj) {
        parentStack.push(obj);
        super.decl(obj);
        parentStack.pop();
    }

    @Override
    public void expression(Expression obj) {
        super.expression(obj);
        TreeNode container = parentStack.peek();
        if (container == null) {
            throw new LintContractViolation("expression at " + obj.getPos().format()
                    + " is not inside a declaration, call, section or task");
        }
        obj.setParent(container);
    }
}
