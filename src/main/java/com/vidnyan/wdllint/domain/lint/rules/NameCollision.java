package com.vidnyan.wdllint.domain.lint.rules;

import com.vidnyan.wdllint.domain.lint.LintContext;
import com.vidnyan.wdllint.domain.lint.Linter;
import com.vidnyan.wdllint.domain.lint.TreeNavigation;
import com.vidnyan.wdllint.domain.model.tree.Call;
import com.vidnyan.wdllint.domain.model.tree.Decl;
import com.vidnyan.wdllint.domain.model.tree.Document;
import com.vidnyan.wdllint.domain.model.tree.DocumentImport;
import com.vidnyan.wdllint.domain.model.tree.Scatter;
import com.vidnyan.wdllint.domain.model.tree.StructTypeDef;
import com.vidnyan.wdllint.domain.model.tree.Task;
import com.vidnyan.wdllint.domain.model.tree.TreeNode;
import com.vidnyan.wdllint.domain.model.tree.Workflow;

/**
 * Names that are legal but confusing because they shadow another kind of name in the same
 * document: import namespaces, the workflow, tasks and struct types.
 */
public class NameCollision extends Linter {

    public NameCollision(LintContext context) {
        super(context);
    }

    @Override
    public void call(Call obj) {
        String description = "call name '" + obj.getName() + "'";
        Document doc = TreeNavigation.enclosingDocument(obj);
        checkImports(obj, obj.getName(), description, doc);
        checkWorkflow(obj, obj.getName(), description, doc);
        checkStructs(obj, obj.getName(), description, doc);
    }

    @Override
    public void decl(Decl obj) {
        String description = "declaration of '" + obj.getName() + "'";
        Document doc = TreeNavigation.enclosingDocument(obj);
        checkImports(obj, obj.getName(), description, doc);
        checkWorkflow(obj, obj.getName(), description, doc);
        checkTasks(obj, obj.getName(), description, doc);
        checkStructs(obj, obj.getName(), description, doc);
    }

    @Override
    public void scatter(Scatter obj) {
        String description = "scatter variable '" + obj.getVariable() + "'";
        Document doc = TreeNavigation.enclosingDocument(obj);
        checkImports(obj, obj.getVariable(), description, doc);
        checkWorkflow(obj, obj.getVariable(), description, doc);
        checkTasks(obj, obj.getVariable(), description, doc);
        checkStructs(obj, obj.getVariable(), description, doc);
    }

    @Override
    public void workflow(Workflow obj) {
        String description = "workflow name '" + obj.getName() + "'";
        Document doc = TreeNavigation.enclosingDocument(obj);
        checkImports(obj, obj.getName(), description, doc);
        checkStructs(obj, obj.getName(), description, doc);
    }

    @Override
    public void task(Task obj) {
        String description = "task name '" + obj.getName() + "'";
        Document doc = TreeNavigation.enclosingDocument(obj);
        checkImports(obj, obj.getName(), description, doc);
        checkStructs(obj, obj.getName(), description, doc);
    }

    @Override
    public void document(Document obj) {
        for (DocumentImport imp : obj.getImports()) {
            checkStructs(obj, imp.namespace(), "imported document namespace '" + imp.namespace() + "'", obj);
        }
    }

    private void checkImports(TreeNode node, String name, String description, Document doc) {
        for (DocumentImport imp : doc.getImports()) {
            if (imp.namespace().equals(name)) {
                add(node, description + " collides with imported document namespace");
            }
        }
    }

    private void checkWorkflow(TreeNode node, String name, String description, Document doc) {
        if (doc.getWorkflow() != null && doc.getWorkflow().getName().equals(name)) {
            add(node, description + " collides with workflow name");
        }
    }

    private void checkTasks(TreeNode node, String name, String description, Document doc) {
        for (Task task : doc.getTasks()) {
            if (task.getName().equals(name)) {
                add(node, description + " collides with a task name");
            }
        }
    }

    private void checkStructs(TreeNode node, String name, String description, Document doc) {
        for (StructTypeDef struct : doc.getStructTypedefs()) {
            if (struct.getName().equals(name)) {
                add(node, description + " collides with " + (struct.isImported() ? "imported " : "") + "struct type");
            }
        }
    }
}
