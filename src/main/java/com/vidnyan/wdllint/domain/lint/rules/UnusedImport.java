package com.vidnyan.wdllint.domain.lint.rules;

import com.vidnyan.wdllint.domain.lint.LintContext;
import com.vidnyan.wdllint.domain.lint.Linter;
import com.vidnyan.wdllint.domain.model.tree.Document;
import com.vidnyan.wdllint.domain.model.tree.DocumentImport;
import com.vidnyan.wdllint.domain.model.tree.Task;

/**
 * Imported document none of whose tasks or workflow is ever called. Documents imported only
 * for their struct types are flagged too.
 */
public class UnusedImport extends Linter {

    public UnusedImport(LintContext context) {
        super(context);
    }

    @Override
    public void document(Document obj) {
        for (DocumentImport imp : obj.getImports()) {
            Document imported = imp.doc();
            boolean anyCalled = imported.getTasks().stream().anyMatch(Task::isCalled)
                    || (imported.getWorkflow() != null && imported.getWorkflow().isCalled());
            boolean hasExecutables = !imported.getTasks().isEmpty() || imported.getWorkflow() != null;
            if (!anyCalled && hasExecutables) {
                add(obj, "no calls to tasks/workflow in the imported document " + imp.namespace());
            }
        }
    }
}
