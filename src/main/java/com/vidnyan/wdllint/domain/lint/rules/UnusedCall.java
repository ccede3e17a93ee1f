package com.vidnyan.wdllint.domain.lint.rules;

import com.vidnyan.wdllint.domain.lint.LintContext;
import com.vidnyan.wdllint.domain.lint.Linter;
import com.vidnyan.wdllint.domain.lint.TreeNavigation;
import com.vidnyan.wdllint.domain.model.tree.Call;
import com.vidnyan.wdllint.domain.model.tree.Workflow;

/**
 * Call whose outputs are neither used nor propagated. Only applies in workflows with an
 * output section, since otherwise all call outputs are exposed.
 */
public class UnusedCall extends Linter {

    public UnusedCall(LintContext context) {
        super(context);
    }

    @Override
    public void call(Call obj) {
        if (obj.effectiveOutputs().isEmpty() || !obj.getReferrers().isEmpty()) {
            return;
        }
        Workflow workflow = TreeNavigation.enclosingWorkflow(obj);
        if (workflow.getOutputs() != null) {
            add(obj, "nothing references the outputs of the call " + obj.getName()
                    + " nor are they output from the workflow " + workflow.getName());
        }
    }
}
