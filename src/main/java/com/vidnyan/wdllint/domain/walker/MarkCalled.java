package com.vidnyan.wdllint.domain.walker;

import com.vidnyan.wdllint.domain.model.LintContractViolation;
import com.vidnyan.wdllint.domain.model.tree.Call;
import com.vidnyan.wdllint.domain.model.tree.Executable;
import com.vidnyan.wdllint.domain.model.tree.Task;
import com.vidnyan.wdllint.domain.model.tree.Workflow;
import lombok.extern.slf4j.Slf4j;

/**
 * Sets {@code called} on each Task and Workflow according to whether a Call to it is
 * reachable from the top-level workflow, through any called sub-workflows. The top-level
 * workflow itself counts as called.
 * <p>
 * Requires {@link SetParents}: the top-level workflow is the one whose document has no parent.
 */
@Slf4j
public class MarkCalled extends Walker {

    // set while descending from the top-level workflow
    private boolean marking;

    public MarkCalled() {
        super(false, true);
    }

    @Override
    public void workflow(Workflow obj) {
        obj.setCalled(false);
        if (isTopLevel(obj)) {
            if (marking) {
                throw new LintContractViolation("second top-level workflow " + obj.getName()
                        + " reached while marking calls");
            }
            log.debug("Marking calls reachable from top-level workflow {}", obj.getName());
            obj.setCalled(true);
            marking = true;
            try {
                super.workflow(obj);
            } finally {
                marking = false;
            }
        } else if (marking) {
            super.workflow(obj);
        }
    }

    @Override
    public void call(Call obj) {
        if (!marking) {
            throw new LintContractViolation("call " + obj.getName() + " visited outside the top-level workflow");
        }
        Executable callee = obj.getCallee();
        if (callee == null) {
            throw new LintContractViolation("call " + obj.getName() + " has no resolved callee");
        }
        if (callee instanceof Workflow) {
            visit(callee);
        }
        callee.setCalled(true);
    }

    @Override
    public void task(Task obj) {
        obj.setCalled(false);
    }

    private static boolean isTopLevel(Workflow obj) {
        if (obj.getParent() == null) {
            throw new LintContractViolation("workflow " + obj.getName() + " has no parent; link parents first");
        }
        return obj.getParent().getParent() == null;
    }
}
