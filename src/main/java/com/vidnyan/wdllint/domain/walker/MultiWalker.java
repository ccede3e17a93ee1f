package com.vidnyan.wdllint.domain.walker;

import com.vidnyan.wdllint.domain.model.LintContractViolation;
import com.vidnyan.wdllint.domain.model.expr.Expression;
import com.vidnyan.wdllint.domain.model.tree.Call;
import com.vidnyan.wdllint.domain.model.tree.Conditional;
import com.vidnyan.wdllint.domain.model.tree.Decl;
import com.vidnyan.wdllint.domain.model.tree.Document;
import com.vidnyan.wdllint.domain.model.tree.Scatter;
import com.vidnyan.wdllint.domain.model.tree.StructTypeDef;
import com.vidnyan.wdllint.domain.model.tree.Task;
import com.vidnyan.wdllint.domain.model.tree.Workflow;

import java.util.List;

/**
 * Runs several auto-descend walkers in a single traversal: at each node, every walker's hook is
 * invoked in list order before descending.
 */
public class MultiWalker extends Walker {

    private final List<Walker> walkers;

    public MultiWalker(List<? extends Walker> walkers, boolean descendImports) {
        super(true, descendImports);
        for (Walker walker : walkers) {
            if (!walker.isAutoDescend()) {
                throw new LintContractViolation(
                        walker.getClass().getSimpleName() + " is manual-descend and cannot be multiplexed");
            }
        }
        this.walkers = List.copyOf(walkers);
    }

    @Override
    public void document(Document obj) {
        for (Walker walker : walkers) {
            walker.document(obj);
        }
    }

    @Override
    public void workflow(Workflow obj) {
        for (Walker walker : walkers) {
            walker.workflow(obj);
        }
    }

    @Override
    public void call(Call obj) {
        for (Walker walker : walkers) {
            walker.call(obj);
        }
    }

    @Override
    public void scatter(Scatter obj) {
        for (Walker walker : walkers) {
            walker.scatter(obj);
        }
    }

    @Override
    public void conditional(Conditional obj) {
        for (Walker walker : walkers) {
            walker.conditional(obj);
        }
    }

    @Override
    public void decl(Decl obj) {
        for (Walker walker : walkers) {
            walker.decl(obj);
        }
    }

    @Override
    public void task(Task obj) {
        for (Walker walker : walkers) {
            walker.task(obj);
        }
    }

    @Override
    public void structTypeDef(StructTypeDef obj) {
        for (Walker walker : walkers) {
            walker.structTypeDef(obj);
        }
    }

    @Override
    public void expression(Expression obj) {
        for (Walker walker : walkers) {
            walker.expression(obj);
        }
    }
}
