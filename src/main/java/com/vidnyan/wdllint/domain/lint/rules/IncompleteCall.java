package com.vidnyan.wdllint.domain.lint.rules;

import com.vidnyan.wdllint.domain.lint.LintContext;
import com.vidnyan.wdllint.domain.lint.Linter;
import com.vidnyan.wdllint.domain.model.LintContractViolation;
import com.vidnyan.wdllint.domain.model.tree.Call;
import com.vidnyan.wdllint.domain.model.tree.Decl;

import java.util.List;

/**
 * Call that does not supply every required input of its callee.
 */
public class IncompleteCall extends Linter {

    public IncompleteCall(LintContext context) {
        super(context);
    }

    @Override
    public void call(Call obj) {
        if (obj.getCallee() == null) {
            throw new LintContractViolation("call " + obj.getName() + " has no resolved callee");
        }
        List<String> omitted = obj.getCallee().requiredInputs().stream()
                .map(Decl::getName)
                .filter(name -> !obj.getInputs().containsKey(name))
                .toList();
        if (!omitted.isEmpty()) {
            add(obj, "required input(s) omitted in call to " + obj.getCallee().getName()
                    + " (" + String.join(", ", omitted) + ")");
        }
    }
}
