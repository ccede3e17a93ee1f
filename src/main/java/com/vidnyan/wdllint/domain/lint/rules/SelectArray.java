package com.vidnyan.wdllint.domain.lint.rules;

import com.vidnyan.wdllint.domain.lint.LintContext;
import com.vidnyan.wdllint.domain.lint.Linter;
import com.vidnyan.wdllint.domain.model.expr.Apply;
import com.vidnyan.wdllint.domain.model.expr.Expression;
import com.vidnyan.wdllint.domain.model.type.ArrayType;

import java.util.Set;

/**
 * {@code select_first} or {@code select_all} applied to an array that cannot hold nulls.
 */
public class SelectArray extends Linter {

    private static final Set<String> SELECT_FUNCTIONS = Set.of("select_first", "select_all");

    public SelectArray(LintContext context) {
        super(context);
    }

    @Override
    public void expression(Expression obj) {
        if (obj instanceof Apply apply
                && SELECT_FUNCTIONS.contains(apply.getFunctionName())
                && !apply.getArguments().isEmpty()) {
            Expression arg = apply.getArguments().get(0);
            if (arg.getType() instanceof ArrayType array && !array.getItemType().isOptional()) {
                add(obj.getParent(), "array of non-optional items passed to " + apply.getFunctionName(), arg.getPos());
            }
        }
    }
}
