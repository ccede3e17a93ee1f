package com.vidnyan.wdllint.domain.lint.rules;

import com.vidnyan.wdllint.domain.lint.LintContext;
import com.vidnyan.wdllint.domain.lint.Linter;
import com.vidnyan.wdllint.domain.lint.TreeNavigation;
import com.vidnyan.wdllint.domain.model.tree.Decl;
import com.vidnyan.wdllint.domain.model.tree.Executable;

/**
 * {@code T? x = <non-optional>} outside an input section, where the quantifier can never
 * matter. In an input section it means the default may be overridden with null.
 */
public class UnnecessaryQuantifier extends Linter {

    public UnnecessaryQuantifier(LintContext context) {
        super(context);
    }

    @Override
    public void decl(Decl obj) {
        if (!obj.getType().isOptional() || obj.getExpr() == null || obj.getExpr().getType().isOptional()) {
            return;
        }
        Executable executable = TreeNavigation.enclosingExecutable(obj);
        if (executable.getInputs() != null && executable.getInputs().stream().noneMatch(input -> input == obj)) {
            add(obj, "unnecessary optional quantifier (?) for non-input " + obj.getType() + " " + obj.getName());
        }
    }
}
