package com.vidnyan.wdllint.domain.lint.rules;

import com.vidnyan.wdllint.domain.lint.Coercions;
import com.vidnyan.wdllint.domain.lint.LintContext;
import com.vidnyan.wdllint.domain.lint.Linter;
import com.vidnyan.wdllint.domain.lint.TreeNavigation;
import com.vidnyan.wdllint.domain.model.expr.Apply;
import com.vidnyan.wdllint.domain.model.expr.Expression;
import com.vidnyan.wdllint.domain.model.tree.Call;
import com.vidnyan.wdllint.domain.model.tree.Decl;
import com.vidnyan.wdllint.domain.model.type.WdlType;
import com.vidnyan.wdllint.domain.stdlib.StdLib;

import java.util.List;
import java.util.Set;

/**
 * Possibly-empty array where {@code Array[T]+} is expected.
 */
public class NonemptyCoercion extends Linter {

    // Array[File]+ outputs = glob(...) and friends are accepted as a common idiom
    private static final Set<String> TOLERATED_INITIALIZERS = Set.of("glob", "read_lines", "read_tsv", "read_array");

    public NonemptyCoercion(LintContext context) {
        super(context);
    }

    @Override
    public void expression(Expression obj) {
        if (obj instanceof Apply apply) {
            StdLib.staticFunction(apply.getFunctionName()).ifPresent(function -> {
                List<WdlType> parameters = function.argumentTypes();
                List<Expression> arguments = apply.getArguments();
                for (int i = 0; i < Math.min(parameters.size(), arguments.size()); i++) {
                    Expression arg = arguments.get(i);
                    if (Coercions.isNonemptyCoercion(parameters.get(i), arg.getType())) {
                        add(obj.getParent(), parameters.get(i) + " argument of " + function.name()
                                + "() = :" + arg.getType() + ":", arg.getPos());
                    }
                }
            });
        }
    }

    @Override
    public void decl(Decl obj) {
        Expression expr = obj.getExpr();
        if (expr != null
                && Coercions.isNonemptyCoercion(obj.getType(), expr.getType())
                && !(expr instanceof Apply apply && TOLERATED_INITIALIZERS.contains(apply.getFunctionName()))) {
            add(obj, obj.getType() + " " + obj.getName() + " = :" + expr.getType() + ":");
        }
    }

    @Override
    public void call(Call obj) {
        obj.getInputs().forEach((name, value) -> {
            Decl decl = TreeNavigation.findInputDecl(obj, name);
            if (Coercions.isNonemptyCoercion(decl.getType(), value.getType())) {
                add(obj, "input " + decl.getType() + " " + decl.getName() + " = :" + value.getType() + ":", value.getPos());
            }
        });
    }
}
