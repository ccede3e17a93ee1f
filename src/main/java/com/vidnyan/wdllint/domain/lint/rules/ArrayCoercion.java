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

/**
 * Implicit promotion of {@code T} to {@code Array[T]}.
 */
public class ArrayCoercion extends Linter {

    public ArrayCoercion(LintContext context) {
        super(context);
    }

    @Override
    public void decl(Decl obj) {
        if (obj.getExpr() != null && Coercions.isArrayCoercion(obj.getType(), obj.getExpr().getType())) {
            add(obj, obj.getType() + " " + obj.getName() + " = :" + obj.getExpr().getType() + ":");
        }
    }

    @Override
    public void expression(Expression obj) {
        if (obj instanceof Apply apply) {
            StdLib.staticFunction(apply.getFunctionName()).ifPresent(function -> {
                List<WdlType> parameters = function.argumentTypes();
                List<Expression> arguments = apply.getArguments();
                for (int i = 0; i < Math.min(parameters.size(), arguments.size()); i++) {
                    Expression arg = arguments.get(i);
                    if (Coercions.isArrayCoercion(parameters.get(i), arg.getType())) {
                        add(obj.getParent(), parameters.get(i) + " argument of " + function.name()
                                + "() = :" + arg.getType() + ":", arg.getPos());
                    }
                }
            });
        }
    }

    @Override
    public void call(Call obj) {
        obj.getInputs().forEach((name, value) -> {
            Decl decl = TreeNavigation.findInputDecl(obj, name);
            if (Coercions.isArrayCoercion(decl.getType(), value.getType())) {
                add(obj, "input " + decl.getType() + " " + decl.getName() + " = :" + value.getType() + ":", value.getPos());
            }
        });
    }
}
