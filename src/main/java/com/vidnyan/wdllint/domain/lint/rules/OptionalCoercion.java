package com.vidnyan.wdllint.domain.lint.rules;

import com.vidnyan.wdllint.domain.lint.Coercions;
import com.vidnyan.wdllint.domain.lint.LintContext;
import com.vidnyan.wdllint.domain.lint.Linter;
import com.vidnyan.wdllint.domain.lint.TreeNavigation;
import com.vidnyan.wdllint.domain.model.LintContractViolation;
import com.vidnyan.wdllint.domain.model.expr.Apply;
import com.vidnyan.wdllint.domain.model.expr.Expression;
import com.vidnyan.wdllint.domain.model.tree.Call;
import com.vidnyan.wdllint.domain.model.tree.Decl;
import com.vidnyan.wdllint.domain.model.tree.Task;
import com.vidnyan.wdllint.domain.model.type.WdlType;
import com.vidnyan.wdllint.domain.stdlib.StdLib;

import java.util.List;
import java.util.Set;

/**
 * Optional value where a non-optional one is expected. These normally fail type checking, but
 * enforcement is lax for older WDL versions.
 */
public class OptionalCoercion extends Linter {

    private static final Set<String> INFIX_OPERATORS = Set.of("_add", "_sub", "_mul", "_div", "_land", "_lor");

    public OptionalCoercion(LintContext context) {
        super(context);
    }

    @Override
    public void expression(Expression obj) {
        if (!(obj instanceof Apply apply)) {
            return;
        }
        if (INFIX_OPERATORS.contains(apply.getFunctionName())) {
            checkInfix(apply);
        } else {
            StdLib.staticFunction(apply.getFunctionName()).ifPresent(function -> {
                List<WdlType> parameters = function.argumentTypes();
                List<Expression> arguments = apply.getArguments();
                for (int i = 0; i < Math.min(parameters.size(), arguments.size()); i++) {
                    Expression arg = arguments.get(i);
                    if (unexpectedOptional(parameters.get(i), arg.getType())) {
                        add(obj.getParent(), parameters.get(i) + " argument of " + function.name()
                                + "() = :" + arg.getType() + ":", arg.getPos());
                    }
                }
            });
        }
    }

    private void checkInfix(Apply apply) {
        if (apply.getArguments().size() != 2) {
            throw new LintContractViolation("infix " + apply.getFunctionName() + " at "
                    + apply.getPos().format() + " has " + apply.getArguments().size() + " operands");
        }
        WdlType left = apply.getArguments().get(0).getType();
        WdlType right = apply.getArguments().get(1).getType();
        // "prefix" ~{"--flag " + x} in a command is intentional
        boolean commandConcatenation = "_add".equals(apply.getFunctionName()) && apply.getParent() instanceof Task;
        if ((left.isOptional() || right.isOptional()) && !commandConcatenation) {
            add(apply.getParent(), "infix operator has :" + left + ": and :" + right + ": operands", apply.getPos());
        }
    }

    @Override
    public void decl(Decl obj) {
        if (obj.getExpr() != null && unexpectedOptional(obj.getType(), obj.getExpr().getType())) {
            add(obj, obj.getType() + " " + obj.getName() + " = :" + obj.getExpr().getType() + ":");
        }
    }

    @Override
    public void call(Call obj) {
        obj.getInputs().forEach((name, value) -> {
            Decl decl = TreeNavigation.findInputDecl(obj, name);
            if (unexpectedOptional(decl.getType(), value.getType())) {
                add(obj, "input " + decl.getType() + " " + decl.getName() + " = :" + value.getType() + ":", value.getPos());
            }
        });
    }

    private static boolean unexpectedOptional(WdlType expected, WdlType actual) {
        return !actual.coerces(expected, true) && !Coercions.isArrayCoercion(expected, actual);
    }
}
