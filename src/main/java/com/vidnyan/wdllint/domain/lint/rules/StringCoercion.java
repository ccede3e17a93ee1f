package com.vidnyan.wdllint.domain.lint.rules;

import com.vidnyan.wdllint.domain.lint.Coercions;
import com.vidnyan.wdllint.domain.lint.LintContext;
import com.vidnyan.wdllint.domain.lint.Linter;
import com.vidnyan.wdllint.domain.lint.TreeNavigation;
import com.vidnyan.wdllint.domain.model.SourceNode;
import com.vidnyan.wdllint.domain.model.expr.Apply;
import com.vidnyan.wdllint.domain.model.expr.ArrayExpr;
import com.vidnyan.wdllint.domain.model.expr.Expression;
import com.vidnyan.wdllint.domain.model.tree.Call;
import com.vidnyan.wdllint.domain.model.tree.Decl;
import com.vidnyan.wdllint.domain.model.tree.Task;
import com.vidnyan.wdllint.domain.model.tree.TreeNode;
import com.vidnyan.wdllint.domain.model.type.AnyType;
import com.vidnyan.wdllint.domain.model.type.FileType;
import com.vidnyan.wdllint.domain.model.type.StringType;
import com.vidnyan.wdllint.domain.model.type.WdlType;
import com.vidnyan.wdllint.domain.stdlib.StaticFunction;
import com.vidnyan.wdllint.domain.stdlib.StdLib;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Non-String value where a String is expected. File to String is normal inside tasks, so it
 * is only flagged at the workflow level.
 */
public class StringCoercion extends Linter {

    public StringCoercion(LintContext context) {
        super(context);
    }

    @Override
    public void decl(Decl obj) {
        if (obj.getExpr() != null
                && Coercions.compoundCoercion(obj.getType(), obj.getExpr().getType(), StringType.class, fileToleratedIn(obj))) {
            add(obj, obj.getType() + " " + obj.getName() + " = :" + obj.getExpr().getType() + ":");
        }
    }

    @Override
    public void expression(Expression obj) {
        TreeNode parent = obj.getParent();
        if (obj instanceof Apply apply) {
            if ("_add".equals(apply.getFunctionName())) {
                checkConcatenation(apply, parent);
            } else if (!"basename".equals(apply.getFunctionName())) {
                // basename takes either String or File
                StdLib.staticFunction(apply.getFunctionName())
                        .ifPresent(function -> checkArguments(apply, function, parent));
            }
        } else if (obj instanceof ArrayExpr array) {
            checkArrayLiteral(array, parent);
        }
    }

    private void checkConcatenation(Apply apply, TreeNode parent) {
        boolean anyString = false;
        WdlType nonString = null;
        for (Expression arg : apply.getArguments()) {
            if (arg.getType() instanceof StringType) {
                anyString = true;
            } else if (!(arg.getType() instanceof FileType)) {
                nonString = arg.getType();
            }
        }
        // in a task command the coercion is probably intentional
        if (anyString && nonString != null && !(parent instanceof Task)) {
            add(parent, "string concatenation (+) has " + nonString + " argument", apply.getPos());
        }
    }

    private void checkArguments(Apply apply, StaticFunction function, TreeNode parent) {
        List<WdlType> parameters = function.argumentTypes();
        List<Expression> arguments = apply.getArguments();
        for (int i = 0; i < Math.min(parameters.size(), arguments.size()); i++) {
            WdlType expected = parameters.get(i);
            Expression arg = arguments.get(i);
            if (Coercions.compoundCoercion(expected, arg.getType(), StringType.class, fileToleratedIn(apply))) {
                add(parent, expected + " argument of " + function.name() + "() = :" + arg.getType() + ":", arg.getPos());
            }
        }
    }

    private void checkArrayLiteral(ArrayExpr array, TreeNode parent) {
        boolean anyString = false;
        boolean allString = true;
        for (Expression item : array.getItems()) {
            WdlType type = item.getType();
            if (type instanceof StringType) {
                anyString = true;
            } else if (!(type instanceof FileType || type instanceof AnyType)) {
                allString = false;
            }
        }
        if (anyString && !allString) {
            String items = array.getItems().stream()
                    .map(item -> ":" + item.getType() + ":")
                    .collect(Collectors.joining(", "));
            add(parent, array.getType() + " literal = [" + items + "]", array.getPos());
        }
    }

    @Override
    public void call(Call obj) {
        obj.getInputs().forEach((name, value) -> {
            Decl decl = TreeNavigation.findInputDecl(obj, name);
            if (Coercions.compoundCoercion(decl.getType(), value.getType(), StringType.class)) {
                add(obj, "input " + decl.getType() + " " + decl.getName() + " = :" + value.getType() + ":", value.getPos());
            }
        });
    }

    private static Class<FileType> fileToleratedIn(SourceNode node) {
        return TreeNavigation.parentExecutable(node) instanceof Task ? FileType.class : null;
    }
}
