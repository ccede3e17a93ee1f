package com.vidnyan.wdllint.domain.lint.rules;

import com.vidnyan.wdllint.domain.lint.Coercions;
import com.vidnyan.wdllint.domain.lint.LintContext;
import com.vidnyan.wdllint.domain.lint.Linter;
import com.vidnyan.wdllint.domain.lint.TreeNavigation;
import com.vidnyan.wdllint.domain.model.expr.Apply;
import com.vidnyan.wdllint.domain.model.expr.Expression;
import com.vidnyan.wdllint.domain.model.tree.Call;
import com.vidnyan.wdllint.domain.model.tree.Decl;
import com.vidnyan.wdllint.domain.model.tree.Task;
import com.vidnyan.wdllint.domain.model.type.ArrayType;
import com.vidnyan.wdllint.domain.model.type.FileType;
import com.vidnyan.wdllint.domain.model.type.WdlType;
import com.vidnyan.wdllint.domain.stdlib.StaticFunction;
import com.vidnyan.wdllint.domain.stdlib.StdLib;

import java.util.List;
import java.util.Optional;

/**
 * String value where a File is expected. Typical in task outputs, so those are not visited.
 */
public class FileCoercion extends Linter {

    public FileCoercion(LintContext context) {
        super(false, context);
    }

    @Override
    public void task(Task obj) {
        if (obj.getInputs() != null) {
            obj.getInputs().forEach(this::visit);
        }
        obj.getPostinputs().forEach(this::visit);
        visit(obj.getCommand());
        obj.getRuntime().values().forEach(this::visit);
    }

    @Override
    public void decl(Decl obj) {
        super.decl(obj);
        if (obj.getExpr() != null
                && Coercions.compoundCoercion(obj.getType(), obj.getExpr().getType(), FileType.class)) {
            add(obj, obj.getType() + " " + obj.getName() + " = :" + obj.getExpr().getType() + ":");
        }
    }

    @Override
    public void expression(Expression obj) {
        super.expression(obj);
        if (!(obj instanceof Apply apply)) {
            return;
        }
        Optional<StaticFunction> function = StdLib.staticFunction(apply.getFunctionName());
        if (function.isPresent()) {
            List<WdlType> parameters = function.get().argumentTypes();
            List<Expression> arguments = apply.getArguments();
            for (int i = 0; i < Math.min(parameters.size(), arguments.size()); i++) {
                Expression arg = arguments.get(i);
                if (Coercions.compoundCoercion(parameters.get(i), arg.getType(), FileType.class)) {
                    add(obj.getParent(), parameters.get(i) + " argument of " + function.get().name()
                            + "() = :" + arg.getType() + ":", arg.getPos());
                }
            }
        } else if ("size".equals(apply.getFunctionName()) && !apply.getArguments().isEmpty()) {
            Expression arg = apply.getArguments().get(0);
            WdlType type = arg.getType();
            boolean fileLike = type instanceof FileType
                    || (type instanceof ArrayType array && array.getItemType() instanceof FileType);
            if (!fileLike) {
                add(obj.getParent(), "File?/Array[File?] argument of size() = :" + type + ":", arg.getPos());
            }
        }
    }

    @Override
    public void call(Call obj) {
        super.call(obj);
        obj.getInputs().forEach((name, value) -> {
            Decl decl = TreeNavigation.findInputDecl(obj, name);
            if (Coercions.compoundCoercion(decl.getType(), value.getType(), FileType.class)) {
                add(obj, "input " + decl.getType() + " " + decl.getName() + " = :" + value.getType() + ":", value.getPos());
            }
        });
    }
}
