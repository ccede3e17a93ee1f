package com.vidnyan.wdllint.domain.model.expr;

import com.vidnyan.wdllint.domain.model.SourceNode;
import com.vidnyan.wdllint.domain.model.SourcePosition;
import com.vidnyan.wdllint.domain.model.type.WdlType;
import lombok.Getter;

import java.util.List;

/**
 * Function application. Infix operators are applications of internal functions named
 * {@code _add}, {@code _sub}, {@code _mul}, {@code _div}, {@code _land}, {@code _lor}, etc.
 */
@Getter
public class Apply extends Expression {

    private final String functionName;
    private final List<Expression> arguments;

    public Apply(SourcePosition pos, WdlType type, String functionName, List<Expression> arguments) {
        super(pos, type);
        this.functionName = functionName;
        this.arguments = List.copyOf(arguments);
    }

    @Override
    public List<? extends SourceNode> children() {
        return arguments;
    }
}
