package com.vidnyan.wdllint.domain.model.tree;

import com.vidnyan.wdllint.domain.model.NodeVisitor;
import com.vidnyan.wdllint.domain.model.SourceNode;
import com.vidnyan.wdllint.domain.model.SourcePosition;
import com.vidnyan.wdllint.domain.model.expr.Expression;
import com.vidnyan.wdllint.domain.model.expr.StringExpr;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Task definition. {@code postinputs} are the declarations after the input section (all
 * declarations when there is no input section); {@code runtime} keeps source order.
 */
@Getter
public class Task extends Executable {

    private final List<Decl> postinputs;
    private final StringExpr command;
    private final List<Decl> outputs;
    private final Map<String, Expression> runtime;

    public Task(SourcePosition pos, String name, List<Decl> inputs, List<Decl> postinputs,
                StringExpr command, List<Decl> outputs, Map<String, Expression> runtime,
                Map<String, Object> meta) {
        super(pos, name, inputs, meta);
        this.postinputs = List.copyOf(postinputs);
        this.command = command;
        this.outputs = List.copyOf(outputs);
        this.runtime = Collections.unmodifiableMap(new LinkedHashMap<>(runtime));
    }

    @Override
    public List<Decl> availableInputs() {
        return getInputs() != null ? getInputs() : postinputs;
    }

    @Override
    public List<Decl> effectiveOutputs() {
        return outputs;
    }

    @Override
    public List<? extends SourceNode> children() {
        List<SourceNode> children = new ArrayList<>();
        if (getInputs() != null) {
            children.addAll(getInputs());
        }
        children.addAll(postinputs);
        children.add(command);
        children.addAll(runtime.values());
        children.addAll(outputs);
        return children;
    }

    @Override
    public void accept(NodeVisitor visitor) {
        visitor.task(this);
    }
}
