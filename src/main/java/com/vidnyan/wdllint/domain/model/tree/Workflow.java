package com.vidnyan.wdllint.domain.model.tree;

import com.vidnyan.wdllint.domain.model.NodeVisitor;
import com.vidnyan.wdllint.domain.model.SourceNode;
import com.vidnyan.wdllint.domain.model.SourcePosition;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Workflow definition. {@code outputs} is null when there is no output section, in which case
 * the outputs of all calls are exposed.
 */
@Getter
public class Workflow extends Executable {

    private final List<WorkflowNode> elements;
    private final List<Decl> outputs;

    public Workflow(SourcePosition pos, String name, List<Decl> inputs, List<WorkflowNode> elements,
                    List<Decl> outputs, Map<String, Object> meta) {
        super(pos, name, inputs, meta);
        this.elements = List.copyOf(elements);
        this.outputs = outputs == null ? null : List.copyOf(outputs);
    }

    @Override
    public List<Decl> availableInputs() {
        if (getInputs() != null) {
            return getInputs();
        }
        return elements.stream()
                .filter(Decl.class::isInstance)
                .map(Decl.class::cast)
                .toList();
    }

    @Override
    public List<Decl> effectiveOutputs() {
        if (outputs != null) {
            return outputs;
        }
        List<Decl> exposed = new ArrayList<>();
        collectCallOutputs(elements, exposed);
        return exposed;
    }

    private static void collectCallOutputs(List<WorkflowNode> nodes, List<Decl> exposed) {
        for (WorkflowNode node : nodes) {
            if (node instanceof Call call) {
                exposed.addAll(call.effectiveOutputs());
            } else if (node instanceof WorkflowSection section) {
                collectCallOutputs(section.getElements(), exposed);
            }
        }
    }

    @Override
    public List<? extends SourceNode> children() {
        List<SourceNode> children = new ArrayList<>();
        if (getInputs() != null) {
            children.addAll(getInputs());
        }
        children.addAll(elements);
        if (outputs != null) {
            children.addAll(outputs);
        }
        return children;
    }

    @Override
    public void accept(NodeVisitor visitor) {
        visitor.workflow(this);
    }
}
