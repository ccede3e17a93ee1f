package com.vidnyan.wdllint.domain.model.tree;

import com.vidnyan.wdllint.domain.model.NodeVisitor;
import com.vidnyan.wdllint.domain.model.SourceNode;
import com.vidnyan.wdllint.domain.model.SourcePosition;
import com.vidnyan.wdllint.domain.model.expr.Expression;
import com.vidnyan.wdllint.domain.model.expr.Ident;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code call [namespace.]callee [as alias] { input: name = expr, ... }}.
 * The {@code callee} is resolved by the type checker.
 */
@Getter
public class Call extends WorkflowNode implements Referee {

    private final List<String> calleeId;
    private final String alias;
    private final Map<String, Expression> inputs;

    @Setter
    private Executable callee;

    private final List<Ident> referrers = new ArrayList<>();

    public Call(SourcePosition pos, List<String> calleeId, String alias, Map<String, Expression> inputs) {
        super(pos);
        this.calleeId = List.copyOf(calleeId);
        this.alias = alias;
        this.inputs = Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
    }

    /**
     * The name the call's outputs are addressed by: the alias, else the callee's own name.
     */
    public String getName() {
        return alias != null ? alias : calleeId.get(calleeId.size() - 1);
    }

    /**
     * Identifier expressions reading any output of this call, in traversal order.
     */
    public List<Ident> getReferrers() {
        return Collections.unmodifiableList(referrers);
    }

    public void addReferrer(Ident ident) {
        referrers.add(ident);
    }

    /**
     * Outputs the call exposes, i.e. those of its callee.
     */
    public List<Decl> effectiveOutputs() {
        return callee == null ? List.of() : callee.effectiveOutputs();
    }

    @Override
    public List<? extends SourceNode> children() {
        return List.copyOf(inputs.values());
    }

    @Override
    public void accept(NodeVisitor visitor) {
        visitor.call(this);
    }
}
