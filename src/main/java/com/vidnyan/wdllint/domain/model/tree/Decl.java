package com.vidnyan.wdllint.domain.model.tree;

import com.vidnyan.wdllint.domain.model.NodeVisitor;
import com.vidnyan.wdllint.domain.model.SourceNode;
import com.vidnyan.wdllint.domain.model.SourcePosition;
import com.vidnyan.wdllint.domain.model.expr.Expression;
import com.vidnyan.wdllint.domain.model.expr.Ident;
import com.vidnyan.wdllint.domain.model.type.WdlType;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Value declaration {@code Type name [= expr]}, in a task, workflow or workflow section.
 */
@Getter
public class Decl extends WorkflowNode implements Referee {

    private final WdlType type;
    private final String name;
    private final Expression expr;

    private final List<Ident> referrers = new ArrayList<>();

    public Decl(SourcePosition pos, WdlType type, String name, Expression expr) {
        super(pos);
        this.type = type;
        this.name = name;
        this.expr = expr;
    }

    /**
     * Identifier expressions reading this declaration, in traversal order.
     */
    public List<Ident> getReferrers() {
        return Collections.unmodifiableList(referrers);
    }

    public void addReferrer(Ident ident) {
        referrers.add(ident);
    }

    @Override
    public List<? extends SourceNode> children() {
        return expr == null ? List.of() : List.of(expr);
    }

    @Override
    public void accept(NodeVisitor visitor) {
        visitor.decl(this);
    }
}
