package com.vidnyan.wdllint.domain.model.expr;

import com.vidnyan.wdllint.domain.model.SourceNode;
import com.vidnyan.wdllint.domain.model.SourcePosition;
import com.vidnyan.wdllint.domain.model.tree.Referee;
import com.vidnyan.wdllint.domain.model.type.WdlType;
import lombok.Getter;
import lombok.Setter;

import java.util.Arrays;
import java.util.List;

/**
 * Identifier reference, possibly dotted ({@code call_name.output}).
 * The {@code referee} is resolved by the type checker.
 */
@Getter
public class Ident extends Expression {

    private final String name;

    @Setter
    private Referee referee;

    public Ident(SourcePosition pos, WdlType type, String name) {
        super(pos, type);
        this.name = name;
    }

    /**
     * Dotted components before the last one; empty for a plain name.
     */
    public List<String> namespace() {
        List<String> components = Arrays.asList(name.split("\\."));
        return components.subList(0, components.size() - 1);
    }

    @Override
    public List<? extends SourceNode> children() {
        return List.of();
    }
}
