package com.vidnyan.wdllint.domain.model.expr;

import com.vidnyan.wdllint.domain.model.SourceNode;
import com.vidnyan.wdllint.domain.model.SourcePosition;
import com.vidnyan.wdllint.domain.model.type.WdlType;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * Map literal {@code {k: v, ...}}.
 */
@Getter
public class MapExpr extends Expression {

    private final List<Entry> entries;

    public MapExpr(SourcePosition pos, WdlType type, List<Entry> entries) {
        super(pos, type);
        this.entries = List.copyOf(entries);
    }

    @Override
    public List<? extends SourceNode> children() {
        List<SourceNode> children = new ArrayList<>();
        for (Entry entry : entries) {
            children.add(entry.key());
            children.add(entry.value());
        }
        return children;
    }

    public record Entry(Expression key, Expression value) {
    }
}
