package com.vidnyan.wdllint.domain.model.expr;

import com.vidnyan.wdllint.domain.model.SourceNode;
import com.vidnyan.wdllint.domain.model.SourcePosition;
import com.vidnyan.wdllint.domain.model.type.Types;
import lombok.Getter;

import java.util.List;

/**
 * String literal with interpolations, also used for task commands. Parts alternate between
 * literal {@link Text} and {@link Placeholder} interpolations, in source order.
 */
@Getter
public class StringExpr extends Expression {

    private final List<Part> parts;

    public StringExpr(SourcePosition pos, List<Part> parts) {
        super(pos, Types.string());
        this.parts = List.copyOf(parts);
    }

    @Override
    public List<? extends SourceNode> children() {
        return parts.stream()
                .filter(Placeholder.class::isInstance)
                .map(Placeholder.class::cast)
                .toList();
    }

    /**
     * A piece of a string expression.
     */
    public interface Part {
    }

    /**
     * Literal text, with escapes already processed.
     */
    public record Text(String text) implements Part {
    }
}
