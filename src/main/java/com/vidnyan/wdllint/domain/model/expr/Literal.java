package com.vidnyan.wdllint.domain.model.expr;

import com.vidnyan.wdllint.domain.model.SourceNode;
import com.vidnyan.wdllint.domain.model.SourcePosition;
import com.vidnyan.wdllint.domain.model.type.Types;
import com.vidnyan.wdllint.domain.model.type.WdlType;
import lombok.Getter;

import java.util.List;

/**
 * Boolean, Int or Float constant, or {@code None}. {@code value} is the literal's source text.
 */
@Getter
public class Literal extends Expression {

    private final String value;

    public Literal(SourcePosition pos, WdlType type, String value) {
        super(pos, type);
        this.value = value;
    }

    public static Literal ofBoolean(SourcePosition pos, boolean value) {
        return new Literal(pos, Types.bool(), String.valueOf(value));
    }

    public static Literal ofInt(SourcePosition pos, long value) {
        return new Literal(pos, Types.integer(), String.valueOf(value));
    }

    public static Literal ofFloat(SourcePosition pos, double value) {
        return new Literal(pos, Types.floating(), String.valueOf(value));
    }

    public static Literal ofNull(SourcePosition pos) {
        return new Literal(pos, Types.optional(Types.any()), "None");
    }

    @Override
    public List<? extends SourceNode> children() {
        return List.of();
    }
}
