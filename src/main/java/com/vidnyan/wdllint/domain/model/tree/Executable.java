package com.vidnyan.wdllint.domain.model.tree;

import com.vidnyan.wdllint.domain.model.SourcePosition;
import lombok.Getter;
import lombok.Setter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Something a {@link Call} can invoke: a {@link Task} or a {@link Workflow}.
 * <p>
 * {@code inputs} is null when the source has no {@code input} section (draft-2 style);
 * {@code called} is filled in by the call-reachability pass. Meta values may be null
 * ({@code meta { note: null }}).
 */
@Getter
public abstract class Executable extends TreeNode {

    private final String name;
    private final List<Decl> inputs;
    private final Map<String, Object> meta;

    @Setter
    private boolean called;

    protected Executable(SourcePosition pos, String name, List<Decl> inputs, Map<String, Object> meta) {
        super(pos);
        this.name = name;
        this.inputs = inputs == null ? null : List.copyOf(inputs);
        this.meta = meta == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(meta));
    }

    /**
     * Declarations a caller may supply.
     */
    public abstract List<Decl> availableInputs();

    /**
     * Outputs visible to a caller.
     */
    public abstract List<Decl> effectiveOutputs();

    /**
     * Available inputs without a default that are not optional.
     */
    public List<Decl> requiredInputs() {
        return availableInputs().stream()
                .filter(decl -> decl.getExpr() == null && !decl.getType().isOptional())
                .toList();
    }
}
