package com.vidnyan.wdllint.domain.model.tree;

/**
 * Referent of a value collected out of a scatter or conditional section: inside-out, a
 * {@code Decl x} within {@code scatter} is seen from outside as {@code Array[...] x}.
 * Gathers nest when sections nest; {@link #unwrap(Referee)} yields the underlying node.
 *
 * @param section the scatter or conditional the value is gathered out of
 * @param referee the gathered Decl, Call, or inner Gather
 */
public record Gather(WorkflowSection section, Referee referee) implements Referee {

    /**
     * Strip any number of Gather layers.
     */
    public static Referee unwrap(Referee referee) {
        Referee current = referee;
        while (current instanceof Gather gather) {
            current = gather.referee();
        }
        return current;
    }
}
