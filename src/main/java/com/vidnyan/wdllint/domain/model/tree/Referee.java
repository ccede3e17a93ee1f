package com.vidnyan.wdllint.domain.model.tree;

/**
 * Something an identifier expression can be bound to by the type checker:
 * a {@link Decl}, a {@link Call} (its outputs), or a {@link Gather} over either.
 */
public interface Referee {
}
