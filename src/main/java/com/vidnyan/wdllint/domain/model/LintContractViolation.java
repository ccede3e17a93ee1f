package com.vidnyan.wdllint.domain.model;

/**
 * Thrown when the tree model or a rule breaks an internal contract of the lint engine
 * (unknown node at dispatch, mixed traversal disciplines, unresolved call input, ...).
 * Indicates a defect, so it is never caught by the engine.
 */
public class LintContractViolation extends IllegalStateException {

    public LintContractViolation(String message) {
        super(message);
    }
}
