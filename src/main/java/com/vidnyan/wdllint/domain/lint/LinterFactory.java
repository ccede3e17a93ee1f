package com.vidnyan.wdllint.domain.lint;

/**
 * Creates a fresh linter instance for one lint run.
 */
@FunctionalInterface
public interface LinterFactory {

    Linter create(LintContext context);
}
