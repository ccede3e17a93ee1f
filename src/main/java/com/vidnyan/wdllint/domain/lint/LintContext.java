package com.vidnyan.wdllint.domain.lint;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.wdllint.application.port.out.ShellChecker;

/**
 * Settings shared by all linter instances of one lint run.
 */
public record LintContext(
    boolean descendImports,
    ShellChecker shellChecker,
    ObjectMapper objectMapper
) {
}
