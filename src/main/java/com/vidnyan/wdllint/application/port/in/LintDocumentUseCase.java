package com.vidnyan.wdllint.application.port.in;

import com.vidnyan.wdllint.domain.model.Diagnostic;
import com.vidnyan.wdllint.domain.model.tree.Document;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Primary use case: lint a type-checked WDL document.
 */
public interface LintDocumentUseCase {

    /**
     * Lint a document and return every diagnostic found.
     * @param request Lint request parameters
     * @return Lint result with diagnostics and statistics
     */
    LintResult lint(LintRequest request);

    /**
     * Lint request parameters.
     */
    record LintRequest(
        Document document,
        Boolean descendImports   // null = configured default
    ) {
        public static LintRequest forDocument(Document document) {
            return new LintRequest(document, null);
        }
    }

    /**
     * Lint result.
     */
    record LintResult(
        List<Diagnostic> diagnostics,
        LintStats stats
    ) {
        public boolean hasDiagnostics() {
            return !diagnostics.isEmpty();
        }

        /**
         * Number of diagnostics per rule name, sorted by rule name.
         */
        public Map<String, Long> countByRule() {
            return diagnostics.stream()
                    .collect(Collectors.groupingBy(Diagnostic::rule, TreeMap::new, Collectors.counting()));
        }
    }

    /**
     * Lint statistics.
     */
    record LintStats(
        int rulesRun,
        int diagnosticCount,
        long totalDurationMs
    ) {}
}
