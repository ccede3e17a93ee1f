package com.vidnyan.wdllint.application.service;

import com.vidnyan.wdllint.application.port.in.LintDocumentUseCase;
import com.vidnyan.wdllint.config.LintProperties;
import com.vidnyan.wdllint.domain.lint.LintEngine;
import com.vidnyan.wdllint.domain.lint.LinterRegistry;
import com.vidnyan.wdllint.domain.model.Diagnostic;
import com.vidnyan.wdllint.domain.model.tree.Document;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Main application service that runs the lint engine over a document.
 * Implements the primary use case.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LintApplicationService implements LintDocumentUseCase {

    private final LintEngine lintEngine;
    private final LinterRegistry linterRegistry;
    private final LintProperties properties;

    @Override
    public LintResult lint(LintRequest request) {
        Instant startTime = Instant.now();
        Document document = request.document();
        boolean descendImports = request.descendImports() != null
                ? request.descendImports()
                : properties.isDescendImports();
        log.info("Starting lint of: {} (imports {})",
                document.getPos().filename(), descendImports ? "included" : "excluded");

        // Step 1: Annotate and run rules
        log.info("Step 1: Running {} lint rules...", linterRegistry.size());
        lintEngine.lint(document, descendImports);

        // Step 2: Collect diagnostics
        log.info("Step 2: Collecting diagnostics...");
        List<Diagnostic> diagnostics = LintEngine.collect(document);

        Duration totalDuration = Duration.between(startTime, Instant.now());
        LintStats stats = new LintStats(linterRegistry.size(), diagnostics.size(), totalDuration.toMillis());
        LintResult result = new LintResult(diagnostics, stats);

        result.countByRule().forEach((rule, count) -> log.info("  {}: {}", rule, count));
        log.info("Lint complete: {} diagnostics in {}ms", stats.diagnosticCount(), stats.totalDurationMs());
        return result;
    }
}
