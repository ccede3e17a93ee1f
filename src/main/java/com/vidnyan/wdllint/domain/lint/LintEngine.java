package com.vidnyan.wdllint.domain.lint;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.wdllint.application.port.out.ShellChecker;
import com.vidnyan.wdllint.domain.model.Diagnostic;
import com.vidnyan.wdllint.domain.model.tree.Document;
import com.vidnyan.wdllint.domain.walker.MarkCalled;
import com.vidnyan.wdllint.domain.walker.MultiWalker;
import com.vidnyan.wdllint.domain.walker.SetParents;
import com.vidnyan.wdllint.domain.walker.SetReferrers;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the annotation passes and then every registered rule over a type-checked document.
 * <p>
 * Auto-descend rules share one traversal; manual-descend rules each traverse the document
 * on their own, in registry order. Diagnostics are attached to the tree; use
 * {@link #collect(Document)} to read them back.
 */
@Slf4j
@RequiredArgsConstructor
public class LintEngine {

    private final LinterRegistry registry;
    private final ShellChecker shellChecker;
    private final ObjectMapper objectMapper;

    /**
     * Lint {@code document} in place.
     *
     * @param descendImports whether imported documents are linted too
     * @return the same document
     */
    public Document lint(Document document, boolean descendImports) {
        log.debug("Annotating tree: parents, call reachability, referrers");
        new SetParents().visit(document);
        new MarkCalled().visit(document);
        new SetReferrers().visit(document);

        LintContext context = new LintContext(descendImports, shellChecker, objectMapper);
        List<Linter> linters = new ArrayList<>();
        try {
            for (LinterRegistry.Entry entry : registry.entries()) {
                log.debug("Instantiating rule {}", entry.name());
                linters.add(entry.factory().create(context));
            }

            List<Linter> autoDescend = linters.stream().filter(Linter::isAutoDescend).toList();
            if (!autoDescend.isEmpty()) {
                log.debug("Running {} auto-descend rules in one traversal", autoDescend.size());
                new MultiWalker(autoDescend, descendImports).visit(document);
            }
            for (Linter linter : linters) {
                if (!linter.isAutoDescend()) {
                    log.debug("Running {}", linter.getName());
                    linter.visit(document);
                }
            }
        } finally {
            linters.forEach(Linter::close);
        }
        return document;
    }

    /**
     * All diagnostics attached in {@code document} and the documents it imports, a node's own
     * diagnostics before those of its descendants.
     */
    public static List<Diagnostic> collect(Document document) {
        DiagnosticCollector collector = new DiagnosticCollector();
        collector.visit(document);
        return List.copyOf(collector.getDiagnostics());
    }
}
