package com.vidnyan.wdllint.domain.lint;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.wdllint.application.port.out.ShellChecker;
import com.vidnyan.wdllint.domain.model.Diagnostic;
import com.vidnyan.wdllint.domain.model.LintContractViolation;
import com.vidnyan.wdllint.domain.model.tree.Decl;
import com.vidnyan.wdllint.domain.model.tree.Document;
import com.vidnyan.wdllint.domain.model.tree.Task;
import com.vidnyan.wdllint.domain.model.tree.Workflow;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static com.vidnyan.wdllint.WdlTrees.*;
import static com.vidnyan.wdllint.domain.model.type.Types.*;
import static org.junit.jupiter.api.Assertions.*;

class LintEngineTest {

    /**
     * w { Int unused = 1; String s = 2; call t { a = unused_ref } } with t missing input b and
     * an unknown runtime key.
     */
    private static Document sampleDocument() {
        Decl a = decl(3, integer(), "a");
        Decl b = decl(4, integer(), "b");
        Task t = task("t").line(2).inputs(a, b)
                .command(command(5, "echo ", ref(5, 20, a), " ", ref(5, 30, b)))
                .runtime("dockr", string(7, 12, "ubuntu"))
                .build();
        Decl n = decl(11, integer(), "n", intLiteral(11, 13, 1));
        Decl s = decl(12, string(), "s", intLiteral(12, 16, 2));
        Workflow w = workflow("w").line(10)
                .body(n, s, call(13, t, Map.of("a", ref(13, 20, n))))
                .build();
        return document().tasks(t).workflow(w).build();
    }

    @Test
    void lint_WithDefaultRules_ShouldReportEachProblem() {
        // Arrange
        LintEngine engine = new LintEngine(LinterRegistry.defaults(), ShellChecker.unavailable(), new ObjectMapper());
        Document doc = sampleDocument();

        // Act
        Document linted = engine.lint(doc, true);
        List<Diagnostic> diagnostics = LintEngine.collect(linted);

        // Assert
        assertSame(doc, linted);
        assertEquals(List.of(
                "UnknownRuntimeKey unknown entry in task runtime section: dockr",
                "StringCoercion String s = :Int:",
                "UnusedDeclaration nothing references String s",
                "IncompleteCall required input(s) omitted in call to t (b)"
        ), diagnostics.stream().map(d -> d.rule() + " " + d.message()).toList());
    }

    @Test
    void lint_OnFreshIdenticalTrees_ShouldBeDeterministic() {
        // Arrange
        LintEngine engine = new LintEngine(LinterRegistry.defaults(), ShellChecker.unavailable(), new ObjectMapper());

        // Act
        List<Diagnostic> first = LintEngine.collect(engine.lint(sampleDocument(), true));
        List<Diagnostic> second = LintEngine.collect(engine.lint(sampleDocument(), true));

        // Assert
        assertFalse(first.isEmpty());
        assertEquals(first, second);
    }

    @Test
    void collect_ShouldListOwnDiagnosticsBeforeDescendants() {
        // Arrange
        Decl x = decl(3, integer(), "x");
        Decl y = decl(4, integer(), "y");
        Task t = task("t").line(2).postinputs(x, y).build();
        Document doc = document().tasks(t).build();
        LinterRegistry registry = LinterRegistry.of(List.of(LinterRegistry.entry(TagEverything.class, TagEverything::new)));

        // Act
        List<Diagnostic> diagnostics = LintEngine.collect(new LintEngine(registry, ShellChecker.unavailable(), new ObjectMapper()).lint(doc, true));

        // Assert
        assertEquals(List.of("document", "task t", "decl x", "decl y"), messages(diagnostics));
    }

    @Test
    void lint_ShouldRunAutoDescendRulesBeforeManualOnes() {
        // Arrange
        Document doc = document().tasks(task("t").build()).build();
        LinterRegistry registry = LinterRegistry.of(List.of(
                LinterRegistry.entry(ManualTag.class, ManualTag::new),
                LinterRegistry.entry(TagEverything.class, TagEverything::new)));

        // Act
        List<Diagnostic> diagnostics = LintEngine.collect(new LintEngine(registry, ShellChecker.unavailable(), new ObjectMapper()).lint(doc, true));

        // Assert
        assertEquals(List.of("document", "task t", "manual task t"), messages(diagnostics));
    }

    @Test
    void lint_WithoutImports_ShouldOnlyLintTheGivenDocument() {
        // Arrange
        Task imported = task("lib_task").runtime("foo", intLiteral(3, 10, 1)).build();
        Document lib = document().filename("lib.wdl").tasks(imported).build();
        Document doc = document().imports("lib", lib).build();
        LinterRegistry registry = LinterRegistry.defaults().without(List.of("UnusedImport"));

        // Act
        List<Diagnostic> diagnostics = LintEngine.collect(new LintEngine(registry, ShellChecker.unavailable(), new ObjectMapper()).lint(doc, false));

        // Assert
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void lint_ShouldCloseEveryRuleEvenWhenOneFails() {
        // Arrange
        AtomicInteger closed = new AtomicInteger();
        LinterRegistry registry = LinterRegistry.of(List.of(
                LinterRegistry.entry(ClosingProbe.class, ctx -> new ClosingProbe(ctx, closed)),
                LinterRegistry.entry(FailOnTask.class, FailOnTask::new)));
        Document doc = document().tasks(task("t").build()).build();
        LintEngine engine = new LintEngine(registry, ShellChecker.unavailable(), new ObjectMapper());

        // Act & Assert
        assertThrows(LintContractViolation.class, () -> engine.lint(doc, true));
        assertEquals(1, closed.get());
    }

    @Test
    void lint_WithUnresolvedCall_ShouldPropagateContractViolation() {
        // Arrange
        Task t = task("t").build();
        Workflow w = workflow("w").body(call(3, List.of("t"), null, null, Map.of())).build();
        Document doc = document().tasks(t).workflow(w).build();
        LintEngine engine = new LintEngine(LinterRegistry.defaults(), ShellChecker.unavailable(), new ObjectMapper());

        // Act & Assert
        assertThrows(LintContractViolation.class, () -> engine.lint(doc, true));
    }

    static class TagEverything extends Linter {
        TagEverything(LintContext context) {
            super(context);
        }

        @Override
        public void document(Document obj) {
            add(obj, "document");
        }

        @Override
        public void task(Task obj) {
            add(obj, "task " + obj.getName());
        }

        @Override
        public void decl(Decl obj) {
            add(obj, "decl " + obj.getName());
        }
    }

    static class ManualTag extends Linter {
        ManualTag(LintContext context) {
            super(false, context);
        }

        @Override
        public void task(Task obj) {
            add(obj, "manual task " + obj.getName());
        }
    }

    static class ClosingProbe extends Linter {
        private final AtomicInteger closed;

        ClosingProbe(LintContext context, AtomicInteger closed) {
            super(context);
            this.closed = closed;
        }

        @Override
        public void close() {
            closed.incrementAndGet();
        }
    }

    static class FailOnTask extends Linter {
        FailOnTask(LintContext context) {
            super(context);
        }

        @Override
        public void task(Task obj) {
            throw new LintContractViolation("boom");
        }
    }
}
