package com.vidnyan.wdllint.domain.lint.rules;

import com.vidnyan.wdllint.domain.model.Diagnostic;
import com.vidnyan.wdllint.domain.model.tree.Document;
import com.vidnyan.wdllint.domain.model.tree.Task;
import com.vidnyan.wdllint.domain.model.tree.Workflow;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.vidnyan.wdllint.WdlTrees.*;
import static com.vidnyan.wdllint.domain.model.type.Types.*;
import static org.junit.jupiter.api.Assertions.*;

class NameCollisionTest {

    private static Document library() {
        return document().filename("lib.wdl").build();
    }

    @Test
    void call_NamedLikeImportOrWorkflow_ShouldReport() {
        // Arrange
        Task t = task("t").line(2).build();
        Workflow w = workflow("w").line(10).body(
                call(11, List.of("t"), "lib", t, Map.of()),
                call(12, List.of("t"), "w", t, Map.of())
        ).build();
        Document doc = document().imports("lib", library()).tasks(t).workflow(w).build();

        // Act
        List<Diagnostic> diagnostics = lint(doc, NameCollision.class, NameCollision::new);

        // Assert
        assertEquals(List.of(
                "call name 'lib' collides with imported document namespace",
                "call name 'w' collides with workflow name"
        ), messages(diagnostics));
    }

    @Test
    void decl_NamedLikeTaskWorkflowOrStruct_ShouldReport() {
        // Arrange
        Task t = task("align").line(2).build();
        Workflow w = workflow("main").line(10).body(
                decl(11, integer(), "align", intLiteral(11, 20, 1)),
                decl(12, integer(), "main", intLiteral(12, 20, 1)),
                decl(13, struct("Sample"), "Sample")
        ).build();
        Document doc = document().structs(struct(1, "Sample", true)).tasks(t).workflow(w).build();

        // Act
        List<Diagnostic> diagnostics = lint(doc, NameCollision.class, NameCollision::new);

        // Assert
        assertEquals(List.of(
                "declaration of 'align' collides with a task name",
                "declaration of 'main' collides with workflow name",
                "declaration of 'Sample' collides with imported struct type"
        ), messages(diagnostics));
    }

    @Test
    void scatterVariable_NamedLikeTask_ShouldReport() {
        // Arrange
        Task t = task("sample").line(2).build();
        Workflow w = workflow("w").line(10).body(
                scatter(11, "sample", array(11, 25, array(integer()), intLiteral(11, 26, 1)))
        ).build();

        // Act
        List<Diagnostic> diagnostics = lint(document().tasks(t).workflow(w).build(), NameCollision.class, NameCollision::new);

        // Assert
        assertEquals(List.of("scatter variable 'sample' collides with a task name"), messages(diagnostics));
        assertEquals(pos(11, 5), diagnostics.get(0).position());
    }

    @Test
    void executablesAndImports_NamedLikeStruct_ShouldReport() {
        // Arrange
        Task t = task("Reads").line(2).build();
        Workflow w = workflow("Sample").line(10).build();
        Document doc = document()
                .imports("Reads", library())
                .structs(struct(1, "Sample", false), struct(1, "Reads", false))
                .tasks(t)
                .workflow(w)
                .build();

        // Act
        List<Diagnostic> diagnostics = lint(doc, NameCollision.class, NameCollision::new);

        // Assert
        assertEquals(List.of(
                "imported document namespace 'Reads' collides with struct type",
                "task name 'Reads' collides with imported document namespace",
                "task name 'Reads' collides with struct type",
                "workflow name 'Sample' collides with struct type"
        ), messages(diagnostics));
    }
}
