package com.vidnyan.wdllint.domain.lint.rules;

import com.vidnyan.wdllint.domain.model.Diagnostic;
import com.vidnyan.wdllint.domain.model.tree.Decl;
import com.vidnyan.wdllint.domain.model.tree.Task;
import com.vidnyan.wdllint.domain.model.tree.Workflow;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.vidnyan.wdllint.WdlTrees.*;
import static com.vidnyan.wdllint.domain.model.type.Types.*;
import static org.junit.jupiter.api.Assertions.*;

class NonemptyCoercionTest {

    @Test
    void decl_PossiblyEmptyArray_ShouldReport() {
        // Arrange
        Decl files = decl(2, array(file()), "files");
        Decl nested = decl(3, array(array(integer())), "nested");
        Workflow w = workflow("w").inputs(files, nested).body(
                decl(4, nonemptyArray(file()), "some", ref(4, 30, files)),
                decl(5, array(nonemptyArray(integer())), "rows", ref(5, 40, nested))
        ).build();

        // Act
        List<Diagnostic> diagnostics = lint(document().workflow(w).build(), NonemptyCoercion.class, NonemptyCoercion::new);

        // Assert
        assertEquals(List.of(
                "Array[File]+ some = :Array[File]:",
                "Array[Array[Int]+] rows = :Array[Array[Int]]:"
        ), messages(diagnostics));
    }

    @Test
    void decl_FromGlobOrReadLines_ShouldBeTolerated() {
        // Arrange
        Task t = task("t").line(2).outputs(
                decl(8, nonemptyArray(file()), "outs", apply(8, 30, array(file()), "glob", string(8, 35, "*.txt"))),
                decl(9, nonemptyArray(string()), "lines", apply(9, 30, array(string()), "read_lines",
                        apply(9, 41, file(), "stdout")))
        ).build();

        // Act & Assert
        assertTrue(lint(document().tasks(t).build(), NonemptyCoercion.class, NonemptyCoercion::new).isEmpty());
    }

    @Test
    void callInput_PossiblyEmptyArray_ShouldReport() {
        // Arrange
        Task t = task("t").line(2).inputs(decl(3, nonemptyArray(file()), "reads")).build();
        Decl reads = decl(11, array(file()), "reads");
        Workflow w = workflow("w").line(10).inputs(reads)
                .body(call(12, t, Map.of("reads", ref(12, 30, reads))))
                .build();

        // Act
        List<Diagnostic> diagnostics = lint(document().tasks(t).workflow(w).build(), NonemptyCoercion.class, NonemptyCoercion::new);

        // Assert
        assertEquals(List.of("input Array[File]+ reads = :Array[File]:"), messages(diagnostics));
        assertEquals(span(12, 30, 35), diagnostics.get(0).position());
    }
}
