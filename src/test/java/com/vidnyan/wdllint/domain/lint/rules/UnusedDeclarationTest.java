package com.vidnyan.wdllint.domain.lint.rules;

import com.vidnyan.wdllint.domain.model.Diagnostic;
import com.vidnyan.wdllint.domain.model.tree.Decl;
import com.vidnyan.wdllint.domain.model.tree.Task;
import com.vidnyan.wdllint.domain.model.tree.Workflow;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vidnyan.wdllint.WdlTrees.*;
import static com.vidnyan.wdllint.domain.model.type.Types.*;
import static org.junit.jupiter.api.Assertions.*;

class UnusedDeclarationTest {

    @Test
    void decl_WithoutReferrers_ShouldReport() {
        // Arrange
        Decl used = decl(2, integer(), "used");
        Decl unused = decl(3, integer(), "x");
        Task t = task("t").inputs(used, unused).command(command(5, "echo ", ref(5, 20, used))).build();

        // Act
        List<Diagnostic> diagnostics = lint(document().tasks(t).build(), UnusedDeclaration.class, UnusedDeclaration::new);

        // Assert
        assertEquals(List.of("nothing references Int x"), messages(diagnostics));
        assertEquals(pos(3, 5), diagnostics.get(0).position());
    }

    @Test
    void fileDecl_NamedLikeIndex_ShouldBeExempt() {
        // Arrange
        Task t = task("t").inputs(
                decl(2, file(), "x"),
                decl(3, file(), "x_bai"),
                decl(4, array(file()), "reference_fai"),
                decl(5, string(), "sample_idx")
        ).build();

        // Act
        List<Diagnostic> diagnostics = lint(document().tasks(t).build(), UnusedDeclaration.class, UnusedDeclaration::new);

        // Assert
        assertEquals(List.of("nothing references File x", "nothing references String sample_idx"), messages(diagnostics));
    }

    @Test
    void outputs_ShouldBeExempt() {
        // Arrange
        Task t = task("t").outputs(decl(4, integer(), "count", intLiteral(4, 17, 1))).build();
        Workflow w = workflow("w").line(10).outputs(decl(12, integer(), "total", intLiteral(12, 17, 2))).build();

        // Act & Assert
        assertTrue(lint(document().tasks(t).workflow(w).build(), UnusedDeclaration.class, UnusedDeclaration::new).isEmpty());
    }

    @Test
    void nativeTaskStubInputs_ShouldBeExempt() {
        // Arrange
        Task stub = task("applet").inputs(decl(2, string(), "name"))
                .meta("type", "native").meta("id", "applet-xxxx").build();
        Task withoutId = task("incomplete").line(10).inputs(decl(11, string(), "name"))
                .meta("type", "native").meta("id", "").build();

        // Act
        List<Diagnostic> diagnostics = lint(document().tasks(stub, withoutId).build(), UnusedDeclaration.class, UnusedDeclaration::new);

        // Assert
        assertEquals(1, diagnostics.size());
        assertEquals(pos(11, 5), diagnostics.get(0).position());
    }
}
