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

class UnnecessaryQuantifierTest {

    @Test
    void optionalNonInput_WithNonOptionalValue_ShouldReport() {
        // Arrange
        Decl input = decl(2, optional(integer()), "threads", intLiteral(2, 20, 1));
        Decl body = decl(5, optional(string()), "label", string(5, 22, "x"));
        Workflow w = workflow("w").inputs(input).body(body).build();

        // Act
        List<Diagnostic> diagnostics = lint(document().workflow(w).build(), UnnecessaryQuantifier.class, UnnecessaryQuantifier::new);

        // Assert
        assertEquals(List.of("unnecessary optional quantifier (?) for non-input String? label"), messages(diagnostics));
    }

    @Test
    void optionalNonInput_WithOptionalValue_ShouldPass() {
        // Arrange
        Decl maybe = decl(2, optional(integer()), "maybe");
        Task t = task("t").inputs(maybe)
                .postinputs(decl(4, optional(integer()), "copy", ref(4, 22, maybe)))
                .build();

        // Act & Assert
        assertTrue(lint(document().tasks(t).build(), UnnecessaryQuantifier.class, UnnecessaryQuantifier::new).isEmpty());
    }

    @Test
    void legacyExecutableWithoutInputSection_ShouldPass() {
        // Arrange
        Task t = task("t").postinputs(decl(2, optional(integer()), "n", intLiteral(2, 20, 1))).build();

        // Act & Assert
        assertTrue(lint(document().tasks(t).build(), UnnecessaryQuantifier.class, UnnecessaryQuantifier::new).isEmpty());
    }
}
