package com.vidnyan.wdllint.domain.walker;

import com.vidnyan.wdllint.domain.model.LintContractViolation;
import com.vidnyan.wdllint.domain.model.tree.Call;
import com.vidnyan.wdllint.domain.model.tree.Document;
import com.vidnyan.wdllint.domain.model.tree.Task;
import com.vidnyan.wdllint.domain.model.tree.Workflow;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.vidnyan.wdllint.WdlTrees.*;
import static com.vidnyan.wdllint.domain.model.type.Types.*;
import static org.junit.jupiter.api.Assertions.*;

class MarkCalledTest {

    @Test
    void visit_ShouldMarkTasksReachableFromTopLevelWorkflow() {
        // Arrange
        Task used = task("used").build();
        Task unused = task("unused").build();
        Task deep = task("deep").build();
        Task orphan = task("orphan").build();

        Workflow sub = workflow("sub").body(call(3, deep, Map.of())).build();
        Workflow unusedSub = workflow("unused_sub").body(call(3, orphan, Map.of())).build();
        Document subDoc = document().filename("sub.wdl").tasks(deep).workflow(sub).build();
        Document otherDoc = document().filename("other.wdl").tasks(orphan).workflow(unusedSub).build();

        Call callSub = call(5, List.of("sub", "sub"), null, sub, Map.of());
        Workflow main = workflow("main").body(call(4, used, Map.of()), callSub).build();
        Document doc = document()
                .imports("sub", subDoc)
                .imports("other", otherDoc)
                .tasks(used, unused)
                .workflow(main)
                .build();
        new SetParents().visit(doc);

        // Act
        new MarkCalled().visit(doc);

        // Assert
        assertTrue(main.isCalled());
        assertTrue(used.isCalled());
        assertFalse(unused.isCalled());
        assertTrue(sub.isCalled());
        assertTrue(deep.isCalled());
        assertFalse(unusedSub.isCalled());
        assertFalse(orphan.isCalled());
    }

    @Test
    void visit_ShouldResetPreviousMarks() {
        // Arrange
        Task t = task("t").build();
        t.setCalled(true);
        Document doc = document().tasks(t).build();
        new SetParents().visit(doc);

        // Act
        new MarkCalled().visit(doc);

        // Assert
        assertFalse(t.isCalled());
    }

    @Test
    void visit_WithoutParentLinks_ShouldThrowContractViolation() {
        // Arrange
        Workflow w = workflow("w").body(decl(2, integer(), "x")).build();
        Document doc = document().workflow(w).build();

        // Act & Assert
        assertThrows(LintContractViolation.class, () -> new MarkCalled().visit(doc));
    }
}
