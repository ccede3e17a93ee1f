package com.vidnyan.wdllint.domain.walker;

import com.vidnyan.wdllint.domain.model.expr.Apply;
import com.vidnyan.wdllint.domain.model.expr.Ident;
import com.vidnyan.wdllint.domain.model.expr.Literal;
import com.vidnyan.wdllint.domain.model.expr.StringExpr;
import com.vidnyan.wdllint.domain.model.tree.Call;
import com.vidnyan.wdllint.domain.model.tree.Conditional;
import com.vidnyan.wdllint.domain.model.tree.Decl;
import com.vidnyan.wdllint.domain.model.tree.Document;
import com.vidnyan.wdllint.domain.model.tree.Scatter;
import com.vidnyan.wdllint.domain.model.tree.StructTypeDef;
import com.vidnyan.wdllint.domain.model.tree.Task;
import com.vidnyan.wdllint.domain.model.tree.Workflow;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.vidnyan.wdllint.WdlTrees.*;
import static com.vidnyan.wdllint.domain.model.type.Types.*;
import static org.junit.jupiter.api.Assertions.*;

class SetParentsTest {

    @Test
    void visit_ShouldLinkEveryNodeToItsContainer() {
        // Arrange
        Decl input = decl(3, integer(), "n");
        Literal runtimeCpu = intLiteral(6, 13, 2);
        Ident commandRef = ref(5, 20, input);
        StringExpr cmd = command(4, "echo ", commandRef);
        Decl output = decl(8, file(), "out", string(8, 20, "out.txt"));
        Task t = task("t").line(2).inputs(input).command(cmd).runtime("cpu", runtimeCpu).outputs(output).build();

        Decl x = decl(12, integer(), "x", intLiteral(12, 13, 1));
        Literal callArg = intLiteral(14, 25, 3);
        Call c = call(14, t, Map.of("n", callArg));
        Apply range = apply(13, 20, array(integer()), "range", ref(13, 26, x));
        Scatter s = scatter(13, "i", range, c);
        Decl wfOut = decl(17, array(file()), "outs");
        Workflow w = workflow("w").line(10).body(x, s).outputs(wfOut).build();
        StructTypeDef struct = struct(1, "Sample", false);

        Document lib = document().filename("lib.wdl").build();
        Document doc = document().imports("lib", lib).structs(struct).tasks(t).workflow(w).build();

        // Act
        new SetParents().visit(doc);

        // Assert
        assertNull(doc.getParent());
        assertSame(doc, lib.getParent());
        assertSame(doc, struct.getParent());
        assertSame(doc, t.getParent());
        assertSame(doc, w.getParent());

        assertSame(t, input.getParent());
        assertSame(t, output.getParent());
        assertSame(t, cmd.getParent());
        assertSame(t, commandRef.getParent());
        assertSame(t, runtimeCpu.getParent());
        assertSame(output, output.getExpr().getParent());

        assertSame(w, x.getParent());
        assertSame(w, s.getParent());
        assertSame(w, wfOut.getParent());
        assertSame(x, x.getExpr().getParent());
        assertSame(s, range.getParent());
        assertSame(s, range.getArguments().get(0).getParent());
        assertSame(s, c.getParent());
        assertSame(c, callArg.getParent());
    }

    @Test
    void visit_ShouldLinkThroughConditionalsNestedInScatters() {
        // Arrange
        Decl flag = decl(2, bool(), "flag");
        Ident condition = ref(5, 13, flag);
        Literal value = intLiteral(6, 20, 1);
        Decl inner = decl(6, integer(), "inner", value);
        Conditional cond = conditional(5, condition, inner);
        Scatter s = scatter(4, "i", array(4, 20, array(integer()), intLiteral(4, 21, 1)), cond);
        Workflow w = workflow("w").inputs(flag).body(s).build();
        Document doc = document().workflow(w).build();

        // Act
        new SetParents().visit(doc);

        // Assert
        assertSame(w, flag.getParent());
        assertSame(w, s.getParent());
        assertSame(s, cond.getParent());
        assertSame(cond, condition.getParent());
        assertSame(cond, inner.getParent());
        assertSame(inner, value.getParent());
    }

    @Test
    void visit_Twice_ShouldGiveSameLinks() {
        // Arrange
        Decl x = decl(2, integer(), "x", intLiteral(2, 13, 1));
        Workflow w = workflow("w").body(x).build();
        Document doc = document().workflow(w).build();

        // Act
        new SetParents().visit(doc);
        new SetParents().visit(doc);

        // Assert
        assertNull(doc.getParent());
        assertSame(w, x.getParent());
        assertSame(x, x.getExpr().getParent());
    }
}
