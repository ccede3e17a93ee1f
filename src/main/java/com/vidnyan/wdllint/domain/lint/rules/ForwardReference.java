package com.vidnyan.wdllint.domain.lint.rules;

import com.vidnyan.wdllint.domain.lint.LintContext;
import com.vidnyan.wdllint.domain.lint.Linter;
import com.vidnyan.wdllint.domain.model.SourcePosition;
import com.vidnyan.wdllint.domain.model.expr.Expression;
import com.vidnyan.wdllint.domain.model.expr.Ident;
import com.vidnyan.wdllint.domain.model.tree.Call;
import com.vidnyan.wdllint.domain.model.tree.Decl;
import com.vidnyan.wdllint.domain.model.tree.Gather;
import com.vidnyan.wdllint.domain.model.tree.Referee;

/**
 * Identifier that lexically precedes the declaration or call it refers to.
 */
public class ForwardReference extends Linter {

    public ForwardReference(LintContext context) {
        super(context);
    }

    @Override
    public void expression(Expression obj) {
        if (!(obj instanceof Ident ident) || ident.getReferee() == null) {
            return;
        }
        Referee referee = Gather.unwrap(ident.getReferee());
        if (referee instanceof Decl decl && follows(decl.getPos(), ident.getPos())) {
            add(ident.getParent(), "reference to " + ident.getName() + " precedes its declaration", ident.getPos());
        } else if (referee instanceof Call call && follows(call.getPos(), ident.getPos())) {
            add(ident.getParent(), "reference to output of " + String.join(".", ident.namespace())
                    + " precedes the call", ident.getPos());
        }
    }

    private static boolean follows(SourcePosition referee, SourcePosition reference) {
        return referee.line() > reference.line()
                || (referee.line() == reference.line() && referee.column() > reference.column());
    }
}
