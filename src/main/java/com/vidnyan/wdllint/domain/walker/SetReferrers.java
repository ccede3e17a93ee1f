package com.vidnyan.wdllint.domain.walker;

import com.vidnyan.wdllint.domain.model.expr.Expression;
import com.vidnyan.wdllint.domain.model.expr.Ident;
import com.vidnyan.wdllint.domain.model.tree.Call;
import com.vidnyan.wdllint.domain.model.tree.Decl;
import com.vidnyan.wdllint.domain.model.tree.Gather;
import com.vidnyan.wdllint.domain.model.tree.Referee;

/**
 * Appends each identifier expression to the {@code referrers} of the Decl or Call it reads,
 * looking through scatter/conditional gathers. Identifiers may sit in declarations, call
 * inputs, task commands, outputs, scatter arrays and if conditions.
 */
public class SetReferrers extends Walker {

    public SetReferrers() {
        super(true, true);
    }

    @Override
    public void expression(Expression obj) {
        if (obj instanceof Ident ident && ident.getReferee() != null) {
            Referee referee = Gather.unwrap(ident.getReferee());
            if (referee instanceof Decl decl) {
                decl.addReferrer(ident);
            } else if (referee instanceof Call call) {
                call.addReferrer(ident);
            }
        }
    }
}
