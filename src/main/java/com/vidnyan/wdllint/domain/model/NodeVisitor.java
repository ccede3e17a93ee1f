package com.vidnyan.wdllint.domain.model;

import com.vidnyan.wdllint.domain.model.expr.Expression;
import com.vidnyan.wdllint.domain.model.tree.Call;
import com.vidnyan.wdllint.domain.model.tree.Conditional;
import com.vidnyan.wdllint.domain.model.tree.Decl;
import com.vidnyan.wdllint.domain.model.tree.Document;
import com.vidnyan.wdllint.domain.model.tree.Scatter;
import com.vidnyan.wdllint.domain.model.tree.StructTypeDef;
import com.vidnyan.wdllint.domain.model.tree.Task;
import com.vidnyan.wdllint.domain.model.tree.Workflow;

/**
 * One hook per node kind. The set of kinds is closed: adding a kind means adding a hook here,
 * which every walker then has to handle.
 */
public interface NodeVisitor {

    void document(Document obj);

    void workflow(Workflow obj);

    void call(Call obj);

    void scatter(Scatter obj);

    void conditional(Conditional obj);

    void decl(Decl obj);

    void task(Task obj);

    void structTypeDef(StructTypeDef obj);

    void expression(Expression obj);
}
