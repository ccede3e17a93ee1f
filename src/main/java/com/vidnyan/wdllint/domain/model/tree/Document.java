package com.vidnyan.wdllint.domain.model.tree;

import com.vidnyan.wdllint.domain.model.NodeVisitor;
import com.vidnyan.wdllint.domain.model.SourceNode;
import com.vidnyan.wdllint.domain.model.SourcePosition;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of a WDL source file. After parent-linking, an imported document's parent is the
 * importing document; the document being linted has no parent.
 */
@Getter
public class Document extends TreeNode {

    private final List<DocumentImport> imports;
    private final List<StructTypeDef> structTypedefs;
    private final List<Task> tasks;
    private final Workflow workflow;

    public Document(SourcePosition pos, List<DocumentImport> imports, List<StructTypeDef> structTypedefs,
                    List<Task> tasks, Workflow workflow) {
        super(pos);
        this.imports = List.copyOf(imports);
        this.structTypedefs = List.copyOf(structTypedefs);
        this.tasks = List.copyOf(tasks);
        this.workflow = workflow;
    }

    @Override
    public List<? extends SourceNode> children() {
        List<SourceNode> children = new ArrayList<>();
        for (DocumentImport imp : imports) {
            children.add(imp.doc());
        }
        children.addAll(structTypedefs);
        children.addAll(tasks);
        if (workflow != null) {
            children.add(workflow);
        }
        return children;
    }

    @Override
    public void accept(NodeVisitor visitor) {
        visitor.document(this);
    }
}
