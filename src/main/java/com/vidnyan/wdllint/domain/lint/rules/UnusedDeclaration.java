package com.vidnyan.wdllint.domain.lint.rules;

import com.vidnyan.wdllint.domain.lint.LintContext;
import com.vidnyan.wdllint.domain.lint.Linter;
import com.vidnyan.wdllint.domain.model.tree.Decl;
import com.vidnyan.wdllint.domain.model.tree.Task;
import com.vidnyan.wdllint.domain.model.tree.TreeNode;
import com.vidnyan.wdllint.domain.model.tree.Workflow;
import com.vidnyan.wdllint.domain.model.type.ArrayType;
import com.vidnyan.wdllint.domain.model.type.FileType;
import com.vidnyan.wdllint.domain.model.type.WdlType;

import java.util.List;
import java.util.Locale;

/**
 * Declaration nothing refers to. Outputs are exempt, as are files named like genomics index
 * files (localized next to their data, seldom named in the command) and the inputs of dxWDL
 * native task stubs.
 */
public class UnusedDeclaration extends Linter {

    private static final List<String> INDEX_SUFFIXES = List.of(
            "index", "indexes", "indices", "idx", "tbi", "bai", "crai", "csi", "fai", "dict");

    public UnusedDeclaration(LintContext context) {
        super(context);
    }

    @Override
    public void decl(Decl obj) {
        TreeNode parent = obj.getParent();
        if (isOutput(obj, parent) || !obj.getReferrers().isEmpty()) {
            return;
        }
        if (isIndexFile(obj) || isNativeStub(parent)) {
            return;
        }
        add(obj, "nothing references " + obj.getType() + " " + obj.getName());
    }

    private static boolean isOutput(Decl obj, TreeNode parent) {
        List<Decl> outputs = null;
        if (parent instanceof Task task) {
            outputs = task.getOutputs();
        } else if (parent instanceof Workflow workflow) {
            outputs = workflow.getOutputs();
        }
        return outputs != null && outputs.stream().anyMatch(output -> output == obj);
    }

    private static boolean isIndexFile(Decl obj) {
        WdlType type = obj.getType();
        boolean fileLike = type instanceof FileType
                || (type instanceof ArrayType array && array.getItemType() instanceof FileType);
        String name = obj.getName().toLowerCase(Locale.ROOT);
        return fileLike && INDEX_SUFFIXES.stream().anyMatch(name::endsWith);
    }

    private static boolean isNativeStub(TreeNode parent) {
        if (parent instanceof Task task) {
            Object id = task.getMeta().get("id");
            return "native".equals(task.getMeta().get("type")) && id != null && !"".equals(id);
        }
        return false;
    }
}
