package com.vidnyan.wdllint.domain.model.tree;

import com.vidnyan.wdllint.domain.model.NodeVisitor;
import com.vidnyan.wdllint.domain.model.SourceNode;
import com.vidnyan.wdllint.domain.model.SourcePosition;
import com.vidnyan.wdllint.domain.model.type.WdlType;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code struct Name { members }}. {@code imported} is set when the definition was brought into
 * the document's namespace from an imported document.
 */
@Getter
public class StructTypeDef extends TreeNode {

    private final String name;
    private final Map<String, WdlType> members;
    private final boolean imported;

    public StructTypeDef(SourcePosition pos, String name, Map<String, WdlType> members, boolean imported) {
        super(pos);
        this.name = name;
        this.members = Collections.unmodifiableMap(new LinkedHashMap<>(members));
        this.imported = imported;
    }

    @Override
    public List<? extends SourceNode> children() {
        return List.of();
    }

    @Override
    public void accept(NodeVisitor visitor) {
        visitor.structTypeDef(this);
    }
}
