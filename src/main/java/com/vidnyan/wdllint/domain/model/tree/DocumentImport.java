package com.vidnyan.wdllint.domain.model.tree;

import com.vidnyan.wdllint.domain.model.SourcePosition;

/**
 * {@code import "uri" as namespace}, with the imported document already loaded.
 */
public record DocumentImport(
    SourcePosition pos,
    String uri,
    String namespace,
    Document doc
) {
}
