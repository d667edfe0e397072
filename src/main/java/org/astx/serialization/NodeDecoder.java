package org.astx.serialization;

import org.astx.ast.AstNode;

/**
 * Rebuilds one node variant from its structural representation.
 */
@FunctionalInterface
public interface NodeDecoder {

    /**
     * @param struct The content of the node, positioned at its key.
     * @return The rebuilt node, without location or comment; those are applied by the importer.
     */
    AstNode decode(StructReader struct);
}
