package io.hyperfoil.tools.sls.lsp.ast;

/**
 * A node that receives the mapping key it was created for.
 */
public interface KeyedNode {

    /**
     * Stores the key. Some keys turn the node into a different variant, in which case the replacement
     * (already attached to the tree in place of this node) is returned. Otherwise returns {@code this}.
     */
    AstNode setKey(String key);
}
