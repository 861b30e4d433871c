package io.hyperfoil.tools.sls.lsp.ast;

/**
 * Pre-order callback for {@link AstNode#visit(NodeVisitor)}.
 * Returning {@code false} skips the children of the visited node.
 */
@FunctionalInterface
public interface NodeVisitor {

    boolean visit(AstNode node);
}
