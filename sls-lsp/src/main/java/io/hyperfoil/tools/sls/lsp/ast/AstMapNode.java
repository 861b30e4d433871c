package io.hyperfoil.tools.sls.lsp.ast;

import java.util.List;

/**
 * A node holding an ordered list of children. {@link #add()} appends a fresh child of the
 * variant this node holds and returns it.
 */
public abstract class AstMapNode extends AstNode {

    public abstract AstNode add();

    @Override
    public abstract List<AstNode> getChildren();

    @Override
    public void visit(NodeVisitor visitor) {
        if (!visitor.visit(this)) {
            return;
        }
        for (AstNode child : getChildren()) {
            child.visit(visitor);
        }
    }

    protected <T extends AstNode> T attach(T child, List<? super T> into) {
        child.setParent(this);
        into.add(child);
        return child;
    }

    static boolean removeSame(List<? extends AstNode> list, AstNode node) {
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i) == node) {
                list.remove(i);
                return true;
            }
        }
        return false;
    }
}
