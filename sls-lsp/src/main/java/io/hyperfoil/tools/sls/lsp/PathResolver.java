package io.hyperfoil.tools.sls.lsp;

import io.hyperfoil.tools.sls.lsp.ast.AstNode;
import io.hyperfoil.tools.sls.lsp.ast.Position;
import io.hyperfoil.tools.sls.lsp.ast.Tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Finds the chain of nodes enclosing a cursor position.
 */
public class PathResolver {

    /**
     * Nodes from the tree down to the innermost node whose span contains {@code position}.
     * Empty when the position is outside the document.
     */
    public List<AstNode> pathTo(Tree tree, Position position) {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(position, "position");
        AstNode[] found = new AstNode[1];
        tree.visit(node -> {
            if (node.contains(position)) {
                found[0] = node;
            }
            return true;
        });
        if (found[0] == null) {
            return Collections.emptyList();
        }
        List<AstNode> path = new ArrayList<>();
        for (AstNode node = found[0]; node != null; node = node.getParent()) {
            path.add(node);
        }
        Collections.reverse(path);
        return path;
    }

    public List<AstNode> pathTo(Tree tree, int line, int character) {
        return pathTo(tree, new Position(line, character));
    }

    /**
     * Innermost node at the position, or null.
     */
    public AstNode innermost(Tree tree, Position position) {
        List<AstNode> path = pathTo(tree, position);
        return path.isEmpty() ? null : path.get(path.size() - 1);
    }

    /**
     * Closest enclosing node of the given type on the path, or null.
     */
    public static <T extends AstNode> T enclosing(List<AstNode> path, Class<T> type) {
        for (int i = path.size() - 1; i >= 0; i--) {
            if (type.isInstance(path.get(i))) {
                return type.cast(path.get(i));
            }
        }
        return null;
    }
}
