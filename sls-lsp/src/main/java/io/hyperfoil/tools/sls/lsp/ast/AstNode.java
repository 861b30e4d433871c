package io.hyperfoil.tools.sls.lsp.ast;

import org.eclipse.lsp4j.Range;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Base of every syntax tree node. Spans are half open: {@code [start, end)}.
 * Equality is structural and ignores the parent link.
 */
public abstract class AstNode {

    private Position start;
    private Position end;
    private AstNode parent;

    public Position getStart() {
        return start;
    }

    public void setStart(Position start) {
        this.start = start;
    }

    public Position getEnd() {
        return end;
    }

    public void setEnd(Position end) {
        this.end = end;
    }

    public AstNode getParent() {
        return parent;
    }

    public void setParent(AstNode parent) {
        this.parent = parent;
    }

    /**
     * A node without a start never contains anything, a node without an end is open to the end of the document.
     */
    public boolean contains(Position position) {
        if (start == null || position == null) {
            return false;
        }
        return start.compareTo(position) <= 0 && (end == null || position.isBefore(end));
    }

    /**
     * The span as an LSP range, or null while the node is still open.
     */
    public Range toRange() {
        if (start == null || end == null) {
            return null;
        }
        return new Range(start.toLsp(), end.toLsp());
    }

    public List<AstNode> getChildren() {
        return Collections.emptyList();
    }

    public void visit(NodeVisitor visitor) {
        visitor.visit(this);
    }

    protected boolean sameSpan(AstNode other) {
        return Objects.equals(start, other.start) && Objects.equals(end, other.end);
    }

    protected int spanHash() {
        return Objects.hash(start, end);
    }

    protected String span() {
        return start + "-" + end;
    }
}
