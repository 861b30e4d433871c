package io.hyperfoil.tools.sls.lsp.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The top level {@code include:} section.
 */
public class IncludesNode extends AstMapNode {

    private final List<IncludeNode> includes = new ArrayList<>();

    public List<IncludeNode> getIncludes() {
        return Collections.unmodifiableList(includes);
    }

    @Override
    public IncludeNode add() {
        return attach(new IncludeNode(), includes);
    }

    @Override
    public List<AstNode> getChildren() {
        return Collections.unmodifiableList(includes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        IncludesNode other = (IncludesNode) o;
        return sameSpan(other) && includes.equals(other.includes);
    }

    @Override
    public int hashCode() {
        return 31 * spanHash() + includes.hashCode();
    }

    @Override
    public String toString() {
        return "IncludesNode[" + span() + "]";
    }
}
