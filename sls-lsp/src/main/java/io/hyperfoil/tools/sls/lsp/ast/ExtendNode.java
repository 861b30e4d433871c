package io.hyperfoil.tools.sls.lsp.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The top level {@code extend:} section. Holds states shaped like the top level ones.
 */
public class ExtendNode extends AstMapNode {

    private final List<StateNode> states = new ArrayList<>();

    public List<StateNode> getStates() {
        return Collections.unmodifiableList(states);
    }

    @Override
    public StateNode add() {
        return attach(new StateNode(), states);
    }

    @Override
    public List<AstNode> getChildren() {
        return Collections.unmodifiableList(states);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ExtendNode other = (ExtendNode) o;
        return sameSpan(other) && states.equals(other.states);
    }

    @Override
    public int hashCode() {
        return 31 * spanHash() + states.hashCode();
    }

    @Override
    public String toString() {
        return "ExtendNode[" + span() + "]";
    }
}
