package io.hyperfoil.tools.sls.lsp.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A state declaration: an identifier followed by its module calls.
 */
public class StateNode extends AstMapNode implements KeyedNode {

    private String identifier;
    private final List<StateCallNode> states = new ArrayList<>();

    public String getIdentifier() {
        return identifier;
    }

    public List<StateCallNode> getStates() {
        return Collections.unmodifiableList(states);
    }

    @Override
    public StateCallNode add() {
        return attach(new StateCallNode(), states);
    }

    @Override
    public List<AstNode> getChildren() {
        return Collections.unmodifiableList(states);
    }

    /**
     * At the top level {@code include} and {@code extend} are section keys, not state identifiers.
     */
    @Override
    public AstNode setKey(String key) {
        this.identifier = key;
        if (getParent() instanceof Tree && (Tree.INCLUDE.equals(key) || Tree.EXTEND.equals(key))) {
            return ((Tree) getParent()).convert(this, key);
        }
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        StateNode other = (StateNode) o;
        return sameSpan(other) && Objects.equals(identifier, other.identifier) && states.equals(other.states);
    }

    @Override
    public int hashCode() {
        return Objects.hash(spanHash(), identifier, states);
    }

    @Override
    public String toString() {
        return "StateNode[" + span() + " " + identifier + "]";
    }
}
