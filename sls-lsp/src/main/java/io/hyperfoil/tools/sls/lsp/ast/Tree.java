package io.hyperfoil.tools.sls.lsp.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Root of a parsed SLS document.
 */
public class Tree extends AstMapNode {

    public static final String INCLUDE = "include";
    public static final String EXTEND = "extend";

    private IncludesNode includes;
    private ExtendNode extend;
    private final List<StateNode> states = new ArrayList<>();

    public IncludesNode getIncludes() {
        return includes;
    }

    public ExtendNode getExtend() {
        return extend;
    }

    public List<StateNode> getStates() {
        return Collections.unmodifiableList(states);
    }

    @Override
    public StateNode add() {
        return attach(new StateNode(), states);
    }

    /**
     * Children in document-section order: includes, extend, then states.
     */
    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(states.size() + 2);
        if (includes != null) {
            children.add(includes);
        }
        if (extend != null) {
            children.add(extend);
        }
        children.addAll(states);
        return children;
    }

    /**
     * Turns a top level state keyed {@code include} or {@code extend} into the matching section node.
     * A previously parsed section of the same kind is replaced.
     */
    AstNode convert(StateNode state, String key) {
        AstNode converted;
        if (INCLUDE.equals(key)) {
            includes = new IncludesNode();
            converted = includes;
        } else if (EXTEND.equals(key)) {
            extend = new ExtendNode();
            converted = extend;
        } else {
            return state;
        }
        converted.setStart(state.getStart());
        converted.setEnd(state.getEnd());
        converted.setParent(this);
        removeSame(states, state);
        return converted;
    }

    /**
     * First top level state with the given identifier, or null.
     */
    public StateNode findState(String identifier) {
        if (identifier == null) {
            return null;
        }
        for (StateNode state : states) {
            if (identifier.equals(state.getIdentifier())) {
                return state;
            }
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Tree other = (Tree) o;
        return sameSpan(other)
                && Objects.equals(includes, other.includes)
                && Objects.equals(extend, other.extend)
                && states.equals(other.states);
    }

    @Override
    public int hashCode() {
        return Objects.hash(spanHash(), includes, extend, states);
    }

    @Override
    public String toString() {
        return "Tree[" + span() + "]";
    }
}
