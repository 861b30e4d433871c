package io.hyperfoil.tools.sls.lsp.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * A {@code module.function} call inside a state, with its parameters and requisite groups.
 */
public class StateCallNode extends AstMapNode implements KeyedNode {

    private String name;
    private final List<StateParameterNode> parameters = new ArrayList<>();
    private final List<RequisitesNode> requisites = new ArrayList<>();

    public String getName() {
        return name;
    }

    public List<StateParameterNode> getParameters() {
        return Collections.unmodifiableList(parameters);
    }

    public List<RequisitesNode> getRequisites() {
        return Collections.unmodifiableList(requisites);
    }

    /**
     * Entries are parameters until their key shows they are a requisite group.
     */
    @Override
    public StateParameterNode add() {
        return attach(new StateParameterNode(), parameters);
    }

    /**
     * Parameters and requisite groups in document order. Nodes without a start keep their relative order at the end.
     */
    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(parameters.size() + requisites.size());
        children.addAll(parameters);
        children.addAll(requisites);
        children.sort(Comparator.comparing(AstNode::getStart, Comparator.nullsLast(Comparator.<Position>naturalOrder())));
        return children;
    }

    @Override
    public AstNode setKey(String key) {
        this.name = key;
        return this;
    }

    RequisitesNode convert(StateParameterNode parameter, String kind) {
        removeSame(parameters, parameter);
        RequisitesNode converted = new RequisitesNode();
        converted.setStart(parameter.getStart());
        converted.setEnd(parameter.getEnd());
        converted.setKey(kind);
        return attach(converted, requisites);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        StateCallNode other = (StateCallNode) o;
        return sameSpan(other)
                && Objects.equals(name, other.name)
                && parameters.equals(other.parameters)
                && requisites.equals(other.requisites);
    }

    @Override
    public int hashCode() {
        return Objects.hash(spanHash(), name, parameters, requisites);
    }

    @Override
    public String toString() {
        return "StateCallNode[" + span() + " " + name + "]";
    }
}
