package io.hyperfoil.tools.sls.lsp.ast;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A {@code name: value} argument of a state call. The value is either a plain scalar or, for nested
 * structures, the raw tokens that make it up. At most one of the two is set.
 */
public class StateParameterNode extends AstNode implements KeyedNode {

    private String name;
    private String value;
    private List<TokenNode> tokens;

    public String getName() {
        return name;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
        this.tokens = null;
    }

    public List<TokenNode> getTokens() {
        return tokens == null ? Collections.emptyList() : tokens;
    }

    public void setTokens(List<TokenNode> tokens) {
        this.tokens = tokens == null ? null : Collections.unmodifiableList(tokens);
        this.value = null;
    }

    public boolean hasValue() {
        return value != null || tokens != null;
    }

    public boolean isComplexValue() {
        return tokens != null;
    }

    @Override
    public AstNode setKey(String key) {
        this.name = key;
        if (RequisitesNode.isRequisite(key) && getParent() instanceof StateCallNode) {
            return ((StateCallNode) getParent()).convert(this, key);
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
        StateParameterNode other = (StateParameterNode) o;
        return sameSpan(other)
                && Objects.equals(name, other.name)
                && Objects.equals(value, other.value)
                && Objects.equals(tokens, other.tokens);
    }

    @Override
    public int hashCode() {
        return Objects.hash(spanHash(), name, value, tokens);
    }

    @Override
    public String toString() {
        return "StateParameterNode[" + span() + " " + name + "=" + (tokens != null ? tokens : value) + "]";
    }
}
