package io.hyperfoil.tools.sls.lsp.ast;

import java.util.Objects;

/**
 * A {@code module: reference} entry of a requisite group, pointing at another state.
 */
public class RequisiteNode extends AstNode implements KeyedNode {

    private String module;
    private String reference;

    public String getModule() {
        return module;
    }

    public String getReference() {
        return reference;
    }

    public void setReference(String reference) {
        this.reference = reference;
    }

    @Override
    public AstNode setKey(String key) {
        this.module = key;
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
        RequisiteNode other = (RequisiteNode) o;
        return sameSpan(other) && Objects.equals(module, other.module) && Objects.equals(reference, other.reference);
    }

    @Override
    public int hashCode() {
        return Objects.hash(spanHash(), module, reference);
    }

    @Override
    public String toString() {
        return "RequisiteNode[" + span() + " " + module + ": " + reference + "]";
    }
}
