package io.hyperfoil.tools.sls.lsp.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A requisite group of a state call such as {@code require:} or {@code watch_in:}.
 */
public class RequisitesNode extends AstMapNode implements KeyedNode {

    private static final List<String> BASES = List.of("require", "watch", "onchanges", "listen", "prereq", "onfail", "use");

    public static final Set<String> KEYWORDS;

    static {
        Set<String> keywords = new LinkedHashSet<>();
        for (String base : BASES) {
            keywords.add(base);
            keywords.add(base + "_any");
            keywords.add(base + "_in");
        }
        KEYWORDS = Collections.unmodifiableSet(keywords);
    }

    public static boolean isRequisite(String key) {
        return key != null && KEYWORDS.contains(key);
    }

    private String kind;
    private final List<RequisiteNode> requisites = new ArrayList<>();

    public String getKind() {
        return kind;
    }

    public List<RequisiteNode> getRequisites() {
        return Collections.unmodifiableList(requisites);
    }

    @Override
    public RequisiteNode add() {
        return attach(new RequisiteNode(), requisites);
    }

    @Override
    public List<AstNode> getChildren() {
        return Collections.unmodifiableList(requisites);
    }

    @Override
    public AstNode setKey(String key) {
        this.kind = key;
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
        RequisitesNode other = (RequisitesNode) o;
        return sameSpan(other) && Objects.equals(kind, other.kind) && requisites.equals(other.requisites);
    }

    @Override
    public int hashCode() {
        return Objects.hash(spanHash(), kind, requisites);
    }

    @Override
    public String toString() {
        return "RequisitesNode[" + span() + " " + kind + "]";
    }
}
