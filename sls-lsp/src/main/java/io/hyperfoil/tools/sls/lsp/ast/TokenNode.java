package io.hyperfoil.tools.sls.lsp.ast;

import org.yaml.snakeyaml.tokens.ScalarToken;
import org.yaml.snakeyaml.tokens.Token;

import java.util.Objects;

/**
 * A lexical token kept verbatim as part of a nested parameter value.
 * Two token nodes are equal when they have the same kind and, for scalars, the same text.
 */
public class TokenNode extends AstNode {

    private final Token token;

    public TokenNode(Token token) {
        this.token = Objects.requireNonNull(token, "token");
        setStart(Position.of(token.getStartMark()));
        setEnd(Position.of(token.getEndMark()));
    }

    public Token getToken() {
        return token;
    }

    public Token.ID getTokenId() {
        return token.getTokenId();
    }

    /**
     * Scalar text, or null for structural tokens.
     */
    public String getValue() {
        return token instanceof ScalarToken ? ((ScalarToken) token).getValue() : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TokenNode other = (TokenNode) o;
        return getTokenId() == other.getTokenId() && Objects.equals(getValue(), other.getValue());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getTokenId(), getValue());
    }

    @Override
    public String toString() {
        String value = getValue();
        return value == null ? getTokenId().toString() : getTokenId() + "(" + value + ")";
    }
}
