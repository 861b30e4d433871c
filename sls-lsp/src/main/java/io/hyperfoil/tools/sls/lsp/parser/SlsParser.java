package io.hyperfoil.tools.sls.lsp.parser;

import io.hyperfoil.tools.sls.lsp.ast.AstMapNode;
import io.hyperfoil.tools.sls.lsp.ast.AstNode;
import io.hyperfoil.tools.sls.lsp.ast.ExtendNode;
import io.hyperfoil.tools.sls.lsp.ast.IncludeNode;
import io.hyperfoil.tools.sls.lsp.ast.IncludesNode;
import io.hyperfoil.tools.sls.lsp.ast.KeyedNode;
import io.hyperfoil.tools.sls.lsp.ast.Position;
import io.hyperfoil.tools.sls.lsp.ast.RequisiteNode;
import io.hyperfoil.tools.sls.lsp.ast.RequisitesNode;
import io.hyperfoil.tools.sls.lsp.ast.StateCallNode;
import io.hyperfoil.tools.sls.lsp.ast.StateNode;
import io.hyperfoil.tools.sls.lsp.ast.StateParameterNode;
import io.hyperfoil.tools.sls.lsp.ast.TokenNode;
import io.hyperfoil.tools.sls.lsp.ast.Tree;
import org.jboss.logging.Logger;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.error.Mark;
import org.yaml.snakeyaml.error.MarkedYAMLException;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.reader.StreamReader;
import org.yaml.snakeyaml.scanner.Scanner;
import org.yaml.snakeyaml.scanner.ScannerImpl;
import org.yaml.snakeyaml.tokens.ScalarToken;
import org.yaml.snakeyaml.tokens.Token;

import java.io.StringReader;
import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds a {@link Tree} from the SnakeYAML token stream of an SLS file.
 * <p>
 * The parser works on tokens rather than on a composed YAML document so that half written files still
 * produce a tree with accurate positions. It keeps a stack of open nodes (the breadcrumbs) and a stack of
 * the nodes that were open when each block or flow collection started, so that closing the collection closes
 * every node opened inside it. Parameter values that are not plain scalars are kept as raw tokens.
 * <p>
 * When the scanner fails, the nodes nested at or past the failing column are closed, the text between the last
 * good token and the failure is salvaged as a scalar, and whatever is still open is stretched to the failure.
 * {@link #parse(String)} never throws for any text.
 */
public class SlsParser {

    private static final Logger logger = Logger.getLogger(MethodHandles.lookup().lookupClass());

    private static final class BlockStart {
        private AstNode node;

        private BlockStart(AstNode node) {
            this.node = node;
        }
    }

    private final String document;
    private final Tree tree = new Tree();
    private final List<AstNode> breadcrumbs = new ArrayList<>();
    private final List<BlockStart> blockStarts = new ArrayList<>();

    private List<TokenNode> unprocessedTokens;
    private boolean nextScalarAsKey;
    private boolean nextTokenIsValue;
    private Position lastStart;
    private Token lastToken;

    private SlsParser(String document) {
        this.document = Objects.requireNonNull(document, "document");
        breadcrumbs.add(tree);
    }

    public static Tree parse(String document) {
        return new SlsParser(document).run();
    }

    private Tree run() {
        Scanner scanner = new ScannerImpl(new StreamReader(new StringReader(document)), new LoaderOptions());
        try {
            while (scanner.checkToken()) {
                Token token = scanner.getToken();
                process(token);
                lastToken = token;
            }
            if (breadcrumbs.size() > 1) {
                // collections left open at the end of the stream
                closeOpenNodes(tree.getEnd() != null ? tree.getEnd() : lastGoodEnd());
            }
        } catch (MarkedYAMLException e) {
            logger.debugf("recovering from scan error %s at %s", e.getProblem(), Position.of(e.getProblemMark()));
            recover(e);
        } catch (YAMLException e) {
            logger.debugf(e, "scanning stopped after %s", lastToken);
            closeOpenNodes(lastGoodEnd());
        }
        finishCapture();
        return tree;
    }

    private void process(Token token) {
        Token.ID id = token.getTokenId();
        if (id == Token.ID.StreamStart) {
            tree.setStart(Position.of(token.getStartMark()));
        } else if (id == Token.ID.StreamEnd) {
            tree.setEnd(Position.of(token.getEndMark()));
        }

        if (unprocessedTokens != null) {
            capture(token);
        } else if (isCollectionStart(id)) {
            blockStarts.add(new BlockStart(top()));
            nextTokenIsValue = false;
        }

        if (id == Token.ID.Value && unprocessedTokens == null) {
            if (top() instanceof StateParameterNode) {
                unprocessedTokens = new ArrayList<>();
                return;
            }
            nextTokenIsValue = true;
        }

        if (isCollectionEnd(id)) {
            closeCollection(Position.of(token.getEndMark()));
        }
        if (unprocessedTokens != null) {
            return;
        }

        switch (id) {
            case Key:
                key(token);
                break;
            case BlockEntry:
                blockEntry(token);
                break;
            case Scalar:
                scalar(((ScalarToken) token).getValue(), Position.of(token.getStartMark()), Position.of(token.getEndMark()));
                break;
            default:
                break;
        }
    }

    /**
     * Keeps a token of a nested parameter value. Nested collections get their own breadcrumb so their end
     * token is kept too. The end of the collection holding the parameter itself is not part of the value.
     */
    private void capture(Token token) {
        Token.ID id = token.getTokenId();
        if (id == Token.ID.StreamEnd || (isCollectionEnd(id) && top() instanceof StateParameterNode)) {
            return;
        }
        TokenNode raw = new TokenNode(token);
        unprocessedTokens.add(raw);
        if (isCollectionStart(id)) {
            blockStarts.add(new BlockStart(raw));
            breadcrumbs.add(raw);
        }
    }

    /**
     * Pops the breadcrumbs down to and including the node that was open when the collection started.
     * The tree itself is only sealed, never popped.
     */
    private void closeCollection(Position end) {
        if (blockStarts.isEmpty()) {
            logger.debugf("collection end at %s without a matching start", end);
            return;
        }
        AstNode owner = blockStarts.remove(blockStarts.size() - 1).node;
        int index = indexOf(owner);
        if (index < 0) {
            // closed early by a scalar or a sibling entry
            return;
        }
        while (breadcrumbs.size() > Math.max(index, 1)) {
            seal(pop(), end);
        }
        if (owner == tree) {
            tree.setEnd(end);
        }
    }

    private void key(Token token) {
        nextScalarAsKey = true;
        AstNode top = top();
        if (top instanceof AstMapNode) {
            AstNode child = ((AstMapNode) top).add();
            child.setStart(lastStart != null ? lastStart : Position.of(token.getStartMark()));
            lastStart = null;
            breadcrumbs.add(child);
        }
    }

    private void blockEntry(Token token) {
        Position start = Position.of(token.getStartMark());
        AstNode top = top();
        if (top != tree && top.getStart() != null && top.getStart().getCol() == start.getCol()) {
            // previous entry of the same list
            seal(pop(), start);
            top = top();
        }
        if (top instanceof StateCallNode
                || top instanceof IncludesNode
                || top instanceof RequisitesNode) {
            AstNode child = ((AstMapNode) top).add();
            child.setStart(start);
            breadcrumbs.add(child);
        } else {
            lastStart = start;
        }
    }

    private void scalar(String value, Position start, Position end) {
        AstNode top = top();
        if (nextScalarAsKey && top instanceof KeyedNode) {
            setKey(top, value);
        } else if (top instanceof IncludeNode) {
            ((IncludeNode) top).setValue(value);
            top.setEnd(end);
            pop();
        } else if (top instanceof RequisiteNode) {
            ((RequisiteNode) top).setReference(value);
        } else if (top instanceof StateParameterNode && ((StateParameterNode) top).getName() == null) {
            // a parameter without its colon yet
            setKey(top, value);
        } else if (top instanceof Tree || top instanceof ExtendNode || top instanceof StateNode) {
            AstNode child = ((AstMapNode) top).add();
            child.setStart(start);
            child.setEnd(end);
            ((KeyedNode) child).setKey(value);
            if (nextTokenIsValue && top != tree) {
                top.setEnd(end);
                pop();
            }
        }
        if (!nextScalarAsKey) {
            lastStart = null;
        }
        nextScalarAsKey = false;
        nextTokenIsValue = false;
    }

    private void setKey(AstNode node, String key) {
        AstNode replacement = ((KeyedNode) node).setKey(key);
        if (replacement == node) {
            return;
        }
        int index = indexOf(node);
        if (index >= 0) {
            breadcrumbs.set(index, replacement);
        }
        for (BlockStart blockStart : blockStarts) {
            if (blockStart.node == node) {
                blockStart.node = replacement;
            }
        }
    }

    private void seal(AstNode node, Position end) {
        node.setEnd(end);
        if (node instanceof StateParameterNode && unprocessedTokens != null) {
            assignCapturedValue((StateParameterNode) node);
        }
    }

    private void assignCapturedValue(StateParameterNode parameter) {
        List<TokenNode> captured = unprocessedTokens;
        unprocessedTokens = null;
        nextTokenIsValue = false;
        if (captured.size() == 1 && captured.get(0).getTokenId() == Token.ID.Scalar) {
            parameter.setValue(captured.get(0).getValue());
        } else if (!captured.isEmpty()) {
            for (TokenNode raw : captured) {
                raw.setParent(parameter);
            }
            parameter.setTokens(captured);
        }
    }

    private void finishCapture() {
        if (unprocessedTokens == null) {
            return;
        }
        StateParameterNode parameter = innermostParameter();
        if (parameter != null) {
            assignCapturedValue(parameter);
        } else {
            unprocessedTokens = null;
        }
    }

    private void recover(MarkedYAMLException e) {
        Mark problem = e.getProblemMark();
        if (problem == null) {
            closeOpenNodes(lastGoodEnd());
            return;
        }
        Mark context = e.getContextMark() != null ? e.getContextMark() : problem;
        Position contextPosition = Position.of(context);
        int column = context.getColumn();
        while (breadcrumbs.size() > 1) {
            Position start = top().getStart();
            if (start != null && start.getCol() < column) {
                break;
            }
            seal(pop(), contextPosition);
        }
        salvage(problem);
        closeOpenNodes(Position.of(problem));
    }

    /**
     * Feeds the text the scanner gave up on as a plain scalar.
     */
    private void salvage(Mark problem) {
        int from = charOffset(lastToken == null ? 0 : lastToken.getEndMark().getIndex());
        int to = charOffset(problem.getIndex());
        if (to <= from) {
            return;
        }
        String raw = document.substring(from, to);
        String text = raw.trim();
        if (text.isEmpty()) {
            return;
        }
        if (unprocessedTokens != null) {
            StateParameterNode parameter = innermostParameter();
            if (unprocessedTokens.isEmpty() && parameter != null) {
                unprocessedTokens = null;
                parameter.setValue(text);
            }
            return;
        }
        scalar(text, positionAt(from + raw.indexOf(text)), Position.of(problem));
    }

    private void closeOpenNodes(Position end) {
        if (tree.getStart() == null) {
            tree.setStart(new Position(0, 0));
        }
        for (AstNode node : breadcrumbs) {
            if (!(node instanceof TokenNode)) {
                node.setEnd(end);
            }
        }
    }

    private Position lastGoodEnd() {
        return lastToken == null ? new Position(0, 0) : Position.of(lastToken.getEndMark());
    }

    private StateParameterNode innermostParameter() {
        for (int i = breadcrumbs.size() - 1; i >= 0; i--) {
            if (breadcrumbs.get(i) instanceof StateParameterNode) {
                return (StateParameterNode) breadcrumbs.get(i);
            }
        }
        return null;
    }

    /**
     * Marks count code points, strings count chars.
     */
    private int charOffset(int codePointIndex) {
        int max = document.codePointCount(0, document.length());
        return document.offsetByCodePoints(0, Math.min(Math.max(codePointIndex, 0), max));
    }

    private Position positionAt(int offset) {
        int line = 0;
        int col = 0;
        for (int i = 0; i < offset; i++) {
            char c = document.charAt(i);
            if (c == '\n' || (c == '\r' && (i + 1 >= document.length() || document.charAt(i + 1) != '\n'))) {
                line++;
                col = 0;
            } else if (c != '\r' && !Character.isLowSurrogate(c)) {
                col++;
            }
        }
        return new Position(line, col);
    }

    private AstNode top() {
        return breadcrumbs.get(breadcrumbs.size() - 1);
    }

    private AstNode pop() {
        return breadcrumbs.remove(breadcrumbs.size() - 1);
    }

    private int indexOf(AstNode node) {
        for (int i = breadcrumbs.size() - 1; i >= 0; i--) {
            if (breadcrumbs.get(i) == node) {
                return i;
            }
        }
        return -1;
    }

    private static boolean isCollectionStart(Token.ID id) {
        return id == Token.ID.BlockMappingStart || id == Token.ID.BlockSequenceStart
                || id == Token.ID.FlowMappingStart || id == Token.ID.FlowSequenceStart;
    }

    private static boolean isCollectionEnd(Token.ID id) {
        return id == Token.ID.BlockEnd || id == Token.ID.FlowMappingEnd || id == Token.ID.FlowSequenceEnd;
    }
}
