package io.hyperfoil.tools.sls.lsp;

import io.hyperfoil.tools.sls.lsp.ast.StateNode;
import io.hyperfoil.tools.sls.lsp.ast.Tree;
import io.hyperfoil.tools.sls.lsp.parser.SlsParser;

import java.util.Objects;

/**
 * An open SLS file: its text, lines and syntax tree. The tree is rebuilt whenever the text changes.
 */
public class SlsDocument {

    private final String uri;
    private String text;
    private String[] lines;
    private Tree tree;

    public SlsDocument(String uri, String text) {
        this.uri = uri;
        setText(text);
    }

    public void setText(String text) {
        Objects.requireNonNull(text, "text");
        Tree parsed = SlsParser.parse(text);
        this.text = text;
        this.lines = text.split("\n", -1);
        this.tree = parsed;
    }

    public String getUri() {
        return uri;
    }

    public String getText() {
        return text;
    }

    public String getLine(int lineIndex) {
        if (lineIndex >= 0 && lineIndex < lines.length) {
            return lines[lineIndex];
        }
        return "";
    }

    public int getLineCount() {
        return lines.length;
    }

    public Tree getTree() {
        return tree;
    }

    public StateNode findState(String identifier) {
        return tree.findState(identifier);
    }
}
