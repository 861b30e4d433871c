package io.hyperfoil.tools.sls.lsp;

import io.hyperfoil.tools.sls.lsp.ast.AstMapNode;
import io.hyperfoil.tools.sls.lsp.ast.AstNode;
import io.hyperfoil.tools.sls.lsp.ast.ExtendNode;
import io.hyperfoil.tools.sls.lsp.ast.IncludeNode;
import io.hyperfoil.tools.sls.lsp.ast.IncludesNode;
import io.hyperfoil.tools.sls.lsp.ast.Position;
import io.hyperfoil.tools.sls.lsp.ast.RequisiteNode;
import io.hyperfoil.tools.sls.lsp.ast.RequisitesNode;
import io.hyperfoil.tools.sls.lsp.ast.StateCallNode;
import io.hyperfoil.tools.sls.lsp.ast.StateNode;
import io.hyperfoil.tools.sls.lsp.ast.StateParameterNode;
import io.hyperfoil.tools.sls.lsp.ast.Tree;
import org.eclipse.lsp4j.DocumentSymbol;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.SymbolKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Provides the outline of an SLS document. Every node with a name becomes a symbol and
 * keeps its children, all the way down to parameters and requisites.
 */
public class DocumentSymbolProvider {

    static final String INCLUDES_DETAIL = "A list of included SLS files.\n"
            + "See also https://docs.saltproject.io/en/latest/ref/states/include.html\n";
    static final String EXTEND_DETAIL = "Extension of external SLS data.\n"
            + "See: https://docs.saltproject.io/en/latest/ref/states/extend.html\n";
    static final String REQUISITES_DETAIL = "List of requisites.\n"
            + "See also: https://docs.saltproject.io/en/latest/ref/states/requisites.html\n";

    private final StateCompletions completions;

    public DocumentSymbolProvider(StateCompletions completions) {
        this.completions = completions;
    }

    public List<DocumentSymbol> documentSymbols(SlsDocument doc) {
        return documentSymbols(doc.getTree());
    }

    public List<DocumentSymbol> documentSymbols(Tree tree) {
        return symbols(tree.getChildren());
    }

    private List<DocumentSymbol> symbols(List<AstNode> nodes) {
        List<DocumentSymbol> symbols = new ArrayList<>();
        for (AstNode node : nodes) {
            DocumentSymbol symbol = toSymbol(node);
            if (symbol != null) {
                symbols.add(symbol);
            }
        }
        return symbols;
    }

    private DocumentSymbol toSymbol(AstNode node) {
        String name = nameOf(node);
        Range range = node.toRange();
        if (name == null || range == null) {
            return null;
        }
        Position start = node.getStart();
        Range selection = new Range(start.toLsp(), new Position(start.getLine(), start.getCol() + name.length()).toLsp());
        SymbolKind kind = node instanceof IncludeNode ? SymbolKind.String : SymbolKind.Object;
        List<DocumentSymbol> children = node instanceof AstMapNode ? symbols(node.getChildren()) : new ArrayList<>();
        return new DocumentSymbol(name, kind, range, selection, detailOf(node), children);
    }

    static String nameOf(AstNode node) {
        if (node instanceof IncludeNode) {
            return ((IncludeNode) node).getValue();
        } else if (node instanceof IncludesNode) {
            return "includes";
        } else if (node instanceof ExtendNode) {
            return "extend";
        } else if (node instanceof StateNode) {
            return ((StateNode) node).getIdentifier();
        } else if (node instanceof StateCallNode) {
            return ((StateCallNode) node).getName();
        } else if (node instanceof StateParameterNode) {
            return ((StateParameterNode) node).getName();
        } else if (node instanceof RequisitesNode) {
            return ((RequisitesNode) node).getKind();
        } else if (node instanceof RequisiteNode) {
            return ((RequisiteNode) node).getModule();
        }
        return null;
    }

    private String detailOf(AstNode node) {
        String detail = null;
        if (node instanceof IncludesNode) {
            detail = INCLUDES_DETAIL;
        } else if (node instanceof ExtendNode) {
            detail = EXTEND_DETAIL;
        } else if (node instanceof RequisitesNode) {
            detail = REQUISITES_DETAIL;
        } else if (node instanceof StateCallNode || node instanceof RequisiteNode) {
            detail = completions.getDocumentation(nameOf(node));
        }
        return detail == null ? "" : detail;
    }
}
