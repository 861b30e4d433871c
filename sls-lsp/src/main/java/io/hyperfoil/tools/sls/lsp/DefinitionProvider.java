package io.hyperfoil.tools.sls.lsp;

import io.hyperfoil.tools.sls.lsp.ast.AstNode;
import io.hyperfoil.tools.sls.lsp.ast.Position;
import io.hyperfoil.tools.sls.lsp.ast.RequisiteNode;
import io.hyperfoil.tools.sls.lsp.ast.StateNode;
import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.Range;

import java.util.Collection;
import java.util.Collections;

/**
 * Go-to-definition from a requisite to the state it references.
 */
public class DefinitionProvider {

    private final PathResolver pathResolver;

    public DefinitionProvider(PathResolver pathResolver) {
        this.pathResolver = pathResolver;
    }

    public Location definition(SlsDocument doc, int line, int character) {
        return definition(doc, line, character, Collections.emptyList());
    }

    /**
     * Searches the current document first, then {@code others} in iteration order.
     * Returns null when the cursor is not on a requisite or the state is not found.
     */
    public Location definition(SlsDocument doc, int line, int character, Collection<SlsDocument> others) {
        AstNode node = pathResolver.innermost(doc.getTree(), new Position(line, character));
        if (!(node instanceof RequisiteNode)) {
            return null;
        }
        String reference = ((RequisiteNode) node).getReference();
        if (reference == null) {
            return null;
        }
        Location local = locate(doc, reference);
        if (local != null || others == null) {
            return local;
        }
        for (SlsDocument other : others) {
            if (other == doc || (other.getUri() != null && other.getUri().equals(doc.getUri()))) {
                continue;
            }
            Location location = locate(other, reference);
            if (location != null) {
                return location;
            }
        }
        return null;
    }

    private Location locate(SlsDocument doc, String identifier) {
        StateNode state = doc.findState(identifier);
        if (state == null) {
            return null;
        }
        Range range = state.toRange();
        return range == null ? null : new Location(doc.getUri(), range);
    }
}
