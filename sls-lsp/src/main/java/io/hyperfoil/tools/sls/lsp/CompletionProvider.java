package io.hyperfoil.tools.sls.lsp;

import io.hyperfoil.tools.sls.lsp.ast.AstNode;
import io.hyperfoil.tools.sls.lsp.ast.IncludesNode;
import io.hyperfoil.tools.sls.lsp.ast.Position;
import io.hyperfoil.tools.sls.lsp.ast.StateCallNode;
import io.hyperfoil.tools.sls.lsp.ast.StateParameterNode;
import org.eclipse.lsp4j.CompletionItem;
import org.eclipse.lsp4j.CompletionItemKind;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Provides completions for SLS documents: include names, state functions after {@code module.}
 * and the parameters of the enclosing state call.
 */
public class CompletionProvider {

    private final StateCompletions completions;
    private final PathResolver pathResolver;
    private final SlsFiles slsFiles;

    public CompletionProvider(StateCompletions completions, PathResolver pathResolver, SlsFiles slsFiles) {
        this.completions = completions;
        this.pathResolver = pathResolver;
        this.slsFiles = slsFiles;
    }

    /**
     * @param documentPath file of the document, used to find the top of the state tree for include names. May be null.
     */
    public List<CompletionItem> complete(SlsDocument doc, int line, int character, Path documentPath) {
        List<AstNode> path = pathResolver.pathTo(doc.getTree(), new Position(line, character));

        if (PathResolver.enclosing(path, IncludesNode.class) != null) {
            return includeCompletions(documentPath);
        }

        String word = extractWordBefore(doc.getLine(line), character);
        int dot = word == null ? -1 : word.indexOf('.');
        if (dot > 0 && completions.contains(word.substring(0, dot))) {
            return stateNameCompletions(word.substring(0, dot), word.substring(dot + 1));
        }

        AstNode innermost = path.isEmpty() ? null : path.get(path.size() - 1);
        if (innermost instanceof StateCallNode
                || (innermost instanceof StateParameterNode && !((StateParameterNode) innermost).hasValue())) {
            return parameterCompletions(PathResolver.enclosing(path, StateCallNode.class));
        }
        return Collections.emptyList();
    }

    List<CompletionItem> includeCompletions(Path documentPath) {
        Path top = slsFiles.findTop(documentPath);
        if (top == null) {
            return Collections.emptyList();
        }
        List<CompletionItem> items = new ArrayList<>();
        for (String include : slsFiles.listIncludes(top)) {
            CompletionItem item = new CompletionItem(include);
            item.setKind(CompletionItemKind.File);
            items.add(item);
        }
        return items;
    }

    /**
     * Functions of {@code stateName} starting with {@code prefix}, documented when the documentation is known.
     */
    public List<CompletionItem> stateNameCompletions(String stateName, String prefix) {
        StateNameCompletion completion = completions.get(stateName);
        if (completion == null) {
            return Collections.emptyList();
        }
        List<CompletionItem> items = new ArrayList<>();
        for (Map.Entry<String, String> entry : completion.provideSubnameCompletion().entrySet()) {
            if (prefix != null && !entry.getKey().startsWith(prefix)) {
                continue;
            }
            CompletionItem item = new CompletionItem(entry.getKey());
            item.setKind(CompletionItemKind.Function);
            item.setDetail(stateName + "." + entry.getKey());
            if (entry.getValue() != null && !entry.getValue().isEmpty()) {
                item.setDocumentation(entry.getValue());
            }
            items.add(item);
        }
        return items;
    }

    private List<CompletionItem> parameterCompletions(StateCallNode call) {
        if (call == null || call.getName() == null) {
            return Collections.emptyList();
        }
        String name = call.getName();
        int dot = name.indexOf('.');
        if (dot <= 0) {
            return Collections.emptyList();
        }
        StateNameCompletion completion = completions.get(name.substring(0, dot));
        if (completion == null) {
            return Collections.emptyList();
        }
        String function = name.substring(dot + 1);
        Map<String, Object> defaults = completion.getStateParams().containsKey(function)
                ? completion.getStateParams().get(function).getParameters()
                : Collections.emptyMap();
        List<CompletionItem> items = new ArrayList<>();
        for (String param : completion.provideParamCompletion(function)) {
            CompletionItem item = new CompletionItem(param);
            item.setKind(CompletionItemKind.Property);
            Object defaultValue = defaults.get(param);
            if (defaultValue != null) {
                item.setDetail("default: " + defaultValue);
            }
            items.add(item);
        }
        return items;
    }

    /**
     * The state-name-like word ending at {@code character}, or null.
     */
    static String extractWordBefore(String line, int character) {
        if (line == null || character <= 0 || character > line.length()) {
            return null;
        }
        int start = character;
        while (start > 0 && isWordChar(line.charAt(start - 1))) {
            start--;
        }
        if (start == character) {
            return null;
        }
        return line.substring(start, character);
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.';
    }
}
