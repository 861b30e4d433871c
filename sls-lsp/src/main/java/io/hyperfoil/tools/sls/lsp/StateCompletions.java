package io.hyperfoil.tools.sls.lsp;

import org.jboss.logging.Logger;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.lang.invoke.MethodHandles;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only index of the known state modules, loaded from a YAML (or JSON) document shaped like
 * <pre>
 * states:
 *   file:
 *     - managed: {name: null, source: null}
 * docs:
 *   file: "..."
 *   file.managed: "..."
 * </pre>
 */
public class StateCompletions {

    private static final Logger logger = Logger.getLogger(MethodHandles.lookup().lookupClass());

    private final Map<String, StateNameCompletion> completions;

    public StateCompletions() {
        this(Collections.emptyMap());
    }

    public StateCompletions(Map<String, StateNameCompletion> completions) {
        this.completions = Collections.unmodifiableMap(new LinkedHashMap<>(completions));
    }

    public static StateCompletions fromConfig(SlsConfig config) {
        String index = config.getStatesIndex();
        try (InputStream is = StateCompletions.class.getClassLoader().getResourceAsStream(index)) {
            if (is != null) {
                return load(is);
            }
        } catch (IOException e) {
            logger.warnf(e, "failed to read state index resource %s", index);
            return new StateCompletions();
        }
        Path path = Path.of(index);
        if (!Files.isRegularFile(path)) {
            logger.warnf("state index %s not found, completions disabled", index);
            return new StateCompletions();
        }
        try (InputStream is = Files.newInputStream(path)) {
            return load(is);
        } catch (IOException e) {
            logger.warnf(e, "failed to read state index %s", path);
            return new StateCompletions();
        }
    }

    public static StateCompletions load(InputStream is) {
        Object loaded;
        try {
            loaded = new Yaml(new SafeConstructor(new LoaderOptions())).load(is);
        } catch (YAMLException e) {
            logger.warnf(e, "state index is not valid YAML");
            return new StateCompletions();
        }
        if (!(loaded instanceof Map)) {
            logger.warnf("state index must be a mapping, found %s", loaded == null ? "nothing" : loaded.getClass().getSimpleName());
            return new StateCompletions();
        }
        Map<?, ?> root = (Map<?, ?>) loaded;
        Map<String, String> docs = new LinkedHashMap<>();
        if (root.get("docs") instanceof Map) {
            ((Map<?, ?>) root.get("docs")).forEach((key, value) ->
                    docs.put(String.valueOf(key), value == null ? null : String.valueOf(value)));
        }
        Map<String, StateNameCompletion> completions = new LinkedHashMap<>();
        if (root.get("states") instanceof Map) {
            ((Map<?, ?>) root.get("states")).forEach((name, functions) -> {
                String stateName = String.valueOf(name);
                completions.put(stateName, new StateNameCompletion(stateName, functions(stateName, functions), docs));
            });
        }
        logger.debugf("loaded %d state modules", completions.size());
        return new StateCompletions(completions);
    }

    private static List<Map<String, Map<String, Object>>> functions(String stateName, Object value) {
        List<Map<String, Map<String, Object>>> functions = new ArrayList<>();
        if (!(value instanceof List)) {
            logger.warnf("skipping functions of %s, expected a list", stateName);
            return functions;
        }
        for (Object entry : (List<?>) value) {
            if (!(entry instanceof Map)) {
                logger.debugf("skipping malformed function entry %s of %s", entry, stateName);
                continue;
            }
            Map<String, Map<String, Object>> function = new LinkedHashMap<>();
            ((Map<?, ?>) entry).forEach((functionName, parameters) -> {
                Map<String, Object> defaults = new LinkedHashMap<>();
                if (parameters instanceof Map) {
                    ((Map<?, ?>) parameters).forEach((param, defaultValue) -> defaults.put(String.valueOf(param), defaultValue));
                }
                function.put(String.valueOf(functionName), defaults);
            });
            functions.add(function);
        }
        return functions;
    }

    public StateNameCompletion get(String stateName) {
        return stateName == null ? null : completions.get(stateName);
    }

    public boolean contains(String stateName) {
        return stateName != null && completions.containsKey(stateName);
    }

    public Set<String> getStateNames() {
        return completions.keySet();
    }

    public boolean isEmpty() {
        return completions.isEmpty();
    }

    /**
     * Documentation of a {@code state} or a {@code state.function}, or null when unknown.
     * A function without documentation falls back to the documentation of its state.
     */
    public String getDocumentation(String name) {
        if (name == null) {
            return null;
        }
        int dot = name.indexOf('.');
        StateNameCompletion completion = completions.get(dot < 0 ? name : name.substring(0, dot));
        if (completion == null) {
            return null;
        }
        if (dot < 0) {
            return completion.getStateDocs();
        }
        StateParameters parameters = completion.getStateParams().get(name.substring(dot + 1));
        if (parameters == null || parameters.getDocumentation() == null) {
            return completion.getStateDocs();
        }
        return parameters.getDocumentation();
    }
}
