package io.hyperfoil.tools.sls.lsp;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parameters of one state function with their defaults, plus its documentation when known.
 */
public class StateParameters {

    private final Map<String, Object> parameters;
    private final String documentation;

    public StateParameters(Map<String, Object> parameters, String documentation) {
        this.parameters = parameters == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        this.documentation = documentation;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public String getDocumentation() {
        return documentation;
    }
}
