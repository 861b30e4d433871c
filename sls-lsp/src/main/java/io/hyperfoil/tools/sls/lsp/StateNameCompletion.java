package io.hyperfoil.tools.sls.lsp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Completion data of one state module, e.g. {@code file}: its functions, their parameters and documentation.
 */
public class StateNameCompletion {

    private final String stateName;
    private final Map<String, StateParameters> stateParams = new LinkedHashMap<>();
    private final String stateDocs;

    /**
     * @param stateParams one single entry map per function, function name to parameter defaults
     * @param moduleDocs  documentation keyed by {@code <state>} and {@code <state>.<function>}
     */
    public StateNameCompletion(String stateName, List<Map<String, Map<String, Object>>> stateParams, Map<String, String> moduleDocs) {
        this.stateName = stateName;
        Map<String, String> docs = moduleDocs == null ? Collections.emptyMap() : moduleDocs;
        if (stateParams != null) {
            for (Map<String, Map<String, Object>> entry : stateParams) {
                for (Map.Entry<String, Map<String, Object>> function : entry.entrySet()) {
                    String submodule = function.getKey();
                    this.stateParams.put(submodule, new StateParameters(function.getValue(), docs.get(stateName + "." + submodule)));
                }
            }
        }
        this.stateDocs = docs.get(stateName);
    }

    public String getStateName() {
        return stateName;
    }

    public String getStateDocs() {
        return stateDocs;
    }

    public Map<String, StateParameters> getStateParams() {
        return Collections.unmodifiableMap(stateParams);
    }

    public List<String> getStateSubNames() {
        return new ArrayList<>(stateParams.keySet());
    }

    /**
     * Function names with their documentation, in declaration order. Documentation may be null.
     */
    public Map<String, String> provideSubnameCompletion() {
        Map<String, String> names = new LinkedHashMap<>();
        stateParams.forEach((name, parameters) -> names.put(name, parameters.getDocumentation()));
        return names;
    }

    public List<String> provideParamCompletion(String submodule) {
        StateParameters parameters = stateParams.get(submodule);
        if (parameters == null) {
            return Collections.emptyList();
        }
        return new ArrayList<>(parameters.getParameters().keySet());
    }
}
