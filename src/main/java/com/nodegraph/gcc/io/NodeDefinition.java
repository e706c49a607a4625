package com.nodegraph.gcc.io;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.nodegraph.gcc.core.FlowPorts;

import lombok.Data;

/**
 * Registry entry describing one node kind: ordered ports, declared port
 * types, and for variable-arity nodes the dynamic port family.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class NodeDefinition {
    private String name, category, description;
    private List<String> inputs = new ArrayList<>();
    private List<String> outputs = new ArrayList<>();
    private Map<String, String> inputTypes = new LinkedHashMap<>();
    private Map<String, String> outputTypes = new LinkedHashMap<>();
    private List<String> aliases = new ArrayList<>();
    /** Extra port names that carry flow, e.g. composite flow pins. */
    private List<String> flowPorts = new ArrayList<>();
    private DynamicPortFamily dynamicPorts = DynamicPortFamily.NONE;
    private int minArgs;
    /** Set when this entry stands for a composite node. */
    private String compositeId;

    public static NodeDefinition of(String name, String category, List<String> inputs, List<String> outputs) {
        NodeDefinition d = new NodeDefinition();
        d.setName(name);
        d.setCategory(category);
        d.setInputs(new ArrayList<>(inputs));
        d.setOutputs(new ArrayList<>(outputs));
        return d;
    }

    public boolean isFlowPort(String port, boolean output) {
        if (flowPorts.contains(port))
            return true;
        return output ? FlowPorts.FLOW_OUTPUTS.contains(port) : FlowPorts.FLOW_INPUTS.contains(port);
    }

    public boolean acceptsFlow() {
        return inputs.contains(FlowPorts.FLOW_IN) || inputs.stream().anyMatch(p -> isFlowPort(p, false));
    }

    public List<String> dataInputs() {
        return inputs.stream().filter(p -> !isFlowPort(p, false)).toList();
    }

    public List<String> dataOutputs() {
        return outputs.stream().filter(p -> !isFlowPort(p, true)).toList();
    }

    public List<String> flowOutputs() {
        return outputs.stream().filter(p -> isFlowPort(p, true)).toList();
    }

    public String inputType(String port) {
        return inputTypes.get(port);
    }

    public String outputType(String port) {
        return outputTypes.get(port);
    }
}
