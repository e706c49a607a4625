package com.nodegraph.gcc.core;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;
import lombok.Setter;

/**
 * A reusable subroutine: identity, public pins and the embedded sub-graph
 * the pins map into.
 */
@Getter
@Setter
public final class CompositeNodeConfig {
    private String compositeId;
    private String nodeName;
    private String description = "";
    private String scope = "server";
    private String category = "";
    private final List<VirtualPin> virtualPins = new ArrayList<>();
    private final Map<String, String> metadata = new LinkedHashMap<>();
    private GraphModel subGraph = new GraphModel();

    public CompositeNodeConfig(String compositeId, String nodeName) {
        this.compositeId = compositeId;
        this.nodeName = nodeName;
    }

    public List<VirtualPin> inputPins() {
        return pins(true);
    }

    public List<VirtualPin> outputPins() {
        return pins(false);
    }

    private List<VirtualPin> pins(boolean input) {
        List<VirtualPin> out = new ArrayList<>();
        for (VirtualPin p : virtualPins)
            if (p.isInput() == input)
                out.add(p);
        out.sort(Comparator.comparingInt(VirtualPin::getIndex));
        return out;
    }

    public VirtualPin findPin(String name, boolean input) {
        for (VirtualPin p : virtualPins)
            if (p.isInput() == input && p.getName().equals(name))
                return p;
        return null;
    }

    public void addPin(VirtualPin pin) {
        if (findPin(pin.getName(), pin.isInput()) != null)
            throw new IllegalArgumentException("Duplicate " + (pin.isInput() ? "input" : "output")
                    + " pin '" + pin.getName() + "' on composite " + nodeName);
        virtualPins.add(pin);
    }
}
