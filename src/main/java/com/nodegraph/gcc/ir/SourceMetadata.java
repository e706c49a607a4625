package com.nodegraph.gcc.ir;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.nodegraph.gcc.core.GraphVariable;

/**
 * Key:value metadata carried by the leading documentation block.
 *
 * <pre>
 * graph_id: server_demo
 * graph_name: Demo
 * graph_variables:
 * - counter: Integer = 0
 * </pre>
 */
public record SourceMetadata(Map<String, String> values, List<GraphVariable> graphVariables) {

    public static final String GRAPH_ID = "graph_id";
    public static final String GRAPH_NAME = "graph_name";
    public static final String GRAPH_TYPE = "graph_type";
    public static final String DESCRIPTION = "description";
    public static final String COMPOSITE_ID = "composite_id";
    public static final String NODE_NAME = "node_name";
    public static final String NODE_DESCRIPTION = "node_description";
    public static final String SCOPE = "scope";
    public static final String CATEGORY = "category";
    public static final String GRAPH_VARIABLES = "graph_variables";

    public String get(String key) {
        return values.get(key);
    }

    public String get(String key, String fallback) {
        String v = values.get(key);
        return v == null || v.isEmpty() ? fallback : v;
    }

    public boolean isComposite() {
        return values.containsKey(COMPOSITE_ID);
    }

    public static SourceMetadata parse(String docstring, String file) {
        Map<String, String> values = new LinkedHashMap<>();
        List<GraphVariable> vars = new ArrayList<>();
        if (docstring == null)
            return new SourceMetadata(values, vars);
        boolean inVariables = false;
        String[] lines = docstring.split("\n");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].strip();
            if (line.isEmpty())
                continue;
            if (inVariables && line.startsWith("-")) {
                vars.add(parseVariable(line.substring(1).strip(), file, i + 1));
                continue;
            }
            inVariables = false;
            int colon = line.indexOf(':');
            if (colon <= 0)
                continue;
            String key = line.substring(0, colon).strip();
            String value = line.substring(colon + 1).strip();
            if (key.equals(GRAPH_VARIABLES)) {
                inVariables = true;
                continue;
            }
            values.put(key, value);
        }
        return new SourceMetadata(values, vars);
    }

    /** {@code name: Type = default}, type and default optional. */
    private static GraphVariable parseVariable(String text, String file, int docLine) {
        String name = text, type = null, defaultValue = null;
        int eq = text.indexOf('=');
        if (eq >= 0) {
            defaultValue = text.substring(eq + 1).strip();
            name = text.substring(0, eq).strip();
        }
        int colon = name.indexOf(':');
        if (colon >= 0) {
            type = name.substring(colon + 1).strip();
            name = name.substring(0, colon).strip();
        }
        if (name.isEmpty())
            throw new GraphParseException("Graph variable without a name in documentation block", file, docLine);
        return new GraphVariable(name, type, defaultValue);
    }

    /** Inverse of {@link #parse}. Values are written on one line each. */
    public static String render(Map<String, String> values, List<GraphVariable> vars) {
        StringBuilder sb = new StringBuilder();
        values.forEach((k, v) -> {
            if (v != null)
                sb.append(k).append(": ").append(v.replace('\n', ' ')).append('\n');
        });
        if (!vars.isEmpty()) {
            sb.append(GRAPH_VARIABLES).append(":\n");
            for (GraphVariable v : vars) {
                sb.append("- ").append(v.getName());
                if (v.getType() != null)
                    sb.append(": ").append(v.getType());
                if (v.getDefaultValue() != null)
                    sb.append(" = ").append(v.getDefaultValue());
                sb.append('\n');
            }
        }
        return sb.toString();
    }
}
