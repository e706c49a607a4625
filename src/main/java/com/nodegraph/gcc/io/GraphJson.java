package com.nodegraph.gcc.io;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.nodegraph.gcc.core.BasicBlock;
import com.nodegraph.gcc.core.Edge;
import com.nodegraph.gcc.core.GraphModel;
import com.nodegraph.gcc.core.GraphVariable;
import com.nodegraph.gcc.core.Node;

import lombok.Data;

/**
 * Jackson mapping between {@link GraphModel} and its {@code graphData} form,
 * the plain map/list tree stored in {@link GraphDataCache} and on disk.
 */
public final class GraphJson {
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private GraphJson() {
        // Utility class
    }

    /** Serialized graph. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class GraphData {
        private String graphId, graphName, graphType, description;
        private List<NodeData> nodes = new ArrayList<>();
        private List<EdgeData> edges = new ArrayList<>();
        private List<BlockData> basicBlocks = new ArrayList<>();
        private List<GraphVariable> graphVariables = new ArrayList<>();
        private Map<String, Object> metadata = new LinkedHashMap<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class NodeData {
        private String id, title, category;
        private List<String> inputs = new ArrayList<>();
        private List<String> outputs = new ArrayList<>();
        private Map<String, String> inputConstants = new LinkedHashMap<>();
        private List<String> flowAliases = new ArrayList<>();
        private Map<String, String> outputLabels = new LinkedHashMap<>();
        private double[] position;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class EdgeData {
        private String id, srcNode, srcPort, dstNode, dstPort;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class BlockData {
        private String id;
        private List<String> nodeIds = new ArrayList<>();
    }

    public static GraphData toDto(GraphModel model) {
        GraphData g = new GraphData();
        g.setGraphId(model.getGraphId());
        g.setGraphName(model.getGraphName());
        g.setGraphType(model.getGraphType());
        g.setDescription(model.getDescription());
        for (Node n : model.nodes()) {
            NodeData nd = new NodeData();
            nd.setId(n.getId());
            nd.setTitle(n.getTitle());
            nd.setCategory(n.getCategory());
            n.inputs().forEach(p -> nd.getInputs().add(p.name()));
            n.outputs().forEach(p -> nd.getOutputs().add(p.name()));
            nd.getInputConstants().putAll(n.inputConstants());
            nd.getFlowAliases().addAll(n.flowAliases());
            nd.getOutputLabels().putAll(n.outputLabels());
            if (n.getPosition() != null)
                nd.setPosition(new double[] { n.getPosition().x(), n.getPosition().y() });
            g.getNodes().add(nd);
        }
        for (Edge e : model.edges()) {
            EdgeData ed = new EdgeData();
            ed.setId(e.id());
            ed.setSrcNode(e.srcNode());
            ed.setSrcPort(e.srcPort());
            ed.setDstNode(e.dstNode());
            ed.setDstPort(e.dstPort());
            g.getEdges().add(ed);
        }
        for (BasicBlock b : model.basicBlocks()) {
            BlockData bd = new BlockData();
            bd.setId(b.id());
            bd.getNodeIds().addAll(b.nodeIds());
            g.getBasicBlocks().add(bd);
        }
        g.getGraphVariables().addAll(model.graphVariables());
        g.getMetadata().putAll(model.metadata());
        return g;
    }

    public static GraphModel fromDto(GraphData g) {
        GraphModel model = new GraphModel();
        model.setGraphId(g.getGraphId());
        model.setGraphName(g.getGraphName());
        model.setGraphType(g.getGraphType());
        model.setDescription(g.getDescription());
        Map<String, Node.Position> positions = new LinkedHashMap<>();
        for (NodeData nd : g.getNodes()) {
            Node n = new Node(nd.getId(), nd.getTitle(), nd.getCategory());
            nd.getInputs().forEach(n::addInput);
            nd.getOutputs().forEach(n::addOutput);
            nd.getFlowAliases().forEach(n::addFlowAlias);
            nd.getInputConstants().forEach(n::setInputConstant);
            nd.getOutputLabels().forEach(n::setOutputLabel);
            if (nd.getPosition() != null && nd.getPosition().length == 2)
                positions.put(n.getId(), new Node.Position(nd.getPosition()[0], nd.getPosition()[1]));
            model.addNode(n);
        }
        for (EdgeData ed : g.getEdges())
            model.addEdge(new Edge(ed.getId(), ed.getSrcNode(), ed.getSrcPort(), ed.getDstNode(), ed.getDstPort()));
        List<BasicBlock> blocks = new ArrayList<>();
        for (BlockData bd : g.getBasicBlocks())
            blocks.add(new BasicBlock(bd.getId(), bd.getNodeIds()));
        model.applyLayout(positions, blocks);
        model.graphVariables().addAll(g.getGraphVariables());
        model.metadata().putAll(g.getMetadata());
        return model;
    }

    /** The {@code graphData} tree: nested maps, lists and scalars. */
    public static Map<String, Object> toData(GraphModel model) {
        return MAPPER.convertValue(toDto(model), new TypeReference<LinkedHashMap<String, Object>>() {
        });
    }

    public static GraphModel fromData(Map<String, Object> data) {
        return fromDto(MAPPER.convertValue(data, GraphData.class));
    }

    public static String toJson(GraphModel model) {
        try {
            return MAPPER.writeValueAsString(toDto(model));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static GraphModel fromJson(String json) {
        try {
            return fromDto(MAPPER.readValue(json, GraphData.class));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static void write(GraphModel model, Path file) {
        try {
            MAPPER.writeValue(file.toFile(), toDto(model));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + file, e);
        }
    }

    public static GraphModel read(Path file) {
        try {
            return fromDto(MAPPER.readValue(file.toFile(), GraphData.class));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }
}
