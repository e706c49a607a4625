package com.nodegraph.gcc.io;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;

/** POJO form of one node-definition JSON file. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class NodeLibraryFile {
    private String library;
    private List<NodeDefinition> nodes = new ArrayList<>();
}
