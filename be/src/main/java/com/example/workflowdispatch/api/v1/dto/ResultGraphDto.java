package com.example.workflowdispatch.api.v1.dto;

import java.util.List;

/**
 * Nodes and links of a dispatch; also the persisted form of the graph.
 */
public record ResultGraphDto(List<NodeDto> nodes, List<EdgeDto> links) {

    public ResultGraphDto {
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        links = links != null ? List.copyOf(links) : List.of();
    }
}
