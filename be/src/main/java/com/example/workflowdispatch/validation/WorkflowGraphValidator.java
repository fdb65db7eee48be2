package com.example.workflowdispatch.validation;

import com.example.workflowdispatch.api.v1.dto.EdgeDto;
import com.example.workflowdispatch.api.v1.dto.NodeDto;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates a submitted workflow graph: node ids and names, edge reference integrity, and that
 * the edges form a DAG.
 */
public final class WorkflowGraphValidator {

    private WorkflowGraphValidator() {
    }

    /**
     * Validates the graph. Throws {@link WorkflowGraphValidationException} with all errors if invalid.
     */
    public static void validate(List<NodeDto> nodes, List<EdgeDto> links) {
        List<ValidationError> errors = new ArrayList<>();

        if (nodes == null || nodes.isEmpty()) {
            errors.add(new ValidationError("nodes", "at least one node is required"));
            throw new WorkflowGraphValidationException(errors);
        }

        Set<Integer> nodeIds = new HashSet<>();
        for (NodeDto node : nodes) {
            validateNode(node, nodeIds, errors);
        }

        List<EdgeDto> edges = links != null ? links : List.of();
        for (int i = 0; i < edges.size(); i++) {
            validateEdge(i, edges.get(i), nodeIds, errors);
        }

        // cycle detection assumes every edge endpoint exists
        if (errors.isEmpty()) {
            List<Integer> cyclic = nodesOnCycles(nodeIds, edges);
            if (!cyclic.isEmpty()) {
                errors.add(new ValidationError("links", "graph must be acyclic; cycle through nodes " + cyclic));
            }
        }

        if (!errors.isEmpty()) {
            throw new WorkflowGraphValidationException(errors);
        }
    }

    private static void validateNode(NodeDto node, Set<Integer> nodeIds, List<ValidationError> errors) {
        if (node == null) {
            errors.add(new ValidationError("nodes", "node must not be null"));
            return;
        }
        String prefix = "nodes[" + node.id() + "]";

        if (node.id() < 0) {
            errors.add(new ValidationError(prefix + ".id", "node id must not be negative"));
        }
        if (!nodeIds.add(node.id())) {
            errors.add(new ValidationError(prefix + ".id", "duplicate node id: " + node.id()));
        }
        if (node.name() == null || node.name().isBlank()) {
            errors.add(new ValidationError(prefix + ".name", "node name is required"));
        }
    }

    private static void validateEdge(int index, EdgeDto edge, Set<Integer> nodeIds, List<ValidationError> errors) {
        String prefix = "links[" + index + "]";
        if (edge == null) {
            errors.add(new ValidationError(prefix, "edge must not be null"));
            return;
        }
        if (!nodeIds.contains(edge.source())) {
            errors.add(new ValidationError(prefix + ".source", "source must reference an existing node id: " + edge.source()));
        }
        if (!nodeIds.contains(edge.target())) {
            errors.add(new ValidationError(prefix + ".target", "target must reference an existing node id: " + edge.target()));
        }
    }

    /**
     * Kahn's algorithm; returns the ids left with incoming edges once no more can be removed,
     * i.e. the nodes on or downstream of a cycle. Empty for a DAG.
     */
    private static List<Integer> nodesOnCycles(Set<Integer> nodeIds, List<EdgeDto> edges) {
        Map<Integer, Integer> inDegree = new HashMap<>();
        Map<Integer, List<Integer>> children = new HashMap<>();
        for (Integer id : nodeIds) {
            inDegree.put(id, 0);
        }
        for (EdgeDto edge : edges) {
            children.computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(edge.target());
            inDegree.merge(edge.target(), 1, Integer::sum);
        }
        Deque<Integer> ready = new ArrayDeque<>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) {
                ready.add(id);
            }
        });
        while (!ready.isEmpty()) {
            Integer id = ready.poll();
            for (Integer child : children.getOrDefault(id, List.of())) {
                if (inDegree.merge(child, -1, Integer::sum) == 0) {
                    ready.add(child);
                }
            }
        }
        return inDegree.entrySet().stream()
                .filter(e -> e.getValue() > 0)
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }
}
