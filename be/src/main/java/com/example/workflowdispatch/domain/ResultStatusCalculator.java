package com.example.workflowdispatch.domain;

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
 * Derives the overall {@link DispatchStatus} from node statuses.
 * <ul>
 *   <li>COMPLETED when every node is COMPLETED</li>
 *   <li>PENDING when every node is PENDING</li>
 *   <li>FAILED when some node FAILED, none is RUNNING and every PENDING node depends
 *       (transitively) on a FAILED node</li>
 *   <li>RUNNING otherwise</li>
 * </ul>
 * A dispatch-level error always yields FAILED.
 */
public final class ResultStatusCalculator {

    private ResultStatusCalculator() {
    }

    public static DispatchStatus compute(List<NodeDto> nodes, List<EdgeDto> links, String dispatchError) {
        if (dispatchError != null) {
            return DispatchStatus.FAILED;
        }
        if (nodes == null || nodes.isEmpty()) {
            return DispatchStatus.PENDING;
        }
        boolean allCompleted = true;
        boolean allPending = true;
        boolean anyFailed = false;
        boolean anyRunning = false;
        for (NodeDto node : nodes) {
            NodeStatus status = statusOf(node);
            allCompleted &= status == NodeStatus.COMPLETED;
            allPending &= status == NodeStatus.PENDING;
            anyFailed |= status == NodeStatus.FAILED;
            anyRunning |= status == NodeStatus.RUNNING;
        }
        if (allCompleted) {
            return DispatchStatus.COMPLETED;
        }
        if (allPending) {
            return DispatchStatus.PENDING;
        }
        if (anyFailed && !anyRunning && allPendingBlocked(nodes, links)) {
            return DispatchStatus.FAILED;
        }
        return DispatchStatus.RUNNING;
    }

    public static int countCompleted(List<NodeDto> nodes) {
        if (nodes == null) {
            return 0;
        }
        return (int) nodes.stream().filter(n -> statusOf(n) == NodeStatus.COMPLETED).count();
    }

    private static boolean allPendingBlocked(List<NodeDto> nodes, List<EdgeDto> links) {
        Set<Integer> blocked = descendantsOfFailed(nodes, links);
        for (NodeDto node : nodes) {
            if (statusOf(node) == NodeStatus.PENDING && !blocked.contains(node.id())) {
                return false;
            }
        }
        return true;
    }

    private static Set<Integer> descendantsOfFailed(List<NodeDto> nodes, List<EdgeDto> links) {
        Map<Integer, List<Integer>> children = new HashMap<>();
        if (links != null) {
            for (EdgeDto edge : links) {
                children.computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(edge.target());
            }
        }
        Deque<Integer> queue = new ArrayDeque<>();
        for (NodeDto node : nodes) {
            if (statusOf(node) == NodeStatus.FAILED) {
                queue.add(node.id());
            }
        }
        Set<Integer> reached = new HashSet<>();
        while (!queue.isEmpty()) {
            Integer current = queue.poll();
            for (Integer child : children.getOrDefault(current, List.of())) {
                if (reached.add(child)) {
                    queue.add(child);
                }
            }
        }
        return reached;
    }

    private static NodeStatus statusOf(NodeDto node) {
        return node.status() != null ? node.status() : NodeStatus.PENDING;
    }
}
