package com.example.workflowdispatch.store;

import com.example.workflowdispatch.api.DispatchNotFoundException;
import com.example.workflowdispatch.api.NodeNotFoundException;
import com.example.workflowdispatch.api.v1.dto.EdgeDto;
import com.example.workflowdispatch.api.v1.dto.NodeDto;
import com.example.workflowdispatch.api.v1.dto.ResultGraphDto;
import com.example.workflowdispatch.api.v1.dto.ResultResponse;
import com.example.workflowdispatch.api.v1.dto.SublatticeResultDto;
import com.example.workflowdispatch.domain.DispatchStatus;
import com.example.workflowdispatch.domain.InvalidTransitionException;
import com.example.workflowdispatch.domain.NodeStatus;
import com.example.workflowdispatch.domain.ParamType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@DisplayName("JpaResultStore")
class JpaResultStoreTest {

    @Autowired
    private ResultStore store;

    private static final ResultGraphDto TWO_STEP = new ResultGraphDto(
            List.of(
                    new NodeDto(0, "load_data", Map.of("executor", "<LocalExecutor>"), "def load_data(): ...",
                            null, null, NodeStatus.COMPLETED, List.of("stale"), null, null, null, null),
                    new NodeDto(1, "train", null, null, null, null, null, null, null, null, null, null)
            ),
            List.of(new EdgeDto(0, 1, "data", ParamType.KWARG))
    );

    @Nested
    @DisplayName("create and get")
    class CreateAndGet {

        @Test
        @DisplayName("stores every node as PENDING and keeps node metadata")
        void createResetsNodes() {
            UUID id = UUID.randomUUID();
            store.create(id, "results/" + id, TWO_STEP);

            ResultResponse result = store.get(id);
            assertThat(result.dispatchId()).isEqualTo(id);
            assertThat(result.status()).isEqualTo(DispatchStatus.PENDING);
            assertThat(result.resultsDir()).isEqualTo("results/" + id);
            assertThat(result.graph().nodes()).extracting(NodeDto::status).containsOnly(NodeStatus.PENDING);
            assertThat(result.graph().nodes().get(0).output()).isNull();
            assertThat(result.graph().nodes().get(0).metadata()).containsEntry("executor", "<LocalExecutor>");
            assertThat(result.graph().links()).containsExactly(new EdgeDto(0, 1, "data", ParamType.KWARG));
        }

        @Test
        @DisplayName("rejects a duplicate dispatch id")
        void duplicateCreateFails() {
            UUID id = UUID.randomUUID();
            store.create(id, "r", TWO_STEP);
            assertThatThrownBy(() -> store.create(id, "r", TWO_STEP))
                    .isInstanceOf(DispatchAlreadyExistsException.class);
            assertThat(store.exists(id)).isTrue();
        }

        @Test
        @DisplayName("get of an unknown id throws DispatchNotFoundException")
        void unknownIdNotFound() {
            assertThatThrownBy(() -> store.get(UUID.randomUUID()))
                    .isInstanceOf(DispatchNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("updateNode")
    class UpdateNode {

        @Test
        @DisplayName("applies fields, stamps times and recomputes status")
        void appliesUpdate() {
            UUID id = UUID.randomUUID();
            store.create(id, "r", TWO_STEP);

            UpdatedResult running = store.updateNode(id, 0, NodeUpdate.status(NodeStatus.RUNNING));
            assertThat(running.previousStatus()).isEqualTo(DispatchStatus.PENDING);
            assertThat(running.result().status()).isEqualTo(DispatchStatus.RUNNING);
            assertThat(running.node().startTime()).isNotNull();
            assertThat(running.node().endTime()).isNull();

            Instant end = Instant.parse("2022-02-28T23:21:17.853741Z");
            SublatticeResultDto sub = new SublatticeResultDto(UUID.randomUUID(), DispatchStatus.COMPLETED, "sub");
            UpdatedResult done = store.updateNode(id, 0, new NodeUpdate(
                    NodeStatus.COMPLETED, List.of("[[5.  3.4 1.5 0.2]]"), null, "loaded", "", null, end, sub));
            assertThat(done.node().endTime()).isEqualTo(end);
            assertThat(done.node().startTime()).isEqualTo(running.node().startTime());
            assertThat(done.result().status()).isEqualTo(DispatchStatus.RUNNING);
            assertThat(done.becameTerminal()).isFalse();

            ResultResponse stored = store.get(id);
            NodeDto node = stored.graph().nodes().get(0);
            assertThat(node.status()).isEqualTo(NodeStatus.COMPLETED);
            assertThat(node.output()).isEqualTo(List.of("[[5.  3.4 1.5 0.2]]"));
            assertThat(node.stdout()).isEqualTo("loaded");
            assertThat(node.sublatticeResult()).isEqualTo(sub);
        }

        @Test
        @DisplayName("reports the terminal transition when the last node completes")
        void becomesCompleted() {
            UUID id = UUID.randomUUID();
            store.create(id, "r", TWO_STEP);
            store.updateNode(id, 0, NodeUpdate.status(NodeStatus.COMPLETED));
            UpdatedResult last = store.updateNode(id, 1, NodeUpdate.status(NodeStatus.COMPLETED));

            assertThat(last.result().status()).isEqualTo(DispatchStatus.COMPLETED);
            assertThat(last.becameTerminal()).isTrue();
            assertThat(store.list()).filteredOn(s -> s.dispatchId().equals(id))
                    .singleElement()
                    .satisfies(s -> {
                        assertThat(s.completedCount()).isEqualTo(2);
                        assertThat(s.nodeCount()).isEqualTo(2);
                    });
        }

        @Test
        @DisplayName("rejects a status regression and leaves the node unchanged")
        void regressionRejected() {
            UUID id = UUID.randomUUID();
            store.create(id, "r", TWO_STEP);
            store.updateNode(id, 0, NodeUpdate.status(NodeStatus.COMPLETED));

            assertThatThrownBy(() -> store.updateNode(id, 0, new NodeUpdate(
                    NodeStatus.RUNNING, null, null, "late output", null, null, null, null)))
                    .isInstanceOf(InvalidTransitionException.class);

            NodeDto node = store.get(id).graph().nodes().get(0);
            assertThat(node.status()).isEqualTo(NodeStatus.COMPLETED);
            assertThat(node.stdout()).isNull();
        }

        @Test
        @DisplayName("unknown node throws NodeNotFoundException")
        void unknownNode() {
            UUID id = UUID.randomUUID();
            store.create(id, "r", TWO_STEP);
            assertThatThrownBy(() -> store.updateNode(id, 42, NodeUpdate.status(NodeStatus.RUNNING)))
                    .isInstanceOf(NodeNotFoundException.class);
        }

        @Test
        @DisplayName("unknown dispatch throws DispatchNotFoundException")
        void unknownDispatch() {
            assertThatThrownBy(() -> store.updateNode(UUID.randomUUID(), 0, NodeUpdate.status(NodeStatus.RUNNING)))
                    .isInstanceOf(DispatchNotFoundException.class);
        }
    }

    @Test
    @DisplayName("markFailed keeps the result FAILED even after node progress")
    void markFailedSticks() {
        UUID id = UUID.randomUUID();
        store.create(id, "r", TWO_STEP);
        ResultResponse failed = store.markFailed(id, "transport error: queue full");
        assertThat(failed.status()).isEqualTo(DispatchStatus.FAILED);
        assertThat(failed.error()).isEqualTo("transport error: queue full");

        UpdatedResult after = store.updateNode(id, 0, NodeUpdate.status(NodeStatus.COMPLETED));
        assertThat(after.result().status()).isEqualTo(DispatchStatus.FAILED);
        assertThat(after.becameTerminal()).isFalse();
    }
}
