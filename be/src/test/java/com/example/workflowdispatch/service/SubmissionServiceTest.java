package com.example.workflowdispatch.service;

import com.example.workflowdispatch.api.v1.dto.DispatchAcceptedResponse;
import com.example.workflowdispatch.api.v1.dto.DispatchRequest;
import com.example.workflowdispatch.api.v1.dto.EdgeDto;
import com.example.workflowdispatch.api.v1.dto.NodeDto;
import com.example.workflowdispatch.api.v1.dto.ResultGraphDto;
import com.example.workflowdispatch.api.v1.dto.ResultResponse;
import com.example.workflowdispatch.domain.DispatchStatus;
import com.example.workflowdispatch.domain.ParamType;
import com.example.workflowdispatch.queue.DispatchMessage;
import com.example.workflowdispatch.queue.DispatchQueue;
import com.example.workflowdispatch.queue.PublishException;
import com.example.workflowdispatch.store.DispatchAlreadyExistsException;
import com.example.workflowdispatch.store.ResultStore;
import com.example.workflowdispatch.validation.WorkflowGraphValidationException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import tools.jackson.databind.json.JsonMapper;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SubmissionService")
class SubmissionServiceTest {

    private static final Instant NOW = Instant.parse("2022-02-28T23:21:17Z");
    private static final DispatchRequest LOAD_DATA = new DispatchRequest(
            List.of(new NodeDto(0, "load_data", null, null, null, null, null, null, null, null, null, null)),
            List.of(),
            null
    );

    @Mock
    private ResultStore store;

    @Mock
    private DispatchQueue queue;

    private final Deque<UUID> ids = new ArrayDeque<>();
    private SubmissionService service;

    @BeforeEach
    void setUp() {
        service = new SubmissionService(
                store,
                queue,
                JsonMapper.builder().build(),
                ids::pop,
                Clock.fixed(NOW, ZoneOffset.UTC),
                "dispatch",
                Duration.ofMillis(200),
                "results"
        );
    }

    @Nested
    @DisplayName("accepted submission")
    class Accepted {

        @Test
        @DisplayName("persists, publishes and returns the generated id")
        void persistsAndPublishes() {
            UUID id = UUID.randomUUID();
            ids.add(id);
            when(store.create(eq(id), anyString(), any())).thenReturn(created(id, "results/" + id));
            when(queue.publish(eq("dispatch"), any())).thenReturn(CompletableFuture.completedFuture(null));

            DispatchAcceptedResponse response = service.submit(LOAD_DATA);

            assertThat(response.dispatchId()).isEqualTo(id);
            assertThat(response.status()).isEqualTo("accepted");
            verify(store).create(eq(id), eq(Path.of("results").resolve(id.toString()).toString()), any());

            ArgumentCaptor<DispatchMessage> message = ArgumentCaptor.forClass(DispatchMessage.class);
            verify(queue).publish(eq("dispatch"), message.capture());
            assertThat(message.getValue().dispatchId()).isEqualTo(id);
            assertThat(message.getValue().publishedAt()).isEqualTo(NOW);
            assertThat(message.getValue().payload()).contains("load_data");
            verify(store, never()).markFailed(any(), anyString());
        }

        @Test
        @DisplayName("uses the requested results dir when given")
        void requestedResultsDir() {
            UUID id = UUID.randomUUID();
            ids.add(id);
            when(store.create(eq(id), eq("/data/run-1"), any())).thenReturn(created(id, "/data/run-1"));
            when(queue.publish(eq("dispatch"), any())).thenReturn(CompletableFuture.completedFuture(null));

            service.submit(new DispatchRequest(LOAD_DATA.nodes(), null, " /data/run-1 "));

            verify(store).create(eq(id), eq("/data/run-1"), any());
        }

        @Test
        @DisplayName("regenerates the id once when the first one is taken")
        void retriesIdCollision() {
            UUID taken = UUID.randomUUID();
            UUID fresh = UUID.randomUUID();
            ids.add(taken);
            ids.add(fresh);
            when(store.exists(taken)).thenReturn(true);
            when(store.create(eq(fresh), anyString(), any())).thenReturn(created(fresh, "r"));
            when(queue.publish(eq("dispatch"), any())).thenReturn(CompletableFuture.completedFuture(null));

            assertThat(service.submit(LOAD_DATA).dispatchId()).isEqualTo(fresh);
            verify(store, never()).create(eq(taken), anyString(), any());
        }
    }

    @Nested
    @DisplayName("rejected submission")
    class Rejected {

        @Test
        @DisplayName("cyclic graph fails validation before anything is stored")
        void cycleRejected() {
            DispatchRequest cyclic = new DispatchRequest(
                    List.of(
                            new NodeDto(0, "a", null, null, null, null, null, null, null, null, null, null),
                            new NodeDto(1, "b", null, null, null, null, null, null, null, null, null, null)
                    ),
                    List.of(new EdgeDto(0, 1, "x", ParamType.ARG), new EdgeDto(1, 0, "y", ParamType.ARG)),
                    null
            );

            assertThatThrownBy(() -> service.submit(cyclic)).isInstanceOf(WorkflowGraphValidationException.class);
            verifyNoInteractions(store, queue);
        }

        @Test
        @DisplayName("null payload fails validation")
        void nullRejected() {
            assertThatThrownBy(() -> service.submit(null)).isInstanceOf(WorkflowGraphValidationException.class);
            verifyNoInteractions(store, queue);
        }

        @Test
        @DisplayName("gives up after two colliding ids")
        void repeatedCollision() {
            UUID first = UUID.randomUUID();
            UUID second = UUID.randomUUID();
            ids.add(first);
            ids.add(second);
            when(store.exists(first)).thenReturn(false);
            when(store.create(eq(first), anyString(), any())).thenThrow(new DispatchAlreadyExistsException(first));
            when(store.exists(second)).thenReturn(true);

            assertThatThrownBy(() -> service.submit(LOAD_DATA)).isInstanceOf(DispatchAlreadyExistsException.class);
            verify(store, times(1)).create(any(), anyString(), any());
            verifyNoInteractions(queue);
        }

        @Test
        @DisplayName("publish failure marks the result FAILED and surfaces PublishException")
        void publishFailure() {
            UUID id = UUID.randomUUID();
            ids.add(id);
            when(store.create(eq(id), anyString(), any())).thenReturn(created(id, "r"));
            when(queue.publish(eq("dispatch"), any()))
                    .thenReturn(CompletableFuture.failedFuture(new PublishException(id, "broker unreachable")));

            assertThatThrownBy(() -> service.submit(LOAD_DATA))
                    .isInstanceOf(PublishException.class)
                    .hasMessageContaining("broker unreachable");
            verify(store).markFailed(eq(id), startsWith("transport error:"));
        }

        @Test
        @DisplayName("publish timeout is treated as a publish failure")
        void publishTimeout() {
            UUID id = UUID.randomUUID();
            ids.add(id);
            when(store.create(eq(id), anyString(), any())).thenReturn(created(id, "r"));
            when(queue.publish(eq("dispatch"), any())).thenReturn(new CompletableFuture<>());

            assertThatThrownBy(() -> service.submit(LOAD_DATA))
                    .isInstanceOf(PublishException.class)
                    .hasMessageContaining("Timed out");
            verify(store).markFailed(eq(id), startsWith("transport error: Timed out"));
        }
    }

    private static ResultResponse created(UUID id, String resultsDir) {
        return new ResultResponse(id, resultsDir, DispatchStatus.PENDING, null,
                new ResultGraphDto(LOAD_DATA.nodes(), List.of()), NOW, NOW);
    }
}
