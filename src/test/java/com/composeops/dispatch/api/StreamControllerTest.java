package com.composeops.dispatch.api;

import com.composeops.core.connection.ConnectionNotFoundException;
import com.composeops.core.events.GroupBroadcaster;
import com.composeops.core.operations.OperationNotFoundException;
import com.composeops.core.operations.OperationRegistry;
import com.composeops.core.streaming.LogSource;
import com.composeops.core.streaming.OperationLogSource;
import com.composeops.core.streaming.StreamCoordinator;
import com.composeops.core.streaming.StreamingProperties;
import com.composeops.docker.DockerLogSources;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Duration;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(StreamController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class StreamControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SseConnectionService sseConnectionService;

    @MockitoBean
    private StreamCoordinator streamCoordinator;

    @MockitoBean
    private GroupBroadcaster broadcaster;

    @MockitoBean
    private OperationRegistry operationRegistry;

    @MockitoBean
    private DockerLogSources logSources;

    @MockitoBean
    private StreamingProperties streamingProperties;

    private final LogSource source = (chunks, token) -> {};

    @BeforeEach
    void setUp() {
        when(streamingProperties.getOperationLogPollInterval()).thenReturn(Duration.ofMillis(250));
    }

    @Test
    @DisplayName("GET /events/stream opens an SSE connection")
    void openConnection() throws Exception {
        when(sseConnectionService.openConnection()).thenReturn(new SseEmitter());

        mockMvc.perform(get("/api/v1/events/stream").accept(MediaType.TEXT_EVENT_STREAM))
                .andExpect(request().asyncStarted());
    }

    @Test
    @DisplayName("POST compose stream returns 202 with the session id")
    void composeStream() throws Exception {
        when(logSources.compose("/srv/app", "web", 20, true)).thenReturn(source);
        when(streamCoordinator.startStream("c1", source)).thenReturn("s1");

        mockMvc.perform(post("/api/v1/connections/c1/streams/compose")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"project_path\":\"/srv/app\",\"service\":\"web\",\"tail\":20,\"follow\":true}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.connection_id").value("c1"))
                .andExpect(jsonPath("$.session_id").value("s1"));
    }

    @Test
    @DisplayName("negative tail returns 400")
    void negativeTail() throws Exception {
        mockMvc.perform(post("/api/v1/connections/c1/streams/compose")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"project_path\":\"/srv/app\",\"tail\":-1}"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(streamCoordinator);
    }

    @Test
    @DisplayName("POST container stream uses tail and follow parameters")
    void containerStream() throws Exception {
        when(logSources.container("abc123", 50, true)).thenReturn(source);
        when(streamCoordinator.startStream("c1", source)).thenReturn("s2");

        mockMvc.perform(post("/api/v1/connections/c1/streams/containers/abc123")
                        .param("tail", "50")
                        .param("follow", "true"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.session_id").value("s2"));
    }

    @Test
    @DisplayName("stream on unknown connection returns 404")
    void unknownConnection() throws Exception {
        when(logSources.container(anyString(), any(), anyBoolean())).thenReturn(source);
        when(streamCoordinator.startStream(eq("ghost"), any())).thenThrow(new ConnectionNotFoundException("ghost"));

        mockMvc.perform(post("/api/v1/connections/ghost/streams/containers/abc123"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Connection not found: ghost"));
    }

    @Test
    @DisplayName("operation stream checks the operation exists")
    void operationStream() throws Exception {
        when(streamCoordinator.startStream(eq("c1"), any(OperationLogSource.class))).thenReturn("s3");

        mockMvc.perform(post("/api/v1/connections/c1/streams/operations/op-1"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.session_id").value("s3"));
        verify(operationRegistry).get("op-1");
    }

    @Test
    @DisplayName("operation stream for unknown operation returns 404")
    void operationStreamUnknown() throws Exception {
        when(operationRegistry.get("nope")).thenThrow(new OperationNotFoundException("nope"));

        mockMvc.perform(post("/api/v1/connections/c1/streams/operations/nope"))
                .andExpect(status().isNotFound());
        verifyNoInteractions(streamCoordinator);
    }

    @Test
    @DisplayName("DELETE streams reports whether a stream was stopped")
    void stopStream() throws Exception {
        when(streamCoordinator.stopStream("c1")).thenReturn(true);

        mockMvc.perform(delete("/api/v1/connections/c1/streams"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stopped").value(true));
    }

    @Test
    @DisplayName("PUT subscription subscribes the connection")
    void subscribe() throws Exception {
        mockMvc.perform(put("/api/v1/connections/c1/subscriptions/op-1"))
                .andExpect(status().isNoContent());
        verify(broadcaster).subscribe("c1", "op-1");
    }

    @Test
    @DisplayName("PUT subscription for unknown connection returns 404")
    void subscribeUnknownConnection() throws Exception {
        doThrow(new ConnectionNotFoundException("ghost")).when(broadcaster).subscribe("ghost", "op-1");

        mockMvc.perform(put("/api/v1/connections/ghost/subscriptions/op-1"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("DELETE subscription unsubscribes the connection")
    void unsubscribe() throws Exception {
        mockMvc.perform(delete("/api/v1/connections/c1/subscriptions/op-1"))
                .andExpect(status().isNoContent());
        verify(broadcaster).unsubscribe("c1", "op-1");
    }
}
