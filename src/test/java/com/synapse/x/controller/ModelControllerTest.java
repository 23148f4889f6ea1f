package com.synapse.x.controller;

import com.synapse.x.dto.ModelVersion;
import com.synapse.x.dto.enums.ActivationError;
import com.synapse.x.dto.enums.ModelStatus;
import com.synapse.x.exceptions.ModelActivationException;
import com.synapse.x.service.ModelRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ModelController.class)
class ModelControllerTest {

    private static final ModelVersion ACTIVE = ModelVersion.builder()
            .versionId("v1.0.0")
            .embeddingDim(128)
            .status(ModelStatus.ACTIVE)
            .registeredAt(Instant.parse("2026-01-01T00:00:00Z"))
            .activatedAt(Instant.parse("2026-01-01T00:00:00Z"))
            .build();

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ModelRegistry modelRegistry;

    @Test
    void listsVersions() throws Exception {
        when(modelRegistry.list()).thenReturn(List.of(ACTIVE));

        mockMvc.perform(get("/api/v1/models"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].version_id").value("v1.0.0"))
                .andExpect(jsonPath("$[0].status").value("ACTIVE"))
                .andExpect(jsonPath("$[0].embedding_dim").value(128));
    }

    @Test
    void activeVersionOr404() throws Exception {
        when(modelRegistry.getActive()).thenReturn(Optional.of(ACTIVE));
        mockMvc.perform(get("/api/v1/models/active"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.version_id").value("v1.0.0"));

        when(modelRegistry.getActive()).thenReturn(Optional.empty());
        mockMvc.perform(get("/api/v1/models/active"))
                .andExpect(status().isNotFound());
    }

    @Test
    void registersStagedVersion() throws Exception {
        when(modelRegistry.register("v2.0.0", 256)).thenReturn(ModelVersion.builder()
                .versionId("v2.0.0").embeddingDim(256).status(ModelStatus.STAGED).build());

        mockMvc.perform(post("/api/v1/models")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"version_id\": \"v2.0.0\", \"embedding_dim\": 256}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("STAGED"));
    }

    @Test
    void rejectsInvalidRegistration() throws Exception {
        mockMvc.perform(post("/api/v1/models")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"version_id\": \"v2.0.0\", \"embedding_dim\": 0}"))
                .andExpect(status().isBadRequest());

        verify(modelRegistry, never()).register(anyString(), anyInt());
    }

    @Test
    void activationErrorsMapToConflictOrNotFound() throws Exception {
        when(modelRegistry.activate("v3")).thenThrow(
                new ModelActivationException(ActivationError.DIMENSION_MISMATCH, "feature_view v1 holds 4-dimensional vectors"));
        when(modelRegistry.activate("missing")).thenThrow(
                new ModelActivationException(ActivationError.NOT_FOUND, "unknown model version: missing"));

        mockMvc.perform(post("/api/v1/models/v3/activate"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error_msg").value("feature_view v1 holds 4-dimensional vectors"))
                .andExpect(jsonPath("$.error_code").value("DIMENSION_MISMATCH"));
        mockMvc.perform(post("/api/v1/models/missing/activate"))
                .andExpect(status().isNotFound());
    }
}
