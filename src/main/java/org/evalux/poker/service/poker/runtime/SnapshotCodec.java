package org.evalux.poker.service.poker.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.evalux.poker.service.poker.error.RestorationException;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class SnapshotCodec {
    private final ObjectMapper objectMapper;

    public String write(PersistedHandState state) {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Sérialisation du snapshot impossible", e);
        }
    }

    /** @return null si la ligne ne porte pas encore d'état moteur ("{}" ou vide) */
    public PersistedHandState read(String json) {
        if (json == null || json.isBlank()) return null;
        try {
            PersistedHandState state = objectMapper.readValue(json, PersistedHandState.class);
            return state.getEngine() == null ? null : state;
        } catch (JsonProcessingException e) {
            throw new RestorationException("Snapshot illisible", e);
        }
    }

    public Map<String, Integer> readTimeouts(String json) {
        if (json == null || json.isBlank()) return new LinkedHashMap<>();
        try {
            return objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, Integer>>() {});
        } catch (JsonProcessingException e) {
            log.warn("timeout_tracking illisible, remis à zéro: {}", e.getOriginalMessage());
            return new LinkedHashMap<>();
        }
    }

    public String writeTimeouts(Map<String, Integer> tracking) {
        try {
            return objectMapper.writeValueAsString(tracking);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Sérialisation timeout_tracking impossible", e);
        }
    }
}
