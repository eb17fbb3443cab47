package org.evalux.poker.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.evalux.poker.model.poker.HandHistory;
import org.evalux.poker.repo.HandHistoryRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.*;

/** Historique des mains : un document JSON (gagnants, board, pot, rake) par main terminée. */
@Slf4j
@Service
@RequiredArgsConstructor
public class HandHistoryService {
    private final HandHistoryRepository repo;
    private final ObjectMapper objectMapper;

    @Transactional
    public HandHistory record(Long tableId, int handNo, Map<String, Object> payload) {
        HandHistory h = new HandHistory();
        h.setTableId(tableId);
        h.setHandNo(handNo);
        h.setPayloadJson(write(payload));
        h.setCreatedAt(Instant.now());
        return repo.save(h);
    }

    /** 20 dernières mains, la plus récente d'abord. */
    public List<Map<String, Object>> recentForTable(Long tableId) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (HandHistory h : repo.findTop20ByTableIdOrderByHandNoDesc(tableId)) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("hand_no", h.getHandNo());
            m.put("created_at", h.getCreatedAt() == null ? null : h.getCreatedAt().toString());
            m.put("payload", read(h.getPayloadJson()));
            out.add(m);
        }
        return out;
    }

    private String write(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Historique non sérialisable", e);
        }
    }

    private Map<String, Object> read(String json) {
        if (json == null || json.isBlank()) return Map.of();
        try {
            return objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, Object>>() {});
        } catch (JsonProcessingException e) {
            log.warn("Historique illisible ignoré: {}", e.getOriginalMessage());
            return Map.of();
        }
    }
}
