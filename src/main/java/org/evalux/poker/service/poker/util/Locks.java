package org.evalux.poker.service.poker.util;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Un moniteur par table : les tables différentes avancent en parallèle. */
@Component
public class Locks {
    private final Map<Long, Object> monitors = new ConcurrentHashMap<>();

    public Object of(Long tableId) {
        return monitors.computeIfAbsent(tableId, k -> new Object());
    }
}
