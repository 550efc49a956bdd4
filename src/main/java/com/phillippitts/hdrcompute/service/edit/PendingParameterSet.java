package com.phillippitts.hdrcompute.service.edit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Latest requested parameters per stage, accumulated between dispatches.
 *
 * <p>Only the latest value per stage survives. Not thread-safe: owned and guarded by
 * {@link SchedulerState}.
 */
final class PendingParameterSet {

    private final Map<String, Map<String, Object>> values = new LinkedHashMap<>();

    void put(String stageId, Map<String, Object> parameters) {
        values.put(Objects.requireNonNull(stageId, "stageId"), parameters);
    }

    /**
     * Restores a value unless a newer one arrived in the meantime.
     */
    void putIfAbsent(String stageId, Map<String, Object> parameters) {
        values.putIfAbsent(stageId, parameters);
    }

    Map<String, Object> remove(String stageId) {
        return values.remove(stageId);
    }

    Map<String, Object> get(String stageId) {
        return values.get(stageId);
    }

    boolean isEmpty() {
        return values.isEmpty();
    }

    int size() {
        return values.size();
    }

    /**
     * Returns every pending value and empties the set.
     */
    Map<String, Map<String, Object>> drain() {
        Map<String, Map<String, Object>> batch = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        values.clear();
        return batch;
    }

    void clear() {
        values.clear();
    }

    @Override
    public String toString() {
        return "PendingParameterSet" + values.keySet();
    }
}
