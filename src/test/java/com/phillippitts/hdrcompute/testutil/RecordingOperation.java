package com.phillippitts.hdrcompute.testutil;

import com.phillippitts.hdrcompute.domain.HdrImage;
import com.phillippitts.hdrcompute.pipeline.StageOperation;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Stage operation that records the parameters of every invocation before delegating.
 */
public class RecordingOperation implements StageOperation {

    private final StageOperation delegate;
    private final List<Map<String, Object>> invocations = new CopyOnWriteArrayList<>();

    public RecordingOperation(StageOperation delegate) {
        this.delegate = delegate;
    }

    @Override
    public HdrImage apply(HdrImage input, Map<String, Object> parameters) {
        invocations.add(parameters);
        return delegate.apply(input, parameters);
    }

    public List<Map<String, Object>> invocations() {
        return invocations;
    }

    /**
     * Values of {@code key} across invocations, in order.
     */
    public List<Object> values(String key) {
        return invocations.stream().map(p -> p.get(key)).toList();
    }
}
