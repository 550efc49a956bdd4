package com.phillippitts.hdrcompute.pipeline;

import com.phillippitts.hdrcompute.domain.HdrImage;
import com.phillippitts.hdrcompute.domain.StageKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Tagged descriptor of one pipeline stage.
 *
 * @param id         stage identifier addressed by {@code setParameters}
 * @param kind       stage kind; {@link StageKind#GEOMETRY} stages may be deferred by tiling
 * @param operation  pixel transform
 * @param parameters current parameters (unmodifiable copy)
 */
public record Stage(String id, StageKind kind, StageOperation operation, Map<String, Object> parameters) {

    public Stage {
        Objects.requireNonNull(id, "Stage id must not be null");
        Objects.requireNonNull(kind, "Stage kind must not be null");
        Objects.requireNonNull(operation, "Stage operation must not be null");
        parameters = parameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public Stage withParameters(Map<String, Object> newParameters) {
        return new Stage(id, kind, operation, newParameters);
    }

    public boolean isGeometry() {
        return kind.isGeometry();
    }

    public HdrImage apply(HdrImage input) {
        return operation.apply(input, parameters);
    }
}
