package com.phillippitts.hdrcompute.pipeline;

import com.phillippitts.hdrcompute.domain.HdrImage;

import java.util.Map;

/**
 * Pixel transform executed by one pipeline stage.
 *
 * <p>Implementations must be stateless: the same operation instance is shared by every copy
 * of a pipeline and may run on several tiles at once.
 */
@FunctionalInterface
public interface StageOperation {

    HdrImage apply(HdrImage input, Map<String, Object> parameters);
}
