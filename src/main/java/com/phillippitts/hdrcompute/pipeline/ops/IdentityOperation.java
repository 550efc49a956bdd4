package com.phillippitts.hdrcompute.pipeline.ops;

import com.phillippitts.hdrcompute.domain.HdrImage;
import com.phillippitts.hdrcompute.pipeline.StageOperation;

import java.util.Map;

/** Returns its input unchanged. */
public final class IdentityOperation implements StageOperation {

    public static final IdentityOperation INSTANCE = new IdentityOperation();

    private IdentityOperation() {
    }

    @Override
    public HdrImage apply(HdrImage input, Map<String, Object> parameters) {
        return input;
    }
}
