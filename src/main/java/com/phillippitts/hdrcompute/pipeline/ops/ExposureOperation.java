package com.phillippitts.hdrcompute.pipeline.ops;

import com.phillippitts.hdrcompute.domain.HdrImage;
import com.phillippitts.hdrcompute.pipeline.StageOperation;

import java.util.Map;

/**
 * Multiplies linear values by {@code 2^EV}.
 */
public final class ExposureOperation implements StageOperation {

    public static final String EV = "EV";

    @Override
    public HdrImage apply(HdrImage input, Map<String, Object> parameters) {
        double ev = ParameterReader.number(parameters, EV, 0.0);
        if (ev == 0.0) {
            return input;
        }
        float gain = (float) Math.pow(2.0, ev);
        return input.mapPixels(rgb -> {
            for (int c = 0; c < rgb.length; c++) {
                rgb[c] *= gain;
            }
        });
    }
}
