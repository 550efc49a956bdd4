package com.phillippitts.hdrcompute.pipeline.ops;

import com.phillippitts.hdrcompute.domain.HdrImage;
import com.phillippitts.hdrcompute.pipeline.StageOperation;

import java.util.Map;

/**
 * Linear contrast around mid grey; {@code contrast} is a percentage, 0 leaves the image unchanged.
 */
public final class ContrastOperation implements StageOperation {

    public static final String CONTRAST = "contrast";

    private static final float MID_GREY = 0.18f;

    @Override
    public HdrImage apply(HdrImage input, Map<String, Object> parameters) {
        double contrast = ParameterReader.number(parameters, CONTRAST, 0.0);
        if (contrast == 0.0) {
            return input;
        }
        float factor = (float) (1.0 + contrast / 100.0);
        return input.mapPixels(rgb -> {
            for (int c = 0; c < rgb.length; c++) {
                rgb[c] = MID_GREY + (rgb[c] - MID_GREY) * factor;
            }
        });
    }
}
