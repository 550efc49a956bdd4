package com.phillippitts.hdrcompute.pipeline.ops;

import com.phillippitts.hdrcompute.domain.HdrImage;
import com.phillippitts.hdrcompute.pipeline.StageOperation;

import java.util.Map;

/**
 * Scales chroma around Rec.709 luminance; {@code saturation} is a percentage.
 */
public final class SaturationOperation implements StageOperation {

    public static final String SATURATION = "saturation";

    @Override
    public HdrImage apply(HdrImage input, Map<String, Object> parameters) {
        double saturation = ParameterReader.number(parameters, SATURATION, 0.0);
        if (saturation == 0.0) {
            return input;
        }
        float factor = (float) (1.0 + saturation / 100.0);
        return input.mapPixels(rgb -> {
            float luminance = 0.2126f * rgb[0] + 0.7152f * rgb[1] + 0.0722f * rgb[2];
            for (int c = 0; c < rgb.length; c++) {
                rgb[c] = luminance + (rgb[c] - luminance) * factor;
            }
        });
    }
}
