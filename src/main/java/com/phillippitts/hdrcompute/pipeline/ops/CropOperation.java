package com.phillippitts.hdrcompute.pipeline.ops;

import com.phillippitts.hdrcompute.domain.HdrImage;
import com.phillippitts.hdrcompute.pipeline.StageOperation;

import java.util.Map;

/**
 * Keeps the rectangle {@code x, y, width, height}; without a width and height the image passes through.
 */
public final class CropOperation implements StageOperation {

    public static final String X = "x";
    public static final String Y = "y";
    public static final String WIDTH = "width";
    public static final String HEIGHT = "height";

    @Override
    public HdrImage apply(HdrImage input, Map<String, Object> parameters) {
        if (!parameters.containsKey(WIDTH) || !parameters.containsKey(HEIGHT)) {
            return input;
        }
        int x = ParameterReader.integer(parameters, X, 0);
        int y = ParameterReader.integer(parameters, Y, 0);
        int width = Math.min(ParameterReader.integer(parameters, WIDTH, input.width()), input.width() - x);
        int height = Math.min(ParameterReader.integer(parameters, HEIGHT, input.height()), input.height() - y);
        return input.region(x, y, width, height);
    }
}
