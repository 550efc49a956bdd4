package com.phillippitts.hdrcompute.pipeline.ops;

import com.phillippitts.hdrcompute.domain.HdrImage;
import com.phillippitts.hdrcompute.pipeline.StageOperation;

import java.util.Map;

/**
 * Clockwise rotation by a multiple of 90 degrees ({@code angle}).
 */
public final class RotateOperation implements StageOperation {

    public static final String ANGLE = "angle";

    @Override
    public HdrImage apply(HdrImage input, Map<String, Object> parameters) {
        int angle = ParameterReader.integer(parameters, ANGLE, 0);
        if (angle % 90 != 0) {
            throw new IllegalArgumentException("Rotation must be a multiple of 90 degrees, got " + angle);
        }
        int quarterTurns = Math.floorMod(angle / 90, 4);
        if (quarterTurns == 0) {
            return input;
        }
        int w = input.width();
        int h = input.height();
        boolean swap = quarterTurns % 2 == 1;
        int outWidth = swap ? h : w;
        int outHeight = swap ? w : h;
        return HdrImage.generate(input.name(), outWidth, outHeight, (x, y, c) -> switch (quarterTurns) {
            case 1 -> input.get(y, h - 1 - x, c);
            case 2 -> input.get(w - 1 - x, h - 1 - y, c);
            default -> input.get(w - 1 - y, x, c);
        });
    }
}
