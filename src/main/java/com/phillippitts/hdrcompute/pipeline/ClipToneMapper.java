package com.phillippitts.hdrcompute.pipeline;

import com.phillippitts.hdrcompute.domain.HdrImage;

/**
 * Scales linear values and clips them to [0, 1].
 */
public final class ClipToneMapper implements ToneMapper {

    private final float scaling;

    public ClipToneMapper() {
        this(1.0f);
    }

    public ClipToneMapper(float scaling) {
        if (scaling <= 0f) {
            throw new IllegalArgumentException("scaling must be positive, got " + scaling);
        }
        this.scaling = scaling;
    }

    @Override
    public HdrImage toneMap(HdrImage hdr) {
        return hdr.mapPixels(rgb -> {
            for (int c = 0; c < rgb.length; c++) {
                rgb[c] = Math.max(0f, Math.min(1f, rgb[c] * scaling));
            }
        });
    }
}
