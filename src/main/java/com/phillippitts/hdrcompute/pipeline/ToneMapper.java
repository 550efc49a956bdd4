package com.phillippitts.hdrcompute.pipeline;

import com.phillippitts.hdrcompute.domain.HdrImage;

/**
 * Display-oriented transform from linear HDR values to a displayable range.
 */
@FunctionalInterface
public interface ToneMapper {

    HdrImage toneMap(HdrImage hdr);
}
