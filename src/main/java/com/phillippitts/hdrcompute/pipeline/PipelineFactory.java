package com.phillippitts.hdrcompute.pipeline;

import com.phillippitts.hdrcompute.domain.HdrImage;
import com.phillippitts.hdrcompute.domain.StageKind;
import com.phillippitts.hdrcompute.pipeline.ops.ContrastOperation;
import com.phillippitts.hdrcompute.pipeline.ops.ExposureOperation;
import com.phillippitts.hdrcompute.pipeline.ops.RotateOperation;
import com.phillippitts.hdrcompute.pipeline.ops.SaturationOperation;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Builds the editing pipe every image starts with.
 *
 * <p>Stage order is fixed: exposure, contrast, saturation, then geometry last so that tiled
 * export can defer it.
 */
@Component
public class PipelineFactory {

    public static final String EXPOSURE = "exposure";
    public static final String CONTRAST = "contrast";
    public static final String SATURATION = "saturation";
    public static final String GEOMETRY = "geometry";

    /**
     * Creates the default pipe without an input image.
     */
    public ProcessPipe createDefault() {
        return new ProcessPipe()
                .append(EXPOSURE, StageKind.EXPOSURE, new ExposureOperation(),
                        Map.of(ExposureOperation.EV, 0.0))
                .append(CONTRAST, StageKind.CONTRAST, new ContrastOperation(),
                        Map.of(ContrastOperation.CONTRAST, 0.0))
                .append(SATURATION, StageKind.SATURATION, new SaturationOperation(),
                        Map.of(SaturationOperation.SATURATION, 0.0))
                .append(GEOMETRY, StageKind.GEOMETRY, new RotateOperation(),
                        Map.of(RotateOperation.ANGLE, 0));
    }

    /**
     * Creates the default pipe bound to {@code image}.
     */
    public ProcessPipe createFor(HdrImage image) {
        ProcessPipe pipe = createDefault();
        pipe.setInputImage(image);
        return pipe;
    }
}
