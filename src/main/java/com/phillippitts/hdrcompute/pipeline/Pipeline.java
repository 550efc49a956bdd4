package com.phillippitts.hdrcompute.pipeline;

import com.phillippitts.hdrcompute.domain.HdrImage;
import com.phillippitts.hdrcompute.domain.TileGrid;
import com.phillippitts.hdrcompute.exception.UnknownStageException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered sequence of parameterized image-transform stages over one input image.
 *
 * <p>This is the contract the compute engines consume. The engines never look inside a stage
 * except to ask whether the last one is a geometry stage.
 *
 * <p><b>Ownership:</b> a pipeline is mutated by at most one thread at a time. Engines that need
 * to change the input image (tiling, export) work on {@link #copy()} so a pipeline shared with an
 * interactive editor is never disturbed.
 */
public interface Pipeline {

    /**
     * Replaces the parameters of one stage and marks it dirty.
     *
     * @throws UnknownStageException if no stage has this identifier
     */
    void setParameters(String stageId, Map<String, Object> parameters);

    /**
     * Returns the current parameters of a stage.
     *
     * @throws UnknownStageException if no stage has this identifier
     */
    Map<String, Object> getParameters(String stageId);

    boolean hasStage(String stageId);

    /**
     * Recomputes every stage from the first dirty one to the end.
     *
     * @throws IllegalStateException if no input image has been set
     */
    void compute();

    HdrImage getInputImage();

    /**
     * Replaces the input image; every stage becomes dirty.
     */
    void setInputImage(HdrImage image);

    /**
     * Returns the last computed output, optionally tone mapped.
     *
     * @throws IllegalStateException if the pipeline has no output yet
     */
    HdrImage getImage(boolean toneMapped);

    /**
     * Stores an output computed outside the pipeline (accelerated path).
     */
    void setOutput(HdrImage output);

    /**
     * Partitions the current input image, see {@link HdrImage#split(int, int)}.
     */
    TileGrid split(int nCols, int nRows);

    List<Stage> stages();

    Optional<Stage> lastStage();

    /**
     * Removes and returns the last stage.
     *
     * @throws IllegalStateException if the pipeline has no stages
     */
    Stage removeLastStage();

    /**
     * Returns an independent pipeline with the same stages, parameters, input and output.
     */
    Pipeline copy();
}
