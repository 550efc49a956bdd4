package com.phillippitts.hdrcompute.pipeline;

import com.phillippitts.hdrcompute.domain.HdrImage;
import com.phillippitts.hdrcompute.domain.StageKind;
import com.phillippitts.hdrcompute.domain.TileGrid;
import com.phillippitts.hdrcompute.exception.ComputeExceptionBuilder;
import com.phillippitts.hdrcompute.exception.UnknownStageException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Default {@link Pipeline}: stages run in insertion order and cache their outputs, so a
 * parameter change only recomputes from the changed stage onwards.
 *
 * <p>All methods synchronize on the instance. The lock is held during {@link #compute()};
 * it gives visibility between the worker that computes and the thread that reads the result,
 * it does not make concurrent editing of one pipe meaningful.
 */
public class ProcessPipe implements Pipeline {

    private final List<Stage> stages = new ArrayList<>();
    private final List<HdrImage> stageOutputs = new ArrayList<>();
    private final ToneMapper toneMapper;

    private HdrImage input;
    private HdrImage output;
    private int firstDirty;

    public ProcessPipe() {
        this(new ClipToneMapper());
    }

    public ProcessPipe(ToneMapper toneMapper) {
        this.toneMapper = Objects.requireNonNull(toneMapper, "toneMapper");
    }

    /**
     * Appends a stage to the end of the pipe.
     *
     * @return this pipe for chaining
     * @throws IllegalArgumentException if a stage with the same id already exists
     */
    public synchronized ProcessPipe append(String id, StageKind kind, StageOperation operation,
                                           Map<String, Object> parameters) {
        if (indexOf(id) >= 0) {
            throw new IllegalArgumentException("Duplicate stage id: " + id);
        }
        stages.add(new Stage(id, kind, operation, parameters));
        stageOutputs.add(null);
        return this;
    }

    @Override
    public synchronized void setParameters(String stageId, Map<String, Object> parameters) {
        int index = indexOf(stageId);
        if (index < 0) {
            throw new UnknownStageException(stageId);
        }
        stages.set(index, stages.get(index).withParameters(parameters));
        markDirty(index);
    }

    @Override
    public synchronized Map<String, Object> getParameters(String stageId) {
        int index = indexOf(stageId);
        if (index < 0) {
            throw new UnknownStageException(stageId);
        }
        return stages.get(index).parameters();
    }

    @Override
    public synchronized boolean hasStage(String stageId) {
        return indexOf(stageId) >= 0;
    }

    @Override
    public synchronized void compute() {
        if (input == null) {
            throw new IllegalStateException("Pipeline has no input image");
        }
        HdrImage current = firstDirty == 0 ? input : stageOutputs.get(firstDirty - 1);
        for (int i = firstDirty; i < stages.size(); i++) {
            if (Thread.currentThread().isInterrupted()) {
                firstDirty = i;
                throw ComputeExceptionBuilder.create("Pipeline computation interrupted")
                        .engine("pipeline")
                        .stage(stages.get(i).id())
                        .build();
            }
            current = stages.get(i).apply(current);
            stageOutputs.set(i, current);
            // advance only after the stage succeeded so a failure is retried on the next compute
            firstDirty = i + 1;
        }
        firstDirty = stages.size();
        output = current;
    }

    @Override
    public synchronized HdrImage getInputImage() {
        return input;
    }

    @Override
    public synchronized void setInputImage(HdrImage image) {
        this.input = Objects.requireNonNull(image, "image");
        this.output = null;
        markDirty(0);
    }

    @Override
    public synchronized HdrImage getImage(boolean toneMapped) {
        if (output == null) {
            throw new IllegalStateException("Pipeline has not been computed");
        }
        return toneMapped ? toneMapper.toneMap(output) : output;
    }

    @Override
    public synchronized void setOutput(HdrImage output) {
        this.output = Objects.requireNonNull(output, "output");
        // stage caches no longer describe the output
        markDirty(0);
    }

    @Override
    public synchronized TileGrid split(int nCols, int nRows) {
        if (input == null) {
            throw new IllegalStateException("Pipeline has no input image");
        }
        return input.split(nCols, nRows);
    }

    @Override
    public synchronized List<Stage> stages() {
        return List.copyOf(stages);
    }

    @Override
    public synchronized Optional<Stage> lastStage() {
        return stages.isEmpty() ? Optional.empty() : Optional.of(stages.get(stages.size() - 1));
    }

    @Override
    public synchronized Stage removeLastStage() {
        if (stages.isEmpty()) {
            throw new IllegalStateException("Pipeline has no stages");
        }
        int last = stages.size() - 1;
        Stage removed = stages.remove(last);
        stageOutputs.remove(last);
        if (firstDirty > last) {
            firstDirty = last;
            output = last == 0 ? input : stageOutputs.get(last - 1);
        } else {
            output = null;
        }
        return removed;
    }

    @Override
    public synchronized ProcessPipe copy() {
        ProcessPipe copy = new ProcessPipe(toneMapper);
        copy.stages.addAll(stages);
        copy.stageOutputs.addAll(stageOutputs);
        copy.input = input;
        copy.output = output;
        copy.firstDirty = firstDirty;
        return copy;
    }

    private void markDirty(int index) {
        firstDirty = Math.min(firstDirty, index);
        for (int i = index; i < stageOutputs.size(); i++) {
            stageOutputs.set(i, null);
        }
    }

    private int indexOf(String stageId) {
        for (int i = 0; i < stages.size(); i++) {
            if (stages.get(i).id().equals(stageId)) {
                return i;
            }
        }
        return -1;
    }
}
