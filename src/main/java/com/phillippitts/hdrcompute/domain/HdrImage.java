package com.phillippitts.hdrcompute.domain;

import com.phillippitts.hdrcompute.exception.InvalidImageException;

import java.util.Arrays;
import java.util.Objects;

/**
 * Linear floating-point RGB raster.
 *
 * <p>Pixels are stored row-major, three interleaved channels per pixel. Instances are
 * immutable: every transform returns a new image, so an image can be handed to several
 * worker threads without copying.
 *
 * <p>Equality compares dimensions and pixel values only; the name is informational.
 */
public final class HdrImage {

    public static final int CHANNELS = 3;

    private final String name;
    private final int width;
    private final int height;
    private final float[] data;

    private HdrImage(String name, int width, int height, float[] data) {
        this.name = name == null ? "" : name;
        this.width = width;
        this.height = height;
        this.data = data;
    }

    /**
     * Creates an image from interleaved RGB values. The array is copied.
     *
     * @throws InvalidImageException if the dimensions are not positive or do not match the array
     */
    public static HdrImage of(String name, int width, int height, float[] rgb) {
        Objects.requireNonNull(rgb, "rgb");
        if (width <= 0 || height <= 0) {
            throw new InvalidImageException(width, height, "dimensions must be positive");
        }
        if (rgb.length != width * height * CHANNELS) {
            throw new InvalidImageException(width, height,
                    "expected " + (width * height * CHANNELS) + " samples, got " + rgb.length);
        }
        return new HdrImage(name, width, height, rgb.clone());
    }

    /**
     * Creates an image whose every channel value is computed by {@code generator}.
     */
    public static HdrImage generate(String name, int width, int height, PixelGenerator generator) {
        if (width <= 0 || height <= 0) {
            throw new InvalidImageException(width, height, "dimensions must be positive");
        }
        float[] rgb = new float[width * height * CHANNELS];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                for (int c = 0; c < CHANNELS; c++) {
                    rgb[(y * width + x) * CHANNELS + c] = generator.value(x, y, c);
                }
            }
        }
        return new HdrImage(name, width, height, rgb);
    }

    public String name() {
        return name;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public float get(int x, int y, int channel) {
        return data[(y * width + x) * CHANNELS + channel];
    }

    /**
     * Returns a copy of the interleaved RGB samples.
     */
    public float[] toArray() {
        return data.clone();
    }

    public HdrImage copy() {
        return new HdrImage(name, width, height, data.clone());
    }

    public HdrImage withName(String newName) {
        return new HdrImage(newName, width, height, data);
    }

    /**
     * Applies {@code operator} to every pixel of a copy of this image.
     */
    public HdrImage mapPixels(PixelOperator operator) {
        float[] out = data.clone();
        float[] rgb = new float[CHANNELS];
        for (int i = 0; i < out.length; i += CHANNELS) {
            System.arraycopy(out, i, rgb, 0, CHANNELS);
            operator.apply(rgb);
            System.arraycopy(rgb, 0, out, i, CHANNELS);
        }
        return new HdrImage(name, width, height, out);
    }

    /**
     * Copies the rectangle starting at {@code (x, y)}.
     *
     * @throws InvalidImageException if the rectangle is empty or leaves the image
     */
    public HdrImage region(int x, int y, int regionWidth, int regionHeight) {
        if (regionWidth <= 0 || regionHeight <= 0 || x < 0 || y < 0
                || x + regionWidth > width || y + regionHeight > height) {
            throw new InvalidImageException(width, height, "region " + regionWidth + "x" + regionHeight
                    + " at (" + x + "," + y + ") is out of bounds");
        }
        float[] out = new float[regionWidth * regionHeight * CHANNELS];
        int rowLength = regionWidth * CHANNELS;
        for (int row = 0; row < regionHeight; row++) {
            System.arraycopy(data, ((y + row) * width + x) * CHANNELS, out, row * rowLength, rowLength);
        }
        return new HdrImage(name, regionWidth, regionHeight, out);
    }

    /**
     * Partitions the image into {@code nCols x nRows} tiles.
     *
     * <p>Column {@code i} starts at {@code i * (width / nCols)}; the last column ends at
     * {@code width} and absorbs the remainder. Rows follow the same rule, so
     * {@link #merge(TileGrid)} restores the exact original dimensions.
     *
     * @throws InvalidImageException if the grid is finer than the image
     */
    public TileGrid split(int nCols, int nRows) {
        if (nCols <= 0 || nRows <= 0 || nCols > width || nRows > height) {
            throw new InvalidImageException(width, height,
                    "cannot split into " + nCols + "x" + nRows + " tiles");
        }
        int[] xLimits = limits(width, nCols);
        int[] yLimits = limits(height, nRows);

        TileGrid grid = new TileGrid(nRows, nCols);
        for (int row = 0; row < nRows; row++) {
            for (int col = 0; col < nCols; col++) {
                grid.set(row, col, region(xLimits[col], yLimits[row],
                        xLimits[col + 1] - xLimits[col], yLimits[row + 1] - yLimits[row]));
            }
        }
        return grid;
    }

    /**
     * Concatenates a complete grid back into one image.
     *
     * <p>Row heights are taken from the first column and column widths from the first row;
     * every other tile must agree with them.
     *
     * @throws InvalidImageException if a cell is empty or the grid is ragged
     */
    public static HdrImage merge(TileGrid grid) {
        Objects.requireNonNull(grid, "grid");
        if (!grid.isComplete()) {
            throw new InvalidImageException("cannot merge an incomplete tile grid");
        }
        int totalWidth = 0;
        for (int col = 0; col < grid.cols(); col++) {
            totalWidth += grid.get(0, col).width();
        }
        int totalHeight = 0;
        for (int row = 0; row < grid.rows(); row++) {
            totalHeight += grid.get(row, 0).height();
        }

        float[] out = new float[totalWidth * totalHeight * CHANNELS];
        int y = 0;
        for (int row = 0; row < grid.rows(); row++) {
            int rowHeight = grid.get(row, 0).height();
            int x = 0;
            for (int col = 0; col < grid.cols(); col++) {
                HdrImage tile = grid.get(row, col);
                if (tile.height() != rowHeight || tile.width() != grid.get(0, col).width()) {
                    throw new InvalidImageException(tile.width(), tile.height(),
                            "tile (" + row + "," + col + ") does not fit the grid");
                }
                int rowLength = tile.width() * CHANNELS;
                for (int line = 0; line < tile.height(); line++) {
                    System.arraycopy(tile.data, line * rowLength,
                            out, ((y + line) * totalWidth + x) * CHANNELS, rowLength);
                }
                x += tile.width();
            }
            y += rowHeight;
        }
        return new HdrImage(grid.get(0, 0).name, totalWidth, totalHeight, out);
    }

    private static int[] limits(int extent, int segments) {
        int[] limits = new int[segments + 1];
        int step = extent / segments;
        for (int i = 0; i < segments; i++) {
            limits[i] = i * step;
        }
        limits[segments] = extent;
        return limits;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HdrImage other)) {
            return false;
        }
        return width == other.width && height == other.height && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "HdrImage[" + name + ", " + width + "x" + height + "]";
    }

    /**
     * Computes one channel value of a generated image.
     */
    @FunctionalInterface
    public interface PixelGenerator {
        float value(int x, int y, int channel);
    }

    /**
     * Transforms one RGB pixel in place.
     */
    @FunctionalInterface
    public interface PixelOperator {
        void apply(float[] rgb);
    }
}
