package com.phillippitts.hdrcompute.domain;

import java.util.Objects;

/**
 * Row-major grid of image tiles produced by {@link HdrImage#split(int, int)}.
 *
 * <p>Cells are replaced in place as tile results arrive; the grid itself does no locking,
 * the owner of the grid is responsible for publishing writes safely.
 */
public final class TileGrid {

    private final HdrImage[][] tiles;
    private final int rows;
    private final int cols;

    public TileGrid(int rows, int cols) {
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("Grid must have at least one row and column, got "
                    + rows + "x" + cols);
        }
        this.rows = rows;
        this.cols = cols;
        this.tiles = new HdrImage[rows][cols];
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    public int size() {
        return rows * cols;
    }

    public HdrImage get(int row, int col) {
        checkBounds(row, col);
        return tiles[row][col];
    }

    public void set(int row, int col, HdrImage tile) {
        checkBounds(row, col);
        tiles[row][col] = Objects.requireNonNull(tile, "tile");
    }

    /**
     * Returns {@code true} when every cell holds a tile.
     */
    public boolean isComplete() {
        for (HdrImage[] line : tiles) {
            for (HdrImage tile : line) {
                if (tile == null) {
                    return false;
                }
            }
        }
        return true;
    }

    private void checkBounds(int row, int col) {
        if (row < 0 || row >= rows || col < 0 || col >= cols) {
            throw new IndexOutOfBoundsException("Tile (" + row + "," + col + ") outside "
                    + rows + "x" + cols + " grid");
        }
    }
}
