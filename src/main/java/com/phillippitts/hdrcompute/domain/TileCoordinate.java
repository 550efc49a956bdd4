package com.phillippitts.hdrcompute.domain;

/**
 * Grid cell of one tile, zero-based.
 */
public record TileCoordinate(int row, int col) {

    public TileCoordinate {
        if (row < 0 || col < 0) {
            throw new IllegalArgumentException("tile coordinates must be >= 0: " + row + "," + col);
        }
    }

    @Override
    public String toString() {
        return row + "," + col;
    }
}
