package com.phillippitts.hdrcompute.exception;

/**
 * Thrown when image data or a tile grid has dimensions that cannot be processed
 * (empty raster, grid finer than the image, ragged tiles on merge).
 */
public class InvalidImageException extends HdrComputeException {

    private final String reason;

    public InvalidImageException(String reason) {
        super("Invalid image: " + reason);
        this.reason = reason;
    }

    public InvalidImageException(int width, int height, String reason) {
        super("Invalid image (" + width + "x" + height + "): " + reason);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
