package com.streamfirst.mosaic.domain;

/**
 * Tunables accepted when submitting a mosaic job.
 *
 * @param cellSize edge length in pixels of one grid cell, 8 to 256
 * @param repeatWindowK number of most recently placed tiles excluded from selection, 0 to 500
 * @param colorStrength how far each tile is shifted toward its cell's average color, 0 to 1
 * @param overlayStrength blend weight of the original target over the mosaic, 0 to 1
 */
public record JobParameters(int cellSize, int repeatWindowK, double colorStrength, double overlayStrength) {

    public static final int MIN_CELL_SIZE = 8;
    public static final int MAX_CELL_SIZE = 256;
    public static final int MAX_REPEAT_WINDOW = 500;

    public static final JobParameters DEFAULTS = new JobParameters(32, 30, 0.35, 0.0);

    /**
     * Creates parameters after checking every bound.
     *
     * @throws ValidationException if any value lies outside its range
     */
    public JobParameters {
        if (cellSize < MIN_CELL_SIZE || cellSize > MAX_CELL_SIZE) {
            throw new ValidationException(
                    "cellSize must be between " + MIN_CELL_SIZE + " and " + MAX_CELL_SIZE + ": " + cellSize);
        }
        if (repeatWindowK < 0 || repeatWindowK > MAX_REPEAT_WINDOW) {
            throw new ValidationException(
                    "repeatWindowK must be between 0 and " + MAX_REPEAT_WINDOW + ": " + repeatWindowK);
        }
        checkUnit("colorStrength", colorStrength);
        checkUnit("overlayStrength", overlayStrength);
    }

    private static void checkUnit(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new ValidationException(name + " must be between 0.0 and 1.0: " + value);
        }
    }
}
