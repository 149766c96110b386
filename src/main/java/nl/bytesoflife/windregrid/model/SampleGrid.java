package nl.bytesoflife.windregrid.model;

import java.util.Arrays;

/**
 * Row-major grid of 8-bit scalar samples (0-255).
 */
public final class SampleGrid {

    public static final int MIN_VALUE = 0;
    public static final int MAX_VALUE = 255;

    private final int width;
    private final int height;
    private final int[] samples;

    public SampleGrid(int width, int height, int[] samples) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Grid dimensions must be positive, got " + width + "x" + height);
        }
        if (samples.length != width * height) {
            throw new IllegalArgumentException("Expected " + (width * height) + " samples, got " + samples.length);
        }
        for (int s : samples) {
            if (s < MIN_VALUE || s > MAX_VALUE) {
                throw new IllegalArgumentException("Sample out of 8-bit range: " + s);
            }
        }
        this.width = width;
        this.height = height;
        this.samples = samples.clone();
    }

    public static SampleGrid filled(int width, int height, int value) {
        int[] samples = new int[width * height];
        Arrays.fill(samples, value);
        return new SampleGrid(width, height, samples);
    }

    public int getWidth() { return width; }
    public int getHeight() { return height; }

    public int get(int row, int col) {
        return samples[row * width + col];
    }

    public int[] toArray() {
        return samples.clone();
    }

    public boolean hasSameShape(SampleGrid other) {
        return width == other.width && height == other.height;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SampleGrid other)) return false;
        return width == other.width && height == other.height && Arrays.equals(samples, other.samples);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(samples);
    }

    @Override
    public String toString() {
        return "SampleGrid[" + width + "x" + height + "]";
    }
}
