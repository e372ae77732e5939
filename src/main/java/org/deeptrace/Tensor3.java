package org.deeptrace;

import java.util.Arrays;

/**
 * Tensor denso canal × altura × largura em float, layout CHW.
 */
public final class Tensor3 {

    private final int channels;
    private final int height;
    private final int width;
    private final float[] data;

    public Tensor3(int channels, int height, int width, float[] data) {
        if (channels <= 0 || height <= 0 || width <= 0) {
            throw new IllegalArgumentException("Dimensões inválidas: " + channels + "x" + height + "x" + width);
        }
        if (data.length != channels * height * width) {
            throw new IllegalArgumentException("Buffer incompatível com " + channels + "x" + height + "x" + width);
        }
        this.channels = channels;
        this.height = height;
        this.width = width;
        this.data = data.clone();
    }

    public static Tensor3 zeros(int channels, int height, int width) {
        return new Tensor3(channels, height, width, new float[channels * height * width]);
    }

    public int channels() {
        return channels;
    }

    public int height() {
        return height;
    }

    public int width() {
        return width;
    }

    public float get(int c, int y, int x) {
        return data[(c * height + y) * width + x];
    }

    /**
     * Média espacial de cada canal (global average pooling).
     */
    public float[] spatialMean() {
        float[] out = new float[channels];
        int plane = height * width;
        for (int c = 0; c < channels; c++) {
            double sum = 0;
            for (int i = c * plane; i < (c + 1) * plane; i++) {
                sum += data[i];
            }
            out[c] = (float) (sum / plane);
        }
        return out;
    }

    public float[] toArray() {
        return data.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Tensor3 other)) return false;
        return channels == other.channels && height == other.height && width == other.width
                && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(new int[]{channels, height, width}) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "Tensor3[" + channels + "x" + height + "x" + width + "]";
    }
}
