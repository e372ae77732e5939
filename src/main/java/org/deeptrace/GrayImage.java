package org.deeptrace;

/**
 * Imagem em tons de cinza com amostras float (0-255), base de todas as
 * primitivas de visão computacional do projeto.
 */
public final class GrayImage {

    private final int width;
    private final int height;
    private final float[] data;

    public GrayImage(int width, int height, float[] data) {
        if (width <= 0 || height <= 0 || data.length != width * height) {
            throw new IllegalArgumentException("Imagem inválida: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.data = data;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public float get(int x, int y) {
        return data[y * width + x];
    }

    /**
     * Acesso direto ao buffer (sem cópia); chamadores não devem modificá-lo.
     */
    float[] raw() {
        return data;
    }

    public GrayImage crop(Region region) {
        Region r = region.clip(width, height);
        if (r.isEmpty()) {
            throw new IllegalArgumentException("Região fora da imagem: " + region);
        }
        float[] out = new float[r.width() * r.height()];
        for (int y = 0; y < r.height(); y++) {
            System.arraycopy(data, (r.y() + y) * width + r.x(), out, y * r.width(), r.width());
        }
        return new GrayImage(r.width(), r.height(), out);
    }

    /**
     * Redimensionamento bilinear com amostragem centrada no pixel.
     */
    public GrayImage resize(int newWidth, int newHeight) {
        float[] out = new float[newWidth * newHeight];
        double sx = (double) width / newWidth;
        double sy = (double) height / newHeight;
        for (int y = 0; y < newHeight; y++) {
            double fy = Math.max(0, (y + 0.5) * sy - 0.5);
            int y0 = Math.min((int) fy, height - 1);
            int y1 = Math.min(y0 + 1, height - 1);
            double dy = fy - y0;
            for (int x = 0; x < newWidth; x++) {
                double fx = Math.max(0, (x + 0.5) * sx - 0.5);
                int x0 = Math.min((int) fx, width - 1);
                int x1 = Math.min(x0 + 1, width - 1);
                double dx = fx - x0;
                double top = data[y0 * width + x0] + (data[y0 * width + x1] - data[y0 * width + x0]) * dx;
                double bottom = data[y1 * width + x0] + (data[y1 * width + x1] - data[y1 * width + x0]) * dx;
                out[y * newWidth + x] = (float) (top + (bottom - top) * dy);
            }
        }
        return new GrayImage(newWidth, newHeight, out);
    }

    /**
     * Arredonda e limita as amostras a 0-255, como uma imagem de 8 bits.
     */
    public GrayImage quantize() {
        float[] out = new float[data.length];
        for (int i = 0; i < data.length; i++) {
            out[i] = Math.max(0, Math.min(255, Math.round(data[i])));
        }
        return new GrayImage(width, height, out);
    }

    public double mean() {
        double sum = 0;
        for (float v : data) {
            sum += v;
        }
        return sum / data.length;
    }

    /**
     * Diferença absoluta média entre duas imagens do mesmo tamanho.
     */
    public double meanAbsDifference(GrayImage other) {
        if (other.width != width || other.height != height) {
            throw new IllegalArgumentException("Imagens com tamanhos diferentes");
        }
        double sum = 0;
        for (int i = 0; i < data.length; i++) {
            sum += Math.abs(data[i] - other.data[i]);
        }
        return sum / data.length;
    }
}
