package org.deeptrace;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * Frame RGB de 8 bits por canal, armazenado como pixels empacotados 0xRRGGBB.
 * Imutável: os construtores copiam o buffer recebido.
 */
public final class RgbFrame {

    private final int width;
    private final int height;
    private final int[] pixels;

    public RgbFrame(int width, int height, int[] pixels) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Dimensões inválidas: " + width + "x" + height);
        }
        if (pixels == null || pixels.length != width * height) {
            throw new IllegalArgumentException("Buffer de pixels incompatível com " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.pixels = pixels.clone();
    }

    /**
     * Frame preenchido com uma única cor.
     */
    public static RgbFrame filled(int width, int height, int r, int g, int b) {
        int[] data = new int[width * height];
        Arrays.fill(data, pack(r, g, b));
        return new RgbFrame(width, height, data);
    }

    /**
     * Converte bytes rgb24 (como emitidos pelo ffmpeg) para um frame.
     */
    public static RgbFrame fromRgb24(byte[] data, int width, int height) {
        if (data.length < width * height * 3) {
            throw new IllegalArgumentException("Buffer rgb24 incompleto: " + data.length + " bytes");
        }
        int[] packed = new int[width * height];
        for (int i = 0, p = 0; i < packed.length; i++, p += 3) {
            packed[i] = pack(data[p] & 0xFF, data[p + 1] & 0xFF, data[p + 2] & 0xFF);
        }
        return new RgbFrame(width, height, packed);
    }

    public static RgbFrame fromImage(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        int[] data = image.getRGB(0, 0, w, h, null, 0, w);
        for (int i = 0; i < data.length; i++) {
            data[i] &= 0xFFFFFF;
        }
        return new RgbFrame(w, h, data);
    }

    public BufferedImage toImage() {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        image.setRGB(0, 0, width, height, pixels, 0, width);
        return image;
    }

    public static int pack(int r, int g, int b) {
        return (clamp(r) << 16) | (clamp(g) << 8) | clamp(b);
    }

    private static int clamp(int v) {
        return v < 0 ? 0 : Math.min(255, v);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int rgb(int x, int y) {
        return pixels[y * width + x];
    }

    public int red(int x, int y) {
        return (pixels[y * width + x] >> 16) & 0xFF;
    }

    public int green(int x, int y) {
        return (pixels[y * width + x] >> 8) & 0xFF;
    }

    public int blue(int x, int y) {
        return pixels[y * width + x] & 0xFF;
    }

    /**
     * Retorna uma cópia do buffer empacotado.
     */
    public int[] pixels() {
        return pixels.clone();
    }

    /**
     * Luminância BT.601 arredondada para inteiros de 8 bits.
     */
    public GrayImage toGray() {
        float[] gray = new float[width * height];
        for (int i = 0; i < gray.length; i++) {
            int p = pixels[i];
            int r = (p >> 16) & 0xFF;
            int g = (p >> 8) & 0xFF;
            int b = p & 0xFF;
            gray[i] = Math.round(0.299f * r + 0.587f * g + 0.114f * b);
        }
        return new GrayImage(width, height, gray);
    }

    /**
     * Recorta a região indicada, limitada às bordas do frame.
     */
    public RgbFrame crop(Region region) {
        Region r = region.clip(width, height);
        if (r.isEmpty()) {
            throw new IllegalArgumentException("Região fora do frame: " + region);
        }
        int[] out = new int[r.width() * r.height()];
        for (int y = 0; y < r.height(); y++) {
            System.arraycopy(pixels, (r.y() + y) * width + r.x(), out, y * r.width(), r.width());
        }
        return new RgbFrame(r.width(), r.height(), out);
    }

    /**
     * Redimensionamento bilinear por canal.
     */
    public RgbFrame resize(int newWidth, int newHeight) {
        if (newWidth == width && newHeight == height) {
            return this;
        }
        int[] out = new int[newWidth * newHeight];
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
                int p00 = pixels[y0 * width + x0];
                int p01 = pixels[y0 * width + x1];
                int p10 = pixels[y1 * width + x0];
                int p11 = pixels[y1 * width + x1];
                int r = (int) Math.round(lerp2(p00 >> 16 & 0xFF, p01 >> 16 & 0xFF, p10 >> 16 & 0xFF, p11 >> 16 & 0xFF, dx, dy));
                int g = (int) Math.round(lerp2(p00 >> 8 & 0xFF, p01 >> 8 & 0xFF, p10 >> 8 & 0xFF, p11 >> 8 & 0xFF, dx, dy));
                int b = (int) Math.round(lerp2(p00 & 0xFF, p01 & 0xFF, p10 & 0xFF, p11 & 0xFF, dx, dy));
                out[y * newWidth + x] = pack(r, g, b);
            }
        }
        return new RgbFrame(newWidth, newHeight, out);
    }

    private static double lerp2(int a, int b, int c, int d, double dx, double dy) {
        double top = a + (b - a) * dx;
        double bottom = c + (d - c) * dx;
        return top + (bottom - top) * dy;
    }

    @Override
    public String toString() {
        return "RgbFrame[" + width + "x" + height + "]";
    }
}
