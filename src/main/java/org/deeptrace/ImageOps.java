package org.deeptrace;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * Operações clássicas de processamento de imagem implementadas sobre {@link GrayImage}:
 * blur gaussiano, limiarização de Otsu, componentes conexos e histogramas.
 */
public final class ImageOps {

    private ImageOps() {
    }

    /**
     * Kernel gaussiano 1D normalizado.
     */
    public static double[] gaussianKernel(int size, double sigma) {
        double[] kernel = new double[size];
        int half = size / 2;
        double sum = 0;
        for (int i = 0; i < size; i++) {
            int d = i - half;
            kernel[i] = Math.exp(-(d * d) / (2 * sigma * sigma));
            sum += kernel[i];
        }
        for (int i = 0; i < size; i++) {
            kernel[i] /= sum;
        }
        return kernel;
    }

    /**
     * Blur gaussiano separável em precisão dupla com borda refletida (reflect-101).
     */
    public static double[] gaussianBlur(double[] src, int width, int height, int size, double sigma) {
        double[] kernel = gaussianKernel(size, sigma);
        int half = size / 2;
        double[] tmp = new double[src.length];
        double[] out = new double[src.length];

        for (int y = 0; y < height; y++) {
            int row = y * width;
            for (int x = 0; x < width; x++) {
                double acc = 0;
                for (int k = 0; k < size; k++) {
                    acc += kernel[k] * src[row + reflect101(x + k - half, width)];
                }
                tmp[row + x] = acc;
            }
        }
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double acc = 0;
                for (int k = 0; k < size; k++) {
                    acc += kernel[k] * tmp[reflect101(y + k - half, height) * width + x];
                }
                out[y * width + x] = acc;
            }
        }
        return out;
    }

    static int reflect101(int i, int n) {
        if (n == 1) {
            return 0;
        }
        while (i < 0 || i >= n) {
            if (i < 0) {
                i = -i;
            } else {
                i = 2 * n - 2 - i;
            }
        }
        return i;
    }

    /**
     * Limiar de Otsu sobre amostras de 8 bits.
     * Retorna o maior limiar que maximiza a variância entre classes.
     */
    public static int otsuThreshold(GrayImage image) {
        int[] hist = new int[256];
        float[] data = image.raw();
        for (float v : data) {
            hist[clampByte(v)]++;
        }
        int total = data.length;
        double sumAll = 0;
        for (int i = 0; i < 256; i++) {
            sumAll += (double) i * hist[i];
        }

        double sumBackground = 0;
        int weightBackground = 0;
        double bestVariance = -1;
        int threshold = 0;
        for (int t = 0; t < 256; t++) {
            weightBackground += hist[t];
            if (weightBackground == 0) {
                continue;
            }
            int weightForeground = total - weightBackground;
            if (weightForeground == 0) {
                break;
            }
            sumBackground += (double) t * hist[t];
            double meanBackground = sumBackground / weightBackground;
            double meanForeground = (sumAll - sumBackground) / weightForeground;
            double diff = meanBackground - meanForeground;
            double variance = (double) weightBackground * weightForeground * diff * diff;
            if (variance > bestVariance) {
                bestVariance = variance;
                threshold = t;
            }
        }
        return threshold;
    }

    /**
     * Máscara binária: pixels acima do limiar de Otsu.
     */
    public static boolean[] otsuMask(GrayImage image) {
        int threshold = otsuThreshold(image);
        float[] data = image.raw();
        boolean[] mask = new boolean[data.length];
        for (int i = 0; i < data.length; i++) {
            mask[i] = clampByte(data[i]) > threshold;
        }
        return mask;
    }

    /**
     * Componentes 8-conexos de uma máscara, com área e caixa envolvente.
     */
    public static List<Component> connectedComponents(boolean[] mask, int width, int height) {
        int[] labels = new int[mask.length];
        List<Component> components = new ArrayList<>();
        ArrayDeque<Integer> queue = new ArrayDeque<>();
        int next = 0;

        for (int start = 0; start < mask.length; start++) {
            if (!mask[start] || labels[start] != 0) {
                continue;
            }
            next++;
            labels[start] = next;
            queue.add(start);
            int area = 0;
            int minX = width, minY = height, maxX = -1, maxY = -1;

            while (!queue.isEmpty()) {
                int idx = queue.poll();
                int x = idx % width;
                int y = idx / width;
                area++;
                minX = Math.min(minX, x);
                maxX = Math.max(maxX, x);
                minY = Math.min(minY, y);
                maxY = Math.max(maxY, y);

                for (int dy = -1; dy <= 1; dy++) {
                    int ny = y + dy;
                    if (ny < 0 || ny >= height) {
                        continue;
                    }
                    for (int dx = -1; dx <= 1; dx++) {
                        int nx = x + dx;
                        if (nx < 0 || nx >= width || (dx == 0 && dy == 0)) {
                            continue;
                        }
                        int n = ny * width + nx;
                        if (mask[n] && labels[n] == 0) {
                            labels[n] = next;
                            queue.add(n);
                        }
                    }
                }
            }
            components.add(new Component(area, new Region(minX, minY, maxX - minX + 1, maxY - minY + 1)));
        }
        return components;
    }

    /**
     * Histograma de intensidades com {@code bins} faixas sobre [0, 256), normalizado pela norma L2.
     */
    public static double[] normalizedHistogram(GrayImage image, int bins) {
        double[] hist = new double[bins];
        double binWidth = 256.0 / bins;
        for (float v : image.raw()) {
            int bin = (int) (clampByte(v) / binWidth);
            hist[Math.min(bins - 1, bin)]++;
        }
        double norm = 0;
        for (double h : hist) {
            norm += h * h;
        }
        norm = Math.sqrt(norm);
        if (norm > 0) {
            for (int i = 0; i < bins; i++) {
                hist[i] /= norm;
            }
        }
        return hist;
    }

    /**
     * Correlação de Pearson entre dois histogramas. Histogramas constantes retornam 1.
     */
    public static double histogramCorrelation(double[] h1, double[] h2) {
        int n = h1.length;
        double mean1 = 0, mean2 = 0;
        for (int i = 0; i < n; i++) {
            mean1 += h1[i];
            mean2 += h2[i];
        }
        mean1 /= n;
        mean2 /= n;
        double num = 0, d1 = 0, d2 = 0;
        for (int i = 0; i < n; i++) {
            double a = h1[i] - mean1;
            double b = h2[i] - mean2;
            num += a * b;
            d1 += a * a;
            d2 += b * b;
        }
        double den = Math.sqrt(d1 * d2);
        return den > Double.MIN_VALUE ? num / den : 1.0;
    }

    static int clampByte(float v) {
        int i = Math.round(v);
        return i < 0 ? 0 : Math.min(255, i);
    }

    /**
     * Componente conexo de uma máscara binária.
     */
    public record Component(int area, Region bounds) {
    }
}
