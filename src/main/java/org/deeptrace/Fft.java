package org.deeptrace;

/**
 * FFT radix-2 iterativa (Cooley-Tukey) em 1D e 2D.
 * Os tamanhos devem ser potências de 2.
 */
public final class Fft {

    private Fft() {
    }

    public static boolean isPowerOfTwo(int n) {
        return n > 0 && (n & (n - 1)) == 0;
    }

    /**
     * Transformada in-place sobre as partes real e imaginária.
     */
    public static void transform(double[] re, double[] im) {
        int n = re.length;
        if (n != im.length || !isPowerOfTwo(n)) {
            throw new IllegalArgumentException("Tamanho da FFT deve ser potência de 2: " + n);
        }

        for (int i = 1, j = 0; i < n; i++) {
            int bit = n >> 1;
            for (; (j & bit) != 0; bit >>= 1) {
                j ^= bit;
            }
            j ^= bit;
            if (i < j) {
                double t = re[i];
                re[i] = re[j];
                re[j] = t;
                t = im[i];
                im[i] = im[j];
                im[j] = t;
            }
        }

        for (int len = 2; len <= n; len <<= 1) {
            double angle = -2 * Math.PI / len;
            double wRe = Math.cos(angle);
            double wIm = Math.sin(angle);
            for (int i = 0; i < n; i += len) {
                double curRe = 1;
                double curIm = 0;
                for (int k = 0; k < len / 2; k++) {
                    int a = i + k;
                    int b = a + len / 2;
                    double tRe = re[b] * curRe - im[b] * curIm;
                    double tIm = re[b] * curIm + im[b] * curRe;
                    re[b] = re[a] - tRe;
                    im[b] = im[a] - tIm;
                    re[a] += tRe;
                    im[a] += tIm;
                    double nextRe = curRe * wRe - curIm * wIm;
                    curIm = curRe * wIm + curIm * wRe;
                    curRe = nextRe;
                }
            }
        }
    }

    /**
     * Magnitudes das frequências não negativas (0..n/2) de um sinal real.
     */
    public static double[] realMagnitudes(double[] signal) {
        int n = signal.length;
        double[] re = signal.clone();
        double[] im = new double[n];
        transform(re, im);
        double[] mags = new double[n / 2 + 1];
        for (int k = 0; k < mags.length; k++) {
            mags[k] = Math.hypot(re[k], im[k]);
        }
        return mags;
    }

    /**
     * Magnitude do espectro 2D de uma imagem quadrada, com a frequência zero
     * deslocada para o centro.
     */
    public static double[][] shiftedMagnitude(GrayImage image) {
        int w = image.width();
        int h = image.height();
        if (!isPowerOfTwo(w) || !isPowerOfTwo(h)) {
            throw new IllegalArgumentException("Dimensões devem ser potências de 2: " + w + "x" + h);
        }
        double[][] re = new double[h][w];
        double[][] im = new double[h][w];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                re[y][x] = image.get(x, y);
            }
            transform(re[y], im[y]);
        }

        double[] colRe = new double[h];
        double[] colIm = new double[h];
        for (int x = 0; x < w; x++) {
            for (int y = 0; y < h; y++) {
                colRe[y] = re[y][x];
                colIm[y] = im[y][x];
            }
            transform(colRe, colIm);
            for (int y = 0; y < h; y++) {
                re[y][x] = colRe[y];
                im[y][x] = colIm[y];
            }
        }

        double[][] magnitude = new double[h][w];
        for (int y = 0; y < h; y++) {
            int sy = (y + h / 2) % h;
            for (int x = 0; x < w; x++) {
                int sx = (x + w / 2) % w;
                magnitude[sy][sx] = Math.hypot(re[y][x], im[y][x]);
            }
        }
        return magnitude;
    }
}
