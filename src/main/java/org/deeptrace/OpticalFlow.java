package org.deeptrace;

/**
 * Fluxo óptico denso de Horn-Schunck entre dois frames em tons de cinza.
 */
public final class OpticalFlow {

    private final double alpha;
    private final int iterations;

    public OpticalFlow() {
        this(15.0, 40);
    }

    public OpticalFlow(double alpha, int iterations) {
        if (alpha <= 0 || iterations <= 0) {
            throw new IllegalArgumentException("Parâmetros de fluxo inválidos");
        }
        this.alpha = alpha;
        this.iterations = iterations;
    }

    /**
     * Magnitude média do campo de fluxo entre {@code previous} e {@code current}.
     */
    public double meanMagnitude(GrayImage previous, GrayImage current) {
        Field field = compute(previous, current);
        double sum = 0;
        for (int i = 0; i < field.u.length; i++) {
            sum += Math.hypot(field.u[i], field.v[i]);
        }
        return sum / field.u.length;
    }

    public Field compute(GrayImage previous, GrayImage current) {
        int w = previous.width();
        int h = previous.height();
        if (current.width() != w || current.height() != h) {
            throw new IllegalArgumentException("Frames com tamanhos diferentes");
        }
        float[] a = previous.raw();
        float[] b = current.raw();
        int n = w * h;
        double[] ix = new double[n];
        double[] iy = new double[n];
        double[] it = new double[n];

        // Derivadas estimadas no cubo 2x2x2 de Horn-Schunck
        for (int y = 0; y < h; y++) {
            int y1 = Math.min(y + 1, h - 1);
            for (int x = 0; x < w; x++) {
                int x1 = Math.min(x + 1, w - 1);
                int p00 = y * w + x, p01 = y * w + x1, p10 = y1 * w + x, p11 = y1 * w + x1;
                ix[p00] = 0.25 * (a[p01] - a[p00] + a[p11] - a[p10] + b[p01] - b[p00] + b[p11] - b[p10]);
                iy[p00] = 0.25 * (a[p10] - a[p00] + a[p11] - a[p01] + b[p10] - b[p00] + b[p11] - b[p01]);
                it[p00] = 0.25 * (b[p00] - a[p00] + b[p01] - a[p01] + b[p10] - a[p10] + b[p11] - a[p11]);
            }
        }

        double[] u = new double[n];
        double[] v = new double[n];
        double alpha2 = alpha * alpha;
        for (int iter = 0; iter < iterations; iter++) {
            double[] uAvg = neighbourAverage(u, w, h);
            double[] vAvg = neighbourAverage(v, w, h);
            for (int i = 0; i < n; i++) {
                double t = (ix[i] * uAvg[i] + iy[i] * vAvg[i] + it[i])
                        / (alpha2 + ix[i] * ix[i] + iy[i] * iy[i]);
                u[i] = uAvg[i] - ix[i] * t;
                v[i] = vAvg[i] - iy[i] * t;
            }
        }
        return new Field(w, h, u, v);
    }

    private static double[] neighbourAverage(double[] f, int w, int h) {
        double[] out = new double[f.length];
        for (int y = 0; y < h; y++) {
            int ym = Math.max(y - 1, 0), yp = Math.min(y + 1, h - 1);
            for (int x = 0; x < w; x++) {
                int xm = Math.max(x - 1, 0), xp = Math.min(x + 1, w - 1);
                double edges = f[ym * w + x] + f[yp * w + x] + f[y * w + xm] + f[y * w + xp];
                double corners = f[ym * w + xm] + f[ym * w + xp] + f[yp * w + xm] + f[yp * w + xp];
                out[y * w + x] = edges / 6.0 + corners / 12.0;
            }
        }
        return out;
    }

    /**
     * Campo de deslocamento (u, v) por pixel.
     */
    public record Field(int width, int height, double[] u, double[] v) {
    }
}
