package org.deeptrace;

/**
 * SSIM médio com janela gaussiana 11x11 (sigma 1.5).
 */
public final class Ssim {

    private static final double C1 = Math.pow(0.01 * 255, 2);
    private static final double C2 = Math.pow(0.03 * 255, 2);
    private static final int WINDOW = 11;
    private static final double SIGMA = 1.5;

    private Ssim() {
    }

    public static double mean(GrayImage first, GrayImage second) {
        int w = first.width();
        int h = first.height();
        if (second.width() != w || second.height() != h) {
            throw new IllegalArgumentException("Imagens com tamanhos diferentes");
        }
        int n = w * h;
        double[] a = new double[n];
        double[] b = new double[n];
        double[] aa = new double[n];
        double[] bb = new double[n];
        double[] ab = new double[n];
        float[] ra = first.raw();
        float[] rb = second.raw();
        for (int i = 0; i < n; i++) {
            a[i] = ra[i];
            b[i] = rb[i];
            aa[i] = a[i] * a[i];
            bb[i] = b[i] * b[i];
            ab[i] = a[i] * b[i];
        }

        double[] mu1 = ImageOps.gaussianBlur(a, w, h, WINDOW, SIGMA);
        double[] mu2 = ImageOps.gaussianBlur(b, w, h, WINDOW, SIGMA);
        double[] s11 = ImageOps.gaussianBlur(aa, w, h, WINDOW, SIGMA);
        double[] s22 = ImageOps.gaussianBlur(bb, w, h, WINDOW, SIGMA);
        double[] s12 = ImageOps.gaussianBlur(ab, w, h, WINDOW, SIGMA);

        double sum = 0;
        for (int i = 0; i < n; i++) {
            double mu1Sq = mu1[i] * mu1[i];
            double mu2Sq = mu2[i] * mu2[i];
            double mu12 = mu1[i] * mu2[i];
            double sigma1 = s11[i] - mu1Sq;
            double sigma2 = s22[i] - mu2Sq;
            double sigma12 = s12[i] - mu12;
            sum += ((2 * mu12 + C1) * (2 * sigma12 + C2))
                    / ((mu1Sq + mu2Sq + C1) * (sigma1 + sigma2 + C2));
        }
        return sum / n;
    }
}
