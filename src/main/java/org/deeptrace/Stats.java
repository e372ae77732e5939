package org.deeptrace;

import java.util.List;

/**
 * Estatísticas descritivas simples (desvio padrão populacional).
 */
public final class Stats {

    private Stats() {
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    public static double std(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double mean = mean(values);
        double acc = 0;
        for (double v : values) {
            acc += (v - mean) * (v - mean);
        }
        return Math.sqrt(acc / values.length);
    }

    public static double min(double[] values) {
        double min = Double.POSITIVE_INFINITY;
        for (double v : values) {
            min = Math.min(min, v);
        }
        return values.length == 0 ? 0.0 : min;
    }

    public static double max(double[] values) {
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            max = Math.max(max, v);
        }
        return values.length == 0 ? 0.0 : max;
    }

    public static double clip(double value, double low, double high) {
        return Math.max(low, Math.min(high, value));
    }

    public static double clipScore(double value) {
        return clip(value, 0.0, 100.0);
    }

    public static double[] toArray(List<Double> values) {
        double[] out = new double[values.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = values.get(i);
        }
        return out;
    }

    /**
     * Coeficiente de correlação de Pearson; NaN quando algum dos sinais é constante.
     */
    public static double pearson(double[] a, double[] b, int from, int to) {
        int n = to - from;
        if (n < 2) {
            return Double.NaN;
        }
        double ma = 0, mb = 0;
        for (int i = from; i < to; i++) {
            ma += a[i];
            mb += b[i];
        }
        ma /= n;
        mb /= n;
        double num = 0, da = 0, db = 0;
        for (int i = from; i < to; i++) {
            num += (a[i] - ma) * (b[i] - mb);
            da += (a[i] - ma) * (a[i] - ma);
            db += (b[i] - mb) * (b[i] - mb);
        }
        double den = Math.sqrt(da * db);
        return den == 0 ? Double.NaN : num / den;
    }
}
