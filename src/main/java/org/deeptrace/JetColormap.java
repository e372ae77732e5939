package org.deeptrace;

/**
 * Mapa de cores JET (azul → ciano → amarelo → vermelho) para valores de 8 bits.
 */
final class JetColormap {

    private static final int[] TABLE = new int[256];

    static {
        for (int i = 0; i < 256; i++) {
            double x = i / 255.0;
            int r = channel(1.5 - Math.abs(4 * x - 3));
            int g = channel(1.5 - Math.abs(4 * x - 2));
            int b = channel(1.5 - Math.abs(4 * x - 1));
            TABLE[i] = RgbFrame.pack(r, g, b);
        }
    }

    private JetColormap() {
    }

    private static int channel(double v) {
        return (int) Math.round(Stats.clip(v, 0, 1) * 255);
    }

    static int color(int value) {
        return TABLE[Math.max(0, Math.min(255, value))];
    }
}
