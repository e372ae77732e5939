package org.deeptrace;

/**
 * Retângulo alinhado aos eixos em coordenadas de pixel (x, y no canto superior esquerdo).
 */
public record Region(int x, int y, int width, int height) {

    public Region {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Região com dimensão negativa");
        }
    }

    public int area() {
        return width * height;
    }

    public boolean isEmpty() {
        return width == 0 || height == 0;
    }

    public double centerX() {
        return x + width / 2.0;
    }

    public double centerY() {
        return y + height / 2.0;
    }

    /**
     * Limita a região ao retângulo [0, maxWidth) x [0, maxHeight).
     */
    public Region clip(int maxWidth, int maxHeight) {
        int x0 = Math.max(0, x);
        int y0 = Math.max(0, y);
        int x1 = Math.min(maxWidth, x + width);
        int y1 = Math.min(maxHeight, y + height);
        return new Region(x0, y0, Math.max(0, x1 - x0), Math.max(0, y1 - y0));
    }

    /**
     * Região da boca: 30% inferiores da altura a partir de 60%, 60% centrais da largura.
     */
    public Region mouthRegion() {
        return new Region(x + (int) (width * 0.2), y + (int) (height * 0.6),
                (int) (width * 0.6), (int) (height * 0.3));
    }
}
