package org.deeptrace;

import java.util.Locale;

/**
 * Rótulo do classificador. O índice segue a saída do modelo: 0 = FAKE, 1 = REAL.
 */
public enum PredictionLabel {

    FAKE(0),
    REAL(1),
    UNKNOWN(-1);

    private final int classIndex;

    PredictionLabel(int classIndex) {
        this.classIndex = classIndex;
    }

    public int getClassIndex() {
        return classIndex;
    }

    public static PredictionLabel fromClassIndex(int index) {
        return switch (index) {
            case 0 -> FAKE;
            case 1 -> REAL;
            default -> UNKNOWN;
        };
    }

    public static PredictionLabel parse(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "FAKE" -> FAKE;
            case "REAL" -> REAL;
            default -> UNKNOWN;
        };
    }
}
