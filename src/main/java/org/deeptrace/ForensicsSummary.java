package org.deeptrace;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Resumo legível das métricas forenses, uma linha por sinal.
 */
public final class ForensicsSummary {

    private ForensicsSummary() {
    }

    public static List<String> lines(ForensicsMetrics metrics) {
        List<String> parts = new ArrayList<>();
        if (metrics.faceConsistencyScore() < 60) {
            parts.add(String.format(Locale.ROOT, "⚠️ Low face consistency (%.1f%%)", metrics.faceConsistencyScore()));
        } else {
            parts.add(String.format(Locale.ROOT, "✓ Face consistency: %.1f%%", metrics.faceConsistencyScore()));
        }
        if (metrics.eyeBlinkScore() < 40) {
            parts.add(String.format(Locale.ROOT, "⚠️ Abnormal blink pattern (%.1f%%)", metrics.eyeBlinkScore()));
        } else {
            parts.add(String.format(Locale.ROOT, "✓ Blink pattern: %.1f%%", metrics.eyeBlinkScore()));
        }
        if (metrics.temporalStabilityScore() < 50) {
            parts.add(String.format(Locale.ROOT, "⚠️ Low temporal stability (%.1f%%)", metrics.temporalStabilityScore()));
        } else {
            parts.add(String.format(Locale.ROOT, "✓ Temporal stability: %.1f%%", metrics.temporalStabilityScore()));
        }
        if (metrics.compressionArtifactScore() > 60) {
            parts.add(String.format(Locale.ROOT, "⚠️ High artifacts (%.1f%%)", metrics.compressionArtifactScore()));
        }
        parts.add(String.format(Locale.ROOT, "📊 Overall forensics score: %.1f%%", metrics.overallForensicsScore()));
        return parts;
    }

    public static String text(ForensicsMetrics metrics) {
        return String.join("\n", lines(metrics));
    }
}
