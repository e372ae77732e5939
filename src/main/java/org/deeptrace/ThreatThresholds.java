package org.deeptrace;

/**
 * Limites superiores (inclusivos) de cada nível; acima de {@code highRiskMax} é crítico.
 */
public record ThreatThresholds(double safeMax, double suspiciousMax, double highRiskMax) {

    public ThreatThresholds {
        ErrorHandler.checkScore("safeMax", safeMax);
        ErrorHandler.checkScore("suspiciousMax", suspiciousMax);
        ErrorHandler.checkScore("highRiskMax", highRiskMax);
        if (!(safeMax <= suspiciousMax && suspiciousMax <= highRiskMax)) {
            throw new IllegalArgumentException("Limiares devem ser crescentes: "
                    + safeMax + ", " + suspiciousMax + ", " + highRiskMax);
        }
    }

    public static ThreatThresholds defaults() {
        return new ThreatThresholds(25, 55, 80);
    }

    public ThreatLevel levelFor(double score) {
        if (score <= safeMax) return ThreatLevel.SAFE;
        if (score <= suspiciousMax) return ThreatLevel.SUSPICIOUS;
        if (score <= highRiskMax) return ThreatLevel.HIGH_RISK;
        return ThreatLevel.CRITICAL;
    }
}
