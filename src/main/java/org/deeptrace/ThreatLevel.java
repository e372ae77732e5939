package org.deeptrace;

import com.google.gson.annotations.SerializedName;

import java.util.List;
import java.util.Locale;

/**
 * Níveis de ameaça com rótulo, cor para a interface, descrição e ações recomendadas.
 */
public enum ThreatLevel {

    @SerializedName("safe")
    SAFE("Safe", "#28a745",
            "Analysis indicates this content is likely authentic. "
                    + "Multiple verification methods show consistent results "
                    + "within expected parameters for genuine content.",
            List.of(
                    "Content appears authentic, but verify source if high-stakes",
                    "Check metadata and chain of custody for additional assurance",
                    "Consider context and source credibility")),

    @SerializedName("suspicious")
    SUSPICIOUS("Suspicious", "#ffc107",
            "Analysis shows some indicators that warrant further investigation. "
                    + "While not definitively manipulated, certain signals deviate from "
                    + "expected patterns for authentic content.",
            List.of(
                    "Recommend manual review by trained analyst",
                    "Cross-reference with known authentic content from the same source",
                    "Check for additional corroborating evidence",
                    "Consider running additional verification tools")),

    @SerializedName("high_risk")
    HIGH_RISK("High Risk", "#fd7e14",
            "Strong indicators of potential manipulation detected. "
                    + "Multiple analysis methods have identified concerning patterns "
                    + "consistent with known deepfake techniques.",
            List.of(
                    "Do NOT use this content without thorough verification",
                    "Escalate to security team for professional analysis",
                    "Attempt to locate original source content",
                    "Document chain of custody for the content",
                    "Consider potential impact if content is used")),

    @SerializedName("critical")
    CRITICAL("Critical", "#dc3545",
            "CRITICAL: Very strong evidence of manipulation detected. "
                    + "Analysis shows clear signs of synthetic or manipulated content. "
                    + "This content should be treated as potentially dangerous.",
            List.of(
                    "BLOCK: Do not publish or distribute this content",
                    "Immediately escalate to security/legal team",
                    "Preserve all metadata and source information",
                    "Document detection for potential legal purposes",
                    "Investigate the source and distribution chain")),

    @SerializedName("unknown")
    UNKNOWN("Unknown", "#6c757d",
            "Unable to determine authenticity with sufficient confidence. "
                    + "Additional analysis or manual review is recommended.",
            List.of(
                    "Seek additional analysis from specialized tools",
                    "Request manual expert review",
                    "Do not use content until verified",
                    "Collect additional context about content origin"));

    private final String displayName;
    private final String colorCode;
    private final String description;
    private final List<String> recommendations;

    ThreatLevel(String displayName, String colorCode, String description, List<String> recommendations) {
        this.displayName = displayName;
        this.colorCode = colorCode;
        this.description = description;
        this.recommendations = recommendations;
    }

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getColorCode() {
        return colorCode;
    }

    public String getDescription() {
        return description;
    }

    public List<String> getRecommendations() {
        return recommendations;
    }
}
