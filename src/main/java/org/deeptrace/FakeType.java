package org.deeptrace;

import com.google.gson.annotations.SerializedName;

import java.util.List;

/**
 * Categorias de manipulação atribuídas pelo {@link FakeTypeClassifier}.
 */
public enum FakeType {

    @SerializedName("authentic")
    AUTHENTIC("authentic",
            "Analysis indicates this video is likely authentic. "
                    + "Face consistency, temporal stability, and audio-visual sync "
                    + "are within normal parameters.",
            List.of(
                    "Video appears authentic based on automated analysis",
                    "Manual verification recommended for high-stakes decisions",
                    "Check video metadata and chain of custody")),

    @SerializedName("gan_face_swap")
    GAN_FACE_SWAP("gan_face_swap",
            "This video shows signs of GAN-based face swap manipulation. "
                    + "Indicators include inconsistent face features across frames, "
                    + "unnatural blink patterns, and potential compression artifacts "
                    + "around facial boundaries.",
            List.of(
                    "Compare with known authentic footage of the subject",
                    "Examine face boundaries and hairline carefully",
                    "Check for inconsistent lighting on face vs. background",
                    "Look for artifacts around ears and facial contours")),

    @SerializedName("lip_sync_manipulation")
    LIP_SYNC("lip_sync_manipulation",
            "This video appears to be a lip-sync manipulation (audio deepfake). "
                    + "The audio track shows signs of synthesis or modification, "
                    + "and the lip movements do not properly correlate with the audio.",
            List.of(
                    "Compare audio with known samples of the speaker",
                    "Look for timing mismatches between words and mouth movements",
                    "Check for unnatural pauses or breathing patterns",
                    "Examine if jaw movement matches speech intensity")),

    @SerializedName("face_reenactment")
    FACE_REENACTMENT("face_reenactment",
            "This video shows signs of face reenactment manipulation. "
                    + "The facial expressions and movements appear to be transferred "
                    + "from another source, with temporal inconsistencies and "
                    + "unnatural expression transitions.",
            List.of(
                    "Look for unnatural or exaggerated expressions",
                    "Check if head movements match body language",
                    "Examine expression transitions for smoothness",
                    "Compare with subject's typical expression patterns")),

    @SerializedName("unknown_manipulation")
    UNKNOWN_MANIPULATION("unknown_manipulation",
            "This video shows signs of manipulation, but the specific type "
                    + "could not be determined with high confidence. Further manual "
                    + "analysis is recommended.",
            List.of(
                    "Request professional forensic analysis",
                    "Gather additional reference footage for comparison",
                    "Check video metadata and encoding history",
                    "Consider multiple analysis tools for verification"));

    private final String value;
    private final String explanation;
    private final List<String> recommendations;

    FakeType(String value, String explanation, List<String> recommendations) {
        this.value = value;
        this.explanation = explanation;
        this.recommendations = recommendations;
    }

    public String getValue() {
        return value;
    }

    /**
     * Nome legível, ex.: "Gan Face Swap".
     */
    public String getDisplayName() {
        StringBuilder sb = new StringBuilder();
        for (String word : value.split("_")) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return sb.toString();
    }

    public String getExplanation() {
        return explanation;
    }

    public List<String> getRecommendations() {
        return recommendations;
    }

    public boolean isManipulation() {
        return this != AUTHENTIC;
    }

    public static FakeType fromValue(String value) {
        for (FakeType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Tipo de fake desconhecido: " + value);
    }
}
