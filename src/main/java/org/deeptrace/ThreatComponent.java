package org.deeptrace;

/**
 * Componentes do score de ameaça, na ordem de avaliação.
 */
public enum ThreatComponent {
    MODEL_CONFIDENCE("model_confidence"),
    FORENSICS_SCORE("forensics_score"),
    AUDIO_SCORE("audio_score"),
    TEMPORAL_SCORE("temporal_score"),
    FAKE_TYPE_SCORE("fake_type_score");

    private final String key;

    ThreatComponent(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public String getDisplayName() {
        return key.replace('_', ' ');
    }
}
