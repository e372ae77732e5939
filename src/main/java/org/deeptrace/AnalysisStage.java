package org.deeptrace;

import java.util.EnumSet;
import java.util.Set;

/**
 * Estágios opcionais do pipeline de explicabilidade, na ordem de execução.
 */
public enum AnalysisStage {
    GRADCAM("Grad-CAM"),
    TIMELINE("Timeline"),
    FORENSICS("Forensics"),
    MULTIMODAL("Multimodal"),
    CLASSIFICATION("Fake type"),
    THREAT("Threat level");

    private final String displayName;

    AnalysisStage(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static Set<AnalysisStage> all() {
        return EnumSet.allOf(AnalysisStage.class);
    }
}
