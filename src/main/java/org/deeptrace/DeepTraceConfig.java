package org.deeptrace;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Configuração do DeepTrace em três camadas: padrões do classpath
 * ({@code deeptrace.properties}), arquivo externo opcional e propriedades de
 * sistema {@code -Ddeeptrace.<chave>}.
 */
public final class DeepTraceConfig {

    private static final Logger logger = Logger.getLogger(DeepTraceConfig.class.getName());

    static final String DEFAULTS_RESOURCE = "/deeptrace.properties";
    static final String SYSTEM_PREFIX = "deeptrace.";

    private final Properties props;

    private DeepTraceConfig(Properties props) {
        this.props = props;
    }

    /**
     * Apenas os padrões embarcados e as propriedades de sistema.
     */
    public static DeepTraceConfig defaults() {
        try {
            return load(null);
        } catch (IOException e) {
            throw new IllegalStateException("Falha ao carregar configuração padrão", e);
        }
    }

    public static DeepTraceConfig load(Path externalFile) throws IOException {
        Properties props = new Properties();
        try (InputStream in = DeepTraceConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                props.load(in);
            } else {
                logger.warning("⚠️ " + DEFAULTS_RESOURCE + " não encontrado no classpath, usando valores internos");
            }
        }

        if (externalFile != null) {
            if (!Files.exists(externalFile)) {
                throw new IOException("Arquivo de configuração não encontrado: " + externalFile);
            }
            try (Reader reader = Files.newBufferedReader(externalFile, StandardCharsets.UTF_8)) {
                props.load(reader);
            }
            logger.info("⚙️ Configuração carregada: " + externalFile);
        }

        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(SYSTEM_PREFIX)) {
                props.setProperty(name.substring(SYSTEM_PREFIX.length()), System.getProperty(name));
            }
        }
        return new DeepTraceConfig(props);
    }

    /**
     * Cópia com uma chave sobrescrita; útil para CLI e testes.
     */
    public DeepTraceConfig with(String key, String value) {
        Properties copy = new Properties();
        copy.putAll(props);
        copy.setProperty(key, value);
        return new DeepTraceConfig(copy);
    }

    public String getString(String key, String defaultValue) {
        String value = props.getProperty(key);
        return value != null && !value.isBlank() ? value.trim() : defaultValue;
    }

    public double getDouble(String key, double defaultValue) {
        try {
            String value = props.getProperty(key);
            return value != null ? Double.parseDouble(value.trim()) : defaultValue;
        } catch (NumberFormatException e) {
            logger.warning("⚠️ Valor inválido para " + key + ", usando " + defaultValue);
            return defaultValue;
        }
    }

    public int getInt(String key, int defaultValue) {
        try {
            String value = props.getProperty(key);
            return value != null ? Integer.parseInt(value.trim()) : defaultValue;
        } catch (NumberFormatException e) {
            logger.warning("⚠️ Valor inválido para " + key + ", usando " + defaultValue);
            return defaultValue;
        }
    }

    // ===== Acesso tipado =====

    public double defaultFps() {
        return getDouble("video.default.fps", 30.0);
    }

    public int maxFrames() {
        return getInt("video.max.frames", 300);
    }

    public String ffmpegPath() {
        return getString("ffmpeg.path", "ffmpeg");
    }

    public String ffprobePath() {
        return getString("ffprobe.path", "ffprobe");
    }

    public int ffprobeTimeoutSeconds() {
        return getInt("ffprobe.timeout.seconds", 30);
    }

    public int audioSampleRate() {
        return getInt("audio.sample.rate", 16000);
    }

    public int audioExtractTimeoutSeconds() {
        return getInt("audio.extract.timeout.seconds", 60);
    }

    public int energySegments() {
        return getInt("audio.energy.segments", 50);
    }

    public double timelineAnomalyThreshold() {
        return getDouble("timeline.anomaly.threshold", 0.3);
    }

    public int timelineSmoothingWindow() {
        return getInt("timeline.smoothing.window", 5);
    }

    public double gradCamAlpha() {
        return getDouble("gradcam.alpha", 0.5);
    }

    public int gradCamInputSize() {
        return getInt("gradcam.input.size", 112);
    }

    public int stageTimeoutSeconds() {
        return getInt("stage.timeout.seconds", 0);
    }

    public Path outputDir() {
        return Path.of(getString("output.dir", "output"));
    }

    public FakeTypeThresholds fakeTypeThresholds() {
        return new FakeTypeThresholds(
                getDouble("faketype.face.consistency.threshold", 60),
                getDouble("faketype.temporal.stability.threshold", 55),
                getDouble("faketype.lip.sync.threshold", 40),
                getDouble("faketype.artifact.threshold", 50));
    }

    public ThreatThresholds threatThresholds() {
        return new ThreatThresholds(
                getDouble("threat.threshold.safe", 25),
                getDouble("threat.threshold.suspicious", 55),
                getDouble("threat.threshold.high.risk", 80));
    }

    public ThreatWeights threatWeights() {
        return ThreatWeights.of(
                getDouble("threat.weight.model.confidence", 0.35),
                getDouble("threat.weight.forensics.score", 0.25),
                getDouble("threat.weight.audio.score", 0.15),
                getDouble("threat.weight.temporal.score", 0.15),
                getDouble("threat.weight.fake.type.score", 0.10));
    }
}
