package org.deeptrace;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Linha de comando: analisa um vídeo sem classificador (Grad-CAM e timeline ficam
 * indisponíveis), imprime o relatório JSON e o grava no diretório de saída.
 *
 * <pre>
 * deeptrace &lt;video&gt; [--label FAKE|REAL] [--confidence N] [--out DIR] [--max-frames N] [--config FILE]
 * </pre>
 */
public class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private static final String USAGE =
            "Uso: deeptrace <video> [--label FAKE|REAL] [--confidence N] [--out DIR] [--max-frames N] [--config FILE]";

    public static void main(String[] args) {
        configureLogging();

        CliOptions options;
        try {
            options = CliOptions.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println("❌ " + e.getMessage());
            System.err.println(USAGE);
            System.exit(2);
            return;
        }

        try {
            DeepTraceConfig config = DeepTraceConfig.load(options.configFile());
            if (options.outputDir() != null) {
                config = config.with("output.dir", options.outputDir().toString());
            }

            AnalysisRequest.Builder builder = AnalysisRequest.forVideo(options.video());
            if (options.label() != PredictionLabel.UNKNOWN) {
                builder.prediction(new ModelPrediction(options.label(), options.confidence()));
            }
            if (options.maxFrames() != null) {
                builder.maxFrames(options.maxFrames());
            }

            ExplainabilityReport report;
            try (ExplainabilityPipeline pipeline = new ExplainabilityPipeline(config)) {
                report = pipeline.analyze(builder.build());
            }

            System.out.println(ReportJson.toJson(report));
            ReportJson.write(report, config.outputDir());
            if (!report.isSuccessful()) {
                System.exit(1);
            }
        } catch (IOException e) {
            LOGGER.severe("❌ Erro de E/S: " + e.getMessage());
            System.exit(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.severe("❌ Análise interrompida");
            System.exit(1);
        }
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.warning("⚠️ Não foi possível carregar logging.properties: " + e.getMessage());
        }
    }

    /**
     * Argumentos da linha de comando já validados.
     */
    record CliOptions(Path video, PredictionLabel label, double confidence, Path outputDir,
                      Integer maxFrames, Path configFile) {

        static CliOptions parse(String[] args) {
            Path video = null;
            PredictionLabel label = PredictionLabel.UNKNOWN;
            double confidence = 0.0;
            Path outputDir = null;
            Integer maxFrames = null;
            Path configFile = null;

            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--label" -> {
                        label = PredictionLabel.parse(value(args, i + 1, arg));
                        if (label == PredictionLabel.UNKNOWN) {
                            throw new IllegalArgumentException("--label deve ser FAKE ou REAL: " + args[i + 1]);
                        }
                        i++;
                    }
                    case "--confidence" -> confidence = parseNumber(value(args, ++i, arg), arg);
                    case "--out" -> outputDir = Path.of(value(args, ++i, arg));
                    case "--max-frames" -> {
                        double n = parseNumber(value(args, ++i, arg), arg);
                        if (n <= 0 || n != Math.floor(n)) {
                            throw new IllegalArgumentException("--max-frames deve ser inteiro positivo");
                        }
                        maxFrames = (int) n;
                    }
                    case "--config" -> configFile = Path.of(value(args, ++i, arg));
                    default -> {
                        if (arg.startsWith("--")) {
                            throw new IllegalArgumentException("Opção desconhecida: " + arg);
                        }
                        if (video != null) {
                            throw new IllegalArgumentException("Apenas um vídeo por execução");
                        }
                        video = Path.of(arg);
                    }
                }
            }

            if (video == null) {
                throw new IllegalArgumentException("Nenhum vídeo informado");
            }
            if (configFile != null && !Files.isRegularFile(configFile)) {
                throw new IllegalArgumentException("Arquivo de configuração não encontrado: " + configFile);
            }
            if (confidence < 0 || confidence > 100) {
                throw new IllegalArgumentException("--confidence deve estar entre 0 e 100");
            }
            if (label == PredictionLabel.UNKNOWN && confidence > 0) {
                throw new IllegalArgumentException("--confidence exige --label");
            }
            return new CliOptions(video, label, confidence, outputDir, maxFrames, configFile);
        }

        private static String value(String[] args, int index, String option) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Valor ausente para " + option);
            }
            return args[index];
        }

        private static double parseNumber(String value, String option) {
            try {
                return Double.parseDouble(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Valor numérico inválido para " + option + ": " + value, e);
            }
        }
    }
}
