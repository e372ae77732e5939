package org.deeptrace;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * Log de proveniência de uma análise: eventos com timestamp e o desfecho de cada estágio.
 * Uma instância por vídeo; opcionalmente espelhado em arquivo.
 */
public class AnalysisAuditLog {

    private static final Logger logger = Logger.getLogger(AnalysisAuditLog.class.getName());
    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");

    private final Path logFile;
    private final List<String> lines = new ArrayList<>();
    private final List<StageOutcome> outcomes = new ArrayList<>();

    /**
     * @param logFile arquivo para espelhar as linhas; nulo mantém só em memória
     */
    public AnalysisAuditLog(Path logFile) {
        this.logFile = logFile;
        if (logFile != null) {
            try {
                Path parent = logFile.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.writeString(logFile, "", StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            } catch (IOException e) {
                logger.warning("⚠️ Erro inicializando log de auditoria: " + e.getMessage());
            }
        }
    }

    public AnalysisAuditLog() {
        this(null);
    }

    public void analysisStart(String videoName) {
        logEvent("ANALYSIS_START", "Iniciando análise: " + videoName);
    }

    public void event(String category, String message) {
        logEvent(category, message);
    }

    public void stage(StageOutcome outcome) {
        outcomes.add(outcome);
        logEvent("STAGE", String.format(Locale.ROOT, "%s | %s | %dms | %s",
                outcome.stage().getDisplayName(), outcome.status(), outcome.durationMs(),
                outcome.detail() != null ? outcome.detail() : "-"));
    }

    public void criticalError(String component, String error) {
        logEvent("CRITICAL_ERROR", String.format("Component: %s | Error: %s", component, error));
    }

    public void analysisSummary(double durationMs) {
        long completed = outcomes.stream().filter(StageOutcome::isCompleted).count();
        logEvent("ANALYSIS_SUMMARY", String.format(Locale.ROOT, "Estágios concluídos: %d/%d | Duração: %.0fms",
                completed, outcomes.size(), durationMs));
    }

    public List<StageOutcome> getOutcomes() {
        return Collections.unmodifiableList(outcomes);
    }

    public List<String> getLines() {
        return Collections.unmodifiableList(lines);
    }

    public Path getLogFile() {
        return logFile;
    }

    private void logEvent(String category, String message) {
        String line = String.format("[%s] [%s] %s", LocalDateTime.now().format(TIMESTAMP_FORMAT), category, message);
        lines.add(line);
        logger.fine(line);

        if (logFile != null) {
            try {
                Files.writeString(logFile, line + "\n", StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } catch (IOException e) {
                logger.warning("⚠️ Erro escrevendo log de auditoria: " + e.getMessage());
            }
        }
    }
}
