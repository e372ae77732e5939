package org.deeptrace;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Extrai a trilha de áudio de um vídeo como PCM mono 16 bits via ffmpeg.
 * Nunca lança exceção: falhas viram {@link Signal#unavailable(String)}.
 */
public class AudioExtractor {

    private static final Logger logger = Logger.getLogger(AudioExtractor.class.getName());

    private final String ffmpegPath;
    private final int sampleRate;
    private final int timeoutSeconds;

    public AudioExtractor(DeepTraceConfig config) {
        this(config.ffmpegPath(), config.audioSampleRate(), config.audioExtractTimeoutSeconds());
    }

    public AudioExtractor(String ffmpegPath, int sampleRate, int timeoutSeconds) {
        this.ffmpegPath = ffmpegPath;
        this.sampleRate = sampleRate;
        this.timeoutSeconds = timeoutSeconds;
    }

    public Signal<AudioClip> extract(Path video) {
        try {
            ErrorHandler.checkMediaFile(video, "Vídeo");
        } catch (MediaAccessException e) {
            return Signal.unavailable(e.getMessage());
        }

        Path tempWav = null;
        try {
            tempWav = Files.createTempFile("deeptrace_audio_", ".wav");
            ProcessBuilder pb = new ProcessBuilder(
                    ffmpegPath, "-nostdin",
                    "-i", video.toString(),
                    "-vn",
                    "-acodec", "pcm_s16le",
                    "-ar", String.valueOf(sampleRate),
                    "-ac", "1",
                    "-y",
                    tempWav.toString()
            );
            String failure = runProcess(pb);
            if (failure != null) {
                logger.warning("⚠️ Extração de áudio falhou: " + failure);
                return Signal.unavailable("Failed to extract audio: " + failure);
            }
            if (!Files.exists(tempWav) || Files.size(tempWav) == 0) {
                return Signal.unavailable("Failed to extract audio: empty output");
            }

            WavReader.Result result = WavReader.read(tempWav);
            if (!result.isSuccess()) {
                return Signal.unavailable("Failed to load audio data: " + result.error());
            }
            if (result.clip().isEmpty()) {
                return Signal.unavailable("Failed to load audio data: no samples");
            }
            logger.info(String.format("🎵 Áudio extraído: %.1fs @ %d Hz",
                    result.clip().durationSeconds(), result.clip().sampleRate()));
            return Signal.available(result.clip());

        } catch (IOException e) {
            logger.warning("⚠️ Erro de I/O na extração de áudio: " + e.getMessage());
            return Signal.unavailable("Failed to extract audio: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Signal.unavailable("Audio extraction interrupted");
        } finally {
            deleteQuietly(tempWav);
        }
    }

    /**
     * Executa o processo com timeout; retorna null em sucesso ou a descrição da falha.
     */
    private String runProcess(ProcessBuilder pb) throws IOException, InterruptedException {
        pb.redirectErrorStream(true);
        Process process = pb.start();

        CompletableFuture<List<String>> errors = CompletableFuture.supplyAsync(() -> {
            List<String> lines = new ArrayList<>();
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    String lower = line.toLowerCase();
                    if (lower.contains("error") || lower.contains("does not contain any stream")
                            || lower.contains("matches no streams")) {
                        lines.add(line.trim());
                    }
                }
            } catch (IOException e) {
                lines.add("erro lendo saída do ffmpeg: " + e.getMessage());
            }
            return lines;
        });

        boolean finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
        if (!finished) {
            process.destroyForcibly();
            process.waitFor(5, TimeUnit.SECONDS);
            return "timeout after " + timeoutSeconds + "s";
        }
        if (process.exitValue() != 0) {
            List<String> lines = errors.join();
            return "ffmpeg exit code " + process.exitValue()
                    + (lines.isEmpty() ? "" : " (" + lines.get(lines.size() - 1) + ")");
        }
        return null;
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.warning("⚠️ Não foi possível remover arquivo temporário " + file + ": " + e.getMessage());
        }
    }
}
