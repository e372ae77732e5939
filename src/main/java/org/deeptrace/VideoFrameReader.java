package org.deeptrace;

import java.io.BufferedReader;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Decodifica frames de vídeo via ffmpeg (saída rawvideo rgb24 no stdout) e lê
 * metadados via ffprobe.
 */
public class VideoFrameReader {

    private static final Logger logger = Logger.getLogger(VideoFrameReader.class.getName());

    private static final int DECODE_EXIT_TIMEOUT_SECONDS = 30;

    private final String ffmpegPath;
    private final String ffprobePath;
    private final int probeTimeoutSeconds;
    private final double defaultFps;

    public VideoFrameReader(DeepTraceConfig config) {
        this(config.ffmpegPath(), config.ffprobePath(), config.ffprobeTimeoutSeconds(), config.defaultFps());
    }

    public VideoFrameReader(String ffmpegPath, String ffprobePath, int probeTimeoutSeconds, double defaultFps) {
        this.ffmpegPath = ffmpegPath;
        this.ffprobePath = ffprobePath;
        this.probeTimeoutSeconds = probeTimeoutSeconds;
        this.defaultFps = defaultFps;
    }

    /**
     * Lê dimensões, fps, número de frames e duração do primeiro stream de vídeo.
     */
    public VideoInfo probe(Path video) throws IOException, InterruptedException {
        ErrorHandler.checkMediaFile(video, "Vídeo");

        ProcessBuilder pb = new ProcessBuilder(
                ffprobePath, "-v", "error",
                "-select_streams", "v:0",
                "-show_entries", "stream=width,height,r_frame_rate,nb_frames:format=duration",
                "-of", "default=noprint_wrappers=1",
                video.toString()
        );
        pb.redirectErrorStream(true);
        Process process = startProcess(pb, video);

        // Saída drenada em paralelo para que o timeout valha mesmo com o ffprobe travado
        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()));

        boolean finished = process.waitFor(probeTimeoutSeconds, TimeUnit.SECONDS);
        if (!finished) {
            process.destroyForcibly();
            throw new MediaAccessException("Timeout ao ler metadados do vídeo: " + video);
        }
        List<String> lines = new ArrayList<>();
        for (String line : output.join().split("\n")) {
            if (!line.isBlank()) {
                lines.add(line.trim());
            }
        }
        if (process.exitValue() != 0) {
            throw new MediaAccessException("ffprobe não conseguiu abrir o vídeo: " + video
                    + (lines.isEmpty() ? "" : " (" + String.join(" ", lines) + ")"));
        }
        return parseProbeOutput(lines, defaultFps, video);
    }

    static VideoInfo parseProbeOutput(List<String> lines, double defaultFps, Path video) throws MediaAccessException {
        Map<String, String> values = new HashMap<>();
        for (String line : lines) {
            int eq = line.indexOf('=');
            if (eq > 0) {
                values.putIfAbsent(line.substring(0, eq).trim(), line.substring(eq + 1).trim());
            }
        }

        int width = parseInt(values.get("width"), 0);
        int height = parseInt(values.get("height"), 0);
        if (width <= 0 || height <= 0) {
            throw new MediaAccessException("Nenhum stream de vídeo encontrado: " + video);
        }

        double fps = parseRate(values.get("r_frame_rate"));
        if (fps <= 0) {
            logger.warning("⚠️ fps indisponível para " + video.getFileName() + ", usando " + defaultFps);
            fps = defaultFps;
        }
        double duration = parseDouble(values.get("duration"), 0.0);
        int frames = parseInt(values.get("nb_frames"), 0);
        if (frames <= 0 && duration > 0) {
            frames = (int) Math.round(duration * fps);
        }
        return new VideoInfo(width, height, fps, frames, duration);
    }

    /**
     * Entrega cada frame decodificado ao consumidor, até {@code maxFrames} quando informado.
     *
     * @return número de frames entregues
     */
    public int forEachFrame(Path video, VideoInfo info, Integer maxFrames, Consumer<RgbFrame> consumer)
            throws IOException, InterruptedException {
        List<String> command = new ArrayList<>(List.of(
                ffmpegPath, "-v", "error", "-nostdin",
                "-i", video.toString(),
                "-map", "0:v:0",
                "-f", "rawvideo", "-pix_fmt", "rgb24"));
        if (maxFrames != null) {
            command.add("-frames:v");
            command.add(String.valueOf(maxFrames));
        }
        command.add("-");

        Process process = startProcess(new ProcessBuilder(command), video);
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()));

        int frameBytes = info.width() * info.height() * 3;
        byte[] buffer = new byte[frameBytes];
        int delivered = 0;
        try (DataInputStream in = new DataInputStream(process.getInputStream())) {
            while (maxFrames == null || delivered < maxFrames) {
                try {
                    in.readFully(buffer);
                } catch (EOFException e) {
                    break;
                }
                consumer.accept(RgbFrame.fromRgb24(buffer, info.width(), info.height()));
                delivered++;
            }
        } finally {
            if (!process.waitFor(DECODE_EXIT_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
            }
        }

        if (delivered == 0) {
            throw new MediaAccessException("Nenhum frame decodificado de " + video + ": " + stderr.join().trim());
        }
        logger.fine(() -> "Frames decodificados: " + video.getFileName());
        return delivered;
    }

    public List<RgbFrame> readFrames(Path video, VideoInfo info, Integer maxFrames)
            throws IOException, InterruptedException {
        List<RgbFrame> frames = new ArrayList<>();
        forEachFrame(video, info, maxFrames, frames::add);
        logger.info(String.format("🎬 %d frames carregados de %s", frames.size(), video.getFileName()));
        return frames;
    }

    private static Process startProcess(ProcessBuilder pb, Path video) throws MediaAccessException {
        try {
            return pb.start();
        } catch (IOException e) {
            throw new MediaAccessException("Não foi possível executar " + pb.command().get(0)
                    + " para " + video, e);
        }
    }

    private static String drain(InputStream stream) {
        StringBuilder out = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                out.append(line).append('\n');
            }
        } catch (IOException e) {
            logger.warning("⚠️ Erro lendo saída do ffmpeg: " + e.getMessage());
        }
        return out.toString();
    }

    private static double parseRate(String value) {
        if (value == null || value.isEmpty()) {
            return 0.0;
        }
        int slash = value.indexOf('/');
        if (slash < 0) {
            return parseDouble(value, 0.0);
        }
        double num = parseDouble(value.substring(0, slash), 0.0);
        double den = parseDouble(value.substring(slash + 1), 0.0);
        return den > 0 ? num / den : 0.0;
    }

    private static double parseDouble(String value, double defaultValue) {
        try {
            return value != null ? Double.parseDouble(value) : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static int parseInt(String value, int defaultValue) {
        try {
            return value != null ? Integer.parseInt(value) : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }
}
