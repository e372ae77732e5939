package org.deeptrace;

/**
 * Metadados do stream de vídeo obtidos pelo ffprobe.
 */
public record VideoInfo(int width, int height, double fps, int frameCount, double durationSeconds) {

    public VideoInfo {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Dimensões de vídeo inválidas: " + width + "x" + height);
        }
        if (fps <= 0 || Double.isNaN(fps)) {
            throw new IllegalArgumentException("fps deve ser > 0");
        }
    }

    @Override
    public String toString() {
        return String.format("Video[%dx%d, %.2f fps, %d frames, %.2fs]",
                width, height, fps, frameCount, durationSeconds);
    }
}
