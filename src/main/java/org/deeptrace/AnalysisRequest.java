package org.deeptrace;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Entrada do {@link ExplainabilityPipeline}.
 *
 * @param video       arquivo de vídeo; pode ser nulo quando {@code frames} já vem decodificado
 * @param prediction  veredito já calculado pelo classificador; nulo para derivar de {@code classifier}
 * @param classifier  necessário para Grad-CAM e timeline
 * @param inputTensors entrada pré-processada do classificador; nula para derivar dos frames
 * @param frames      frames já decodificados; nulo para ler do vídeo
 * @param fps         fps dos frames fornecidos; ignorado quando o vídeo é sondado
 * @param maxFrames   nulo usa {@code video.max.frames}
 */
public record AnalysisRequest(
        Path video,
        ModelPrediction prediction,
        DeepfakeClassifier classifier,
        List<Tensor3> inputTensors,
        List<RgbFrame> frames,
        Double fps,
        Set<AnalysisStage> stages,
        Integer maxFrames,
        String videoName
) {

    public AnalysisRequest {
        if (video == null && frames == null) {
            throw new IllegalArgumentException("Informe o vídeo ou os frames decodificados");
        }
        if (maxFrames != null && maxFrames <= 0) {
            throw new IllegalArgumentException("maxFrames deve ser > 0");
        }
        if (fps != null && fps <= 0) {
            throw new IllegalArgumentException("fps deve ser > 0");
        }
        inputTensors = inputTensors != null ? List.copyOf(inputTensors) : null;
        frames = frames != null ? List.copyOf(frames) : null;
        if (stages == null) {
            stages = EnumSet.allOf(AnalysisStage.class);
        } else {
            stages = stages.isEmpty() ? EnumSet.noneOf(AnalysisStage.class) : EnumSet.copyOf(stages);
        }
        stages = Collections.unmodifiableSet(stages);
        if (videoName == null || videoName.isBlank()) {
            videoName = video != null ? baseName(video) : "video";
        }
    }

    public static Builder forVideo(Path video) {
        return new Builder().video(video);
    }

    public static Builder forFrames(List<RgbFrame> frames, double fps) {
        return new Builder().frames(frames).fps(fps);
    }

    public boolean isEnabled(AnalysisStage stage) {
        return stages.contains(stage);
    }

    static String baseName(Path video) {
        String name = video.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    public static final class Builder {
        private Path video;
        private ModelPrediction prediction;
        private DeepfakeClassifier classifier;
        private List<Tensor3> inputTensors;
        private List<RgbFrame> frames;
        private Double fps;
        private Set<AnalysisStage> stages = EnumSet.allOf(AnalysisStage.class);
        private Integer maxFrames;
        private String videoName;

        private Builder() {
        }

        public Builder video(Path video) {
            this.video = video;
            return this;
        }

        public Builder prediction(ModelPrediction prediction) {
            this.prediction = prediction;
            return this;
        }

        public Builder classifier(DeepfakeClassifier classifier) {
            this.classifier = classifier;
            return this;
        }

        public Builder inputTensors(List<Tensor3> inputTensors) {
            this.inputTensors = inputTensors;
            return this;
        }

        public Builder frames(List<RgbFrame> frames) {
            this.frames = frames;
            return this;
        }

        public Builder fps(double fps) {
            this.fps = fps;
            return this;
        }

        public Builder stages(Set<AnalysisStage> stages) {
            this.stages = stages;
            return this;
        }

        public Builder disable(AnalysisStage stage) {
            Set<AnalysisStage> copy = stages.isEmpty() ? EnumSet.noneOf(AnalysisStage.class) : EnumSet.copyOf(stages);
            copy.remove(stage);
            this.stages = copy;
            return this;
        }

        public Builder maxFrames(int maxFrames) {
            this.maxFrames = maxFrames;
            return this;
        }

        public Builder videoName(String videoName) {
            this.videoName = videoName;
            return this;
        }

        public AnalysisRequest build() {
            return new AnalysisRequest(video, prediction, classifier, inputTensors, frames, fps, stages,
                    maxFrames, videoName);
        }
    }
}
