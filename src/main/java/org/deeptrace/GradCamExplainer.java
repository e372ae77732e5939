package org.deeptrace;

import javax.imageio.ImageIO;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Explicações Grad-CAM sobre o mapa de ativação final do backbone do classificador.
 *
 * <p>Cada chamada registra seus hooks numa captura própria e os remove ao terminar;
 * chamadas concorrentes sobre o mesmo modelo são serializadas no monitor do modelo.
 * Nunca altera pesos nem a inferência.</p>
 */
public class GradCamExplainer implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(GradCamExplainer.class.getName());

    private final DeepfakeClassifier model;
    private volatile boolean closed;

    public GradCamExplainer(DeepfakeClassifier model) {
        if (model == null) throw new IllegalArgumentException("model não pode ser nulo");
        this.model = model;
    }

    /**
     * Mapa de saliência de um frame da sequência.
     *
     * @param targetClass classe a explicar; nulo usa a classe prevista
     * @param frameIdx    índice do frame; -1 = último
     */
    public CamResult generateCam(List<Tensor3> input, Integer targetClass, int frameIdx) {
        ActivationCapture capture = runCapture(input, targetClass);
        return capture.camFor(resolveFrame(frameIdx, input.size()));
    }

    /**
     * Saliência redimensionada ao frame original, colorida em JET e misturada com {@code alpha}.
     */
    public Heatmap generateHeatmapOverlay(List<Tensor3> input, RgbFrame original, Integer targetClass,
                                          int frameIdx, double alpha) {
        int idx = resolveFrame(frameIdx, input.size());
        CamResult cam = runCapture(input, targetClass).camFor(idx);
        return render(idx, cam, original, alpha);
    }

    public Heatmap generateHeatmapOverlay(List<Tensor3> input, RgbFrame original) {
        return generateHeatmapOverlay(input, original, null, -1, 0.5);
    }

    /**
     * Sobreposições de todos os frames, gravadas como {@code <video>_gradcam_frame_NNNN.png}.
     * Um único forward/backward atende a sequência inteira.
     */
    public List<Heatmap> generateSequence(List<Tensor3> input, List<RgbFrame> originals, Path outputDir,
                                          String videoName, double alpha) throws IOException {
        Files.createDirectories(outputDir);
        int length = Math.min(input.size(), originals.size());
        ActivationCapture capture = runCapture(input, null);

        List<Heatmap> results = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            Heatmap heatmap = render(i, capture.camFor(i), originals.get(i), alpha);
            Path file = outputDir.resolve(String.format(Locale.ROOT, "%s_gradcam_frame_%04d.png", videoName, i));
            if (!ImageIO.write(heatmap.overlay().toImage(), "png", file.toFile())) {
                throw new IOException("Nenhum writer PNG disponível para " + file);
            }
            results.add(heatmap.withSavedPath(file));
        }
        logger.info("🔥 Grad-CAM: " + results.size() + " heatmaps salvos em " + outputDir);
        return results;
    }

    @Override
    public void close() {
        closed = true;
    }

    private ActivationCapture runCapture(List<Tensor3> input, Integer targetClass) {
        if (closed) {
            throw new IllegalStateException("GradCamExplainer já foi fechado");
        }
        if (input == null || input.isEmpty()) {
            throw new IllegalArgumentException("Sequência de entrada vazia");
        }
        ActivationCapture capture = new ActivationCapture();
        synchronized (model) {
            try (HookHandle forward = model.registerForwardHook(capture::onActivation);
                 HookHandle backward = model.registerBackwardHook(capture::onGradient)) {
                float[] logits = model.forward(input);
                double[] probs = Softmax.apply(logits);
                int predicted = Softmax.argmax(logits);
                int target = targetClass != null ? targetClass : predicted;
                if (target < 0 || target >= logits.length) {
                    throw new IllegalArgumentException("Classe alvo inválida: " + target);
                }
                model.zeroGrad();
                model.backward(target);
                capture.predictedClass = predicted;
                capture.confidence = probs[predicted];
            }
        }
        return capture;
    }

    private static int resolveFrame(int frameIdx, int length) {
        int idx = frameIdx == -1 ? length - 1 : frameIdx;
        if (idx < 0 || idx >= length) {
            throw new IllegalArgumentException("frameIdx fora da sequência: " + frameIdx);
        }
        return idx;
    }

    private static Heatmap render(int frameIndex, CamResult cam, RgbFrame original, double alpha) {
        float[][] map = cam.map();
        int h = map.length;
        int w = map[0].length;
        float[] flat = new float[w * h];
        for (int y = 0; y < h; y++) {
            System.arraycopy(map[y], 0, flat, y * w, w);
        }
        GrayImage resized = new GrayImage(w, h, flat).resize(original.width(), original.height());

        int[] colored = new int[original.width() * original.height()];
        int[] overlay = new int[colored.length];
        int[] src = original.pixels();
        for (int y = 0; y < original.height(); y++) {
            for (int x = 0; x < original.width(); x++) {
                int i = y * original.width() + x;
                int heat = JetColormap.color((int) (255 * resized.get(x, y)));
                colored[i] = heat;
                overlay[i] = RgbFrame.pack(
                        blend(src[i] >> 16 & 0xFF, heat >> 16 & 0xFF, alpha),
                        blend(src[i] >> 8 & 0xFF, heat >> 8 & 0xFF, alpha),
                        blend(src[i] & 0xFF, heat & 0xFF, alpha));
            }
        }
        return new Heatmap(frameIndex, map,
                new RgbFrame(original.width(), original.height(), colored),
                new RgbFrame(original.width(), original.height(), overlay),
                PredictionLabel.fromClassIndex(cam.predictedClass()),
                cam.confidence() * 100, null);
    }

    private static int blend(int base, int heat, double alpha) {
        return ImageOps.clampByte((int) Math.round((1 - alpha) * base + alpha * heat));
    }

    /**
     * Saliência [0,1] na resolução do backbone, classe prevista e confiança (0-1).
     */
    public record CamResult(float[][] map, int predictedClass, double confidence) {
    }

    /**
     * Ativações e gradientes capturados por uma única chamada.
     */
    private static final class ActivationCapture {
        private final Map<Integer, Tensor3> activations = new HashMap<>();
        private final Map<Integer, Tensor3> gradients = new HashMap<>();
        private int predictedClass;
        private double confidence;

        void onActivation(int frameIndex, Tensor3 tensor) {
            activations.put(frameIndex, tensor);
        }

        void onGradient(int frameIndex, Tensor3 tensor) {
            gradients.put(frameIndex, tensor);
        }

        CamResult camFor(int frameIndex) {
            Tensor3 activation = activations.get(frameIndex);
            Tensor3 gradient = gradients.get(frameIndex);
            if (activation == null || gradient == null) {
                throw new IllegalStateException("Failed to capture gradients or activations. Check hook registration.");
            }
            float[] weights = gradient.spatialMean();
            int h = activation.height();
            int w = activation.width();
            float[][] cam = new float[h][w];
            float min = Float.MAX_VALUE;
            float max = -Float.MAX_VALUE;
            for (int y = 0; y < h; y++) {
                for (int x = 0; x < w; x++) {
                    float v = 0;
                    for (int c = 0; c < activation.channels(); c++) {
                        v += weights[c] * activation.get(c, y, x);
                    }
                    v = Math.max(0, v);
                    cam[y][x] = v;
                    min = Math.min(min, v);
                    max = Math.max(max, v);
                }
            }
            float range = max - min;
            for (int y = 0; y < h; y++) {
                for (int x = 0; x < w; x++) {
                    cam[y][x] -= min;
                    if (range > 0) {
                        cam[y][x] /= range;
                    }
                }
            }
            return new CamResult(cam, predictedClass, confidence);
        }
    }
}
