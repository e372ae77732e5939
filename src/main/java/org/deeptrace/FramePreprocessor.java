package org.deeptrace;

import java.util.ArrayList;
import java.util.List;

/**
 * Converte frames RGB no tensor de entrada do classificador: redimensiona para o lado
 * configurado, escala para [0,1] e normaliza com média/desvio do ImageNet.
 */
public final class FramePreprocessor {

    private static final float[] MEAN = {0.485f, 0.456f, 0.406f};
    private static final float[] STD = {0.229f, 0.224f, 0.225f};

    private final int inputSize;

    public FramePreprocessor(int inputSize) {
        if (inputSize <= 0) throw new IllegalArgumentException("inputSize deve ser > 0");
        this.inputSize = inputSize;
    }

    public FramePreprocessor(DeepTraceConfig config) {
        this(config.gradCamInputSize());
    }

    public int getInputSize() {
        return inputSize;
    }

    public Tensor3 toTensor(RgbFrame frame) {
        RgbFrame resized = frame.resize(inputSize, inputSize);
        int plane = inputSize * inputSize;
        float[] data = new float[3 * plane];
        int[] px = resized.pixels();
        for (int i = 0; i < plane; i++) {
            int p = px[i];
            data[i] = ((p >> 16 & 0xFF) / 255f - MEAN[0]) / STD[0];
            data[plane + i] = ((p >> 8 & 0xFF) / 255f - MEAN[1]) / STD[1];
            data[2 * plane + i] = ((p & 0xFF) / 255f - MEAN[2]) / STD[2];
        }
        return new Tensor3(3, inputSize, inputSize, data);
    }

    public List<Tensor3> toTensors(List<RgbFrame> frames) {
        List<Tensor3> out = new ArrayList<>(frames.size());
        for (RgbFrame frame : frames) {
            out.add(toTensor(frame));
        }
        return out;
    }
}
