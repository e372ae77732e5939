package org.deeptrace;

import java.util.List;

/**
 * Contrato do classificador externo de sequências de frames (backbone convolucional,
 * estágio temporal e camada linear final). Índice 0 = FAKE, índice 1 = REAL.
 *
 * <p>Os hooks do backbone disparam apenas dentro de {@link #forward(List)} e
 * {@link #backward(int)}, uma vez por frame da sequência. Implementações não precisam
 * ser thread-safe: quem compartilha uma instância deve sincronizar no próprio objeto.</p>
 */
public interface DeepfakeClassifier {

    int NUM_CLASSES = 2;

    /**
     * Logits da sequência inteira (tamanho {@link #NUM_CLASSES}).
     */
    float[] forward(List<Tensor3> frames);

    /**
     * Mapa de ativação final do backbone para um frame, sem disparar hooks.
     */
    Tensor3 backbone(Tensor3 frame);

    /**
     * Camada linear final aplicada a features já agregadas por pooling.
     */
    float[] linearHead(float[] pooledFeatures);

    void zeroGrad();

    /**
     * Retropropaga a partir do logit da classe indicada do último {@link #forward(List)}.
     */
    void backward(int classIndex);

    HookHandle registerForwardHook(BackboneHook hook);

    HookHandle registerBackwardHook(BackboneHook hook);

    /**
     * Recebe a ativação (forward) ou o gradiente (backward) do backbone para um frame.
     */
    @FunctionalInterface
    interface BackboneHook {
        void onTensor(int frameIndex, Tensor3 tensor);
    }
}
