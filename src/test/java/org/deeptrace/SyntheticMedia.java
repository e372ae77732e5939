package org.deeptrace;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;

/**
 * Mídia sintética para os testes: frames com um "rosto" cor de pele sobre fundo azul,
 * tons puros e WAVs montados em memória.
 */
final class SyntheticMedia {

    static final int[] SKIN = {224, 172, 140};
    static final int[] DARK_SKIN = {120, 80, 60};
    static final int[] BACKGROUND = {30, 60, 200};

    private SyntheticMedia() {
    }

    /**
     * Frame 320x240 com um retângulo de pele uniforme.
     */
    static RgbFrame faceFrame(int x, int y, int w, int h, int[] skin) {
        int width = 320;
        int height = 240;
        int[] px = new int[width * height];
        int bg = RgbFrame.pack(BACKGROUND[0], BACKGROUND[1], BACKGROUND[2]);
        int face = RgbFrame.pack(skin[0], skin[1], skin[2]);
        for (int j = 0; j < height; j++) {
            for (int i = 0; i < width; i++) {
                boolean inside = i >= x && i < x + w && j >= y && j < y + h;
                px[j * width + i] = inside ? face : bg;
            }
        }
        return new RgbFrame(width, height, px);
    }

    static RgbFrame faceFrame() {
        return faceFrame(100, 60, 80, 100, SKIN);
    }

    /**
     * Frame com textura determinística (gradiente + padrão xadrez) para os analisadores de movimento.
     */
    static RgbFrame texturedFrame(int shift) {
        int width = 64;
        int height = 48;
        int[] px = new int[width * height];
        for (int j = 0; j < height; j++) {
            for (int i = 0; i < width; i++) {
                int v = ((i + shift) * 4 + j * 3) % 256;
                int checker = (((i + shift) / 8 + j / 8) % 2) * 40;
                px[j * width + i] = RgbFrame.pack(v, Math.min(255, v / 2 + checker), 255 - v);
            }
        }
        return new RgbFrame(width, height, px);
    }

    static List<RgbFrame> repeat(RgbFrame frame, int count) {
        List<RgbFrame> frames = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            frames.add(frame);
        }
        return frames;
    }

    static float[] sine(double hz, int sampleRate, double seconds, double amplitude) {
        float[] samples = new float[(int) (sampleRate * seconds)];
        for (int n = 0; n < samples.length; n++) {
            samples[n] = (float) (amplitude * Math.sin(2 * Math.PI * hz * n / sampleRate));
        }
        return samples;
    }

    /**
     * WAV PCM 16 bits; {@code extraChunk} insere um chunk desconhecido (com tamanho ímpar) antes do data.
     */
    static byte[] wav(short[] interleaved, int channels, int sampleRate, boolean extraChunk) {
        int dataBytes = interleaved.length * 2;
        int extra = extraChunk ? 8 + 3 + 1 : 0;
        ByteBuffer buf = ByteBuffer.allocate(12 + 24 + extra + 8 + dataBytes).order(ByteOrder.LITTLE_ENDIAN);
        buf.put("RIFF".getBytes()).putInt(4 + 24 + extra + 8 + dataBytes).put("WAVE".getBytes());
        buf.put("fmt ".getBytes()).putInt(16)
                .putShort((short) 1)
                .putShort((short) channels)
                .putInt(sampleRate)
                .putInt(sampleRate * channels * 2)
                .putShort((short) (channels * 2))
                .putShort((short) 16);
        if (extraChunk) {
            buf.put("LIST".getBytes()).putInt(3).put(new byte[]{1, 2, 3}).put((byte) 0);
        }
        buf.put("data".getBytes()).putInt(dataBytes);
        for (short s : interleaved) {
            buf.putShort(s);
        }
        return buf.array();
    }
}
