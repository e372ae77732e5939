package org.deeptrace;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Leitor de WAV PCM 16 bits que percorre os chunks RIFF → fmt → data com
 * verificação de limites. Entradas malformadas resultam em {@link Result#failure}
 * em vez de exceção.
 */
public final class WavReader {

    private static final Logger logger = Logger.getLogger(WavReader.class.getName());

    private static final int FORMAT_PCM = 1;
    private static final int FORMAT_EXTENSIBLE = 0xFFFE;
    private static final int MIN_FMT_SIZE = 16;

    private WavReader() {
    }

    public static Result read(Path file) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            return Result.failure("Erro lendo WAV " + file + ": " + e.getMessage());
        }
        return parse(bytes);
    }

    public static Result parse(byte[] bytes) {
        ByteBuffer buf = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        if (buf.remaining() < 12) {
            return Result.failure("Arquivo curto demais para um cabeçalho RIFF");
        }
        if (!fourCc(buf, 0).equals("RIFF")) {
            return Result.failure("Assinatura RIFF ausente");
        }
        if (!fourCc(buf, 8).equals("WAVE")) {
            return Result.failure("Formato WAVE ausente");
        }

        Format format = null;
        int pos = 12;
        while (pos + 8 <= bytes.length) {
            String id = fourCc(buf, pos);
            long size = Integer.toUnsignedLong(buf.getInt(pos + 4));
            int body = pos + 8;
            long available = bytes.length - (long) body;

            if (id.equals("fmt ")) {
                if (size < MIN_FMT_SIZE || size > available) {
                    return Result.failure("Chunk fmt truncado ou inválido (" + size + " bytes)");
                }
                format = new Format(
                        Short.toUnsignedInt(buf.getShort(body)),
                        Short.toUnsignedInt(buf.getShort(body + 2)),
                        buf.getInt(body + 4),
                        Short.toUnsignedInt(buf.getShort(body + 14)));
            } else if (id.equals("data")) {
                if (format == null) {
                    return Result.failure("Chunk data encontrado antes do chunk fmt");
                }
                if (size > available) {
                    // Comum quando o WAV foi escrito em streaming e o tamanho não foi corrigido
                    logger.fine(() -> "Chunk data declara " + size + " bytes, disponíveis " + available);
                }
                return decode(format, buf, body, (int) Math.min(size, available));
            }

            long next = body + size + (size & 1);
            if (next > bytes.length) {
                break;
            }
            pos = (int) next;
        }
        return Result.failure(format == null ? "Chunk fmt não encontrado" : "Chunk data não encontrado");
    }

    private static Result decode(Format format, ByteBuffer buf, int offset, int length) {
        if (format.audioFormat() != FORMAT_PCM && format.audioFormat() != FORMAT_EXTENSIBLE) {
            return Result.failure("Formato de áudio não suportado: " + format.audioFormat());
        }
        if (format.bitsPerSample() != 16) {
            return Result.failure("Apenas PCM 16 bits é suportado (recebido " + format.bitsPerSample() + ")");
        }
        if (format.channels() <= 0 || format.sampleRate() <= 0) {
            return Result.failure("Canais ou taxa de amostragem inválidos");
        }

        int frameBytes = 2 * format.channels();
        int frames = length / frameBytes;
        float[] samples = new float[frames];
        for (int i = 0; i < frames; i++) {
            int base = offset + i * frameBytes;
            float sum = 0;
            for (int c = 0; c < format.channels(); c++) {
                sum += buf.getShort(base + 2 * c) / 32768.0f;
            }
            samples[i] = sum / format.channels();
        }
        return Result.success(new AudioClip(samples, format.sampleRate()));
    }

    private static String fourCc(ByteBuffer buf, int pos) {
        char[] chars = new char[4];
        for (int i = 0; i < 4; i++) {
            chars[i] = (char) (buf.get(pos + i) & 0xFF);
        }
        return new String(chars);
    }

    private record Format(int audioFormat, int channels, int sampleRate, int bitsPerSample) {
    }

    /**
     * Áudio decodificado ou o motivo da falha.
     */
    public record Result(AudioClip clip, String error) {

        public static Result success(AudioClip clip) {
            return new Result(clip, null);
        }

        public static Result failure(String error) {
            return new Result(null, error);
        }

        public boolean isSuccess() {
            return clip != null;
        }
    }
}
