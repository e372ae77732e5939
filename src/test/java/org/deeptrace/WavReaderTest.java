package org.deeptrace;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class WavReaderTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void stereoIsDownmixedAndUnknownChunksSkipped() {
        short[] interleaved = {16384, 0, -16384, -16384, 8192, 8192};
        byte[] wav = SyntheticMedia.wav(interleaved, 2, 22050, true);

        WavReader.Result result = WavReader.parse(wav);

        assertTrue(result.error(), result.isSuccess());
        AudioClip clip = result.clip();
        assertEquals(22050, clip.sampleRate());
        assertEquals(3, clip.samples().length);
        assertEquals(0.25f, clip.samples()[0], 1e-6f);
        assertEquals(-0.5f, clip.samples()[1], 1e-6f);
        assertEquals(0.25f, clip.samples()[2], 1e-6f);
    }

    @Test
    public void readsFromDisk() throws Exception {
        File file = folder.newFile("tone.wav");
        Files.write(file.toPath(), SyntheticMedia.wav(new short[]{1000, 2000, 3000, 4000}, 1, 16000, false));

        WavReader.Result result = WavReader.read(file.toPath());

        assertTrue(result.isSuccess());
        assertEquals(4, result.clip().samples().length);
    }

    @Test
    public void missingFileFails() {
        WavReader.Result result = WavReader.read(folder.getRoot().toPath().resolve("none.wav"));

        assertFalse(result.isSuccess());
    }

    @Test
    public void tooShortFails() {
        assertFalse(WavReader.parse(new byte[]{'R', 'I', 'F', 'F'}).isSuccess());
    }

    @Test
    public void badSignatureFails() {
        byte[] wav = SyntheticMedia.wav(new short[]{1, 2}, 1, 16000, false);
        wav[0] = 'X';

        WavReader.Result result = WavReader.parse(wav);

        assertFalse(result.isSuccess());
        assertEquals("Assinatura RIFF ausente", result.error());
    }

    @Test
    public void missingFmtChunkFails() {
        ByteBuffer buf = ByteBuffer.allocate(12 + 8 + 4).order(ByteOrder.LITTLE_ENDIAN);
        buf.put(ascii("RIFF")).putInt(16).put(ascii("WAVE"));
        buf.put(ascii("LIST")).putInt(4).putInt(0);

        WavReader.Result result = WavReader.parse(buf.array());

        assertFalse(result.isSuccess());
        assertEquals("Chunk fmt não encontrado", result.error());
    }

    @Test
    public void dataBeforeFmtFails() {
        ByteBuffer buf = ByteBuffer.allocate(12 + 8 + 4).order(ByteOrder.LITTLE_ENDIAN);
        buf.put(ascii("RIFF")).putInt(16).put(ascii("WAVE"));
        buf.put(ascii("data")).putInt(4).putInt(0);

        WavReader.Result result = WavReader.parse(buf.array());

        assertFalse(result.isSuccess());
        assertEquals("Chunk data encontrado antes do chunk fmt", result.error());
    }

    @Test
    public void eightBitPcmIsRejected() {
        byte[] wav = SyntheticMedia.wav(new short[]{1, 2}, 1, 16000, false);
        // bitsPerSample fica no offset 34
        wav[34] = 8;

        WavReader.Result result = WavReader.parse(wav);

        assertFalse(result.isSuccess());
        assertTrue(result.error().contains("16 bits"));
    }

    @Test
    public void truncatedDataChunkIsClamped() {
        byte[] wav = SyntheticMedia.wav(new short[]{100, 200, 300}, 1, 16000, false);
        byte[] truncated = java.util.Arrays.copyOf(wav, wav.length - 2);

        WavReader.Result result = WavReader.parse(truncated);

        assertTrue(result.isSuccess());
        assertEquals(2, result.clip().samples().length);
    }

    private static byte[] ascii(String s) {
        return s.getBytes(java.nio.charset.StandardCharsets.US_ASCII);
    }
}
