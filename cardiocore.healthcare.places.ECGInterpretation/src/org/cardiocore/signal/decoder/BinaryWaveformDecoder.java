package org.cardiocore.signal.decoder;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.cardiocore.exceptions.DecodeException;
import org.cardiocore.signal.WaveformFormat;

/**
 * Binary acquisition format written by the bedside recorders, big-endian throughout:
 *
 * <pre>
 * magic         4 bytes  "ECG1"
 * version       u16      1
 * leadCount     u16
 * sampleRate    u32      Hz
 * sampleCount   u32      samples per lead
 * resolution    u32      nanovolts per count
 * leadCount x { u8 length, US-ASCII name }
 * sampleCount x leadCount signed 16-bit counts, interleaved by sample
 * </pre>
 */
public class BinaryWaveformDecoder implements WaveformDecoder {

    public static final int SUPPORTED_VERSION = 1;
    public static final int FIXED_HEADER_BYTES = 20;

    @Override
    public WaveformFormat getFormat() {
        return WaveformFormat.PROPRIETARY;
    }

    @Override
    public DecodedWaveform decode(byte[] data) throws DecodeException {
        ByteBuffer buffer = ByteBuffer.wrap(data).order(ByteOrder.BIG_ENDIAN);

        byte[] magic = WaveformFormat.PROPRIETARY_MAGIC;
        if (data.length < magic.length) {
            throw new DecodeException(DecodeException.Kind.UNSUPPORTED_FORMAT, "Input too short for binary waveform");
        }
        for (int i = 0; i < magic.length; i++) {
            if (buffer.get() != magic[i]) {
                throw new DecodeException(DecodeException.Kind.UNSUPPORTED_FORMAT, "Missing binary waveform signature");
            }
        }
        if (data.length < FIXED_HEADER_BYTES) {
            throw new DecodeException(DecodeException.Kind.MALFORMED_HEADER, "Binary header truncated");
        }

        int version = Short.toUnsignedInt(buffer.getShort());
        if (version != SUPPORTED_VERSION) {
            throw new DecodeException(DecodeException.Kind.UNSUPPORTED_FORMAT, "Unsupported binary version " + version);
        }
        int leadCount = Short.toUnsignedInt(buffer.getShort());
        long sampleRate = Integer.toUnsignedLong(buffer.getInt());
        long sampleCount = Integer.toUnsignedLong(buffer.getInt());
        long resolutionNv = Integer.toUnsignedLong(buffer.getInt());

        if (leadCount == 0) {
            throw new DecodeException(DecodeException.Kind.MALFORMED_HEADER, "Binary header declares no leads");
        }
        if (sampleCount > Integer.MAX_VALUE) {
            throw new DecodeException(DecodeException.Kind.MALFORMED_HEADER,
                "Binary header declares " + sampleCount + " samples per lead");
        }
        if (sampleRate == 0) {
            throw new DecodeException(DecodeException.Kind.MALFORMED_HEADER, "Binary header declares a zero sample rate");
        }
        if (resolutionNv == 0) {
            throw new DecodeException(DecodeException.Kind.MALFORMED_HEADER, "Binary header declares a zero resolution");
        }

        List<String> leadNames = new ArrayList<>();
        try {
            for (int i = 0; i < leadCount; i++) {
                int length = Byte.toUnsignedInt(buffer.get());
                byte[] name = new byte[length];
                buffer.get(name);
                leadNames.add(new String(name, StandardCharsets.US_ASCII).trim());
            }
        } catch (BufferUnderflowException e) {
            throw new DecodeException(DecodeException.Kind.MALFORMED_HEADER, "Binary lead table truncated", e);
        }

        long expectedBytes = sampleCount * leadCount * 2L;
        if (buffer.remaining() < expectedBytes) {
            throw new DecodeException(DecodeException.Kind.TRUNCATED_DATA, String.format(
                "Binary sample block has %d bytes, header declares %d", buffer.remaining(), expectedBytes));
        }

        // counts x nV -> mV
        double scale = resolutionNv / 1_000_000.0;
        int samples = (int) sampleCount;
        double[][] leads = new double[leadCount][samples];
        for (int s = 0; s < samples; s++) {
            for (int l = 0; l < leadCount; l++) {
                leads[l][s] = buffer.getShort() * scale;
            }
        }
        return new DecodedWaveform(leads, leadNames, (double) sampleRate);
    }
}
