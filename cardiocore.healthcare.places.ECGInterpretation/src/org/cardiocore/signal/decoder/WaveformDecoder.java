package org.cardiocore.signal.decoder;

import org.cardiocore.exceptions.DecodeException;
import org.cardiocore.signal.WaveformFormat;

/**
 * Decodes one raw encoding into lead-major samples. Implementations are stateless.
 */
public interface WaveformDecoder {

    WaveformFormat getFormat();

    DecodedWaveform decode(byte[] data) throws DecodeException;

    /**
     * Parse one sample value; unparsable or non-finite values mean the data block is corrupt
     */
    static double parseSample(String text, String location) throws DecodeException {
        try {
            double value = Double.parseDouble(text);
            if (Double.isFinite(value)) {
                return value;
            }
        } catch (NumberFormatException e) {
            throw new DecodeException(DecodeException.Kind.TRUNCATED_DATA,
                "Unreadable sample '" + text + "' at " + location, e);
        }
        throw new DecodeException(DecodeException.Kind.TRUNCATED_DATA,
            "Non-finite sample '" + text + "' at " + location);
    }
}
