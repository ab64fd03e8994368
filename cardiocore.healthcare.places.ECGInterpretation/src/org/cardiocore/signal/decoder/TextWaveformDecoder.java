package org.cardiocore.signal.decoder;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.cardiocore.exceptions.DecodeException;
import org.cardiocore.signal.WaveformFormat;

/**
 * Whitespace separated samples, one row per sample. Lines starting with '#' are comments.
 * A first row containing a non-numeric cell is a header of lead names, so a
 * single-column export with a lead label reads the same way as its CSV form.
 */
public class TextWaveformDecoder implements WaveformDecoder {

    @Override
    public WaveformFormat getFormat() {
        return WaveformFormat.TEXT;
    }

    @Override
    public DecodedWaveform decode(byte[] data) throws DecodeException {
        String text = new String(data, StandardCharsets.UTF_8);
        String[] lines = text.split("\\r?\\n");

        List<double[]> samples = new ArrayList<>();
        List<String> leadNames = null;
        int width = -1;
        for (int lineNumber = 0; lineNumber < lines.length; lineNumber++) {
            String line = lines[lineNumber].replace("\uFEFF", "").trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            String[] cells = line.split("\\s+");
            if (width < 0) {
                width = cells.length;
                if (isHeader(cells)) {
                    leadNames = Arrays.asList(cells);
                    continue;
                }
            } else if (cells.length != width) {
                throw new DecodeException(DecodeException.Kind.TRUNCATED_DATA, String.format(
                    "Line %d has %d values, expected %d", lineNumber + 1, cells.length, width));
            }
            double[] values = new double[width];
            for (int c = 0; c < width; c++) {
                values[c] = WaveformDecoder.parseSample(cells[c], "line " + (lineNumber + 1));
            }
            samples.add(values);
        }
        if (width < 0) {
            return new DecodedWaveform(new double[0][0], null, null);
        }
        return new DecodedWaveform(DecodedWaveform.toLeadMajor(samples, width), leadNames, null);
    }

    private static boolean isHeader(String[] cells) {
        for (String cell : cells) {
            try {
                Double.parseDouble(cell);
            } catch (NumberFormatException e) {
                return true;
            }
        }
        return false;
    }
}
