package org.cardiocore.signal.decoder;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.cardiocore.exceptions.DecodeException;
import org.cardiocore.signal.WaveformFormat;
import org.cardiocore.utils.CsvTableReader;

/**
 * Comma separated samples, one row per sample and one column per lead.
 * The first row is treated as a header of lead names when any of its cells is
 * not a number.
 */
public class CsvWaveformDecoder implements WaveformDecoder {

    private final CsvTableReader tableReader = new CsvTableReader();

    @Override
    public WaveformFormat getFormat() {
        return WaveformFormat.CSV;
    }

    @Override
    public DecodedWaveform decode(byte[] data) throws DecodeException {
        List<String[]> rows;
        try {
            rows = tableReader.readRows(new InputStreamReader(new ByteArrayInputStream(data), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new DecodeException(DecodeException.Kind.MALFORMED_HEADER, "Unreadable CSV content", e);
        }
        if (rows.isEmpty()) {
            return new DecodedWaveform(new double[0][0], null, null);
        }

        List<String> leadNames = null;
        int firstDataRow = 0;
        if (isHeader(rows.get(0))) {
            leadNames = stripBom(Arrays.asList(rows.get(0)));
            for (String name : leadNames) {
                if (name.isEmpty()) {
                    throw new DecodeException(DecodeException.Kind.MALFORMED_HEADER, "CSV header has an empty lead name");
                }
            }
            firstDataRow = 1;
        }

        int width = rows.get(0).length;
        List<double[]> samples = new ArrayList<>();
        for (int r = firstDataRow; r < rows.size(); r++) {
            String[] row = rows.get(r);
            if (row.length != width) {
                throw new DecodeException(DecodeException.Kind.TRUNCATED_DATA, String.format(
                    "CSV row %d has %d columns, expected %d", r + 1, row.length, width));
            }
            double[] values = new double[width];
            for (int c = 0; c < width; c++) {
                values[c] = WaveformDecoder.parseSample(row[c], "row " + (r + 1) + ", column " + (c + 1));
            }
            samples.add(values);
        }
        return new DecodedWaveform(DecodedWaveform.toLeadMajor(samples, width), leadNames, null);
    }

    private static boolean isHeader(String[] row) {
        for (String cell : row) {
            try {
                Double.parseDouble(stripBom(cell));
            } catch (NumberFormatException e) {
                return true;
            }
        }
        return false;
    }

    private static List<String> stripBom(List<String> names) {
        List<String> cleaned = new ArrayList<>(names);
        if (!cleaned.isEmpty()) {
            cleaned.set(0, stripBom(cleaned.get(0)));
        }
        return cleaned;
    }

    private static String stripBom(String cell) {
        return !cell.isEmpty() && cell.charAt(0) == '\uFEFF' ? cell.substring(1).trim() : cell;
    }
}
