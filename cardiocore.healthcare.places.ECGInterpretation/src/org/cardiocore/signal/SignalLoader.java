package org.cardiocore.signal;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;
import org.cardiocore.base.StageResult;
import org.cardiocore.config.PipelineSettings;
import org.cardiocore.exceptions.DecodeException;
import org.cardiocore.signal.decoder.BinaryWaveformDecoder;
import org.cardiocore.signal.decoder.CsvWaveformDecoder;
import org.cardiocore.signal.decoder.DecodedWaveform;
import org.cardiocore.signal.decoder.TextWaveformDecoder;
import org.cardiocore.signal.decoder.WaveformDecoder;
import org.cardiocore.signal.decoder.XmlWaveformDecoder;

/**
 * Signal Loader/Decoder
 *
 * Turns raw bytes into a validated {@link EcgSignal}. This is the only stage whose
 * failure aborts an analysis, so every structural problem surfaces as a
 * {@link DecodeException}:
 * - no leads                          MALFORMED_HEADER
 * - duplicate lead names              MALFORMED_HEADER
 * - unequal lead lengths              TRUNCATED_DATA
 * - shorter than the minimum duration TRUNCATED_DATA
 * - unknown declared format           UNSUPPORTED_FORMAT
 *
 * Sample rate precedence: file header, then hint, then configured default.
 * Lead name precedence: file, then hint (when the count matches), then the
 * standard 12-lead names for 12-lead data, then Lead_1..Lead_n.
 */
public class SignalLoader {

    private static final Logger logger = Logger.getLogger(SignalLoader.class);

    public static final String STAGE_NAME = "LOADER";

    private final double defaultSampleRate;
    private final double minimumDurationSeconds;
    private final Map<WaveformFormat, WaveformDecoder> decoders = new EnumMap<>(WaveformFormat.class);

    public SignalLoader(PipelineSettings settings) {
        this.defaultSampleRate = settings.getPositiveDouble("defaultSampleRate");
        this.minimumDurationSeconds = settings.getPositiveDouble("minimumDurationSeconds");
        register(new CsvWaveformDecoder());
        register(new TextWaveformDecoder());
        register(new XmlWaveformDecoder());
        register(new BinaryWaveformDecoder());
    }

    private void register(WaveformDecoder decoder) {
        decoders.put(decoder.getFormat(), decoder);
    }

    // ===== PUBLIC API =====

    public StageResult<EcgSignal> load(Path path, MetadataHint hint) throws DecodeException {
        byte[] data;
        try {
            data = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new DecodeException(DecodeException.Kind.TRUNCATED_DATA, "Unable to read " + path, e);
        }
        MetadataHint effective = MetadataHint.orEmpty(hint);
        if (effective.fileName == null) {
            effective = MetadataHint.builder()
                .analysisId(effective.analysisId)
                .format(effective.format)
                .sampleRate(effective.sampleRate)
                .leadNames(effective.leadNames)
                .fileName(path.getFileName().toString())
                .build();
        }
        return load(data, effective);
    }

    /**
     * @param hint caller hints; null is the same as {@link MetadataHint#EMPTY}
     */
    public StageResult<EcgSignal> load(byte[] data, MetadataHint hint) throws DecodeException {
        hint = MetadataHint.orEmpty(hint);
        List<String> warnings = new ArrayList<>();
        WaveformFormat format = resolveFormat(data, hint);
        logger.debug("Decoding " + data.length + " bytes as " + format);

        DecodedWaveform decoded = decoders.get(format).decode(data);

        if (decoded.getLeadCount() == 0) {
            throw new DecodeException(DecodeException.Kind.MALFORMED_HEADER, "Input contains no leads");
        }
        int sampleCount = decoded.leads[0].length;
        for (int i = 1; i < decoded.leads.length; i++) {
            if (decoded.leads[i].length != sampleCount) {
                throw new DecodeException(DecodeException.Kind.TRUNCATED_DATA, String.format(
                    "Lead %d has %d samples, lead 1 has %d", i + 1, decoded.leads[i].length, sampleCount));
            }
        }

        double sampleRate = resolveSampleRate(decoded, hint, warnings);
        double duration = sampleCount / sampleRate;
        if (duration < minimumDurationSeconds) {
            throw new DecodeException(DecodeException.Kind.TRUNCATED_DATA, String.format(
                "Recording is %.3f s long, at least %.1f s required", duration, minimumDurationSeconds));
        }

        List<String> leadNames = resolveLeadNames(decoded, hint, warnings);

        AcquisitionMetadata metadata = AcquisitionMetadata.builder()
            .sampleRate(sampleRate)
            .leadNames(leadNames)
            .sampleCount(sampleCount)
            .sourceFormat(format)
            .acquisitionDate(decoded.acquisitionDate)
            .device(decoded.deviceManufacturer, decoded.deviceModel, decoded.deviceSerial)
            .build();

        logger.info("Loaded signal: " + metadata.getSummary());
        return new StageResult<>(new EcgSignal(new WaveformMatrix(decoded.leads), metadata), warnings, false);
    }

    // ===== RESOLUTION RULES =====

    private WaveformFormat resolveFormat(byte[] data, MetadataHint hint) throws DecodeException {
        if (hint.format != null && !hint.format.trim().isEmpty()) {
            return WaveformFormat.fromName(hint.format);
        }
        if (hint.fileName != null) {
            WaveformFormat byName = WaveformFormat.fromFileName(hint.fileName);
            if (byName != null) {
                return byName;
            }
        }
        return WaveformFormat.sniff(data);
    }

    private double resolveSampleRate(DecodedWaveform decoded, MetadataHint hint, List<String> warnings)
            throws DecodeException {
        if (decoded.sampleRate != null) {
            if (!(decoded.sampleRate > 0) || decoded.sampleRate.isInfinite()) {
                throw new DecodeException(DecodeException.Kind.MALFORMED_HEADER,
                    "Header declares an invalid sample rate: " + decoded.sampleRate);
            }
            return decoded.sampleRate;
        }
        if (hint.sampleRate != null) {
            if (!(hint.sampleRate > 0) || hint.sampleRate.isInfinite()) {
                throw new DecodeException(DecodeException.Kind.MALFORMED_HEADER,
                    "Metadata declares an invalid sample rate: " + hint.sampleRate);
            }
            return hint.sampleRate;
        }
        warnings.add("Sample rate not declared, assuming " + defaultSampleRate + " Hz");
        return defaultSampleRate;
    }

    private List<String> resolveLeadNames(DecodedWaveform decoded, MetadataHint hint, List<String> warnings)
            throws DecodeException {
        int leadCount = decoded.getLeadCount();
        List<String> names;
        if (decoded.leadNames != null) {
            names = new ArrayList<>(decoded.leadNames);
        } else if (hint.leadNames != null && hint.leadNames.size() == leadCount) {
            names = new ArrayList<>(hint.leadNames);
        } else {
            if (hint.leadNames != null) {
                warnings.add(String.format("Ignoring %d hinted lead names for %d-lead data",
                    hint.leadNames.size(), leadCount));
            }
            names = leadCount == AcquisitionMetadata.STANDARD_12_LEADS.size()
                ? new ArrayList<>(AcquisitionMetadata.STANDARD_12_LEADS)
                : genericNames(leadCount);
        }

        Set<String> seen = new HashSet<>();
        for (int i = 0; i < names.size(); i++) {
            if (names.get(i) == null || names.get(i).trim().isEmpty()) {
                names.set(i, "Lead_" + (i + 1));
            }
            if (!seen.add(names.get(i))) {
                throw new DecodeException(DecodeException.Kind.MALFORMED_HEADER, "Duplicate lead name: " + names.get(i));
            }
        }
        return names;
    }

    private static List<String> genericNames(int leadCount) {
        List<String> names = new ArrayList<>();
        for (int i = 1; i <= leadCount; i++) {
            names.add("Lead_" + i);
        }
        return names;
    }
}
