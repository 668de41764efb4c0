package com.phillippitts.bes3t.service.archive;

import com.phillippitts.bes3t.domain.AcquisitionParams;
import com.phillippitts.bes3t.domain.Metadata;
import com.phillippitts.bes3t.domain.ParseDiagnostic;
import com.phillippitts.bes3t.domain.ParseDiagnostic.Kind;
import com.phillippitts.bes3t.domain.ParseResult;
import com.phillippitts.bes3t.domain.Spectrum;
import com.phillippitts.bes3t.domain.SpectrumType;
import com.phillippitts.bes3t.exception.DecodeException;
import com.phillippitts.bes3t.exception.InvalidDescriptorException;
import com.phillippitts.bes3t.exception.LayoutMismatchException;
import com.phillippitts.bes3t.exception.MissingDataFileException;
import com.phillippitts.bes3t.service.DecoderSettings;
import com.phillippitts.bes3t.service.assembly.SpectrumAssembler;
import com.phillippitts.bes3t.service.decode.BinaryDecoder;
import com.phillippitts.bes3t.service.decode.DecodeOutcome;
import com.phillippitts.bes3t.service.decode.DecodedChannel;
import com.phillippitts.bes3t.service.inference.FilenameParamExtractor;
import com.phillippitts.bes3t.service.inference.SpectrumTypeInferencer;
import com.phillippitts.bes3t.service.layout.ChannelLayout;
import com.phillippitts.bes3t.service.layout.ChannelLayoutResolver;
import com.phillippitts.bes3t.service.metadata.AxisReconstructor;
import com.phillippitts.bes3t.service.metadata.MetadataTextParser;
import com.phillippitts.bes3t.service.normalize.NormalizedAxis;
import com.phillippitts.bes3t.service.normalize.UnitNormalizer;
import com.phillippitts.bes3t.service.quality.QualityFilter;
import com.phillippitts.bes3t.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Decodes every descriptor/data pair of a BES3T ZIP archive into spectra.
 *
 * <p>Pipeline per pair: pair lookup, descriptor parsing, layout resolution and size check,
 * type and parameter inference, x-axis reconstruction and normalization, binary decoding,
 * multi-channel quality filtering, assembly.
 *
 * <p><b>Failure policy:</b> archive-level problems raise
 * {@link com.phillippitts.bes3t.exception.InvalidArchiveException}. Anything that goes wrong
 * inside one pair is logged, recorded as a {@link ParseDiagnostic} and the pair is skipped.
 *
 * <p>Pure and synchronous: no I/O beyond the supplied buffer and no state shared between
 * calls, so one instance may serve concurrent callers.
 */
public final class ArchiveParser {

    private static final Logger LOG = LogManager.getLogger(ArchiveParser.class);

    private final DecoderSettings settings;
    private final BinaryDecoder decoder;
    private final QualityFilter qualityFilter;
    private final long maxEntrySizeBytes;

    public ArchiveParser(DecoderSettings settings) {
        this(settings, ArchiveReader.DEFAULT_MAX_ENTRY_SIZE_BYTES);
    }

    public ArchiveParser(DecoderSettings settings, long maxEntrySizeBytes) {
        if (settings == null) {
            throw new IllegalArgumentException("settings must not be null");
        }
        if (maxEntrySizeBytes <= 0) {
            throw new IllegalArgumentException("maxEntrySizeBytes must be > 0");
        }
        this.settings = settings;
        this.decoder = new BinaryDecoder(settings);
        this.qualityFilter = new QualityFilter(settings.qualityThreshold());
        this.maxEntrySizeBytes = maxEntrySizeBytes;
    }

    /**
     * @param archive ZIP archive bytes
     * @return sample name, spectra in archive order and diagnostics
     * @throws com.phillippitts.bes3t.exception.InvalidArchiveException if the buffer is not a readable archive
     */
    public ParseResult parse(byte[] archive) {
        Map<String, byte[]> entries = ArchiveReader.readEntries(archive, maxEntrySizeBytes);
        List<String> descriptors = entries.keySet().stream()
                .filter(DataFileLocator::isDescriptor)
                .collect(Collectors.toList());
        if (descriptors.isEmpty()) {
            LOG.warn("Archive holds no descriptor (.DSC) files among {} entries", entries.size());
        }

        List<Spectrum> spectra = new ArrayList<>();
        List<ParseDiagnostic> diagnostics = new ArrayList<>();
        for (String descriptor : descriptors) {
            String safeName = LogSanitizer.sanitize(descriptor);
            try {
                spectra.addAll(parsePair(descriptor, entries, diagnostics));
            } catch (MissingDataFileException e) {
                LOG.warn("No DTA found for {}", safeName);
                diagnostics.add(new ParseDiagnostic(descriptor, Kind.MISSING_DATA_FILE, e.getMessage()));
            } catch (LayoutMismatchException e) {
                LOG.warn("Size mismatch {}: got {}, expected {}", safeName, e.getActualBytes(), e.getExpectedBytes());
                diagnostics.add(new ParseDiagnostic(descriptor, Kind.SIZE_MISMATCH, e.getMessage()));
            } catch (InvalidDescriptorException e) {
                LOG.warn("Invalid descriptor {}: {}", safeName, e.getMessage());
                diagnostics.add(new ParseDiagnostic(descriptor, Kind.INVALID_DESCRIPTOR, e.getMessage()));
            } catch (RuntimeException e) {
                LOG.error("Failed to parse {}: {}", safeName, e.getMessage(), e);
                diagnostics.add(new ParseDiagnostic(descriptor, Kind.PAIR_FAILED,
                        e.getClass().getSimpleName() + ": " + e.getMessage()));
            }
        }

        String sampleName = spectra.isEmpty()
                ? settings.defaultSampleName()
                : spectra.get(0).params().map(AcquisitionParams::sampleName).orElse(settings.defaultSampleName());
        ParseResult result = new ParseResult(sampleName, spectra, diagnostics);
        LOG.info("Parsed {} spectra from {} descriptor(s), {} skipped", result.spectraCount(),
                descriptors.size(), result.skippedPairs());
        return result;
    }

    private List<Spectrum> parsePair(String descriptor, Map<String, byte[]> entries,
                                     List<ParseDiagnostic> diagnostics) {
        String dataName = DataFileLocator.locate(descriptor, entries.keySet())
                .orElseThrow(() -> new MissingDataFileException(descriptor));
        Metadata meta = MetadataTextParser.parse(decodeText(entries.get(descriptor)));
        byte[] payload = entries.get(dataName);
        ChannelLayout layout = ChannelLayoutResolver.resolve(meta, payload.length);

        String baseName = DataFileLocator.fileNameOf(DataFileLocator.stripExtension(descriptor));
        SpectrumType type = SpectrumTypeInferencer.infer(baseName, meta, layout.isTwoDimensional());
        Optional<AcquisitionParams> params =
                Optional.of(FilenameParamExtractor.extract(DataFileLocator.fileNameOf(descriptor)));

        NormalizedAxis xAxis = UnitNormalizer.normalize(
                SpectrumAssembler.axisLabel(meta, "X"),
                AxisReconstructor.axisVector(meta, "X", layout.xPoints()),
                type);

        DecodeOutcome outcome = decoder.decode(payload, layout);
        if (outcome.fastPathFailed()) {
            diagnostics.add(new ParseDiagnostic(dataName, Kind.FAST_PATH_FALLBACK, outcome.fastPathFailure()));
        }
        for (DecodedChannel channel : outcome.channels()) {
            if (channel.byteOrderSwapped()) {
                diagnostics.add(new ParseDiagnostic(dataName, Kind.ENDIAN_SWAPPED,
                        "Channel " + (channel.index() + 1) + " decoded with reversed byte order"));
            }
        }

        List<DecodedChannel> kept = qualityFilter.filter(outcome.channels());
        if (kept.size() < outcome.channels().size()) {
            diagnostics.add(new ParseDiagnostic(dataName, Kind.CHANNELS_DROPPED, "Dropped "
                    + (outcome.channels().size() - kept.size()) + " of " + outcome.channels().size()
                    + " channels scoring at or above " + qualityFilter.threshold()));
        }

        boolean suffixed = outcome.channels().size() > 1;
        List<Spectrum> spectra = new ArrayList<>(kept.size());
        for (DecodedChannel channel : kept) {
            String displayName = suffixed ? baseName + "_ch" + (channel.index() + 1) : baseName;
            spectra.add(SpectrumAssembler.assemble(displayName, type, params, xAxis.label(), xAxis.values(),
                    meta, layout, channel));
        }
        LOG.debug("{}: {} spectra of type {}", LogSanitizer.sanitize(descriptor), spectra.size(), type);
        return spectra;
    }

    /** UTF-8, malformed bytes dropped. */
    static String decodeText(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.IGNORE)
                    .onUnmappableCharacter(CodingErrorAction.IGNORE)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new DecodeException("Descriptor text is not decodable", e);
        }
    }
}
