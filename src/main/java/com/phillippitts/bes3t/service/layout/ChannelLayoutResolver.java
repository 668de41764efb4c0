package com.phillippitts.bes3t.service.layout;

import com.phillippitts.bes3t.domain.Metadata;
import com.phillippitts.bes3t.exception.InvalidDescriptorException;
import com.phillippitts.bes3t.exception.LayoutMismatchException;

import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Derives per-dataset binary layout from descriptor fields and checks it against the payload.
 *
 * <p>Fields used:
 * <ul>
 *   <li>{@code XPTS}, {@code YPTS} (default 1) - grid size</li>
 *   <li>{@code IKKF} (default {@code CPLX}) - comma list, {@code CPLX} marks a complex dataset</li>
 *   <li>{@code IRFMT} (default {@code F}) - comma list of element formats ({@code D}, {@code I}, {@code F})</li>
 *   <li>{@code BSEQ} (default {@code BIG}) - byte order</li>
 * </ul>
 * The shorter of the two lists is padded with its last entry. Datasets are laid out back to
 * back in list order. Only an explicit {@code CPLX} in {@code IKKF} marks the layout as
 * {@linkplain ChannelLayout#complexDeclared() declared complex}.
 */
public final class ChannelLayoutResolver {

    private ChannelLayoutResolver() {}

    /**
     * Resolves the layout declared by {@code meta}.
     *
     * @throws InvalidDescriptorException if {@code XPTS} is missing or not positive
     */
    public static ChannelLayout resolve(Metadata meta) {
        int xpts = meta.getInt("XPTS", 0);
        if (xpts <= 0) {
            throw new InvalidDescriptorException("XPTS", "expected a positive point count, got '"
                    + meta.getString("XPTS", "") + "'");
        }
        int ypts = meta.getInt("YPTS", 1);
        if (ypts <= 0) {
            throw new InvalidDescriptorException("YPTS", "expected a positive row count, got '"
                    + meta.getString("YPTS", "") + "'");
        }
        int pointCount = Math.multiplyExact(xpts, ypts);

        boolean complexDeclared = meta.getString("IKKF", "REAL").toUpperCase(Locale.ROOT).contains("CPLX");
        List<String> kinds = splitList(meta.getString("IKKF", "CPLX"));
        List<String> formats = splitList(meta.getString("IRFMT", "F"));
        int datasets = Math.max(kinds.size(), formats.size());
        pad(kinds, datasets);
        pad(formats, datasets);

        ByteOrder order = meta.getString("BSEQ", "BIG").toUpperCase(Locale.ROOT).contains("BIG")
                ? ByteOrder.BIG_ENDIAN
                : ByteOrder.LITTLE_ENDIAN;

        List<ChannelConfig> channels = new ArrayList<>(datasets);
        for (int i = 0; i < datasets; i++) {
            boolean complex = kinds.get(i).toUpperCase(Locale.ROOT).contains("CPLX");
            ElementType type = ElementType.fromFormatCode(formats.get(i));
            long bytes = (long) pointCount * (complex ? 2 : 1) * type.size();
            channels.add(new ChannelConfig(complex, type, order, bytes, pointCount));
        }
        return new ChannelLayout(xpts, ypts, channels, complexDeclared);
    }

    /**
     * Resolves the layout and requires it to account for exactly {@code payloadLength} bytes.
     *
     * @throws LayoutMismatchException if the declared datasets do not add up to the payload length
     */
    public static ChannelLayout resolve(Metadata meta, long payloadLength) {
        ChannelLayout layout = resolve(meta);
        long expected = layout.totalBytes();
        if (expected != payloadLength) {
            throw new LayoutMismatchException(expected, payloadLength);
        }
        return layout;
    }

    private static List<String> splitList(String value) {
        List<String> items = new ArrayList<>();
        Arrays.stream(value.split(",")).map(String::trim).forEach(items::add);
        return items;
    }

    private static void pad(List<String> items, int size) {
        String last = items.get(items.size() - 1);
        while (items.size() < size) {
            items.add(last);
        }
    }
}
