package com.phillippitts.bes3t.service.archive;

import com.phillippitts.bes3t.exception.InvalidArchiveException;
import com.phillippitts.bes3t.util.LogSanitizer;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.commons.compress.utils.SeekableInMemoryByteChannel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads every file entry of an in-memory ZIP archive into memory, preserving archive order.
 *
 * <p>Entries are located through the central directory, so archives written by streaming
 * tools (entries followed by data descriptors, stored or deflated) and archives with leading
 * bytes before the first entry are read like any other. Directory entries are skipped. A
 * repeated entry name keeps its first position and its last content. Each entry is bounded by
 * {@code maxEntrySizeBytes} once decompressed.
 */
public final class ArchiveReader {

    private static final Logger LOG = LogManager.getLogger(ArchiveReader.class);

    /** Default bound for one decompressed entry: 128 MB. */
    public static final long DEFAULT_MAX_ENTRY_SIZE_BYTES = 128L * 1024 * 1024;

    private static final int BUFFER_SIZE = 8192;

    private ArchiveReader() {}

    /**
     * @return entry name to content, in archive order
     * @throws InvalidArchiveException if the buffer is null, not a ZIP, corrupt, or holds an oversized entry
     */
    public static Map<String, byte[]> readEntries(byte[] archive, long maxEntrySizeBytes) {
        if (archive == null) {
            throw new InvalidArchiveException("Archive buffer must not be null");
        }

        Map<String, byte[]> entries = new LinkedHashMap<>();
        try (ZipFile zip = ZipFile.builder()
                .setSeekableByteChannel(new SeekableInMemoryByteChannel(archive))
                .setCharset(StandardCharsets.UTF_8)
                .get()) {
            Enumeration<ZipArchiveEntry> all = zip.getEntriesInPhysicalOrder();
            while (all.hasMoreElements()) {
                ZipArchiveEntry entry = all.nextElement();
                if (entry.isDirectory()) {
                    continue;
                }
                if (!zip.canReadEntryData(entry)) {
                    throw new InvalidArchiveException("Entry '" + LogSanitizer.sanitize(entry.getName())
                            + "' uses an unsupported compression method " + entry.getMethod());
                }
                try (InputStream in = zip.getInputStream(entry)) {
                    entries.put(entry.getName(), readBounded(in, entry.getName(), maxEntrySizeBytes));
                }
            }
        } catch (IOException e) {
            throw new InvalidArchiveException("Not a readable ZIP archive (" + archive.length + " bytes): "
                    + e.getMessage(), e);
        }
        LOG.debug("Read {} entries from archive of {} bytes", entries.size(), archive.length);
        return Collections.unmodifiableMap(entries);
    }

    private static byte[] readBounded(InputStream in, String name, long max) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[BUFFER_SIZE];
        long total = 0;
        int n;
        while ((n = in.read(buffer)) != -1) {
            total += n;
            if (total > max) {
                throw new InvalidArchiveException("Entry '" + LogSanitizer.sanitize(name)
                        + "' exceeds limit of " + max + " bytes");
            }
            out.write(buffer, 0, n);
        }
        return out.toByteArray();
    }
}
