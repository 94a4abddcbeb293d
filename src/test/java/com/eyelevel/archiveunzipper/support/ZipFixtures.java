package com.eyelevel.archiveunzipper.support;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Builds ZIP archives for tests. Entries whose name ends with '/' are written as directories.
 */
public final class ZipFixtures {

    /**
     * An archive with no entries: only the end-of-central-directory record.
     */
    public static final byte[] EMPTY_ARCHIVE = {
            0x50, 0x4b, 0x05, 0x06, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0
    };

    private ZipFixtures() {
    }

    /**
     * @param entries alternating entry names and text contents; directory names take an ignored content.
     */
    public static byte[] zip(String... entries) {
        if (entries.length % 2 != 0) {
            throw new IllegalArgumentException("Entries must be given as name/content pairs");
        }
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ZipOutputStream zos = new ZipOutputStream(bytes)) {
            for (int i = 0; i < entries.length; i += 2) {
                zos.putNextEntry(new ZipEntry(entries[i]));
                if (!entries[i].endsWith("/")) {
                    zos.write(entries[i + 1].getBytes(StandardCharsets.UTF_8));
                }
                zos.closeEntry();
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }

    /**
     * Returns a copy of {@code archive} whose first entry has an invalid deflate block header. The central
     * directory stays intact, so the archive opens and the failure shows only when that entry is read.
     */
    public static byte[] corruptFirstEntryData(byte[] archive) {
        byte[] copy = archive.clone();
        int nameLength = (copy[26] & 0xff) | (copy[27] & 0xff) << 8;
        int extraLength = (copy[28] & 0xff) | (copy[29] & 0xff) << 8;
        copy[30 + nameLength + extraLength] = (byte) 0xff;
        return copy;
    }

    public static String text(byte[] content) {
        return new String(content, StandardCharsets.UTF_8);
    }
}
