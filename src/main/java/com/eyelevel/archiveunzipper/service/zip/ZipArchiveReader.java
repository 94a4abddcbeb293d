package com.eyelevel.archiveunzipper.service.zip;

import com.eyelevel.archiveunzipper.config.UnzipProcessingConfig;
import com.eyelevel.archiveunzipper.exception.ArchiveExtractionException;
import com.eyelevel.archiveunzipper.service.storage.ObjectKeys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.commons.compress.utils.SeekableInMemoryByteChannel;
import org.apache.commons.io.IOUtils;
import org.apache.commons.io.input.ProxyInputStream;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Enumeration;

/**
 * Reads a ZIP archive held in memory and hands each file entry to a handler, one at a time.
 * <p>
 * The archive is opened through its central directory (random access), so entries are visited in
 * central directory order and their sizes are known before their data is read.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ZipArchiveReader {

    private final UnzipProcessingConfig config;

    /**
     * Visits every file entry of the archive in order. Directory entries and entries without a leaf name
     * are skipped, as are OS metadata entries when {@code app.unzip.skip-system-entries} is set.
     * <p>
     * Exceptions thrown by the handler stop the iteration and propagate unchanged, except when the entry data
     * itself could not be decompressed: that is reported as an {@link ArchiveExtractionException}.
     *
     * @param archive the complete archive content.
     * @param handler receives each file entry with an open stream over its decompressed bytes.
     * @return the number of entries handed to the handler.
     * @throws ArchiveExtractionException if the archive cannot be opened or an entry cannot be read.
     */
    public int readEntries(final byte[] archive, final ZipEntryHandler handler) {
        int visited = 0;
        try (ZipFile zipFile = open(archive)) {
            final Enumeration<ZipArchiveEntry> entries = zipFile.getEntries();
            while (entries.hasMoreElements()) {
                final ZipArchiveEntry entry = entries.nextElement();
                final String fullPath = entry.getName();
                final String leafName = ObjectKeys.leafName(fullPath);
                if (shouldSkipEntry(fullPath, leafName)) {
                    log.debug("Skipping archive entry '{}'", fullPath);
                    continue;
                }
                visitEntry(zipFile, entry, leafName, handler);
                visited++;
            }
        } catch (IOException e) {
            throw new ArchiveExtractionException("Failed to read ZIP archive: " + e.getMessage(), e);
        }
        return visited;
    }

    private ZipFile open(final byte[] archive) {
        try {
            return ZipFile.builder()
                          .setSeekableByteChannel(new SeekableInMemoryByteChannel(archive))
                          .get();
        } catch (IOException e) {
            throw new ArchiveExtractionException("Invalid or corrupted ZIP archive: " + e.getMessage(), e);
        }
    }

    private void visitEntry(final ZipFile zipFile, final ZipArchiveEntry entry, final String leafName,
                            final ZipEntryHandler handler) throws IOException {
        try (InputStream raw = zipFile.getInputStream(entry)) {
            if (entry.getSize() >= 0) {
                final EntryContentStream content = new EntryContentStream(raw);
                try {
                    handler.handle(new ZipFileEntry(entry.getName(), leafName, entry.getSize()), content);
                } catch (RuntimeException e) {
                    throw content.readFailure() == null ? e : entryReadFailure(entry, content.readFailure(), e);
                }
            } else {
                // Size missing from the central directory: buffer the entry to learn it.
                final byte[] content = IOUtils.toByteArray(raw);
                handler.handle(new ZipFileEntry(entry.getName(), leafName, content.length),
                               new ByteArrayInputStream(content));
            }
        }
    }

    /**
     * Corrupt entry data surfaces while the handler consumes the stream, usually wrapped by whatever
     * consumed it. The read failure decides the outcome, the handler's exception is kept as suppressed.
     */
    private static ArchiveExtractionException entryReadFailure(final ZipArchiveEntry entry,
                                                               final IOException readFailure,
                                                               final RuntimeException handlerFailure) {
        final ArchiveExtractionException exception = new ArchiveExtractionException(
                String.format("Failed to read archive entry '%s': %s", entry.getName(), readFailure.getMessage()),
                readFailure);
        exception.addSuppressed(handlerFailure);
        return exception;
    }

    /**
     * Determines whether an entry is something other than a file to extract.
     *
     * @param fullPath the entry path as stored in the archive.
     * @param leafName the file name portion of that path.
     * @return {@code true} if the entry should be skipped.
     */
    private boolean shouldSkipEntry(final String fullPath, final String leafName) {
        if (fullPath.endsWith("/") || leafName.isEmpty()) {
            return true;
        }
        if (!config.isSkipSystemEntries()) {
            return false;
        }

        final String normalizedPath = fullPath.replace('\\', '/');
        final String rootDir = normalizedPath.contains("/")
                               ? normalizedPath.substring(0, normalizedPath.indexOf('/'))
                               : "";
        return config.getSystemEntryNames().contains(leafName)
                || config.getSystemEntryNames().contains(rootDir)
                || leafName.startsWith("._");
    }

    /**
     * Metadata of one file entry.
     *
     * @param fullPath the entry path inside the archive.
     * @param leafName the file name portion of the path.
     * @param size     number of decompressed bytes the entry stream yields.
     */
    public record ZipFileEntry(String fullPath, String leafName, long size) {
    }

    /**
     * Remembers the first I/O error raised while the entry data is read.
     */
    private static final class EntryContentStream extends ProxyInputStream {

        private volatile IOException readFailure;

        private EntryContentStream(final InputStream raw) {
            super(raw);
        }

        @Override
        protected void handleIOException(final IOException e) throws IOException {
            if (readFailure == null) {
                readFailure = e;
            }
            throw e;
        }

        IOException readFailure() {
            return readFailure;
        }
    }

    /**
     * Receives one file entry. The stream is closed by the reader once the handler returns.
     */
    @FunctionalInterface
    public interface ZipEntryHandler {
        void handle(ZipFileEntry entry, InputStream content) throws IOException;
    }
}
