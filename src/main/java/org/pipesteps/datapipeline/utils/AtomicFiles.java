package org.pipesteps.datapipeline.utils;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.UUID;

import org.pipesteps.datapipeline.api.resources.storage.CheckedConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Write-to-temporary-then-rename helper.
 * <p>
 * Content is streamed into {@code <target>.<uuid>.tmp} in the target's directory, forced to disk,
 * and then moved over the target with {@link StandardCopyOption#ATOMIC_MOVE}. Readers therefore
 * see either the previous file or the complete new one, never a partial write. If anything
 * fails the temp file is removed and the target is left untouched.
 */
public final class AtomicFiles {

    private static final Logger log = LoggerFactory.getLogger(AtomicFiles.class);

    /** Suffix of in-flight temporary files. Listings must ignore files ending with it. */
    public static final String TEMP_SUFFIX = ".tmp";

    private AtomicFiles() {
    }

    /**
     * Atomically replaces {@code target} with the bytes produced by {@code writer}.
     *
     * @param target final file path
     * @param writer streams the content; closing the stream is allowed
     * @throws IOException if writing or the atomic move fails
     */
    public static void write(Path target, CheckedConsumer<OutputStream> writer) throws IOException {
        Path parentDir = target.toAbsolutePath().getParent();
        Files.createDirectories(parentDir);

        // Use suffix .UUID.tmp instead of prefix to ensure temp files are filtered correctly
        Path tempFile = parentDir.resolve(target.getFileName() + "." + UUID.randomUUID() + TEMP_SUFFIX);
        try {
            try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(
                    tempFile, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE, StandardOpenOption.SYNC))) {
                writer.accept(out);
            }
            try {
                Files.move(tempFile, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                throw new IOException("Filesystem does not support atomic rename for " + target, e);
            }
        } catch (IOException | RuntimeException e) {
            // Clean up temp file on failure
            try {
                Files.deleteIfExists(tempFile);
            } catch (IOException cleanupEx) {
                log.warn("Failed to clean up temp file after write failure: {}", tempFile, cleanupEx);
            }
            throw e;
        }
    }

    /**
     * Atomically replaces {@code target} with {@code data}.
     *
     * @param target final file path
     * @param data complete file content
     * @throws IOException if writing or the atomic move fails
     */
    public static void write(Path target, byte[] data) throws IOException {
        write(target, out -> out.write(data));
    }

    /**
     * @param file a file name or path
     * @return true if the name denotes an in-flight temporary file
     */
    public static boolean isTempFile(Path file) {
        return file.getFileName().toString().endsWith(TEMP_SUFFIX);
    }
}
