package org.pipesteps.datapipeline.utils.compression;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Stream-level compression used for checkpoint artifacts.
 * <p>
 * The codec of an existing file is identified by its extension
 * (see {@link CompressionCodecFactory#detectFromExtension(String)}), so files written with
 * different codecs can be read side by side after a configuration change.
 */
public interface ICompressionCodec {

    /**
     * @return codec name as used in configuration (e.g., "zstd", "none")
     */
    String getName();

    /**
     * @return configured compression level (0 for codecs without levels)
     */
    int getLevel();

    /**
     * @return file extension appended to artifact names, including the dot, or "" for none
     */
    String getFileExtension();

    /**
     * Wraps a stream so that data written to the result is compressed.
     * Closing the returned stream closes the underlying stream.
     *
     * @param out target stream
     * @return compressing stream
     * @throws IOException if the codec cannot be initialized
     */
    OutputStream wrapOutputStream(OutputStream out) throws IOException;

    /**
     * Wraps a stream so that data read from the result is decompressed.
     *
     * @param in compressed source stream
     * @return decompressing stream
     * @throws IOException if the codec cannot be initialized
     */
    InputStream wrapInputStream(InputStream in) throws IOException;
}
