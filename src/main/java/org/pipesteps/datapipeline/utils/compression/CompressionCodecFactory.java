package org.pipesteps.datapipeline.utils.compression;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Creates compression codecs from configuration and detects them from file names.
 * <p>
 * Configuration (all optional, under the storage's options):
 * <pre>
 * compression {
 *   enabled = true
 *   codec = "zstd"   # or "none"
 *   level = 3
 * }
 * </pre>
 * Without a {@code compression} block, or with {@code enabled = false}, the {@link NoneCodec}
 * is used.
 */
public final class CompressionCodecFactory {

    private static final Logger log = LoggerFactory.getLogger(CompressionCodecFactory.class);

    private static final byte[] SELF_CHECK_PAYLOAD = "pipe-steps codec self-check".getBytes(java.nio.charset.StandardCharsets.UTF_8);

    private CompressionCodecFactory() {
    }

    /**
     * Creates the configured codec and verifies it with a compress/decompress self-check, so that a
     * missing native library fails at startup instead of on the first checkpoint write.
     *
     * @param options storage options possibly containing a {@code compression} block
     * @return the validated codec
     * @throws CompressionException if the codec is unknown or fails the self-check
     */
    public static ICompressionCodec createAndValidate(Config options) throws CompressionException {
        ICompressionCodec codec = create(options);
        if (codec instanceof NoneCodec) {
            return codec;
        }
        try {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            try (OutputStream out = codec.wrapOutputStream(buffer)) {
                out.write(SELF_CHECK_PAYLOAD);
            }
            byte[] roundTrip;
            try (InputStream in = codec.wrapInputStream(new ByteArrayInputStream(buffer.toByteArray()))) {
                roundTrip = in.readAllBytes();
            }
            if (!Arrays.equals(SELF_CHECK_PAYLOAD, roundTrip)) {
                throw new CompressionException("Codec '" + codec.getName() + "' failed the round-trip self-check");
            }
        } catch (CompressionException e) {
            throw e;
        } catch (Exception | LinkageError e) {
            throw new CompressionException("Codec '" + codec.getName() + "' is not usable: " + e.getMessage(), e);
        }
        log.debug("Compression codec '{}' validated (level {})", codec.getName(), codec.getLevel());
        return codec;
    }

    /**
     * Creates the configured codec without validation.
     *
     * @param options storage options possibly containing a {@code compression} block
     * @return the codec
     * @throws CompressionException if the codec name is unknown
     */
    public static ICompressionCodec create(Config options) throws CompressionException {
        if (options == null || !options.hasPath("compression")) {
            return new NoneCodec();
        }
        Config compression = options.getConfig("compression");
        boolean enabled = !compression.hasPath("enabled") || compression.getBoolean("enabled");
        if (!enabled) {
            return new NoneCodec();
        }
        String name = compression.hasPath("codec") ? compression.getString("codec") : ZstdCodec.NAME;
        return switch (name.toLowerCase(java.util.Locale.ROOT)) {
            case ZstdCodec.NAME -> {
                int level = compression.hasPath("level") ? compression.getInt("level") : ZstdCodec.DEFAULT_LEVEL;
                try {
                    yield new ZstdCodec(level);
                } catch (IllegalArgumentException e) {
                    throw new CompressionException(e.getMessage(), e);
                }
            }
            case NoneCodec.NAME -> new NoneCodec();
            default -> throw new CompressionException("Unknown compression codec: " + name);
        };
    }

    /**
     * Detects the codec of an existing file from its extension.
     *
     * @param fileName file name or path
     * @return {@link ZstdCodec} for {@code .zst} files, {@link NoneCodec} otherwise
     */
    public static ICompressionCodec detectFromExtension(String fileName) {
        if (fileName != null && fileName.endsWith(ZstdCodec.EXTENSION)) {
            return new ZstdCodec(ZstdCodec.DEFAULT_LEVEL);
        }
        return new NoneCodec();
    }
}
