package org.pipesteps.datapipeline.utils.compression;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

import com.github.luben.zstd.Zstd;
import com.github.luben.zstd.ZstdInputStream;
import com.github.luben.zstd.ZstdOutputStream;

/**
 * Zstandard compression via zstd-jni.
 * <p>
 * Columnar artifacts compress well because each column's values are stored contiguously.
 * Level 3 is zstd's default speed/ratio trade-off; higher levels rarely pay off for
 * artifacts that are rewritten on every retry.
 */
public class ZstdCodec implements ICompressionCodec {

    public static final String NAME = "zstd";
    public static final String EXTENSION = ".zst";
    public static final int DEFAULT_LEVEL = 3;

    private final int level;

    public ZstdCodec(int level) {
        if (level < Zstd.minCompressionLevel() || level > Zstd.maxCompressionLevel()) {
            throw new IllegalArgumentException(String.format(
                "zstd level must be between %d and %d: %d",
                Zstd.minCompressionLevel(), Zstd.maxCompressionLevel(), level));
        }
        this.level = level;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getLevel() {
        return level;
    }

    @Override
    public String getFileExtension() {
        return EXTENSION;
    }

    @Override
    public OutputStream wrapOutputStream(OutputStream out) throws IOException {
        return new ZstdOutputStream(out, level);
    }

    @Override
    public InputStream wrapInputStream(InputStream in) throws IOException {
        return new ZstdInputStream(in);
    }
}
