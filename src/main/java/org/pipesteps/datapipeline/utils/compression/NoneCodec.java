package org.pipesteps.datapipeline.utils.compression;

import java.io.InputStream;
import java.io.OutputStream;

/**
 * Pass-through codec used when compression is disabled.
 */
public class NoneCodec implements ICompressionCodec {

    public static final String NAME = "none";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getLevel() {
        return 0;
    }

    @Override
    public String getFileExtension() {
        return "";
    }

    @Override
    public OutputStream wrapOutputStream(OutputStream out) {
        return out;
    }

    @Override
    public InputStream wrapInputStream(InputStream in) {
        return in;
    }
}
