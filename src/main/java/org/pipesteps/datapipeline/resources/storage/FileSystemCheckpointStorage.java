package org.pipesteps.datapipeline.resources.storage;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.pipesteps.datapipeline.api.batch.Table;
import org.pipesteps.datapipeline.api.resources.storage.ICheckpointStorage;
import org.pipesteps.datapipeline.utils.AtomicFiles;
import org.pipesteps.datapipeline.utils.compression.CompressionCodecFactory;
import org.pipesteps.datapipeline.utils.compression.CompressionException;
import org.pipesteps.datapipeline.utils.compression.ICompressionCodec;
import org.pipesteps.datapipeline.utils.compression.ZstdCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Checkpoint storage on the local file system.
 * <p>
 * <b>Layout</b> under {@code rootDirectory}:
 * <pre>
 * frontier.json
 * steps/&lt;stepName&gt;/batch_&lt;batchId as 19 digits&gt;.cols[.zst]
 * </pre>
 * The zero-padded batch id makes lexicographic and numeric order agree. Artifacts are encoded
 * with {@link ColumnarTableFormat} and compressed with the configured codec; the codec of an
 * existing artifact is detected from its extension, so artifacts written before a codec change
 * stay readable.
 * <p>
 * <b>Options:</b>
 * <ul>
 *   <li>{@code rootDirectory} - required, absolute path; created if missing</li>
 *   <li>{@code compression} - optional, see {@link CompressionCodecFactory}</li>
 * </ul>
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe; a storage instance belongs to one pipeline.
 */
public class FileSystemCheckpointStorage implements ICheckpointStorage {

    private static final Logger log = LoggerFactory.getLogger(FileSystemCheckpointStorage.class);

    static final String FRONTIER_FILE = "frontier.json";
    static final String STEPS_DIR = "steps";
    static final String ARTIFACT_EXTENSION = ".cols";

    private static final Pattern ARTIFACT_PATTERN =
        Pattern.compile("^batch_(\\d{19})" + Pattern.quote(ARTIFACT_EXTENSION) + "(\\.zst)?$");
    private static final List<String> KNOWN_CODEC_EXTENSIONS = List.of("", ZstdCodec.EXTENSION);
    private static final Pattern STEP_NAME_PATTERN = Pattern.compile("^[A-Za-z0-9_.-]+$");

    private final String name;
    private final Path rootDirectory;
    private final ICompressionCodec codec;

    /**
     * Creates the storage and its root directory.
     *
     * @param name Resource name used in log messages
     * @param options Storage options (see class documentation)
     * @throws IllegalArgumentException if {@code rootDirectory} is missing, relative or unusable
     * @throws IllegalStateException if the configured compression codec cannot be used
     */
    public FileSystemCheckpointStorage(String name, Config options) {
        this.name = name;
        if (!options.hasPath("rootDirectory")) {
            throw new IllegalArgumentException("rootDirectory is required for FileSystemCheckpointStorage");
        }
        String rootPath = options.getString("rootDirectory");
        this.rootDirectory = Paths.get(rootPath);
        if (!this.rootDirectory.isAbsolute()) {
            throw new IllegalArgumentException("rootDirectory must be an absolute path: " + rootPath);
        }
        try {
            Files.createDirectories(this.rootDirectory);
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot create rootDirectory: " + rootPath, e);
        }
        if (!Files.isWritable(this.rootDirectory)) {
            throw new IllegalArgumentException("rootDirectory is not writable: " + rootPath);
        }

        // Initialize compression codec (fail-fast if environment validation fails)
        try {
            this.codec = CompressionCodecFactory.createAndValidate(options);
        } catch (CompressionException e) {
            throw new IllegalStateException("Failed to initialize compression codec for storage '" + name + "'", e);
        }
        log.debug("Checkpoint storage '{}' initialized: root={}, codec={}, level={}",
            name, rootDirectory, codec.getName(), codec.getLevel());
    }

    @Override
    public void writeArtifact(String stepName, long batchId, Table table) throws IOException {
        Path target = artifactPath(stepName, batchId, codec.getFileExtension());
        AtomicFiles.write(target, out -> {
            try (OutputStream compressed = codec.wrapOutputStream(out)) {
                ColumnarTableFormat.write(table, compressed);
            }
        });

        // Keep exactly one artifact per (step, batch) if the codec changed since the last write
        for (String extension : KNOWN_CODEC_EXTENSIONS) {
            if (!extension.equals(codec.getFileExtension())) {
                Files.deleteIfExists(artifactPath(stepName, batchId, extension));
            }
        }
        log.debug("Wrote artifact {} ({} rows)", target, table.rowCount());
    }

    @Override
    public Table readArtifact(String stepName, long batchId) throws IOException {
        Path path = findArtifact(stepName, batchId);
        if (path == null) {
            throw new NoSuchFileException(artifactPath(stepName, batchId, codec.getFileExtension()).toString(), null,
                "No checkpoint artifact for step '" + stepName + "' and batch " + batchId);
        }
        ICompressionCodec detected = CompressionCodecFactory.detectFromExtension(path.getFileName().toString());
        try (InputStream in = detected.wrapInputStream(new BufferedInputStream(Files.newInputStream(path)))) {
            return ColumnarTableFormat.read(in);
        } catch (IOException e) {
            throw new IOException("Failed to read checkpoint artifact " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean hasArtifact(String stepName, long batchId) {
        return findArtifact(stepName, batchId) != null;
    }

    @Override
    public List<Long> listArtifactBatchIds(String stepName) throws IOException {
        Path stepDir = stepDirectory(stepName);
        if (!Files.isDirectory(stepDir)) {
            return List.of();
        }
        TreeSet<Long> ids = new TreeSet<>();
        try (Stream<Path> files = Files.list(stepDir)) {
            files.filter(Files::isRegularFile)
                .map(p -> ARTIFACT_PATTERN.matcher(p.getFileName().toString()))
                .filter(Matcher::matches)
                .forEach(m -> ids.add(Long.parseLong(m.group(1))));
        }
        return new ArrayList<>(ids);
    }

    @Override
    public int deleteAllArtifacts() throws IOException {
        Path stepsDir = rootDirectory.resolve(STEPS_DIR);
        if (!Files.exists(stepsDir)) {
            return 0;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(stepsDir)) {
            paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        }
        int deleted = 0;
        for (Path path : paths) {
            if (Files.isRegularFile(path) && ARTIFACT_PATTERN.matcher(path.getFileName().toString()).matches()) {
                deleted++;
            }
            Files.delete(path);
        }
        log.debug("Storage '{}': deleted {} checkpoint artifacts", name, deleted);
        return deleted;
    }

    @Override
    public Path getFrontierPath() {
        return rootDirectory.resolve(FRONTIER_FILE);
    }

    public Path getRootDirectory() {
        return rootDirectory;
    }

    public ICompressionCodec getCodec() {
        return codec;
    }

    /**
     * Returns the path an artifact has when written with a codec of the given extension.
     *
     * @param stepName step name
     * @param batchId batch id
     * @param codecExtension codec file extension ("" or ".zst")
     * @return the artifact path
     */
    Path artifactPath(String stepName, long batchId, String codecExtension) {
        if (batchId < 0) {
            throw new IllegalArgumentException("batchId must be non-negative: " + batchId);
        }
        String fileName = String.format("batch_%019d%s%s", batchId, ARTIFACT_EXTENSION, codecExtension);
        return stepDirectory(stepName).resolve(fileName);
    }

    private Path stepDirectory(String stepName) {
        if (stepName == null || !STEP_NAME_PATTERN.matcher(stepName).matches()
                || stepName.equals(".") || stepName.equals("..")) {
            throw new IllegalArgumentException("Invalid step name for checkpoint storage: " + stepName);
        }
        return rootDirectory.resolve(STEPS_DIR).resolve(stepName);
    }

    private Path findArtifact(String stepName, long batchId) {
        // Prefer the current codec's file; fall back to artifacts written with another codec
        Path preferred = artifactPath(stepName, batchId, codec.getFileExtension());
        if (Files.isRegularFile(preferred)) {
            return preferred;
        }
        for (String extension : KNOWN_CODEC_EXTENSIONS) {
            Path candidate = artifactPath(stepName, batchId, extension);
            if (Files.isRegularFile(candidate)) {
                return candidate;
            }
        }
        return null;
    }
}
