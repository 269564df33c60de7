package replacer.backup;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import replacer.model.BackupRecord;
import replacer.model.ReportDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * {@link BackupManager} storing snapshots on the local filesystem.
 *
 * <p>Layout under the backup root:
 * <pre>
 * &lt;runId&gt;/&lt;reportId&gt;.report-meta.xml   original definition, byte for byte
 * &lt;runId&gt;/&lt;reportId&gt;.backup.json       record metadata
 * </pre>
 *
 * <p>Each file is written to a temporary sibling, forced to disk and atomically moved into
 * place. The metadata file is written last, so its presence marks a complete snapshot.
 */
public class FileBackupManager implements BackupManager {

    private static final Logger log = LoggerFactory.getLogger(FileBackupManager.class);

    static final String CONTENT_SUFFIX = ".report-meta.xml";
    static final String METADATA_SUFFIX = ".backup.json";

    private final Path root;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final ConcurrentMap<String, Object> locks = new ConcurrentHashMap<>();

    public FileBackupManager(Path root) {
        this(root, Clock.systemUTC());
    }

    public FileBackupManager(Path root, Clock clock) {
        this.root = Objects.requireNonNull(root, "root");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path root() {
        return root;
    }

    @Override
    public BackupRecord snapshot(String runId, ReportDescriptor report) throws IOException {
        if (!report.isRetrieved()) {
            throw new IllegalArgumentException("Cannot back up " + report.reportId() + ": definition not retrieved");
        }
        Path runDir = runDir(runId);
        Path metadata = runDir.resolve(fileName(report.reportId(), METADATA_SUFFIX));

        synchronized (locks.computeIfAbsent(runId + '/' + report.reportId(), k -> new Object())) {
            if (Files.exists(metadata)) {
                log.debug("Reusing existing backup of {} for run {}", report.reportId(), runId);
                return readRecord(metadata);
            }
            Files.createDirectories(runDir);
            BackupRecord record = new BackupRecord(runId, report.reportId(), report.fullName(),
                    report.storagePath(), report.rawDefinition(), clock.instant());

            writeDurably(runDir.resolve(fileName(report.reportId(), CONTENT_SUFFIX)),
                    report.rawDefinition().getBytes(StandardCharsets.UTF_8));
            writeDurably(metadata, mapper.writeValueAsBytes(BackupMetadata.of(record)));
            log.debug("Backed up {} ({}) for run {}", report.reportId(), report.fullName(), runId);
            return record;
        }
    }

    @Override
    public ReportDescriptor restore(BackupRecord record) throws IOException {
        Path content = runDir(record.runId()).resolve(fileName(record.reportId(), CONTENT_SUFFIX));
        String definition = Files.readString(content, StandardCharsets.UTF_8);
        return new ReportDescriptor(record.reportId(), record.fullName(), record.storagePath(), definition);
    }

    @Override
    public boolean hasDurableBackup(String runId, String reportId) {
        Path runDir = runDir(runId);
        return Files.isRegularFile(runDir.resolve(fileName(reportId, METADATA_SUFFIX)))
                && Files.isRegularFile(runDir.resolve(fileName(reportId, CONTENT_SUFFIX)));
    }

    @Override
    public List<BackupRecord> listRun(String runId) throws IOException {
        Path runDir = runDir(runId);
        List<BackupRecord> records = new ArrayList<>();
        if (!Files.isDirectory(runDir)) {
            return records;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(runDir, "*" + METADATA_SUFFIX)) {
            for (Path file : files) {
                records.add(readRecord(file));
            }
        }
        records.sort(Comparator.comparing(BackupRecord::reportId));
        return records;
    }

    private BackupRecord readRecord(Path metadataFile) throws IOException {
        BackupMetadata meta = mapper.readValue(metadataFile.toFile(), BackupMetadata.class);
        Path content = metadataFile.resolveSibling(fileName(meta.reportId(), CONTENT_SUFFIX));
        String original = Files.readString(content, StandardCharsets.UTF_8);
        return new BackupRecord(meta.runId(), meta.reportId(), meta.fullName(), meta.storagePath(),
                original, meta.timestamp());
    }

    private Path runDir(String runId) {
        if (runId == null || runId.isBlank() || runId.contains("/") || runId.contains("\\") || runId.contains("..")) {
            throw new IllegalArgumentException("Invalid run id: '" + runId + "'");
        }
        return root.resolve(runId);
    }

    static String fileName(String reportId, String suffix) {
        return reportId.replaceAll("[^A-Za-z0-9_.-]", "_") + suffix;
    }

    private static void writeDurably(Path target, byte[] bytes) throws IOException {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try (FileChannel channel = FileChannel.open(tmp,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            ByteBuffer buffer = ByteBuffer.wrap(bytes);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to replace", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
