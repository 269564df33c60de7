package replacer.report;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import replacer.workspace.RunWorkspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Persists run summaries as JSON under {@code runs/} of the workspace.
 */
public class RunSummaryStore {

    private static final Logger log = LoggerFactory.getLogger(RunSummaryStore.class);

    private final RunWorkspace workspace;
    private final ObjectMapper mapper;

    public RunSummaryStore(RunWorkspace workspace) {
        this.workspace = workspace;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * @return the file written
     */
    public Path save(RunSummary summary) throws IOException {
        Path file = workspace.summaryFile(summary.runId());
        Files.createDirectories(file.getParent());
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        mapper.writeValue(tmp.toFile(), summary);
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        log.info("Run summary written to {}", file);
        return file;
    }

    public RunSummary load(Path file) throws IOException {
        return mapper.readValue(file.toFile(), RunSummary.class);
    }

    public RunSummary load(String runId) throws IOException {
        return load(workspace.summaryFile(runId));
    }
}
