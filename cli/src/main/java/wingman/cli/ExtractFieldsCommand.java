package wingman.cli;

import replacer.exceptions.ConnectorException;
import replacer.exceptions.OrgAuthException;
import wingman.extract.FieldMetadataExtractor;
import wingman.extract.FieldMetadataExtractor.ObjectExport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "extract-fields", description = "Export field metadata of objects to CSV files")
class ExtractFieldsCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExtractFieldsCommand.class);

    @ParentCommand
    WingmanCommand parent;

    @Spec
    CommandSpec spec;

    @Option(names = {"-o", "--org"}, description = "Org alias (overrides the global --org)")
    String org;

    @Option(names = "--objects", required = true, split = ",", description = "Comma-separated object names")
    List<String> objects;

    @Option(names = {"-m", "--max-fields"}, defaultValue = "0", description = "Fields per object, 0 for all")
    int maxFields;

    @Option(names = {"-f", "--specific-fields"}, split = ",", description = "Only these fields")
    List<String> specificFields = new ArrayList<>();

    @Option(names = {"-d", "--output-dir"}, defaultValue = ".", description = "Directory for the CSV files")
    Path outputDir;

    @Override
    public Integer call() throws Exception {
        String targetOrg = parent.resolveOrg(org, spec);
        FieldMetadataExtractor extractor = new FieldMetadataExtractor(parent.sf());
        PrintWriter out = spec.commandLine().getOut();

        List<String> fields = trimmed(specificFields);
        List<ObjectExport> exports = new ArrayList<>();
        int failures = 0;
        for (String object : trimmed(objects)) {
            try {
                exports.add(extractor.export(targetOrg, object, maxFields, fields, outputDir));
            } catch (OrgAuthException e) {
                throw e;
            } catch (ConnectorException | IOException | IllegalArgumentException e) {
                log.error("Error processing object {}: {}", object, e.getMessage());
                failures++;
            }
        }

        if (exports.isEmpty()) {
            out.println("No CSV files were generated");
        }
        for (ObjectExport export : exports) {
            out.printf("%s  %d field(s)  %,d bytes%s%n", export.file().getFileName(), export.rows(),
                    Files.size(export.file()),
                    export.skipped() > 0 ? "  (" + export.skipped() + " skipped)" : "");
        }
        out.flush();
        return failures == 0 ? 0 : 1;
    }

    private static List<String> trimmed(List<String> values) {
        List<String> out = new ArrayList<>();
        if (values == null) return out;
        for (String v : values) {
            if (!v.isBlank()) out.add(v.strip());
        }
        return out;
    }
}
