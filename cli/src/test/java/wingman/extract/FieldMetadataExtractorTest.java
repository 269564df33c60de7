package wingman.extract;

import replacer.exceptions.OrgAuthException;
import wingman.fixtures.ScriptedCommandRunner;
import wingman.sf.SfCli;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("FieldMetadataExtractor")
class FieldMetadataExtractorTest {

    private static final String HEADER = "Object,Full Name,Namespace,DeveloperName,Label,Type,Description,Formula";

    @TempDir
    Path tempDir;

    private ScriptedCommandRunner runner;
    private FieldMetadataExtractor extractor;

    @BeforeEach
    void setUp() {
        runner = new ScriptedCommandRunner();
        extractor = new FieldMetadataExtractor(new SfCli(runner));
    }

    private static String metadata(String name, String label, String type, String formula) {
        String meta = formula == null ? "null" : "{\"formula\":\"" + formula + "\"}";
        return "{\"EntityDefinition\":{\"DeveloperName\":\"Account\"},\"FullName\":\"Account." + name + "__c\","
                + "\"NamespacePrefix\":null,\"DeveloperName\":\"" + name + "\",\"MasterLabel\":\"" + label + "\","
                + "\"DataType\":\"" + type + "\",\"Description\":null,\"Metadata\":" + meta + "}";
    }

    private void listFields(String... names) {
        String[] rows = new String[names.length];
        for (int i = 0; i < names.length; i++) {
            rows[i] = "{\"DeveloperName\":\"" + names[i] + "\"}";
        }
        runner.on(cmd -> !cmd.contains("--use-tooling-api") && cmd.stream().anyMatch(a -> a.contains("FieldDefinition")),
                inv -> ScriptedCommandRunner.records(rows));
    }

    private void fieldMetadata(String name, String json) {
        runner.on(cmd -> cmd.contains("--use-tooling-api")
                        && cmd.stream().anyMatch(a -> a.contains("DeveloperName = '" + name + "'")),
                inv -> ScriptedCommandRunner.records(json));
    }

    @Test
    @DisplayName("should write one row per field with the formula from the metadata")
    void shouldWriteRows() throws Exception {
        listFields("Score", "Region");
        fieldMetadata("Score", metadata("Score", "Score, weighted", "Formula (Number)", "Amount * 2"));
        fieldMetadata("Region", metadata("Region", "Region", "Picklist", null));

        FieldMetadataExtractor.ObjectExport export = extractor.export("dev", "Account", 0, List.of(), tempDir);

        assertThat(export.file()).isEqualTo(tempDir.resolve("Account_field_metadata.csv"));
        assertThat(export.rows()).isEqualTo(2);
        assertThat(Files.readString(export.file())).isEqualTo(HEADER + "\r\n"
                + "Account,Account.Score__c,,Score,\"Score, weighted\",Formula (Number),,Amount * 2\r\n"
                + "Account,Account.Region__c,,Region,Region,Picklist,,\r\n");
    }

    @Test
    @DisplayName("should keep only the first max-fields listed fields")
    void shouldLimitFields() throws Exception {
        listFields("A", "B", "C");
        fieldMetadata("A", metadata("A", "A", "Text", null));

        FieldMetadataExtractor.ObjectExport export = extractor.export("dev", "Account", 1, List.of(), tempDir);

        assertThat(export.rows()).isEqualTo(1);
        assertThat(runner.invocations()).hasSize(2);
    }

    @Test
    @DisplayName("should use the explicit field list and skip fields without metadata")
    void shouldUseSpecificFields() throws Exception {
        fieldMetadata("Score", metadata("Score", "Score", "Number", null));
        runner.on(cmd -> cmd.stream().anyMatch(a -> a.contains("'Missing'")),
                inv -> ScriptedCommandRunner.error("INVALID_FIELD", "no such field"));

        FieldMetadataExtractor.ObjectExport export =
                extractor.export("dev", "Account", 0, List.of("Score", "Missing", "bad name"), tempDir);

        assertThat(export.rows()).isEqualTo(1);
        assertThat(export.skipped()).isEqualTo(2);
    }

    @Test
    @DisplayName("should stop on authorization failures")
    void shouldStopOnAuthFailure() {
        runner.onArgContaining("FieldDefinition", ScriptedCommandRunner.error("NoOrgFound", "No authorization"));

        assertThatThrownBy(() -> extractor.export("dev", "Account", 0, List.of("Score"), tempDir))
                .isInstanceOf(OrgAuthException.class);
    }

    @Test
    @DisplayName("should reject an object name that is not an API name")
    void shouldRejectBadObjectName() {
        assertThatThrownBy(() -> extractor.export("dev", "Account' OR 1=1", 0, List.of(), tempDir))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
