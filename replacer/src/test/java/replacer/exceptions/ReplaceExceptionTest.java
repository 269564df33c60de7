package replacer.exceptions;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ReplaceException hierarchy")
class ReplaceExceptionTest {

    @Test
    @DisplayName("should append stage and report to the message")
    void shouldAppendDiagnostics() {
        ReplaceException e = new ReplaceException("Backup failed", "backup", "00O1", null);

        assertThat(e.getMessage()).isEqualTo("Backup failed [stage=backup] [report=00O1]");
        assertThat(e.getRawMessage()).isEqualTo("Backup failed");
        assertThat(e.getStage()).isEqualTo("backup");
        assertThat(e.getReportId()).isEqualTo("00O1");
    }

    @Test
    @DisplayName("should leave a plain message untouched")
    void shouldKeepPlainMessage() {
        assertThat(new ReplaceException("boom").getMessage()).isEqualTo("boom");
    }

    @Test
    @DisplayName("should list deploy diagnostics after the message")
    void shouldListDeployDiagnostics() {
        DeployValidationException e = new DeployValidationException("Deploy rejected", "0Af1",
                List.of("Sales/A: Unknown field", "Sales/B: Invalid column"));

        assertThat(e.getMessage())
                .isEqualTo("Deploy rejected [stage=deploy]: Sales/A: Unknown field; Sales/B: Invalid column");
        assertThat(e.getDeployId()).isEqualTo("0Af1");
    }

    @Test
    @DisplayName("should treat rate limiting as transient")
    void shouldClassifyRateLimitAsTransient() {
        ConnectorException e = new RateLimitException("REQUEST_LIMIT_EXCEEDED");

        assertThat(e).isInstanceOf(TransientConnectorException.class).isInstanceOf(ReplaceException.class);
    }

    @Test
    @DisplayName("should carry the raw match count of a malformed report")
    void shouldCarryMalformedCount() {
        MalformedReportException e = new MalformedReportException("Unclosed tag", "00O7", 2, null);

        assertThat(e.getReferencesFound()).isEqualTo(2);
        assertThat(e.getMessage()).contains("[stage=rewrite]").contains("[report=00O7]");
    }

    @Test
    @DisplayName("should describe a timed out operation")
    void shouldDescribeTimeout() {
        assertThat(new ConnectorTimeoutException("retrieve", Duration.ofSeconds(2)).getMessage())
                .isEqualTo("Operation 'retrieve' timed out after 2000 ms");
    }
}
