package wingman.sf;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import replacer.exceptions.ConnectorException;
import replacer.exceptions.OrgAuthException;
import replacer.exceptions.RateLimitException;
import replacer.exceptions.TransientConnectorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Thin wrapper over the {@code sf} command line: runs a subcommand against an org with
 * {@code --json}, parses the envelope and maps failures onto the connector exceptions.
 *
 * <h2>Error mapping:</h2>
 * <ul>
 *   <li>missing or expired authorization, unknown org alias - {@link OrgAuthException}</li>
 *   <li>{@code REQUEST_LIMIT_EXCEEDED} - {@link RateLimitException}</li>
 *   <li>network timeouts, unavailable server, process start or I/O failure - {@link TransientConnectorException}</li>
 *   <li>anything else - {@link ConnectorException}</li>
 * </ul>
 */
public class SfCli {

    private static final Logger log = LoggerFactory.getLogger(SfCli.class);

    public static final String DEFAULT_EXECUTABLE = "sf";

    private static final List<String> AUTH_MARKERS = List.of(
            "NOORGFOUND", "NAMEDORGNOTFOUND", "NOAUTHINFOFOUND", "AUTHINFO", "INVALID_SESSION_ID",
            "REFRESHTOKENAUTHERROR", "INVALID_GRANT", "EXPIRED ACCESS/REFRESH TOKEN", "NO AUTHORIZATION",
            "NODEFAULTENVERROR");
    private static final List<String> RATE_LIMIT_MARKERS = List.of("REQUEST_LIMIT_EXCEEDED", "CONCURRENT_REQUESTS_LIMIT");
    private static final List<String> TRANSIENT_MARKERS = List.of(
            "ETIMEDOUT", "ECONNRESET", "ECONNREFUSED", "SOCKET HANG UP", "TIMED OUT", "SERVER_UNAVAILABLE",
            "UNABLE_TO_LOCK_ROW", "SERVICE UNAVAILABLE");

    private final CommandRunner runner;
    private final String executable;
    private final ObjectMapper mapper = new ObjectMapper();

    public SfCli(CommandRunner runner) {
        this(runner, DEFAULT_EXECUTABLE);
    }

    public SfCli(CommandRunner runner, String executable) {
        this.runner = runner;
        this.executable = executable;
    }

    /**
     * Runs a subcommand and returns its {@code result} payload.
     *
     * @param args subcommand and its arguments, e.g. {@code "data", "query", "--query", soql}
     * @throws ConnectorException mapped from the failure
     */
    public JsonNode run(String targetOrg, Path workingDir, String... args) throws ConnectorException {
        SfResponse response = invoke(targetOrg, workingDir, args);
        if (!response.ok()) {
            throw toException(args, response);
        }
        return response.result();
    }

    /**
     * Runs a subcommand and returns the envelope even when it reports a failure. Used where a
     * failed command still carries a useful result, such as a deploy report.
     */
    public SfResponse invoke(String targetOrg, Path workingDir, String... args) throws ConnectorException {
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.addAll(List.of(args));
        if (targetOrg != null) {
            command.add("--target-org");
            command.add(targetOrg);
        }
        command.add("--json");

        CommandResult result;
        try {
            result = runner.run(command, workingDir);
        } catch (IOException e) {
            throw new TransientConnectorException("Cannot run " + executable + " " + args[0] + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectorException("Interrupted while running " + commandName(args), e);
        }

        JsonNode root;
        try {
            root = mapper.readTree(result.stdout());
        } catch (JsonProcessingException e) {
            root = null;
        }
        if (root == null || !root.isObject()) {
            String detail = result.stderr().isBlank() ? result.stdout().strip() : result.stderr().strip();
            SfResponse unparsed = new SfResponse(result.succeeded() ? 1 : result.exitCode(), null,
                    "Unreadable output (exit " + result.exitCode() + "): " + abbreviate(detail), null);
            throw toException(args, unparsed);
        }
        SfResponse response = SfResponse.of(root, result.exitCode());
        log.debug("{} -> status {}", commandName(args), response.status());
        return response;
    }

    /**
     * Runs a SOQL query and returns its records.
     *
     * @param tooling true to query the tooling API
     */
    public List<JsonNode> query(String targetOrg, String soql, boolean tooling) throws ConnectorException {
        JsonNode result = tooling
                ? run(targetOrg, null, "data", "query", "--query", soql, "--use-tooling-api")
                : run(targetOrg, null, "data", "query", "--query", soql);
        List<JsonNode> records = new ArrayList<>();
        result.path("records").forEach(records::add);
        return records;
    }

    /**
     * Maps a failed envelope onto the connector exception hierarchy.
     */
    public ConnectorException toException(String[] args, SfResponse response) {
        String message = commandName(args) + " failed: " + response.describe();
        String haystack = response.describe().toUpperCase(Locale.ROOT);
        if (containsAny(haystack, AUTH_MARKERS)) {
            return new OrgAuthException(message);
        }
        if (containsAny(haystack, RATE_LIMIT_MARKERS)) {
            return new RateLimitException(message);
        }
        if (containsAny(haystack, TRANSIENT_MARKERS)) {
            return new TransientConnectorException(message);
        }
        return new ConnectorException(message);
    }

    private static boolean containsAny(String haystack, List<String> markers) {
        for (String marker : markers) {
            if (haystack.contains(marker)) return true;
        }
        return false;
    }

    private String commandName(String[] args) {
        StringBuilder sb = new StringBuilder(executable);
        for (String arg : args) {
            if (arg.startsWith("-")) break;
            sb.append(' ').append(arg);
        }
        return sb.toString();
    }

    private static String abbreviate(String text) {
        return text.length() > 300 ? text.substring(0, 300) + "..." : text;
    }
}
