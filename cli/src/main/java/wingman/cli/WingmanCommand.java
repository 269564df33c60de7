package wingman.cli;

import replacer.config.ReplacerConfig;
import replacer.config.ReplacerConfigException;
import replacer.config.ReplacerConfigLoader;
import replacer.connector.OrgConnector;
import replacer.engine.Sleeper;
import replacer.workspace.RunWorkspace;
import wingman.logging.LoggingConfigurator;
import wingman.sf.CommandRunner;
import wingman.sf.ProcessCommandRunner;
import wingman.sf.SfCli;
import wingman.sf.SfCliOrgConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;

/**
 * Root of the {@code wingman} command line.
 *
 * <p>Holds the global options and the collaborators shared by subcommands. The target org
 * comes from the subcommand {@code --org}, then the global {@code --org}, then the
 * {@code SF_TARGET_ORG} environment variable.
 *
 * <p>Exit codes: 0 on success, 1 on a failed batch or run-level error, 2 on usage errors.
 */
@Command(
        name = "wingman",
        mixinStandardHelpOptions = true,
        version = "wingman 1.0.0",
        description = "Automates bulk report field replacement and field metadata extraction for Salesforce orgs.",
        subcommands = {
                ReplaceFieldsCommand.class,
                ExtractFieldsCommand.class,
                PullReportsCommand.class,
                TestConnectionCommand.class,
                RestoreBackupCommand.class
        }
)
public class WingmanCommand implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(WingmanCommand.class);

    public static final String ORG_ENV = "SF_TARGET_ORG";

    @Spec
    CommandSpec spec;

    @Option(names = {"-o", "--org"}, description = "Default org alias for every command")
    String org;

    @Option(names = {"-v", "--verbose"}, description = "Log at DEBUG level")
    boolean verbose;

    @Option(names = "--config", description = "Configuration file (.properties or .yml) instead of the bundled one")
    Path configFile;

    private final CommandRunner runner;
    private final Map<String, String> env;
    private final Sleeper sleeper;
    private final Clock clock;

    public WingmanCommand() {
        this(new ProcessCommandRunner(), System.getenv(), Sleeper.SYSTEM, Clock.systemUTC());
    }

    public WingmanCommand(CommandRunner runner, Map<String, String> env, Sleeper sleeper, Clock clock) {
        this.runner = runner;
        this.env = env;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    /**
     * Builds the command line with the exit-code mapping and verbose handling applied.
     */
    public static CommandLine commandLine(WingmanCommand command) {
        CommandLine cli = new CommandLine(command);
        cli.setExecutionStrategy(parseResult -> {
            if (command.verbose) {
                LoggingConfigurator.enableVerboseLogging();
            }
            return new CommandLine.RunLast().execute(parseResult);
        });
        cli.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            commandLine.getErr().println("Error: " + ex.getMessage());
            log.debug("Command failed", ex);
            return 1;
        });
        return cli;
    }

    @Override
    public void run() {
        throw new ParameterException(spec.commandLine(), "Missing command");
    }

    String resolveOrg(String commandOrg, CommandSpec command) {
        String resolved = optionalOrg(commandOrg);
        if (resolved != null) return resolved;
        throw new ParameterException(command.commandLine(),
                "No org specified. Use --org or set " + ORG_ENV + ".");
    }

    /** Same lookup as {@link #resolveOrg}, but null when no org is set anywhere. */
    String optionalOrg(String commandOrg) {
        if (commandOrg != null && !commandOrg.isBlank()) return commandOrg;
        if (org != null && !org.isBlank()) return org;
        String fromEnv = env.get(ORG_ENV);
        return fromEnv != null && !fromEnv.isBlank() ? fromEnv : null;
    }

    ReplacerConfig config(CommandSpec command) {
        try {
            return configFile != null ? ReplacerConfigLoader.loadFromFile(configFile) : ReplacerConfigLoader.load();
        } catch (IOException e) {
            throw new ParameterException(command.commandLine(), "Cannot read config " + configFile + ": " + e.getMessage());
        } catch (ReplacerConfigException e) {
            throw new ParameterException(command.commandLine(), e.getMessage());
        }
    }

    SfCli sf() {
        return new SfCli(runner);
    }

    OrgConnector connector(RunWorkspace workspace) {
        return new SfCliOrgConnector(sf(), workspace);
    }

    Sleeper sleeper() {
        return sleeper;
    }

    Clock clock() {
        return clock;
    }
}
