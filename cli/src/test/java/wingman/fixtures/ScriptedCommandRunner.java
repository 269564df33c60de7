package wingman.fixtures;

import wingman.sf.CommandResult;
import wingman.sf.CommandRunner;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Fake {@code sf} executable: the first rule whose predicate matches a command answers it.
 * Unmatched commands fail the way {@code sf} does for an unknown command.
 */
public class ScriptedCommandRunner implements CommandRunner {

    private record Rule(Predicate<List<String>> matcher, Function<Invocation, CommandResult> answer) {
    }

    /**
     * A recorded call.
     */
    public record Invocation(List<String> command, Path workingDir) {

        /** Value following the given flag, or null. */
        public String option(String flag) {
            int i = command.indexOf(flag);
            return i >= 0 && i + 1 < command.size() ? command.get(i + 1) : null;
        }

        /** Resolves a path argument against the working directory. */
        public Path path(String flag) {
            Path p = Path.of(option(flag));
            return workingDir != null ? workingDir.resolve(p) : p;
        }
    }

    private final List<Rule> rules = new ArrayList<>();
    private final List<Invocation> invocations = Collections.synchronizedList(new ArrayList<>());

    public static CommandResult ok(String resultJson) {
        return new CommandResult(0, "{\"status\":0,\"result\":" + resultJson + "}", "");
    }

    public static CommandResult records(String... recordJson) {
        return ok("{\"totalSize\":" + recordJson.length + ",\"done\":true,\"records\":["
                + String.join(",", recordJson) + "]}");
    }

    public static CommandResult error(String name, String message) {
        return new CommandResult(1, "{\"status\":1,\"name\":\"" + name + "\",\"message\":\"" + message + "\"}", "");
    }

    /** Answers commands containing every given token. */
    public ScriptedCommandRunner on(List<String> tokens, CommandResult result) {
        return on(cmd -> cmd.containsAll(tokens), inv -> result);
    }

    /** Answers commands with any argument containing the fragment. */
    public ScriptedCommandRunner onArgContaining(String fragment, CommandResult result) {
        return on(cmd -> cmd.stream().anyMatch(a -> a.contains(fragment)), inv -> result);
    }

    public ScriptedCommandRunner on(Predicate<List<String>> matcher, Function<Invocation, CommandResult> answer) {
        rules.add(new Rule(matcher, answer));
        return this;
    }

    public List<Invocation> invocations() {
        synchronized (invocations) {
            return List.copyOf(invocations);
        }
    }

    @Override
    public CommandResult run(List<String> command, Path workingDir) throws IOException {
        Invocation invocation = new Invocation(List.copyOf(command), workingDir);
        invocations.add(invocation);
        for (Rule rule : rules) {
            if (rule.matcher().test(command)) {
                return rule.answer().apply(invocation);
            }
        }
        return error("UnexpectedCommand", String.join(" ", command));
    }
}
