package wingman.sf;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs an external command to completion.
 *
 * <p>Implementations must stop the process when the calling thread is interrupted.
 */
@FunctionalInterface
public interface CommandRunner {

    /**
     * @param command the executable followed by its arguments
     * @param workingDir directory to run in, or null for the current one
     * @throws IOException if the process cannot be started or its output read
     * @throws InterruptedException if interrupted while waiting; the process is destroyed
     */
    CommandResult run(List<String> command, Path workingDir) throws IOException, InterruptedException;
}
