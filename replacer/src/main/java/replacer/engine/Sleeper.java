package replacer.engine;

import java.time.Duration;

/**
 * Waits between retries and deploy polls. Tests substitute a recording no-op.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
