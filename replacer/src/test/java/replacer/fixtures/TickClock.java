package replacer.fixtures;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Clock advancing one millisecond on every read, so successive instants are strictly ordered.
 */
public final class TickClock extends Clock {

    private final Instant base;
    private final AtomicLong ticks = new AtomicLong();

    public TickClock() {
        this(Instant.parse("2025-03-14T09:30:00Z"));
    }

    public TickClock(Instant base) {
        this.base = base;
    }

    /** Moves the clock forward without reading it. */
    public void advanceMillis(long millis) {
        ticks.addAndGet(millis);
    }

    @Override
    public Instant instant() {
        return base.plusMillis(ticks.getAndIncrement());
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }
}
