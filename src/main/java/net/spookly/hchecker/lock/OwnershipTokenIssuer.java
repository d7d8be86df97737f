package net.spookly.hchecker.lock;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Issues lock ownership tokens of the form {@code checkerId;epochSeconds.nanos}.
 *
 * <p>The same issuer never hands out a token twice: when the clock has not advanced past the
 * previous instant, the previous instant plus one nanosecond is used.
 */
public final class OwnershipTokenIssuer {
    private final String checkerId;
    private final Clock clock;
    private final AtomicReference<Instant> lastIssued = new AtomicReference<>(Instant.MIN);

    public OwnershipTokenIssuer(String checkerId, Clock clock) {
        this.checkerId = Objects.requireNonNull(checkerId, "checkerId");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public String issue() {
        Instant now = clock.instant();
        Instant issued = lastIssued.updateAndGet(previous -> now.isAfter(previous) ? now : previous.plusNanos(1));
        return checkerId + ";" + issued.getEpochSecond() + "." + issued.getNano();
    }
}
