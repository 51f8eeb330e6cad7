package my.finresolver.app.resolve;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Per-request time budget.
 */
public final class Deadline {
	private final Clock clock;
	private final Instant expiresAt;

	private Deadline(Clock clock, Instant expiresAt) {
		this.clock = clock;
		this.expiresAt = expiresAt;
	}

	public static Deadline after(Clock clock, Duration timeout) {
		return new Deadline(clock, clock.instant().plus(timeout));
	}

	public boolean isExpired() {
		return !clock.instant().isBefore(expiresAt);
	}

	public Instant expiresAt() {
		return expiresAt;
	}
}
