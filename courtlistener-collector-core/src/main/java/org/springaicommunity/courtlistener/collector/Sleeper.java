package org.springaicommunity.courtlistener.collector;

import java.time.Duration;

/**
 * Blocks the calling thread for a backoff delay. Replaced by a recording fake in tests.
 */
@FunctionalInterface
public interface Sleeper {

	/**
	 * Sleeper backed by {@link Thread#sleep(long, int)}.
	 */
	Sleeper THREAD = duration -> Thread.sleep(duration.toMillis(), (int) (duration.toNanosPart() % 1_000_000));

	void sleep(Duration duration) throws InterruptedException;

}
