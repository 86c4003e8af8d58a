package works.intfbus;

import java.util.concurrent.atomic.AtomicInteger;
import lombok.With;

import static java.util.Objects.requireNonNull;

/**
 * @param name         identifies the bus in log messages and {@link Object#toString()}.
 * @param level        security level; 0 is the most secure.
 * @param finishPasses number of ordered teardown passes. Interfaces must be connected with
 *                     an <code>order</code> in the range <code>[0, finishPasses)</code>.
 */
@With
public record BusSettings(
	String name,
	int level,
	int finishPasses
) {
	public static final int DEFAULT_FINISH_PASSES = 3;

	public BusSettings {
		requireNonNull(name);
		if (level < 0) {
			throw new IllegalArgumentException("Bus level must not be negative: " + level);
		}
		if (finishPasses < 1) {
			throw new IllegalArgumentException("Bus needs at least one finish pass: " + finishPasses);
		}
	}

	/**
	 * @return settings for a bus at the given level with a generated name and the default number of passes.
	 */
	public static BusSettings atLevel(int level) {
		return new BusSettings("bus" + BUS_COUNTER.incrementAndGet() + "-L" + level, level, DEFAULT_FINISH_PASSES);
	}

	private static final AtomicInteger BUS_COUNTER = new AtomicInteger(0);
}
