package works.intfbus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ready-made {@link RefMonitor}s.
 */
public final class RefMonitors {
	private RefMonitors() {}

	/**
	 * @return a monitor that reports every counting operation at <code>TRACE</code> level.
	 */
	public static RefMonitor logging() {
		return LOGGING;
	}

	/**
	 * @return a monitor that calls each of <code>monitors</code> in turn.
	 */
	public static RefMonitor all(RefMonitor... monitors) {
		RefMonitor result = RefMonitor.NONE;
		for (RefMonitor m: monitors) {
			result = (result == RefMonitor.NONE) ? m : result.andThen(m);
		}
		return result;
	}

	private static final RefMonitor LOGGING = (target, countBefore, operation) -> {
		if (RefMonitors.LOGGER.isTraceEnabled()) {
			RefMonitors.LOGGER.trace("{} {} (count before: {})", operation, target, countBefore);
		}
	};

	private static final Logger LOGGER = LoggerFactory.getLogger(RefMonitors.class);
}
