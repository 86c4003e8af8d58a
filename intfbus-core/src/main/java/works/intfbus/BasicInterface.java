package works.intfbus;

import lombok.NonNull;

/**
 * Base class for objects offering one or more interfaces but not hosted on a {@link Bus}.
 *
 * <p>
 * A query for any interface type the class implements returns this same object,
 * with its single reference count shared among all its interfaces:
 *
 * <pre>
 * class Clock extends BasicInterface implements TimeSource, Ticker { ... }
 *
 * try (AutoRef&lt;TimeSource&gt; time = AutoRef.of(new Clock())) {
 *     Ticker ticker = time.get().cast(Ticker.class); // same object
 * }
 * </pre>
 */
public abstract class BasicInterface extends AbstractRefObject implements Interface {
	protected BasicInterface() {
	}

	protected BasicInterface(RefMonitor monitor) {
		super(monitor);
	}

	@Override
	public Resolution queryInterface(@NonNull InterfaceId iid) {
		if (Capabilities.of(getClass()).supports(iid)) {
			ref();
			return Resolution.resolved(this);
		}
		return Resolution.notResolved();
	}
}
