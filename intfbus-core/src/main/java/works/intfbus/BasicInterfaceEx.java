package works.intfbus;

import java.util.concurrent.atomic.AtomicReference;
import lombok.NonNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.intfbus.exceptions.AlreadyFinishedException;
import works.intfbus.exceptions.AlreadyHostedException;

import static works.intfbus.BasicInterfaceEx.Lifecycle.ACTIVE;
import static works.intfbus.BasicInterfaceEx.Lifecycle.FINISHED;
import static works.intfbus.BasicInterfaceEx.Lifecycle.FINISHING;

/**
 * Base class for objects offering one or more interfaces that can be hosted on a {@link Bus}.
 *
 * <p>
 * A query that this object cannot answer itself is passed on to its hosting bus,
 * so any interface reachable from the bus is reachable from here too:
 *
 * <pre>
 * bus.connect(new ConsoleGreeter());
 * bus.connect(new Scheduler());
 *
 * Greeter greeter = bus.cast(Greeter.class);
 * Scheduler scheduler = greeter.cast(Scheduler.class); // found via the bus
 * </pre>
 *
 * Subclasses override {@link #onClear()} to release resources when finished.
 */
public abstract class BasicInterfaceEx extends AbstractRefObject implements InterfaceEx {
	private final AtomicReference<Bus> host = new AtomicReference<>(null);
	private final AtomicReference<Lifecycle> lifecycle = new AtomicReference<>(ACTIVE);

	enum Lifecycle { ACTIVE, FINISHING, FINISHED }

	protected BasicInterfaceEx() {
	}

	protected BasicInterfaceEx(RefMonitor monitor) {
		super(monitor);
	}

	@Override
	public Resolution queryInterface(@NonNull InterfaceId iid) {
		return queryInterfaceEx(iid, new QueryState());
	}

	@Override
	public Resolution queryInterfaceEx(@NonNull InterfaceId iid, @NonNull QueryState state) {
		checkNotFinished("query");
		if (Capabilities.of(getClass()).supports(iid)) {
			ref();
			return Resolution.resolved(this);
		}

		state.addVisited(this);

		Bus bus = host.get();
		if (bus != null && !state.isVisited(bus)) {
			return bus.queryInterfaceEx(iid, state);
		}
		return Resolution.notResolved();
	}

	@Override
	public void setBus(@Nullable Bus bus) {
		if (bus == null) {
			host.set(null);
		} else if (!host.compareAndSet(null, bus)) {
			throw new AlreadyHostedException(this, host.get(), bus);
		}
	}

	@Override
	public @Nullable Bus bus() {
		return host.get();
	}

	@Override
	public void finish() {
		if (lifecycle.compareAndSet(ACTIVE, FINISHING)) {
			LOGGER.debug("Finishing {}", this);
			try {
				onClear();
			} finally {
				lifecycle.set(FINISHED);
			}
		}
	}

	@Override
	public boolean finished() {
		return lifecycle.get() != ACTIVE;
	}

	/**
	 * Called once, by the first call to {@link #finish()}.
	 * Queries still work while this runs, so the implementation may
	 * look up the collaborators it needs to shut down cleanly.
	 */
	protected void onClear() { }

	/**
	 * @throws AlreadyFinishedException if {@link #finish()} has completed.
	 */
	protected final void checkNotFinished(String operation) {
		if (lifecycle.get() == FINISHED) {
			throw new AlreadyFinishedException(this, operation);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(BasicInterfaceEx.class);
}
