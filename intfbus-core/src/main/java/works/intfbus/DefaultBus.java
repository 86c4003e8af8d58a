package works.intfbus;

import java.util.ArrayList;
import java.util.List;
import java.util.ListIterator;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import lombok.NonNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.intfbus.exceptions.AlreadyFinishedException;
import works.intfbus.logging.MappedDiagnosticContext;

import static java.util.Comparator.comparingInt;
import static works.intfbus.DefaultBus.Status.ACTIVE;
import static works.intfbus.DefaultBus.Status.CLEARED;
import static works.intfbus.DefaultBus.Status.CLEARING;

/**
 * The standard {@link Bus}.
 *
 * <p>
 * Holds three kinds of connection:
 * <ol>
 *     <li>
 *         Hosted interfaces, in the order they were connected, each with the
 *         teardown pass given to {@link #connect(InterfaceEx, int)}.
 *         The bus holds a reference to each, and is each one's {@link InterfaceEx#bus() host}.
 *     </li>
 *     <li>
 *         Downstream buses at less secure levels, kept sorted by level.
 *         The bus holds a reference to each.
 *     </li>
 *     <li>
 *         Sibling buses at the same level. These hold no reference;
 *         instead, a bus tearing down removes itself from all its siblings.
 *     </li>
 * </ol>
 *
 * Queries look in that order: local interfaces first, then siblings, then downstream buses.
 *
 * <p>
 * All structural operations are serialized by a lock, which is reentrant
 * because teardown can call back into this bus. Traversals work on a snapshot of the
 * connections taken under the lock. While holding its lock, a bus only takes the locks
 * of less secure buses, or of a sibling with a higher serial number.
 * The bus is torn down by {@link #finish()}, or by releasing its last reference,
 * whichever comes first.
 */
public class DefaultBus extends BasicInterfaceEx implements Bus {
	private final String name;
	private final int level;
	private final int finishPasses;
	private final long serial = SERIAL_NUMBERS.getAndIncrement();
	private final ReentrantLock lock = new ReentrantLock();

	// Guarded by lock
	private final List<HostedInterface> interfaces = new ArrayList<>();
	private final List<Bus> buses = new ArrayList<>();
	private final List<Bus> siblings = new ArrayList<>();
	private volatile Status status = ACTIVE;

	enum Status { ACTIVE, CLEARING, CLEARED }

	record HostedInterface(int order, InterfaceEx target) { }

	public DefaultBus(int level) {
		this(BusSettings.atLevel(level));
	}

	public DefaultBus(String name, int level) {
		this(new BusSettings(name, level, BusSettings.DEFAULT_FINISH_PASSES));
	}

	public DefaultBus(BusSettings settings) {
		this(settings, RefMonitor.NONE);
	}

	public DefaultBus(@NonNull BusSettings settings, RefMonitor monitor) {
		super(monitor);
		this.name = settings.name();
		this.level = settings.level();
		this.finishPasses = settings.finishPasses();
	}

	public String name() {
		return name;
	}

	@Override
	public int level() {
		return level;
	}

	public int totalInterfaces() {
		lock.lock();
		try {
			return interfaces.size();
		} finally {
			lock.unlock();
		}
	}

	public int totalBuses() {
		lock.lock();
		try {
			return buses.size();
		} finally {
			lock.unlock();
		}
	}

	public int totalSiblings() {
		lock.lock();
		try {
			return siblings.size();
		} finally {
			lock.unlock();
		}
	}

	@Override
	public boolean connect(@NonNull InterfaceEx candidate, int order) {
		if (order < 0 || order >= finishPasses) {
			throw new IllegalArgumentException("Order " + order + " is outside [0, " + finishPasses + ") for " + this);
		}
		checkOpen("connect");
		if (candidate == this) {
			LOGGER.debug("{}: refusing to connect to itself", this);
			return false;
		}

		// Asking the candidate takes the candidate's lock (or its host's), so ours must not be held yet
		Resolution asBus = candidate.queryInterfaceEx(BUS_ID, new QueryState());
		try (AutoRef<Bus> other = AutoRef.adopt(asBus.targetAs(Bus.class))) {
			if (other.isPresent()) {
				return connectBus(candidate, other.get());
			}
		}

		lock.lock();
		try {
			checkOpen("connect");
			return connectInterface(candidate, order);
		} finally {
			lock.unlock();
		}
	}

	private boolean connectBus(InterfaceEx candidate, Bus other) {
		if (other != candidate) {
			// The query went through the candidate's host
			LOGGER.debug("{}: refusing {}, which is already hosted by {}", this, candidate, other);
			return false;
		}

		int otherLevel = other.level();
		if (otherLevel > level) {
			lock.lock();
			try {
				checkOpen("connect");
				if (indexOf(buses, other) >= 0) {
					LOGGER.debug("{}: {} is already connected", this, other);
					return false;
				}
				other.ref();
				buses.add(other);
				buses.sort(comparingInt(Bus::level));
				LOGGER.debug("{}: connected downstream bus {}", this, other);
				return true;
			} finally {
				lock.unlock();
			}
		}

		if (otherLevel == level) {
			if (other.count() == 1) {
				// Only our query refers to it. Siblings are not referenced, so it would
				// be destroyed as soon as we return, leaving us with a dangling sibling.
				LOGGER.debug("{}: refusing sibling {}, which nobody else refers to", this, other);
				return false;
			}
			if (other instanceof DefaultBus) {
				return connectSibling((DefaultBus) other);
			} else {
				return connectForeignSibling(other);
			}
		}

		LOGGER.debug("{}: refusing {}, which is more secure", this, other);
		return false;
	}

	/**
	 * Both sides of the link change under both locks, so two buses linking
	 * to each other at once end up with exactly one link.
	 */
	private boolean connectSibling(DefaultBus other) {
		lockWith(other);
		try {
			checkOpen("connect");
			if (status != ACTIVE || other.status != ACTIVE) {
				LOGGER.debug("{}: refusing sibling {} during teardown", this, other);
				return false;
			}
			if (indexOf(siblings, other) >= 0) {
				LOGGER.debug("{}: {} is already a sibling", this, other);
				return false;
			}
			siblings.add(other);
			if (indexOf(other.siblings, this) < 0) {
				other.siblings.add(this);
			}
			LOGGER.debug("{}: connected sibling bus {}", this, other);
			return true;
		} finally {
			unlockWith(other);
		}
	}

	/**
	 * A {@link Bus} of another class only offers {@link Bus#addSiblingBus},
	 * which is called after our own lock is released.
	 */
	private boolean connectForeignSibling(Bus other) {
		lock.lock();
		try {
			checkOpen("connect");
			if (status != ACTIVE) {
				LOGGER.debug("{}: refusing sibling {} during teardown", this, other);
				return false;
			}
			if (indexOf(siblings, other) >= 0) {
				LOGGER.debug("{}: {} is already a sibling", this, other);
				return false;
			}
			siblings.add(other);
		} finally {
			lock.unlock();
		}

		try {
			other.addSiblingBus(this);
		} catch (AlreadyFinishedException e) {
			LOGGER.debug("{}: sibling {} finished while connecting", this, other, e);
			removeSiblingBus(other);
			return false;
		}
		LOGGER.debug("{}: connected sibling bus {}", this, other);
		return true;
	}

	private boolean connectInterface(InterfaceEx candidate, int order) {
		Bus currentHost = candidate.bus();
		if (currentHost != null) {
			LOGGER.debug("{}: refusing {}, which is already hosted by {}", this, candidate, currentHost);
			return false;
		}
		if (indexOfInterface(candidate) >= 0) {
			LOGGER.debug("{}: {} is already hosted here", this, candidate);
			return false;
		}
		candidate.ref();
		interfaces.add(new HostedInterface(order, candidate));
		candidate.setBus(this);
		LOGGER.debug("{}: hosting {} for finish pass {}", this, candidate, order);
		return true;
	}

	@Override
	public void disconnect(@NonNull InterfaceEx candidate) {
		if (candidate instanceof DefaultBus && candidate != this && disconnectSibling((DefaultBus) candidate)) {
			return;
		}

		Bus foreignSibling = null;
		lock.lock();
		try {
			checkOpen("disconnect");

			int index = indexOfInterface(candidate);
			if (index >= 0) {
				interfaces.remove(index);
				candidate.setBus(null);
				LOGGER.debug("{}: disconnected {}", this, candidate);
				candidate.unref();
				return;
			}

			index = indexOf(buses, candidate);
			if (index >= 0) {
				buses.remove(index);
				LOGGER.debug("{}: disconnected downstream bus {}", this, candidate);
				candidate.unref();
				return;
			}

			index = indexOf(siblings, candidate);
			if (index >= 0) {
				foreignSibling = siblings.remove(index);
			} else {
				LOGGER.debug("{}: ignoring disconnection of {}, which is not connected", this, candidate);
				return;
			}
		} finally {
			lock.unlock();
		}

		foreignSibling.removeSiblingBus(this);
		LOGGER.debug("{}: disconnected sibling bus {}", this, foreignSibling);
	}

	/**
	 * @return true if <code>other</code> was a sibling, and both sides of the link are now gone.
	 */
	private boolean disconnectSibling(DefaultBus other) {
		lockWith(other);
		try {
			checkOpen("disconnect");
			int index = indexOf(siblings, other);
			if (index < 0) {
				return false;
			}
			siblings.remove(index);
			index = indexOf(other.siblings, this);
			if (index >= 0) {
				other.siblings.remove(index);
			}
			LOGGER.debug("{}: disconnected sibling bus {}", this, other);
			return true;
		} finally {
			unlockWith(other);
		}
	}

	/**
	 * Locks are always taken in order of level, then serial number. Nothing
	 * takes a bus's lock while holding the lock of a less secure bus,
	 * or of a sibling with a higher serial number.
	 */
	private void lockWith(DefaultBus other) {
		if (comesBefore(other)) {
			lock.lock();
			other.lock.lock();
		} else {
			other.lock.lock();
			lock.lock();
		}
	}

	private void unlockWith(DefaultBus other) {
		other.lock.unlock();
		lock.unlock();
	}

	private boolean comesBefore(DefaultBus other) {
		if (level != other.level) {
			return level < other.level;
		} else {
			return serial < other.serial;
		}
	}

	@Override
	public @Nullable Bus findFirstBusByLevel(int busLevel, @NonNull QueryState state) {
		if (busLevel < level) {
			checkOpen("find bus");
			return null;
		}
		if (busLevel == level) {
			checkOpen("find bus");
			return this;
		}

		state.addVisited(this);
		Snapshot snapshot = snapshot("find bus");
		for (Bus bus: snapshot.buses()) {
			Bus result = findFrom(bus, busLevel, state);
			if (result != null) {
				return result;
			}
		}
		for (Bus bus: snapshot.siblings()) {
			Bus result = findFrom(bus, busLevel, state);
			if (result != null) {
				return result;
			}
		}
		return null;
	}

	private static @Nullable Bus findFrom(Bus bus, int busLevel, QueryState state) {
		if (state.isVisited(bus) || bus.finished()) {
			return null;
		}
		return bus.findFirstBusByLevel(busLevel, state);
	}

	@Override
	public void addSiblingBus(@NonNull Bus bus) {
		lock.lock();
		try {
			if (status != ACTIVE) {
				// A sibling added now would never be told we are gone
				throw new AlreadyFinishedException(this, "add sibling");
			}
			if (indexOf(siblings, bus) < 0) {
				siblings.add(bus);
			}
		} finally {
			lock.unlock();
		}
	}

	@Override
	public void removeSiblingBus(@NonNull Bus bus) {
		lock.lock();
		try {
			int index = indexOf(siblings, bus);
			if (index >= 0) {
				siblings.remove(index);
			}
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Looks in hosted interfaces, then siblings, then downstream buses.
	 * The lock is held only long enough to take a snapshot of the connections,
	 * so that queries arriving at two siblings from different threads cannot deadlock.
	 */
	@Override
	public Resolution queryInterfaceEx(@NonNull InterfaceId iid, @NonNull QueryState state) {
		Snapshot snapshot = snapshot("query");
		if (Capabilities.of(getClass()).supports(iid)) {
			ref();
			return Resolution.resolved(this);
		}

		state.addVisited(this);

		for (InterfaceEx target: snapshot.interfaces()) {
			Resolution result = state.resolve(target, iid);
			if (result.isResolved()) {
				return result;
			}
		}
		for (Bus bus: snapshot.siblings()) {
			Resolution result = state.resolve(bus, iid);
			if (result.isResolved()) {
				return result;
			}
		}
		for (Bus bus: snapshot.buses()) {
			Resolution result = state.resolve(bus, iid);
			if (result.isResolved()) {
				return result;
			}
		}
		return Resolution.notResolved();
	}

	private record Snapshot(List<InterfaceEx> interfaces, List<Bus> siblings, List<Bus> buses) { }

	private Snapshot snapshot(String operation) {
		lock.lock();
		try {
			checkOpen(operation);
			List<InterfaceEx> targets = new ArrayList<>(interfaces.size());
			for (HostedInterface h: interfaces) {
				targets.add(h.target());
			}
			return new Snapshot(targets, List.copyOf(siblings), List.copyOf(buses));
		} finally {
			lock.unlock();
		}
	}

	@Override
	protected void onClear() {
		reset();
	}

	@Override
	protected void onDestroy() {
		reset();
	}

	/**
	 * Tears down all connections:
	 * <ol>
	 *     <li>leave every sibling,</li>
	 *     <li>finish hosted interfaces pass by pass, the most recently connected first within each pass,</li>
	 *     <li>detach and release all hosted interfaces,</li>
	 *     <li>finish, detach and release downstream buses, the most recently connected first.</li>
	 * </ol>
	 * If any of these throws, the rest of the teardown still happens,
	 * and the first exception is rethrown at the end.
	 */
	private void reset() {
		List<Bus> leaving;
		lock.lock();
		try {
			if (status != ACTIVE) {
				return;
			}
			status = CLEARING;
			leaving = List.copyOf(siblings);
			siblings.clear();
		} finally {
			lock.unlock();
		}

		try (var __ = MappedDiagnosticContext.setupMDC(name)) {
			RuntimeException failure = null;

			// Each sibling takes its own lock, so ours is not held here
			for (Bus sibling: leaving) {
				failure = attempt(failure, "leave sibling " + sibling, () -> sibling.removeSiblingBus(this));
			}

			lock.lock();
			try {
				LOGGER.debug("Tearing down {}: {} interfaces, {} buses, {} siblings left", this, interfaces.size(), buses.size(), leaving.size());

				for (int pass = 0; pass < finishPasses; pass++) {
					List<HostedInterface> hosted = List.copyOf(interfaces);
					for (ListIterator<HostedInterface> iter = hosted.listIterator(hosted.size()); iter.hasPrevious(); ) {
						HostedInterface h = iter.previous();
						if (h.order() == pass) {
							failure = attempt(failure, "finish " + h.target(), h.target()::finish);
						}
					}
				}

				List<HostedInterface> hosted = List.copyOf(interfaces);
				interfaces.clear();
				for (HostedInterface h: hosted) {
					InterfaceEx target = h.target();
					failure = attempt(failure, "release " + target, () -> {
						target.setBus(null);
						target.unref();
					});
				}

				List<Bus> downstream = List.copyOf(buses);
				buses.clear();
				for (ListIterator<Bus> iter = downstream.listIterator(downstream.size()); iter.hasPrevious(); ) {
					Bus bus = iter.previous();
					failure = attempt(failure, "release downstream bus " + bus, () -> {
						bus.finish();
						bus.setBus(null);
						bus.unref();
					});
				}

				status = CLEARED;
				LOGGER.debug("Finished tearing down {}", this);
			} finally {
				lock.unlock();
			}

			if (failure != null) {
				throw failure;
			}
		}
	}

	private @Nullable RuntimeException attempt(@Nullable RuntimeException failure, String description, Runnable action) {
		try {
			action.run();
			return failure;
		} catch (RuntimeException e) {
			LOGGER.warn("{}: unable to {}; continuing teardown", this, description, e);
			if (failure == null) {
				return e;
			} else {
				failure.addSuppressed(e);
				return failure;
			}
		}
	}

	private void checkOpen(String operation) {
		if (status == CLEARED) {
			throw new AlreadyFinishedException(this, operation);
		}
	}

	private int indexOfInterface(InterfaceEx candidate) {
		for (int i = 0; i < interfaces.size(); i++) {
			if (interfaces.get(i).target() == candidate) {
				return i;
			}
		}
		return -1;
	}

	private static int indexOf(List<Bus> list, Object candidate) {
		for (int i = 0; i < list.size(); i++) {
			if (list.get(i) == candidate) {
				return i;
			}
		}
		return -1;
	}

	@Override
	public String toString() {
		return "DefaultBus{" +
			"name=" + name +
			", level=" + level +
			'}';
	}

	private static final InterfaceId BUS_ID = InterfaceId.of(Bus.class);
	private static final AtomicLong SERIAL_NUMBERS = new AtomicLong(0);
	private static final Logger LOGGER = LoggerFactory.getLogger(DefaultBus.class);
}
