package works.intfbus;

import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.intfbus.exceptions.ReferenceCountException;

import static works.intfbus.RefOperation.REF;
import static works.intfbus.RefOperation.UNREF;
import static works.intfbus.RefOperation.UNREF_NO_DELETE;

/**
 * Thread-safe reference counting for {@link RefObject}.
 *
 * <p>
 * Counting operations on one object are serialized by a lock private to that object.
 * The lock is held only while the monitor runs and the count changes;
 * in particular, {@link #onDestroy()} runs after it has been released,
 * so that destruction may release references to other objects
 * (or even, indirectly, to this one) without deadlocking.
 */
public abstract class AbstractRefObject implements RefObject {
	private final Object countLock = new Object();
	private final RefMonitor monitor;
	private int count = 0;
	private boolean destroyed = false;

	protected AbstractRefObject() {
		this(RefMonitor.NONE);
	}

	protected AbstractRefObject(@NonNull RefMonitor monitor) {
		this.monitor = monitor;
	}

	@Override
	public final void ref() {
		synchronized (countLock) {
			checkNotDestroyed(REF);
			monitor.onRefOperation(this, count, REF);
			++count;
		}
	}

	@Override
	public final void unref() {
		boolean destroyNow;
		synchronized (countLock) {
			checkNotDestroyed(UNREF);
			monitor.onRefOperation(this, count, UNREF);
			if (count == 0) {
				throw new ReferenceCountException("unref(): reference count is already 0 for " + this);
			}
			destroyNow = (--count == 0);
			destroyed = destroyNow;
		}
		if (destroyNow) {
			LOGGER.trace("Destroying {}", this);
			onDestroy();
		}
	}

	@Override
	public final void unrefNoDelete() {
		synchronized (countLock) {
			checkNotDestroyed(UNREF_NO_DELETE);
			monitor.onRefOperation(this, count, UNREF_NO_DELETE);
			if (count == 0) {
				throw new ReferenceCountException("unrefNoDelete(): reference count is already 0 for " + this);
			}
			--count;
		}
	}

	@Override
	public final int count() {
		synchronized (countLock) {
			return count;
		}
	}

	/**
	 * @return true if the last reference has been released by {@link #unref()}.
	 * Nothing else may be done with a destroyed object.
	 */
	public final boolean destroyed() {
		synchronized (countLock) {
			return destroyed;
		}
	}

	/**
	 * Called exactly once, on the thread whose {@link #unref()} released the last reference.
	 * Subclasses release whatever they own here.
	 */
	protected void onDestroy() { }

	private void checkNotDestroyed(RefOperation operation) {
		if (destroyed) {
			throw new ReferenceCountException(operation + " on destroyed object " + this);
		}
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "@" + Integer.toHexString(System.identityHashCode(this));
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(AbstractRefObject.class);
}
