package works.intfbus;

import java.util.NoSuchElementException;
import lombok.NonNull;
import org.jetbrains.annotations.Nullable;

/**
 * Owns at most one reference to a {@link RefObject}, and releases it on {@link #close()}.
 *
 * <p>
 * Intended for try-with-resources:
 *
 * <pre>
 * try (AutoRef&lt;Foo&gt; foo = AutoRef.query(bus, Foo.class)) {
 *     if (foo.isPresent()) {
 *         foo.get().doSomething();
 *     }
 * }
 * </pre>
 *
 * Not thread-safe: an <code>AutoRef</code> belongs to one thread at a time,
 * though the object it refers to may be shared freely.
 */
public final class AutoRef<T extends RefObject> implements AutoCloseable {
	private @Nullable T target;

	private AutoRef(@Nullable T target) {
		this.target = target;
	}

	public static <T extends RefObject> AutoRef<T> empty() {
		return new AutoRef<>(null);
	}

	/**
	 * Takes a new reference to <code>target</code>.
	 */
	public static <T extends RefObject> AutoRef<T> of(@NonNull T target) {
		target.ref();
		return new AutoRef<>(target);
	}

	/**
	 * Takes ownership of a reference the caller already holds, such as
	 * the target of a {@link Resolution}.
	 */
	public static <T extends RefObject> AutoRef<T> adopt(@Nullable T target) {
		return new AutoRef<>(target);
	}

	/**
	 * @return an <code>AutoRef</code> owning the <code>type</code> interface reachable from
	 * <code>from</code>, or an empty one if there is none.
	 */
	public static <T extends Interface> AutoRef<T> query(@NonNull Interface from, @NonNull Class<T> type) {
		return adopt(from.queryInterface(InterfaceId.of(type)).targetAs(type));
	}

	public @Nullable T get() {
		return target;
	}

	/**
	 * @return the target, which must be present.
	 * @throws NoSuchElementException if this is empty
	 */
	public T require() {
		if (target == null) {
			throw new NoSuchElementException("AutoRef is empty");
		}
		return target;
	}

	/**
	 * @return the target with a new reference taken for the caller, or null if empty.
	 */
	public @Nullable T getRef() {
		T result = target;
		if (result != null) {
			result.ref();
		}
		return result;
	}

	public boolean isPresent() {
		return target != null;
	}

	public boolean isEmpty() {
		return target == null;
	}

	/**
	 * Refers to <code>newTarget</code> instead, releasing the old target.
	 * The new reference is taken first, so setting the current target is harmless.
	 */
	public AutoRef<T> set(@Nullable T newTarget) {
		if (newTarget != null) {
			newTarget.ref();
		}
		T old = target;
		target = newTarget;
		if (old != null) {
			old.unref();
		}
		return this;
	}

	/**
	 * Refers to the <code>type</code> interface reachable from <code>from</code>, or to nothing
	 * if there is none. The old target is released either way.
	 */
	public AutoRef<T> assign(@NonNull Interface from, @NonNull Class<? extends T> type) {
		T newTarget = from.queryInterface(InterfaceId.of(type)).targetAs(type);
		T old = target;
		target = newTarget;
		if (old != null) {
			old.unref();
		}
		return this;
	}

	/**
	 * @return another <code>AutoRef</code> with its own reference to the same target.
	 */
	public AutoRef<T> copy() {
		return new AutoRef<>(getRef());
	}

	/**
	 * @return a new <code>AutoRef</code> that takes over this one's reference, leaving this one empty.
	 */
	public AutoRef<T> move() {
		T result = target;
		target = null;
		return new AutoRef<>(result);
	}

	/**
	 * @return an <code>AutoRef</code> owning the <code>type</code> interface reachable from
	 * the target. Empty if this is empty, or the target is not an {@link Interface}.
	 */
	public <U extends Interface> AutoRef<U> cast(@NonNull Class<U> type) {
		if (target instanceof Interface) {
			return query((Interface) target, type);
		} else {
			return empty();
		}
	}

	/**
	 * Gives up ownership of the target's reference via {@link RefObject#unrefNoDelete()},
	 * so the target is not destroyed even if this was the last reference.
	 *
	 * @return the former target, or null if empty
	 */
	public @Nullable T release() {
		T result = target;
		target = null;
		if (result != null) {
			result.unrefNoDelete();
		}
		return result;
	}

	/**
	 * Releases the target, which may destroy it.
	 */
	public void clear() {
		T old = target;
		target = null;
		if (old != null) {
			old.unref();
		}
	}

	@Override
	public void close() {
		clear();
	}

	@Override
	public String toString() {
		return "AutoRef(" + target + ")";
	}
}
