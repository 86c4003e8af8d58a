package works.intfbus;

/**
 * An object whose lifetime is governed by an explicit reference count.
 *
 * <p>
 * A new object starts with a count of zero. Whoever wants to keep it must
 * {@link #ref()} it, and must later {@link #unref()} it exactly once.
 * When {@link #unref()} takes the count from one to zero, the object is destroyed
 * on the spot, and nobody may touch it again.
 *
 * <p>
 * {@link AutoRef} automates the bookkeeping.
 */
public interface RefObject {
	/**
	 * Increments the reference count.
	 */
	void ref();

	/**
	 * Decrements the reference count, destroying this object if the count reaches zero.
	 */
	void unref();

	/**
	 * Decrements the reference count without ever destroying this object,
	 * even if the count reaches zero.
	 *
	 * <p>
	 * Used to give back a reference that was handed out by a query
	 * when the caller only wanted to know the object was there.
	 */
	void unrefNoDelete();

	/**
	 * @return the current reference count.
	 */
	int count();
}
