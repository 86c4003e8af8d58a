package works.intfbus;

import static java.util.Objects.requireNonNull;

/**
 * Observes the counting operations of a {@link RefObject}.
 * Supplied when the object is constructed.
 *
 * <p>
 * Monitors are for testing and debugging; nothing in the object model depends on them.
 * They are called while the object's counting lock is held, so they should be quick,
 * and must not count references on other objects.
 */
@FunctionalInterface
public interface RefMonitor {
	/**
	 * @param target the object whose count is about to change
	 * @param countBefore the count before the operation takes effect
	 * @param operation the operation being performed
	 */
	void onRefOperation(RefObject target, int countBefore, RefOperation operation);

	default RefMonitor andThen(RefMonitor next) {
		requireNonNull(next);
		return (target, countBefore, operation) -> {
			onRefOperation(target, countBefore, operation);
			next.onRefOperation(target, countBefore, operation);
		};
	}

	RefMonitor NONE = (target, countBefore, operation) -> { };
}
