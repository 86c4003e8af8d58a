package works.intfbus;

import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;
import static works.intfbus.QueryResult.NOT_RESOLVED;
import static works.intfbus.QueryResult.OK;

/**
 * The result of {@link Interface#queryInterface}.
 *
 * <p>
 * When {@link #result()} is {@link QueryResult#OK OK}, {@link #target()} holds the
 * interface that was found, and one reference to it now belongs to the caller,
 * who must eventually release it (or wrap it with {@link AutoRef#adopt}).
 *
 * @param target the interface found, or null if the query was not resolved
 */
public record Resolution(QueryResult result, @Nullable Interface target) {
	public Resolution {
		requireNonNull(result);
		if ((result == OK) != (target != null)) {
			throw new IllegalArgumentException("Target must be present exactly when the result is OK: " + result + ", " + target);
		}
	}

	public static Resolution resolved(Interface target) {
		return new Resolution(OK, requireNonNull(target));
	}

	public static Resolution notResolved() {
		return UNRESOLVED;
	}

	public boolean isResolved() {
		return result == OK;
	}

	/**
	 * @return the target viewed as <code>type</code>, or null if the query was not resolved.
	 * @throws ClassCastException if the target does not implement <code>type</code>.
	 */
	public <T> @Nullable T targetAs(Class<T> type) {
		return type.cast(target);
	}

	private static final Resolution UNRESOLVED = new Resolution(NOT_RESOLVED, null);
}
