package works.intfbus;

import org.jetbrains.annotations.Nullable;
import works.intfbus.annotations.Iid;

import static java.util.Objects.requireNonNull;

/**
 * The root of all interfaces: a reference-counted object that can be asked,
 * by {@link InterfaceId}, for the other interfaces it offers.
 *
 * <p>
 * An interface type is a Java interface extending this one and carrying an
 * {@link Iid @Iid} annotation. Implementations usually extend {@link BasicInterface}
 * or, for objects that live on a {@link Bus}, {@link BasicInterfaceEx}.
 */
@Iid("B4FF784E-2DDA-4CA2-BC84-4AAD35FCAAF3")
public interface Interface extends RefObject {
	/**
	 * Looks up the interface with the given identity.
	 * On success, the returned target has been {@link #ref() ref}'d on behalf of the caller.
	 * Failure is reported as {@link Resolution#notResolved()}, never as an exception.
	 */
	Resolution queryInterface(InterfaceId iid);

	/**
	 * @return true if the interface <code>iid</code> can be reached from this one.
	 * The reference count is unchanged afterward.
	 */
	default boolean supports(InterfaceId iid) {
		requireNonNull(iid);
		Resolution resolution = queryInterface(iid);
		if (resolution.isResolved()) {
			resolution.target().unrefNoDelete(); // balance queryInterface
			return true;
		}
		return false;
	}

	/**
	 * @return the interface <code>type</code> reachable from this one, or null.
	 * No reference is taken: the result is only valid as long as some other
	 * reference keeps it alive. Use {@link AutoRef#query} to keep it.
	 */
	default <T extends Interface> @Nullable T cast(Class<T> type) {
		Resolution resolution = queryInterface(InterfaceId.of(requireNonNull(type)));
		if (!resolution.isResolved()) {
			return null;
		}
		T result = resolution.targetAs(type);
		result.unrefNoDelete(); // balance queryInterface
		return result;
	}
}
