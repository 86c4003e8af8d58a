package works.intfbus;

import org.jetbrains.annotations.Nullable;
import works.intfbus.annotations.Iid;

/**
 * An {@link Interface} that can be hosted on a {@link Bus}, and so can discover
 * the other interfaces reachable through that bus.
 *
 * <p>
 * Extended interfaces also have an explicit shutdown phase, {@link #finish()},
 * separate from destruction, so that resources can be released in a controlled order
 * before the final reference goes away.
 */
@Iid("632B176F-E7B9-4557-9657-15DB3AC94FBC")
public interface InterfaceEx extends Interface {
	/**
	 * The bus-aware form of {@link #queryInterface}, carrying the traversal's visited set.
	 */
	Resolution queryInterfaceEx(InterfaceId iid, QueryState state);

	/**
	 * Sets the hosting bus, or clears it if <code>bus</code> is null.
	 * Called by the bus itself on connection and disconnection.
	 *
	 * @throws works.intfbus.exceptions.AlreadyHostedException if <code>bus</code> is not null and a host is already set.
	 */
	void setBus(@Nullable Bus bus);

	/**
	 * @return the hosting bus, or null. No reference is taken.
	 */
	@Nullable Bus bus();

	/**
	 * Releases internal resources. Idempotent.
	 *
	 * <p>
	 * For an ordinary interface, its operations should not be called once it is finished.
	 * For a bus, all hosted interfaces and connected buses are finished and released.
	 */
	void finish();

	/**
	 * @return true once {@link #finish()} has been called.
	 */
	boolean finished();
}
