package works.intfbus;

import org.jetbrains.annotations.Nullable;
import works.intfbus.annotations.Iid;

/**
 * Connects interfaces, and other buses, so that each can discover the others.
 *
 * <p>
 * Each bus has a <em>level</em>: 0 is the most secure, and larger numbers are
 * progressively less secure. A bus may connect only to buses at its own level
 * (which become its <em>siblings</em>) or at less secure levels.
 * Queries flow from the more secure side to the less secure side but not back,
 * so interfaces on a secure bus can use those on less secure buses
 * without being visible to them.
 */
@Iid("B7914714-4159-48C6-BFF3-A21C6F0BB1CA")
public interface Bus extends InterfaceEx {
	/**
	 * Same as {@link #connect(InterfaceEx, int) connect(candidate, 0)}.
	 */
	default boolean connect(InterfaceEx candidate) {
		return connect(candidate, 0);
	}

	/**
	 * Connects <code>candidate</code>, which can be an ordinary interface or another bus.
	 *
	 * <p>
	 * An ordinary interface is hosted by this bus, which takes a reference to it.
	 * A bus at a less secure level is connected downstream, and a reference is taken.
	 * A bus at the same level becomes a sibling: a mutual link that holds no reference,
	 * so the caller must itself keep the sibling alive.
	 *
	 * @param order the teardown pass in which this bus will {@link #finish() finish} the candidate;
	 *              lower passes are finished first. Ignored for buses.
	 * @return false if the connection was refused.
	 */
	boolean connect(InterfaceEx candidate, int order);

	/**
	 * Disconnects <code>candidate</code>, whether it is a hosted interface, a downstream bus, or a sibling.
	 * An interface already obtained from a query remains usable until it is released.
	 */
	void disconnect(InterfaceEx candidate);

	/**
	 * @return this bus's security level; 0 is the most secure.
	 */
	int level();

	/**
	 * Finds a bus with the given level reachable from this one.
	 * No reference is taken on the result.
	 *
	 * @return this bus if <code>busLevel</code> is its own level; null if there is no such bus,
	 * which is always the case if <code>busLevel</code> is more secure than this bus.
	 */
	default @Nullable Bus findFirstBusByLevel(int busLevel) {
		return findFirstBusByLevel(busLevel, new QueryState());
	}

	/**
	 * The traversal step of {@link #findFirstBusByLevel(int)}.
	 */
	@Nullable Bus findFirstBusByLevel(int busLevel, QueryState state);

	/**
	 * Records <code>bus</code> as a sibling without taking a reference.
	 * Only half of the mutual sibling protocol; use {@link #connect} instead.
	 */
	void addSiblingBus(Bus bus);

	/**
	 * Forgets the sibling <code>bus</code>. Only half of the mutual sibling protocol;
	 * called by a sibling that is being disconnected or torn down.
	 */
	void removeSiblingBus(Bus bus);
}
