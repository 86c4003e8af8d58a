package works.intfbus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.NonNull;
import org.jetbrains.annotations.Nullable;
import works.intfbus.exceptions.InvalidInterfaceTypeException;

/**
 * The table of interface types implemented by a class, keyed by {@link InterfaceId}.
 *
 * <p>
 * The table is computed once per class. It lists every {@link Interface} subtype
 * carrying an {@code @Iid} that the class implements, in declaration order:
 * the class's own <code>implements</code> clause first, each interface followed
 * (depth-first) by the interfaces it extends, then the same for each superclass.
 * Answering a query is a lookup in this table.
 */
public final class Capabilities {
	private final Class<?> owner;
	private final Map<InterfaceId, Class<?>> typesByID;

	private Capabilities(Class<?> owner, Map<InterfaceId, Class<?>> typesByID) {
		this.owner = owner;
		this.typesByID = Collections.unmodifiableMap(typesByID);
	}

	/**
	 * @throws InvalidInterfaceTypeException if two interfaces implemented by <code>type</code> declare the same identity.
	 */
	public static Capabilities of(@NonNull Class<?> type) {
		return BY_CLASS.get(type);
	}

	public boolean supports(InterfaceId iid) {
		return typesByID.containsKey(iid);
	}

	/**
	 * @return the interface type having the identity <code>iid</code>, or null.
	 */
	public @Nullable Class<?> lookup(InterfaceId iid) {
		return typesByID.get(iid);
	}

	/**
	 * @return the identities in declaration order.
	 */
	public List<InterfaceId> ids() {
		return List.copyOf(typesByID.keySet());
	}

	@Override
	public String toString() {
		return "Capabilities{" +
			"owner=" + owner.getSimpleName() +
			", ids=" + typesByID.keySet() +
			'}';
	}

	private static Capabilities compute(Class<?> type) {
		Map<InterfaceId, Class<?>> table = new LinkedHashMap<>();
		for (Class<?> c = type; c != null; c = c.getSuperclass()) {
			for (Class<?> i: c.getInterfaces()) {
				addInterface(type, i, table);
			}
		}
		return new Capabilities(type, table);
	}

	private static void addInterface(Class<?> owner, Class<?> candidate, Map<InterfaceId, Class<?>> table) {
		if (Interface.class.isAssignableFrom(candidate) && InterfaceId.isDeclaredBy(candidate)) {
			InterfaceId iid = InterfaceId.of(candidate);
			Class<?> existing = table.putIfAbsent(iid, candidate);
			if (existing != null && existing != candidate) {
				throw new InvalidInterfaceTypeException(owner.getName() + " implements "
					+ existing.getName() + " and " + candidate.getName()
					+ ", which have the same identity " + iid);
			}
		}
		for (Class<?> superInterface: candidate.getInterfaces()) {
			addInterface(owner, superInterface, table);
		}
	}

	private static final ClassValue<Capabilities> BY_CLASS = new ClassValue<>() {
		@Override
		protected Capabilities computeValue(Class<?> type) {
			return compute(type);
		}
	};
}
