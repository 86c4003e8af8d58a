package works.intfbus;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import works.intfbus.annotations.Iid;
import works.intfbus.exceptions.InvalidInterfaceTypeException;
import works.intfbus.util.StableHash;

/**
 * The identity of an interface type: a 64-bit hash of the string
 * declared by its {@link Iid @Iid} annotation.
 *
 * <p>
 * Two identifiers are equal if and only if their hashes are equal.
 * The source string is kept only so that identifiers print legibly.
 */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public final class InterfaceId {
	@EqualsAndHashCode.Include final long value;
	@NonNull final String name;

	public static InterfaceId of(@NonNull String name) {
		return new InterfaceId(StableHash.hash(name), name);
	}

	/**
	 * @throws InvalidInterfaceTypeException if <code>interfaceType</code> has no {@link Iid @Iid} annotation.
	 */
	public static InterfaceId of(@NonNull Class<?> interfaceType) {
		return BY_TYPE.get(interfaceType);
	}

	/**
	 * @return true if <code>type</code> declares an identity.
	 */
	public static boolean isDeclaredBy(@NonNull Class<?> type) {
		return type.isAnnotationPresent(Iid.class);
	}

	public long value() {
		return value;
	}

	public String name() {
		return name;
	}

	@Override
	public String toString() {
		return name + "#" + Long.toHexString(value);
	}

	private static final ClassValue<InterfaceId> BY_TYPE = new ClassValue<>() {
		@Override
		protected InterfaceId computeValue(Class<?> type) {
			Iid iid = type.getAnnotation(Iid.class);
			if (iid == null) {
				throw new InvalidInterfaceTypeException("Interface type " + type.getName() + " has no @" + Iid.class.getSimpleName() + " annotation");
			}
			return InterfaceId.of(iid.value());
		}
	};
}
