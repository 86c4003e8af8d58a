package works.intfbus.exceptions;

/**
 * Indicates a class that cannot serve as an interface type,
 * usually because it declares no identity, or because two of the
 * interfaces it implements declare the same one.
 */
public class InvalidInterfaceTypeException extends IllegalArgumentException {
	public InvalidInterfaceTypeException(String message) { super(message); }
	public InvalidInterfaceTypeException(String message, Throwable cause) { super(message, cause); }
}
