package works.intfbus.exceptions;

/**
 * Thrown when a reference is released from an object whose count is already zero,
 * or when any counting operation is applied to an object that has been destroyed.
 */
@SuppressWarnings("serial")
public class ReferenceCountException extends ContractViolationException {
	public ReferenceCountException(String message) { super(message); }
}
