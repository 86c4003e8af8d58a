package works.intfbus.exceptions;

/**
 * Indicates that the caller broke one of the rules of the object model,
 * such as releasing a reference it never held,
 * or using an interface after it has been finished.
 *
 * <p>
 * These are programming errors. They are never thrown to report that an interface
 * could not be found; that outcome is an ordinary result of a query.
 */
public class ContractViolationException extends IllegalStateException {
	public ContractViolationException(String message) { super(message); }
	public ContractViolationException(Throwable cause) { super(cause); }
	public ContractViolationException(String message, Throwable cause) { super(message, cause); }
}
