package works.intfbus.exceptions;

import works.intfbus.InterfaceEx;

/**
 * Thrown when a query or a connect-style operation is invoked on an
 * {@link InterfaceEx} whose {@link InterfaceEx#finish() finish} has completed.
 */
@SuppressWarnings("serial")
public class AlreadyFinishedException extends ContractViolationException {
	public AlreadyFinishedException(InterfaceEx target, String operation) {
		super("Cannot " + operation + ": " + target + " is already finished");
	}
}
