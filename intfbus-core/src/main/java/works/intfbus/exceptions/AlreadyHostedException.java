package works.intfbus.exceptions;

import works.intfbus.Bus;
import works.intfbus.InterfaceEx;

/**
 * Thrown when a hosting bus is assigned to an {@link InterfaceEx} that already has one.
 * An interface can be hosted by at most one bus at a time.
 */
@SuppressWarnings("serial")
public class AlreadyHostedException extends ContractViolationException {
	public AlreadyHostedException(InterfaceEx target, Bus currentHost, Bus newHost) {
		super("Hosting bus already exists for " + target + ": currently " + currentHost + ", attempted " + newHost);
	}
}
