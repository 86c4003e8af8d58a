package works.intfbus.logging;

import org.slf4j.MDC;

import static works.intfbus.logging.MdcKeys.BUS_NAME;

public final class MappedDiagnosticContext {
	private MappedDiagnosticContext() {}

	public static MDCScope setupMDC(String busName) {
		MDCScope result = new MDCScope();
		MDC.put(BUS_NAME, busName);
		return result;
	}

	/**
	 * This is like {@link org.slf4j.MDC.MDCCloseable} except instead of
	 * deleting the MDC entry at the end, it restores it to its prior value,
	 * which allows us to nest these. Tearing down a bus tears down the buses
	 * connected to it, so nesting is the normal case.
	 */
	public static final class MDCScope implements AutoCloseable {
		final String oldValue = MDC.get(BUS_NAME);

		@Override
		public void close() {
			if (oldValue == null) {
				MDC.remove(BUS_NAME);
			} else {
				MDC.put(BUS_NAME, oldValue);
			}
		}
	}
}
