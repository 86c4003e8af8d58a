package works.intfbus.logging;

/**
 * Keys to use for SLF4J's Mapped Diagnostic Context.
 */
public final class MdcKeys {
	private MdcKeys() {}

	/**
	 * The name of the bus being torn down.
	 */
	public static final String BUS_NAME = "intfbus.bus";
}
