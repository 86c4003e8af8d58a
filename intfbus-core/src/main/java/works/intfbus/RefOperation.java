package works.intfbus;

/**
 * The counting operations reported to a {@link RefMonitor}.
 */
public enum RefOperation {
	REF,
	UNREF,
	UNREF_NO_DELETE,
}
