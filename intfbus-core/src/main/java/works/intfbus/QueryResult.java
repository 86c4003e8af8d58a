package works.intfbus;

/**
 * Outcome of an interface query.
 */
public enum QueryResult {
	OK,
	NOT_RESOLVED,
}
