package works.intfbus;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import lombok.NonNull;

/**
 * The objects already visited by one query as it traverses the bus graph.
 *
 * <p>
 * Buses may refer to each other in cycles (siblings refer to each other,
 * and an interface refers to its host which refers back to it),
 * so each step of a traversal records where it has been, and never goes there again.
 * A fresh state is created for every top-level query, and is not shared between threads.
 */
public final class QueryState {
	private final Set<Object> visited = Collections.newSetFromMap(new IdentityHashMap<>());

	public void addVisited(@NonNull Object node) {
		visited.add(node);
	}

	public boolean isVisited(Object node) {
		return visited.contains(node);
	}

	public int visitedCount() {
		return visited.size();
	}

	/**
	 * Continues the query at <code>target</code>, unless it has already been visited,
	 * or has been finished.
	 */
	public Resolution resolve(@NonNull InterfaceEx target, @NonNull InterfaceId iid) {
		if (isVisited(target) || target.finished()) {
			return Resolution.notResolved();
		}
		return target.queryInterfaceEx(iid, this);
	}
}
