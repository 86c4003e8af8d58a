package works.intfbus;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import works.intfbus.fixtures.Bar;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static works.intfbus.RefOperation.REF;
import static works.intfbus.RefOperation.UNREF;

class RefMonitorsTest {

	@Test
	void logging_reportsWithoutInterfering() {
		Bar bar = new Bar(1, RefMonitors.logging());
		bar.ref();
		bar.ref();
		bar.unref();
		assertEquals(1, bar.count());
		bar.unref();
		assertEquals(0, bar.count());
	}

	@Test
	void all_callsEachMonitorInOrder() {
		List<String> calls = new ArrayList<>();
		RefMonitor first = (target, countBefore, operation) -> calls.add("first " + operation + " " + countBefore);
		RefMonitor second = (target, countBefore, operation) -> calls.add("second " + operation + " " + countBefore);
		Bar bar = new Bar(1, RefMonitors.all(first, RefMonitors.logging(), second));

		bar.ref();
		bar.unref();

		assertEquals(List.of(
			"first " + REF + " 0",
			"second " + REF + " 0",
			"first " + UNREF + " 1",
			"second " + UNREF + " 1"
		), calls);
	}

	@Test
	void all_ofNothing_isNone() {
		assertSame(RefMonitor.NONE, RefMonitors.all());
	}

	@Test
	void all_ofOne_isThatMonitor() {
		RefMonitor only = (target, countBefore, operation) -> { };
		assertSame(only, RefMonitors.all(only));
	}

}
