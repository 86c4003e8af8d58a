package works.intfbus.testing;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import works.intfbus.BusSettings;
import works.intfbus.DefaultBus;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

public class DefaultBusConformanceTest extends BusConformanceTest {

	@BeforeEach
	void setupBusFactory() {
		busFactory = (name, level) -> new DefaultBus(new BusSettings(name, level, BusSettings.DEFAULT_FINISH_PASSES));
	}

	@Test
	void busNames_identifyLevelAndCaller() {
		DefaultBus first = (DefaultBus) newBus(2);
		DefaultBus second = (DefaultBus) newBus(2);
		assertThat(first.name(), startsWith("L2-bus"));
		assertThat(first.name(), containsString("DefaultBusConformanceTest.java:"));
		assertNotEquals(first.name(), second.name());
	}

}
