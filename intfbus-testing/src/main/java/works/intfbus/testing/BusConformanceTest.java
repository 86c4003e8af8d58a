package works.intfbus.testing;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.intfbus.AutoRef;
import works.intfbus.Bus;
import works.intfbus.InterfaceId;
import works.intfbus.testing.state.Counter;
import works.intfbus.testing.state.Greeter;
import works.intfbus.testing.state.TestCounter;
import works.intfbus.testing.state.TestGreeter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Checks the behaviour every {@link Bus} must have, using only the {@link Bus} interface.
 * Subclasses set {@link #busFactory} in a {@link BeforeEach} method.
 */
public abstract class BusConformanceTest {
	protected BusFactory busFactory;
	protected RecordingRefMonitor monitor;
	protected List<String> finishLog;
	private final List<AutoRef<? extends Bus>> ownedBuses = new ArrayList<>();

	@FunctionalInterface
	public interface BusFactory {
		/**
		 * @return a new bus, with nothing connected and nobody holding a reference to it
		 */
		Bus create(String name, int level);
	}

	@BeforeEach
	void setupMonitor() {
		monitor = new RecordingRefMonitor();
		finishLog = new ArrayList<>();
	}

	@AfterEach
	void releaseBuses() {
		for (int i = ownedBuses.size() - 1; i >= 0; i--) {
			ownedBuses.get(i).close();
		}
		ownedBuses.clear();
	}

	/**
	 * @return a new bus that will be released at the end of the test.
	 * Its name gives its level and the test line that asked for it.
	 */
	protected Bus newBus(int level) {
		AutoRef<Bus> bus = AutoRef.of(busFactory.create(busName(level), level));
		ownedBuses.add(bus);
		return bus.get();
	}

	private static String busName(int level) {
		// Skip ourselves and newBus
		StackWalker.StackFrame caller = StackWalker.getInstance().walk(s -> s.skip(2).findFirst()).get();
		return "L" + level + "-bus" + BUS_COUNTER.incrementAndGet() + "(" + caller.getFileName() + ":" + caller.getLineNumber() + ")";
	}

	protected TestGreeter newGreeter(String name) {
		return new TestGreeter(name, finishLog, monitor);
	}

	@Test
	void connectInterface_discoverable() {
		Bus bus = newBus(0);
		try (AutoRef<TestGreeter> greeter = AutoRef.of(newGreeter("greeter"))) {
			assertTrue(bus.connect(greeter.get()));
			assertSame(bus, greeter.get().bus());
			assertSame(greeter.get(), bus.cast(Greeter.class));
			assertEquals("Hello, you, from greeter", bus.cast(Greeter.class).greet("you"));
			assertEquals(2, greeter.get().count());
		}
	}

	@Test
	void cast_leavesCountUnchanged() {
		Bus bus = newBus(0);
		try (AutoRef<TestGreeter> greeter = AutoRef.of(newGreeter("greeter"))) {
			bus.connect(greeter.get());
			int busCount = bus.count();
			int greeterCount = greeter.get().count();
			assertSame(greeter.get(), greeter.get().cast(Greeter.class));
			assertSame(bus, greeter.get().cast(Bus.class));
			assertNull(greeter.get().cast(Counter.class));
			assertFalse(bus.supports(InterfaceId.of(Counter.class)));
			assertEquals(busCount, bus.count());
			assertEquals(greeterCount, greeter.get().count());
		}
	}

	@Test
	void connectTwice_secondFails() {
		Bus first = newBus(0);
		Bus second = newBus(0);
		try (AutoRef<TestGreeter> greeter = AutoRef.of(newGreeter("greeter"))) {
			assertTrue(first.connect(greeter.get()));
			assertFalse(first.connect(greeter.get()));
			assertFalse(second.connect(greeter.get()));
			assertSame(first, greeter.get().bus());
			assertNull(second.cast(Greeter.class));
		}
	}

	@Test
	void connectSelf_fails() {
		Bus bus = newBus(0);
		assertFalse(bus.connect(bus));
	}

	@Test
	void siblings_mutual() {
		Bus left = newBus(1);
		Bus right = newBus(1);
		try (AutoRef<TestGreeter> greeter = AutoRef.of(newGreeter("greeter"))) {
			right.connect(greeter.get());
			assertTrue(left.connect(right));
			assertSame(greeter.get(), left.cast(Greeter.class));
			assertFalse(right.connect(left), "Already siblings");

			right.disconnect(left);
			assertNull(left.cast(Greeter.class));
			assertTrue(left.connect(right), "Can reconnect after disconnecting");
		}
	}

	@Test
	void moreSecureBus_rejected() {
		Bus secure = newBus(0);
		Bus insecure = newBus(1);
		try (AutoRef<TestGreeter> greeter = AutoRef.of(newGreeter("secret"))) {
			secure.connect(greeter.get());
			assertFalse(insecure.connect(secure));
			assertNull(insecure.cast(Greeter.class));
		}
	}

	@Test
	void cascade_discoverableDownstreamOnly() {
		Bus bus0 = newBus(0);
		Bus bus1 = newBus(1);
		Bus bus2 = newBus(2);
		try (
			AutoRef<TestGreeter> top = AutoRef.of(newGreeter("top"));
			AutoRef<TestCounter> bottom = AutoRef.of(new TestCounter("bottom", finishLog, monitor))
		) {
			bus0.connect(top.get());
			bus2.connect(bottom.get());
			assertTrue(bus1.connect(bus2));
			assertTrue(bus0.connect(bus1));

			assertSame(bottom.get(), bus0.cast(Counter.class));
			assertSame(bottom.get(), top.get().cast(Counter.class));
			assertEquals(1, top.get().cast(Counter.class).increment());
			assertNull(bus2.cast(Greeter.class));
			assertNull(bottom.get().cast(Greeter.class));
		}
	}

	@Test
	void findFirstBusByLevel() {
		Bus bus0 = newBus(0);
		Bus bus1 = newBus(1);
		Bus bus2 = newBus(2);
		bus1.connect(bus2);
		bus0.connect(bus1);

		assertSame(bus0, bus0.findFirstBusByLevel(0));
		assertSame(bus2, bus0.findFirstBusByLevel(2));
		assertNull(bus2.findFirstBusByLevel(0));
		assertNull(bus0.findFirstBusByLevel(3));
	}

	@Test
	void finish_laterInstalledFirst() {
		Bus bus = newBus(0);
		try (
			AutoRef<TestGreeter> early = AutoRef.of(newGreeter("early"));
			AutoRef<TestGreeter> late = AutoRef.of(newGreeter("late"))
		) {
			bus.connect(early.get());
			bus.connect(late.get());
			bus.finish();

			assertEquals(List.of("late", "early"), finishLog);
			assertTrue(early.get().finished());
			assertTrue(late.get().finished());
			assertNull(early.get().bus());
			assertNull(late.get().bus());
		}
	}

	@Test
	void finish_lowerOrderFirst() {
		Bus bus = newBus(0);
		try (
			AutoRef<TestGreeter> greeter = AutoRef.of(newGreeter("greeter"));
			AutoRef<TestCounter> counter = AutoRef.of(new TestCounter("counter", finishLog, monitor))
		) {
			bus.connect(greeter.get(), 1);
			bus.connect(counter.get(), 0);
			bus.finish();

			// The counter could still use the greeter while it was finishing
			assertEquals(List.of("Hello, counter, from greeter", "greeter"), finishLog);
		}
	}

	@Test
	void finish_releasesReferences() {
		Bus bus0 = newBus(0);
		Bus bus1 = newBus(1);
		try (
			AutoRef<TestGreeter> greeter = AutoRef.of(newGreeter("greeter"));
			AutoRef<TestCounter> counter = AutoRef.of(new TestCounter("counter", finishLog, monitor))
		) {
			bus0.connect(greeter.get());
			bus1.connect(counter.get());
			bus0.connect(bus1);
			bus0.cast(Counter.class);

			bus0.finish();

			LOGGER.debug("Events: {}", monitor.events());
			assertEquals(1, monitor.netReferences(greeter.get()));
			assertEquals(1, monitor.netReferences(counter.get()));
			assertTrue(bus1.finished());
			assertTrue(counter.get().finished());
		}
	}

	@Test
	void disconnect_stopsDiscovery() {
		Bus bus = newBus(0);
		try (AutoRef<TestGreeter> greeter = AutoRef.of(newGreeter("greeter"))) {
			bus.connect(greeter.get());
			bus.disconnect(greeter.get());
			assertNull(bus.cast(Greeter.class));
			assertNull(greeter.get().bus());
			assertEquals(1, monitor.netReferences(greeter.get()));
			assertFalse(greeter.get().finished());
		}
	}

	private static final AtomicInteger BUS_COUNTER = new AtomicInteger(0);
	private static final Logger LOGGER = LoggerFactory.getLogger(BusConformanceTest.class);
}
