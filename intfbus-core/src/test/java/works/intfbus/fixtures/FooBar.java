package works.intfbus.fixtures;

import java.util.function.Consumer;

/**
 * Offers {@link IFoo} and {@link IBaz}, and therefore {@link IBar} as well.
 */
public class FooBar extends Foo implements IBaz {
	private final int bar;

	public FooBar(String label, int bar) {
		super(label);
		this.bar = bar;
	}

	public FooBar(String label, int bar, Consumer<Foo> clearAction) {
		super(label, clearAction);
		this.bar = bar;
	}

	@Override
	public int bar() {
		return bar;
	}

	@Override
	public String toString() {
		return "FooBar(" + label() + ")";
	}
}
