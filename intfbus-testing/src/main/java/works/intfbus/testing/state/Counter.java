package works.intfbus.testing.state;

import works.intfbus.InterfaceEx;
import works.intfbus.annotations.Iid;

@Iid("works.intfbus.testing.Counter")
public interface Counter extends InterfaceEx {
	int increment();
}
