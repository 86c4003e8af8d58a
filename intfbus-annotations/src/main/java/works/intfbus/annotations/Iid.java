package works.intfbus.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.TYPE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Declares the stable identity of an interface type.
 *
 * <p>
 * The string is hashed once into an <code>InterfaceId</code>; two interface types
 * are the same interface if and only if their strings are equal.
 * A UUID string is customary, but any string that is unique among the
 * interfaces of an application will do.
 *
 * <pre>
 * &#64;Iid("23c88882-8edb-4b04-a017-e2be0b68acea")
 * public interface Greeter extends InterfaceEx {
 *     String greet(String name);
 * }
 * </pre>
 */
@Documented
@Retention(RUNTIME)
@Target(TYPE)
public @interface Iid {
	String value();
}
