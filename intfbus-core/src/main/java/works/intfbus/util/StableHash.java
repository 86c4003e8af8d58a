package works.intfbus.util;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * A 64-bit string hash whose values never change from one build or JVM to the next.
 *
 * <p>
 * The algorithm is the one behind the 64-bit <code>std::hash&lt;std::string&gt;</code>
 * of libstdc++ (a MurmurHash2 variant with seed <code>0xc70f6907</code>),
 * applied to the UTF-8 bytes of the string, so identifiers computed here agree with
 * those computed by native components that use the same convention.
 */
public final class StableHash {
	private StableHash() {}

	public static long hash(String value) {
		return hash(value.getBytes(UTF_8), SEED);
	}

	public static long hash(byte[] bytes, long seed) {
		int length = bytes.length;
		int aligned = length & ~0x7;
		long hash = seed ^ (length * MUL);
		for (int i = 0; i < aligned; i += 8) {
			long data = shiftMix(littleEndian(bytes, i, 8) * MUL) * MUL;
			hash ^= data;
			hash *= MUL;
		}
		if ((length & 0x7) != 0) {
			hash ^= littleEndian(bytes, aligned, length & 0x7);
			hash *= MUL;
		}
		hash = shiftMix(hash) * MUL;
		return shiftMix(hash);
	}

	private static long shiftMix(long v) {
		return v ^ (v >>> 47);
	}

	private static long littleEndian(byte[] bytes, int offset, int count) {
		long result = 0;
		for (int i = count - 1; i >= 0; i--) {
			result = (result << 8) | (bytes[offset + i] & 0xFFL);
		}
		return result;
	}

	private static final long MUL = 0xc6a4a7935bd1e995L;
	private static final long SEED = 0xc70f6907L;
}
