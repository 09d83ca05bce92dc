package works.mvs.annotation;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CanonicalJsonTest {

	@Test
	void keyOrderAndNulls_ignored() {
		Map<String, Object> first = new LinkedHashMap<>();
		first.put("a", 1);
		first.put("b", null);
		first.put("c", Map.of("d", List.of(), "e", 2));
		Map<String, Object> inner = new LinkedHashMap<>();
		inner.put("e", 2);
		inner.put("d", List.of());
		Map<String, Object> second = new HashMap<>();
		second.put("c", inner);
		second.put("a", 1);
		assertEquals(CanonicalJson.of(first), CanonicalJson.of(second));
		assertEquals("{\"a\":1,\"c\":{\"d\":[],\"e\":2}}", CanonicalJson.of(first));
	}

	@Test
	void stringHash_isEightHexDigits() {
		assertEquals("00000000", CanonicalJson.stringHash(""));
		assertEquals("00000061", CanonicalJson.stringHash("a"));
		// hashCode is Integer.MIN_VALUE
		assertEquals("80000000", CanonicalJson.stringHash("polygenelubricants"));
	}
}
