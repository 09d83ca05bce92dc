package works.mvs.annotation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

/**
 * Canonical JSON rendering of map-and-list values, independent of key order
 * and of map entries whose value is null.
 * <p>
 * <code>{a: 1, b: null, c: {d: [], e: 2}}</code> and <code>{c: {e: 2, d: []}, a: 1}</code>
 * have the same canonical string.
 */
public final class CanonicalJson {
	private CanonicalJson() { }

	private static final ObjectMapper MAPPER = JsonMapper.builder().build();

	public static String of(Object value) {
		return MAPPER.writeValueAsString(normalize(value));
	}

	/**
	 * @return a copy of <code>value</code> in which every map is a {@link TreeMap}
	 * without null-valued entries
	 */
	static Object normalize(Object value) {
		if (value instanceof Map) {
			Map<String, Object> result = new TreeMap<>();
			((Map<?, ?>) value).forEach((k, v) -> {
				if (v != null) {
					result.put(String.valueOf(k), normalize(v));
				}
			});
			return result;
		} else if (value instanceof List) {
			List<Object> result = new ArrayList<>();
			for (Object item : (List<?>) value) {
				result.add(item == null ? null : normalize(item));
			}
			return result;
		} else {
			return value;
		}
	}

	/**
	 * @return 8 hex digits derived from <code>input</code>, like {@code "bd65e59a"}
	 */
	public static String stringHash(String input) {
		return String.format("%08x", input.hashCode());
	}
}
