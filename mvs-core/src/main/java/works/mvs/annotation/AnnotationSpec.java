package works.mvs.annotation;

import java.util.LinkedHashMap;
import java.util.Map;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Where the per-element data for an annotation comes from.
 * <p>
 * The {@link #id} is derived from the other fields,
 * so specs describing the same data always have the same id.
 */
public record AnnotationSpec(
	@NotNull String id,
	@NotNull Source source,
	@Nullable String schema,
	@NotNull CifBlock cifBlock,
	@Nullable String cifCategory
) {
	public AnnotationSpec {
		requireNonNull(id);
		requireNonNull(source);
		requireNonNull(cifBlock);
	}

	/**
	 * Creates a spec whose id is the hash of the {@link #canonicalKey canonical key} of the other fields.
	 */
	public static AnnotationSpec create(Source source, @Nullable String schema, CifBlock cifBlock, @Nullable String cifCategory) {
		String key = canonicalKey(source, schema, cifBlock, cifCategory);
		return new AnnotationSpec(CanonicalJson.stringHash(key), source, schema, cifBlock, cifCategory);
	}

	public String canonicalKey() {
		return canonicalKey(source, schema, cifBlock, cifCategory);
	}

	static String canonicalKey(Source source, @Nullable String schema, CifBlock cifBlock, @Nullable String cifCategory) {
		Map<String, Object> map = new LinkedHashMap<>();
		map.put("source", source.toMap());
		map.put("schema", schema);
		map.put("cifBlock", cifBlock.toMap());
		map.put("cifCategory", cifCategory);
		return CanonicalJson.of(map);
	}

	public sealed interface Source {
		Map<String, Object> toMap();
	}

	/**
	 * Annotation file downloaded separately from the structure.
	 */
	public record Url(@NotNull String url, @NotNull String format) implements Source {
		public Url {
			requireNonNull(url);
			requireNonNull(format);
		}

		@Override
		public Map<String, Object> toMap() {
			return namedParams("url", Map.of("url", url, "format", format));
		}
	}

	/**
	 * Annotation stored in the same mmCIF file as the structure.
	 */
	public record SourceCif() implements Source {
		@Override
		public Map<String, Object> toMap() {
			return namedParams("source-cif", Map.of());
		}
	}

	public sealed interface CifBlock {
		Map<String, Object> toMap();

		static CifBlock of(@Nullable String header, @Nullable Integer index) {
			if (header != null) {
				return new Header(header);
			} else {
				return new Index(index == null ? 0 : index);
			}
		}
	}

	public record Header(@NotNull String header) implements CifBlock {
		public Header {
			requireNonNull(header);
		}

		@Override
		public Map<String, Object> toMap() {
			return namedParams("header", Map.of("header", header));
		}
	}

	public record Index(int index) implements CifBlock {
		@Override
		public Map<String, Object> toMap() {
			return namedParams("index", Map.of("index", index));
		}
	}

	private static Map<String, Object> namedParams(String name, Map<String, Object> params) {
		Map<String, Object> result = new LinkedHashMap<>();
		result.put("name", name);
		result.put("params", params);
		return result;
	}
}
