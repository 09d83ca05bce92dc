package works.mvs.tree;

import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import works.mvs.selector.Selector;

import static java.util.Objects.requireNonNull;

/**
 * The parameters of one {@link MvsNode}. Each {@link MvsKind} expects one of these shapes;
 * see {@link MvsKind#paramsClass()}.
 * <p>
 * Optional parameters are nullable fields. List-valued parameters are copied on construction.
 */
public sealed interface NodeParams {

	/**
	 * For kinds that carry no parameters, like {@code root} and {@code focus}.
	 */
	record None() implements NodeParams {
		public static final None INSTANCE = new None();
	}

	record Download(@NotNull String url) implements NodeParams {
		public Download {
			requireNonNull(url, "url");
		}
	}

	/**
	 * @param format one of {@code mmcif}, {@code bcif}, {@code pdb}
	 * @param isBinary null means binary exactly when the format is {@code bcif}
	 */
	record Parse(@NotNull String format, @Nullable Boolean isBinary) implements NodeParams {
		public Parse {
			requireNonNull(format, "format");
		}

		public static Parse of(String format) {
			return new Parse(format, null);
		}

		public boolean binary() {
			return isBinary != null ? isBinary : "bcif".equals(format);
		}
	}

	/**
	 * @param type one of {@code model}, {@code assembly}, {@code symmetry}, {@code symmetry_mates}
	 */
	record Structure(
		@NotNull String type,
		@Nullable Integer modelIndex,
		@Nullable String assemblyId,
		@Nullable Double radius,
		@Nullable List<Integer> ijkMin,
		@Nullable List<Integer> ijkMax,
		@Nullable String blockHeader,
		@Nullable Integer blockIndex
	) implements NodeParams {
		public Structure {
			requireNonNull(type, "type");
			ijkMin = ijkMin == null ? null : List.copyOf(ijkMin);
			ijkMax = ijkMax == null ? null : List.copyOf(ijkMax);
		}

		public static Structure ofType(String type) {
			return new Structure(type, null, null, null, null, null, null, null);
		}
	}

	/**
	 * @param rotation 3x3 rotation matrix in row-major order
	 */
	record Transform(
		@Nullable List<Double> rotation,
		@Nullable List<Double> translation
	) implements NodeParams {
		public Transform {
			rotation = rotation == null ? null : List.copyOf(rotation);
			translation = translation == null ? null : List.copyOf(translation);
		}
	}

	/**
	 * @param selector null means the whole structure
	 */
	record Component(@Nullable Selector selector) implements NodeParams { }

	record Representation(@NotNull String type) implements NodeParams {
		public Representation {
			requireNonNull(type, "type");
		}
	}

	/**
	 * @param color X11 color name or hex code, like {@code "red"} or {@code "#ff0000"}
	 * @param selector null means the whole representation
	 */
	record Color(@NotNull String color, @Nullable Selector selector) implements NodeParams {
		public Color {
			requireNonNull(color, "color");
		}
	}

	/**
	 * Parameters shared by all nodes that refer to an annotation.
	 */
	sealed interface AnnotationRef extends NodeParams {
		@Nullable String schema();
		@Nullable String blockHeader();
		@Nullable Integer blockIndex();
		@Nullable String categoryName();
		@Nullable String fieldName();

		/**
		 * Only meaningful for {@code component_from_*} nodes; null selects every non-empty value.
		 */
		@Nullable List<String> fieldValues();
	}

	record AnnotationFromUri(
		@NotNull String uri,
		@NotNull String format,
		@Nullable String schema,
		@Nullable String blockHeader,
		@Nullable Integer blockIndex,
		@Nullable String categoryName,
		@Nullable String fieldName,
		@Nullable List<String> fieldValues
	) implements AnnotationRef {
		public AnnotationFromUri {
			requireNonNull(uri, "uri");
			requireNonNull(format, "format");
			fieldValues = fieldValues == null ? null : List.copyOf(fieldValues);
		}
	}

	record AnnotationFromSource(
		@Nullable String schema,
		@Nullable String blockHeader,
		@Nullable Integer blockIndex,
		@Nullable String categoryName,
		@Nullable String fieldName,
		@Nullable List<String> fieldValues
	) implements AnnotationRef {
		public AnnotationFromSource {
			fieldValues = fieldValues == null ? null : List.copyOf(fieldValues);
		}
	}

	/**
	 * For {@code label} and {@code tooltip} nodes.
	 */
	record Text(@NotNull String text) implements NodeParams {
		public Text {
			requireNonNull(text, "text");
		}
	}

	record Camera(
		@NotNull List<Double> target,
		@NotNull List<Double> position,
		@Nullable List<Double> up
	) implements NodeParams {
		public Camera {
			target = List.copyOf(target);
			position = List.copyOf(position);
			up = up == null ? null : List.copyOf(up);
		}
	}

	record Canvas(@NotNull String backgroundColor) implements NodeParams {
		public Canvas {
			requireNonNull(backgroundColor, "backgroundColor");
		}
	}

	/**
	 * Params of a node whose kind is not in {@link MvsKind}, kept verbatim
	 * so the tree can be written back out unchanged.
	 */
	record Raw(@NotNull Map<String, Object> values) implements NodeParams {
		public Raw {
			values = Map.copyOf(values);
		}

		public static final Raw EMPTY = new Raw(Map.of());
	}
}
