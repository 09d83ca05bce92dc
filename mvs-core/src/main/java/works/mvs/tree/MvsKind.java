package works.mvs.tree;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.util.function.Function.identity;
import static java.util.stream.Collectors.toMap;

/**
 * The closed vocabulary of node kinds understood by this library.
 * <p>
 * Trees may contain other kinds too; those are kept as-is with {@link NodeParams.Raw} params
 * and are skipped during loading.
 */
public enum MvsKind {
	ROOT("root", NodeParams.None.class),
	DOWNLOAD("download", NodeParams.Download.class),
	PARSE("parse", NodeParams.Parse.class),
	STRUCTURE("structure", NodeParams.Structure.class),
	TRANSFORM("transform", NodeParams.Transform.class),
	COMPONENT("component", NodeParams.Component.class),
	COMPONENT_FROM_URI("component_from_uri", NodeParams.AnnotationFromUri.class),
	COMPONENT_FROM_SOURCE("component_from_source", NodeParams.AnnotationFromSource.class),
	REPRESENTATION("representation", NodeParams.Representation.class),
	COLOR("color", NodeParams.Color.class),
	COLOR_FROM_URI("color_from_uri", NodeParams.AnnotationFromUri.class),
	COLOR_FROM_SOURCE("color_from_source", NodeParams.AnnotationFromSource.class),
	LABEL("label", NodeParams.Text.class),
	LABEL_FROM_URI("label_from_uri", NodeParams.AnnotationFromUri.class),
	LABEL_FROM_SOURCE("label_from_source", NodeParams.AnnotationFromSource.class),
	TOOLTIP("tooltip", NodeParams.Text.class),
	TOOLTIP_FROM_URI("tooltip_from_uri", NodeParams.AnnotationFromUri.class),
	TOOLTIP_FROM_SOURCE("tooltip_from_source", NodeParams.AnnotationFromSource.class),
	FOCUS("focus", NodeParams.None.class),
	CAMERA("camera", NodeParams.Camera.class),
	CANVAS("canvas", NodeParams.Canvas.class),
	;

	private final String tag;
	private final Class<? extends NodeParams> paramsClass;

	MvsKind(String tag, Class<? extends NodeParams> paramsClass) {
		this.tag = tag;
		this.paramsClass = paramsClass;
	}

	public String tag() {
		return tag;
	}

	public Class<? extends NodeParams> paramsClass() {
		return paramsClass;
	}

	/**
	 * @return the annotation field that nodes of this kind read when their params name none;
	 * empty for kinds that do not read annotations
	 */
	public Optional<String> defaultFieldName() {
		switch (this) {
			case COLOR_FROM_URI:
			case COLOR_FROM_SOURCE:
				return Optional.of("color");
			case COMPONENT_FROM_URI:
			case COMPONENT_FROM_SOURCE:
				return Optional.of("component");
			case LABEL_FROM_URI:
			case LABEL_FROM_SOURCE:
				return Optional.of("label");
			case TOOLTIP_FROM_URI:
			case TOOLTIP_FROM_SOURCE:
				return Optional.of("tooltip");
			default:
				return Optional.empty();
		}
	}

	public static Optional<MvsKind> fromTag(String tag) {
		return Optional.ofNullable(BY_TAG.get(tag));
	}

	/**
	 * Kinds whose nodes take per-element data from an annotation file at some URI.
	 */
	public static final Set<MvsKind> ANNOTATION_FROM_URI = Set.of(COLOR_FROM_URI, COMPONENT_FROM_URI, LABEL_FROM_URI, TOOLTIP_FROM_URI);

	/**
	 * Kinds whose nodes take per-element data from a category stored alongside the structure data.
	 */
	public static final Set<MvsKind> ANNOTATION_FROM_SOURCE = Set.of(COLOR_FROM_SOURCE, COMPONENT_FROM_SOURCE, LABEL_FROM_SOURCE, TOOLTIP_FROM_SOURCE);

	public static final Set<MvsKind> COLORS = Set.of(COLOR, COLOR_FROM_URI, COLOR_FROM_SOURCE);
	public static final Set<MvsKind> TOOLTIPS = Set.of(TOOLTIP, TOOLTIP_FROM_URI, TOOLTIP_FROM_SOURCE);
	public static final Set<MvsKind> COMPONENTS = Set.of(COMPONENT, COMPONENT_FROM_URI, COMPONENT_FROM_SOURCE);

	private static final Map<String, MvsKind> BY_TAG = Arrays.stream(values()).collect(toMap(MvsKind::tag, identity()));
}
