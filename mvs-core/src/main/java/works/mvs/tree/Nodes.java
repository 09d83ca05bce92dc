package works.mvs.tree;

import java.util.List;
import org.jetbrains.annotations.Nullable;
import works.mvs.selector.Selector;

/**
 * Static factories for building trees in code.
 * <p>
 * <pre>
 * MvsNode tree = root(
 *     download("https://example.com/1cbs.cif",
 *         parse("mmcif",
 *             structure("model",
 *                 component(Selector.ALL,
 *                     representation("cartoon",
 *                         color("red")))))));
 * </pre>
 */
public final class Nodes {
	private Nodes() { }

	public static MvsNode root(MvsNode... children) {
		return MvsNode.root(children);
	}

	public static MvsNode download(String url, MvsNode... children) {
		return MvsNode.of(MvsKind.DOWNLOAD, new NodeParams.Download(url), children);
	}

	public static MvsNode parse(String format, MvsNode... children) {
		return MvsNode.of(MvsKind.PARSE, NodeParams.Parse.of(format), children);
	}

	public static MvsNode structure(String type, MvsNode... children) {
		return structure(NodeParams.Structure.ofType(type), children);
	}

	public static MvsNode structure(NodeParams.Structure params, MvsNode... children) {
		return MvsNode.of(MvsKind.STRUCTURE, params, children);
	}

	public static MvsNode transform(@Nullable List<Double> rotation, @Nullable List<Double> translation) {
		return MvsNode.of(MvsKind.TRANSFORM, new NodeParams.Transform(rotation, translation));
	}

	public static MvsNode component(@Nullable Selector selector, MvsNode... children) {
		return MvsNode.of(MvsKind.COMPONENT, new NodeParams.Component(selector), children);
	}

	public static MvsNode componentFromUri(String uri, String format, @Nullable String fieldName, @Nullable List<String> fieldValues, MvsNode... children) {
		return MvsNode.of(MvsKind.COMPONENT_FROM_URI,
			new NodeParams.AnnotationFromUri(uri, format, null, null, null, null, fieldName, fieldValues),
			children);
	}

	public static MvsNode componentFromSource(@Nullable String categoryName, @Nullable String fieldName, @Nullable List<String> fieldValues, MvsNode... children) {
		return MvsNode.of(MvsKind.COMPONENT_FROM_SOURCE,
			new NodeParams.AnnotationFromSource(null, null, null, categoryName, fieldName, fieldValues),
			children);
	}

	public static MvsNode representation(String type, MvsNode... children) {
		return MvsNode.of(MvsKind.REPRESENTATION, new NodeParams.Representation(type), children);
	}

	public static MvsNode color(String color) {
		return color(color, null);
	}

	public static MvsNode color(String color, @Nullable Selector selector) {
		return MvsNode.of(MvsKind.COLOR, new NodeParams.Color(color, selector));
	}

	public static MvsNode colorFromUri(String uri, String format, @Nullable String fieldName) {
		return MvsNode.of(MvsKind.COLOR_FROM_URI, new NodeParams.AnnotationFromUri(uri, format, null, null, null, null, fieldName, null));
	}

	public static MvsNode colorFromSource(@Nullable String categoryName, @Nullable String fieldName) {
		return MvsNode.of(MvsKind.COLOR_FROM_SOURCE, new NodeParams.AnnotationFromSource(null, null, null, categoryName, fieldName, null));
	}

	public static MvsNode label(String text) {
		return MvsNode.of(MvsKind.LABEL, new NodeParams.Text(text));
	}

	public static MvsNode labelFromUri(String uri, String format, @Nullable String fieldName) {
		return MvsNode.of(MvsKind.LABEL_FROM_URI, new NodeParams.AnnotationFromUri(uri, format, null, null, null, null, fieldName, null));
	}

	public static MvsNode labelFromSource(@Nullable String categoryName, @Nullable String fieldName) {
		return MvsNode.of(MvsKind.LABEL_FROM_SOURCE, new NodeParams.AnnotationFromSource(null, null, null, categoryName, fieldName, null));
	}

	public static MvsNode tooltip(String text) {
		return MvsNode.of(MvsKind.TOOLTIP, new NodeParams.Text(text));
	}

	public static MvsNode tooltipFromUri(String uri, String format, @Nullable String fieldName) {
		return MvsNode.of(MvsKind.TOOLTIP_FROM_URI, new NodeParams.AnnotationFromUri(uri, format, null, null, null, null, fieldName, null));
	}

	public static MvsNode tooltipFromSource(@Nullable String categoryName, @Nullable String fieldName) {
		return MvsNode.of(MvsKind.TOOLTIP_FROM_SOURCE, new NodeParams.AnnotationFromSource(null, null, null, categoryName, fieldName, null));
	}

	public static MvsNode focus() {
		return MvsNode.of(MvsKind.FOCUS, NodeParams.None.INSTANCE);
	}

	public static MvsNode camera(List<Double> target, List<Double> position, @Nullable List<Double> up) {
		return MvsNode.of(MvsKind.CAMERA, new NodeParams.Camera(target, position, up));
	}

	public static MvsNode canvas(String backgroundColor) {
		return MvsNode.of(MvsKind.CANVAS, new NodeParams.Canvas(backgroundColor));
	}
}
