package works.mvs.color;

import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.mvs.exceptions.InvalidParameterException;
import works.mvs.load.AnnotationReferences;
import works.mvs.load.LoadingContext;
import works.mvs.selector.Selector;
import works.mvs.tree.MvsKind;
import works.mvs.tree.MvsNode;
import works.mvs.tree.NodeParams;

import static java.util.stream.Collectors.toList;

/**
 * Composes the {@link ColorTheme} of a representation from its color children.
 */
public final class ColorThemes {
	private ColorThemes() { }

	/**
	 * @param node a {@code representation} or one of the color kinds; if null, the default color applies
	 * @throws InvalidParameterException if <code>node</code> is of any other kind, or has an undecodable color
	 */
	public static ColorTheme forNode(@Nullable MvsNode node, LoadingContext context) {
		if (node == null) {
			return new ColorTheme.Uniform(context.defaultColor());
		}
		if (node.is(MvsKind.REPRESENTATION)) {
			return forRepresentation(node, context);
		}
		if (node.is(MvsKind.COLOR)) {
			return new ColorTheme.Uniform(decode(node.params(NodeParams.Color.class).color()));
		}
		if (node.is(MvsKind.COLOR_FROM_URI) || node.is(MvsKind.COLOR_FROM_SOURCE)) {
			Optional<String> annotationId = context.annotationId(node);
			Optional<String> fieldName = AnnotationReferences.fieldNameOf(node);
			if (annotationId.isEmpty() || fieldName.isEmpty()) {
				LOGGER.debug("No annotation for {}; using default color", node);
				return new ColorTheme.Uniform(context.defaultColor());
			}
			return new ColorTheme.AnnotationDriven(annotationId.get(), fieldName.get(), Color.NO_COLOR);
		}
		throw new InvalidParameterException("kind", "Cannot derive a color theme from a \"" + node.kind() + "\" node");
	}

	private static ColorTheme forRepresentation(MvsNode representation, LoadingContext context) {
		List<MvsNode> colorNodes = representation.children().stream()
			.filter(ColorThemes::isColorNode)
			.collect(toList());
		if (colorNodes.isEmpty()) {
			return new ColorTheme.Uniform(context.defaultColor());
		} else if (colorNodes.size() == 1 && appliesToWholeRepresentation(colorNodes.get(0))) {
			return forNode(colorNodes.get(0), context);
		} else {
			List<ColorTheme.Layer> layers = colorNodes.stream()
				.map(c -> new ColorTheme.Layer(forNode(c, context), selectionOf(c)))
				.collect(toList());
			return new ColorTheme.Layered(layers);
		}
	}

	static boolean isColorNode(MvsNode node) {
		return node.knownKind().map(MvsKind.COLORS::contains).orElse(false);
	}

	private static boolean appliesToWholeRepresentation(MvsNode colorNode) {
		if (colorNode.is(MvsKind.COLOR)) {
			return Selector.orAll(colorNode.params(NodeParams.Color.class).selector()).isAll();
		} else {
			return true;
		}
	}

	private static Selector selectionOf(MvsNode colorNode) {
		if (colorNode.is(MvsKind.COLOR)) {
			return Selector.orAll(colorNode.params(NodeParams.Color.class).selector());
		} else {
			return Selector.ALL;
		}
	}

	private static Color decode(String colorString) {
		return Color.decode(colorString)
			.orElseThrow(() -> new InvalidParameterException("color", "Not a color name or hex code: \"" + colorString + "\""));
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ColorThemes.class);
}
