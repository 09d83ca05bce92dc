package works.mvs.color;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import works.mvs.annotation.AnnotationRegistry;
import works.mvs.annotation.AnnotationTable;
import works.mvs.selector.ElementLocation;
import works.mvs.selector.ElementSet;
import works.mvs.structure.Atom;
import works.mvs.structure.AtomTable;
import works.mvs.structure.Structure;
import works.mvs.structure.StructureQueryEngine;

import static java.util.Objects.requireNonNull;

/**
 * A {@link ColorTheme} bound to one structure, answering the color of each element.
 * <p>
 * Layer selections are resolved once, when the evaluator is created.
 * Annotation-driven themes need per-atom data, so they only color elements of an {@link AtomTable};
 * on other structures they yield their background.
 */
public final class ColorThemeEvaluator {
	private final ColorFunction function;
	private final Color fallback;

	private ColorThemeEvaluator(ColorFunction function, Color fallback) {
		this.function = function;
		this.fallback = fallback;
	}

	/**
	 * @param fallback the color of elements the theme leaves uncolored
	 */
	public static ColorThemeEvaluator bind(
		ColorTheme theme,
		Structure structure,
		StructureQueryEngine engine,
		AnnotationRegistry annotations,
		Color fallback
	) {
		requireNonNull(fallback);
		return new ColorThemeEvaluator(compile(theme, structure, engine, annotations), fallback);
	}

	public Color colorAt(ElementLocation location) {
		Color result = function.colorAt(location);
		return result.isNone() ? fallback : result;
	}

	@FunctionalInterface
	private interface ColorFunction {
		/**
		 * @return {@link Color#NO_COLOR} if this function leaves <code>location</code> uncolored
		 */
		Color colorAt(ElementLocation location);
	}

	private static ColorFunction compile(ColorTheme theme, Structure structure, StructureQueryEngine engine, AnnotationRegistry annotations) {
		if (theme instanceof ColorTheme.Uniform) {
			Color color = ((ColorTheme.Uniform) theme).color();
			return location -> color;
		} else if (theme instanceof ColorTheme.AnnotationDriven) {
			return annotationFunction((ColorTheme.AnnotationDriven) theme, structure, annotations);
		} else {
			List<ColorTheme.Layer> layers = ((ColorTheme.Layered) theme).layers();
			List<ElementSet> selections = new ArrayList<>(layers.size());
			List<ColorFunction> functions = new ArrayList<>(layers.size());
			for (ColorTheme.Layer layer : layers) {
				selections.add(ElementSet.fromSelector(structure, layer.selection(), engine));
				functions.add(compile(layer.theme(), structure, engine, annotations));
			}
			return location -> {
				// Later layers take precedence
				for (int i = layers.size() - 1; i >= 0; i--) {
					if (selections.get(i).has(location)) {
						Color color = functions.get(i).colorAt(location);
						if (!color.isNone()) {
							return color;
						}
					}
				}
				return Color.NO_COLOR;
			};
		}
	}

	private static ColorFunction annotationFunction(ColorTheme.AnnotationDriven theme, Structure structure, AnnotationRegistry annotations) {
		Optional<AnnotationTable> table = annotations.table(theme.annotationId());
		if (table.isEmpty() || !(structure instanceof AtomTable)) {
			return location -> theme.background();
		}
		AtomTable atoms = (AtomTable) structure;
		AnnotationTable annotation = table.get();
		return location -> {
			Optional<Atom> atom = atoms.atomAt(location);
			if (atom.isEmpty()) {
				return theme.background();
			}
			return annotation.valueFor(atom.get(), theme.fieldName())
				.flatMap(Color::decode)
				.orElse(theme.background());
		};
	}
}
