package works.mvs.color;

import java.util.List;
import org.jetbrains.annotations.NotNull;
import works.mvs.selector.Selector;

import static java.util.Objects.requireNonNull;

/**
 * How a representation is colored.
 */
public sealed interface ColorTheme {

	record Uniform(@NotNull Color color) implements ColorTheme {
		public Uniform {
			requireNonNull(color);
		}
	}

	/**
	 * Colors each element by the value of an annotation field, which must itself be a color.
	 *
	 * @param background for elements with no value
	 */
	record AnnotationDriven(
		@NotNull String annotationId,
		@NotNull String fieldName,
		@NotNull Color background
	) implements ColorTheme {
		public AnnotationDriven {
			requireNonNull(annotationId);
			requireNonNull(fieldName);
			requireNonNull(background);
		}
	}

	/**
	 * Applies each layer's theme to the elements of its selection.
	 * Where selections overlap, later layers win.
	 */
	record Layered(@NotNull List<Layer> layers) implements ColorTheme {
		public Layered {
			layers = List.copyOf(layers);
		}
	}

	record Layer(@NotNull ColorTheme theme, @NotNull Selector selection) {
		public Layer {
			requireNonNull(theme);
			requireNonNull(selection);
		}
	}
}
