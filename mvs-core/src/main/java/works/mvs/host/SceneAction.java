package works.mvs.host;

import java.util.List;
import javax.vecmath.Matrix4d;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import works.mvs.annotation.AnnotationSpec;
import works.mvs.annotation.AnnotationTooltip;
import works.mvs.annotation.InlineTooltip;
import works.mvs.color.ColorTheme;
import works.mvs.selector.Selector;

import static java.util.Objects.requireNonNull;

/**
 * A step that creates one object in the host's scene, as a child of some existing object.
 * <p>
 * These are descriptions only; the host decides how to carry them out.
 */
public sealed interface SceneAction {

	record Download(@NotNull String url, boolean isBinary) implements SceneAction {
		public Download {
			requireNonNull(url);
		}
	}

	/**
	 * Decodes downloaded data. The host infers the concrete decoder from <code>format</code>.
	 */
	record Parse(@NotNull String format) implements SceneAction {
		public Parse {
			requireNonNull(format);
		}
	}

	record TrajectoryFromFormat(@NotNull String format) implements SceneAction {
		public TrajectoryFromFormat {
			requireNonNull(format);
		}
	}

	record ModelFromTrajectory(int modelIndex) implements SceneAction { }

	record StructureFromModel(@NotNull StructureType type) implements SceneAction {
		public StructureFromModel {
			requireNonNull(type);
		}
	}

	/**
	 * Applies a rigid motion to the coordinates of a structure.
	 * The matrix is copied on the way in and on the way out.
	 */
	record TransformConformation(@NotNull Matrix4d matrix) implements SceneAction {
		public TransformConformation {
			matrix = new Matrix4d(matrix);
		}

		@Override
		public Matrix4d matrix() {
			return new Matrix4d(matrix);
		}
	}

	/**
	 * Custom properties attached to a structure.
	 * Unlike the other actions, this is {@link SceneBatch#setProperties set} on an existing object
	 * rather than added as a child.
	 */
	record StructureProperties(
		@NotNull List<AnnotationSpec> annotations,
		@NotNull List<AnnotationTooltip> annotationTooltips,
		@NotNull List<InlineTooltip> inlineTooltips
	) implements SceneAction {
		public StructureProperties {
			annotations = List.copyOf(annotations);
			annotationTooltips = List.copyOf(annotationTooltips);
			inlineTooltips = List.copyOf(inlineTooltips);
		}

		public boolean isEmpty() {
			return annotations.isEmpty() && annotationTooltips.isEmpty() && inlineTooltips.isEmpty();
		}
	}

	record Component(@NotNull Selector selector) implements SceneAction {
		public Component {
			requireNonNull(selector);
		}
	}

	/**
	 * @param fieldValues null selects every element with a non-empty value
	 */
	record AnnotationComponent(
		@NotNull String annotationId,
		@NotNull String fieldName,
		@Nullable List<String> fieldValues
	) implements SceneAction {
		public AnnotationComponent {
			requireNonNull(annotationId);
			requireNonNull(fieldName);
			fieldValues = fieldValues == null ? null : List.copyOf(fieldValues);
		}
	}

	record Representation(@NotNull RepresentationType type, @NotNull ColorTheme colorTheme) implements SceneAction {
		public Representation {
			requireNonNull(type);
			requireNonNull(colorTheme);
		}
	}

	record AnnotationLabel(
		@NotNull String annotationId,
		@NotNull String fieldName,
		@NotNull ColorTheme colorTheme
	) implements SceneAction {
		public AnnotationLabel {
			requireNonNull(annotationId);
			requireNonNull(fieldName);
			requireNonNull(colorTheme);
		}
	}

	record InlineLabel(@NotNull String text, @NotNull ColorTheme colorTheme) implements SceneAction {
		public InlineLabel {
			requireNonNull(text);
			requireNonNull(colorTheme);
		}
	}
}
