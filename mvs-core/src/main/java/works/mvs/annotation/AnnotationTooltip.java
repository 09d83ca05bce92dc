package works.mvs.annotation;

import org.jetbrains.annotations.NotNull;

import static java.util.Objects.requireNonNull;

/**
 * Shows the value of an annotation field when hovering over an element.
 */
public record AnnotationTooltip(@NotNull String annotationId, @NotNull String fieldName) {
	public AnnotationTooltip {
		requireNonNull(annotationId);
		requireNonNull(fieldName);
	}
}
