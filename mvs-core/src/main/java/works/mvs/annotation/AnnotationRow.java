package works.mvs.annotation;

import java.util.Map;
import org.jetbrains.annotations.NotNull;
import works.mvs.selector.ComponentExpression;

import static java.util.Objects.requireNonNull;

/**
 * One row of annotation data: the elements it applies to, and its field values.
 */
public record AnnotationRow(@NotNull ComponentExpression selector, @NotNull Map<String, String> fields) {
	public AnnotationRow {
		requireNonNull(selector);
		fields = Map.copyOf(fields);
	}
}
