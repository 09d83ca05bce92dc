package works.mvs.annotation;

import org.jetbrains.annotations.NotNull;
import works.mvs.selector.Selector;

import static java.util.Objects.requireNonNull;

/**
 * Shows fixed text when hovering over the elements of <code>selector</code>.
 */
public record InlineTooltip(@NotNull String text, @NotNull Selector selector) {
	public InlineTooltip {
		requireNonNull(text);
		requireNonNull(selector);
	}
}
