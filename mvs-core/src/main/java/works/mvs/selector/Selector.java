package works.mvs.selector;

import java.util.List;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Declarative description of a part of a structure.
 * Resolve one against actual structure data with {@link ElementSet#fromSelector}.
 */
public sealed interface Selector {
	Selector ALL = new Static(StaticSelector.ALL);

	default boolean isAll() {
		return this.equals(ALL);
	}

	/**
	 * @return <code>selector</code>, or {@link #ALL} if it is null
	 */
	static Selector orAll(@Nullable Selector selector) {
		return selector == null ? ALL : selector;
	}

	record Static(@NotNull StaticSelector value) implements Selector {
		public Static {
			requireNonNull(value);
		}

		public static Static named(String name) {
			return new Static(StaticSelector.fromName(name));
		}
	}

	/**
	 * The union of the elements matched by each row.
	 */
	record Expression(@NotNull List<ComponentExpression> rows) implements Selector {
		public Expression {
			rows = List.copyOf(rows);
		}

		public static Expression of(ComponentExpression... rows) {
			return new Expression(List.of(rows));
		}
	}

	/**
	 * A precomputed set of elements. Resolves to those of its elements present in the structure.
	 */
	record Bundle(@NotNull ElementSet elements) implements Selector {
		public Bundle {
			requireNonNull(elements);
		}
	}

	/**
	 * @param language name of the query language, like {@code mol-script}
	 */
	record Script(@NotNull String language, @NotNull String expression) implements Selector {
		public Script {
			requireNonNull(language);
			requireNonNull(expression);
		}
	}

	/**
	 * Elements whose annotation field has one of the given values.
	 *
	 * @param fieldValues null selects every element with a non-empty value
	 */
	record Annotation(
		@NotNull String annotationId,
		@NotNull String fieldName,
		@Nullable List<String> fieldValues
	) implements Selector {
		public Annotation {
			requireNonNull(annotationId);
			requireNonNull(fieldName);
			fieldValues = fieldValues == null ? null : List.copyOf(fieldValues);
		}
	}
}
