package works.mvs.annotation;

import java.util.List;
import java.util.Optional;
import works.mvs.structure.Atom;

/**
 * Per-element field values of one annotation.
 * <p>
 * When several rows match an element, the last one that has a value for the field wins.
 */
public final class AnnotationTable {
	private final List<AnnotationRow> rows;

	public AnnotationTable(List<AnnotationRow> rows) {
		this.rows = List.copyOf(rows);
	}

	public static AnnotationTable empty() {
		return new AnnotationTable(List.of());
	}

	public List<AnnotationRow> rows() {
		return rows;
	}

	/**
	 * @return the value of <code>fieldName</code> for <code>atom</code>; empty if no row
	 * gives the atom a non-empty value for that field
	 */
	public Optional<String> valueFor(Atom atom, String fieldName) {
		for (int i = rows.size() - 1; i >= 0; i--) {
			AnnotationRow row = rows.get(i);
			String value = row.fields().get(fieldName);
			if (value != null && !value.isEmpty() && atom.matches(row.selector())) {
				return Optional.of(value);
			}
		}
		return Optional.empty();
	}

	@Override
	public String toString() {
		return "AnnotationTable{" + rows.size() + " rows}";
	}
}
