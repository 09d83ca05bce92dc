package works.mvs.selector;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import works.mvs.exceptions.InvalidParameterException;

/**
 * Converts between {@link Selector}s and the plain values that represent them in tree params:
 * a static selector name, one row object, or a list of row objects.
 * Row keys are the snake_case column names, like {@code label_asym_id}.
 */
public final class Selectors {
	private Selectors() { }

	/**
	 * @param value a {@link String}, a {@link Map} of column names to values, a {@link List} of such maps, or null
	 * @return {@link Selector#ALL} if <code>value</code> is null
	 * @throws InvalidParameterException if <code>value</code> has any other shape
	 */
	public static Selector fromParams(@Nullable Object value) {
		if (value == null) {
			return Selector.ALL;
		} else if (value instanceof String) {
			return Selector.Static.named((String) value);
		} else if (value instanceof Map) {
			return new Selector.Expression(List.of(rowFromParams((Map<?, ?>) value)));
		} else if (value instanceof List) {
			List<ComponentExpression> rows = new ArrayList<>();
			for (Object row : (List<?>) value) {
				if (!(row instanceof Map)) {
					throw new InvalidParameterException("selector", "Selector list must contain only objects; found " + row);
				}
				rows.add(rowFromParams((Map<?, ?>) row));
			}
			return new Selector.Expression(rows);
		} else {
			throw new InvalidParameterException("selector", "Unexpected selector: " + value);
		}
	}

	/**
	 * @throws InvalidParameterException if <code>row</code> has a key that is not one of the {@link #COLUMNS}
	 */
	public static ComponentExpression rowFromParams(Map<?, ?> row) {
		for (Object key : row.keySet()) {
			if (!COLUMNS.contains(key)) {
				throw new InvalidParameterException("selector", "Unknown selector field \"" + key + "\"");
			}
		}
		return ComponentExpression.builder()
			.labelEntityId(string(row, "label_entity_id"))
			.labelAsymId(string(row, "label_asym_id"))
			.authAsymId(string(row, "auth_asym_id"))
			.labelSeqId(integer(row, "label_seq_id"))
			.authSeqId(integer(row, "auth_seq_id"))
			.pdbxPdbInsCode(string(row, "pdbx_PDB_ins_code"))
			.begLabelSeqId(integer(row, "beg_label_seq_id"))
			.endLabelSeqId(integer(row, "end_label_seq_id"))
			.begAuthSeqId(integer(row, "beg_auth_seq_id"))
			.endAuthSeqId(integer(row, "end_auth_seq_id"))
			.labelAtomId(string(row, "label_atom_id"))
			.authAtomId(string(row, "auth_atom_id"))
			.typeSymbol(string(row, "type_symbol"))
			.atomId(integer(row, "atom_id"))
			.atomIndex(integer(row, "atom_index"))
			.build();
	}

	/**
	 * The inverse of {@link #fromParams}. A single-row expression becomes a lone object.
	 *
	 * @throws IllegalArgumentException if <code>selector</code> has no representation in tree params
	 */
	public static Object toParams(Selector selector) {
		if (selector instanceof Selector.Static) {
			return ((Selector.Static) selector).value().selectorName();
		} else if (selector instanceof Selector.Expression) {
			List<ComponentExpression> rows = ((Selector.Expression) selector).rows();
			if (rows.size() == 1) {
				return rowToParams(rows.get(0));
			}
			List<Map<String, Object>> result = new ArrayList<>();
			rows.forEach(r -> result.add(rowToParams(r)));
			return result;
		} else {
			throw new IllegalArgumentException("Selector has no tree representation: " + selector);
		}
	}

	public static Map<String, Object> rowToParams(ComponentExpression row) {
		Map<String, Object> result = new LinkedHashMap<>();
		putIfPresent(result, "label_entity_id", row.labelEntityId());
		putIfPresent(result, "label_asym_id", row.labelAsymId());
		putIfPresent(result, "auth_asym_id", row.authAsymId());
		putIfPresent(result, "label_seq_id", row.labelSeqId());
		putIfPresent(result, "auth_seq_id", row.authSeqId());
		putIfPresent(result, "pdbx_PDB_ins_code", row.pdbxPdbInsCode());
		putIfPresent(result, "beg_label_seq_id", row.begLabelSeqId());
		putIfPresent(result, "end_label_seq_id", row.endLabelSeqId());
		putIfPresent(result, "beg_auth_seq_id", row.begAuthSeqId());
		putIfPresent(result, "end_auth_seq_id", row.endAuthSeqId());
		putIfPresent(result, "label_atom_id", row.labelAtomId());
		putIfPresent(result, "auth_atom_id", row.authAtomId());
		putIfPresent(result, "type_symbol", row.typeSymbol());
		putIfPresent(result, "atom_id", row.atomId());
		putIfPresent(result, "atom_index", row.atomIndex());
		return result;
	}

	private static void putIfPresent(Map<String, Object> map, String key, @Nullable Object value) {
		if (value != null) {
			map.put(key, value);
		}
	}

	@Nullable
	private static String string(Map<?, ?> row, String key) {
		Object value = row.get(key);
		if (value == null || value instanceof String) {
			return (String) value;
		}
		throw new InvalidParameterException("selector", "Selector field \"" + key + "\" must be a string; found " + value);
	}

	@Nullable
	private static Integer integer(Map<?, ?> row, String key) {
		Object value = row.get(key);
		if (value == null) {
			return null;
		} else if (value instanceof Integer || value instanceof Long || value instanceof Short) {
			return ((Number) value).intValue();
		}
		throw new InvalidParameterException("selector", "Selector field \"" + key + "\" must be an integer; found " + value);
	}

	public static final Set<String> COLUMNS = Set.of(
		"label_entity_id", "label_asym_id", "auth_asym_id",
		"label_seq_id", "auth_seq_id", "pdbx_PDB_ins_code",
		"beg_label_seq_id", "end_label_seq_id", "beg_auth_seq_id", "end_auth_seq_id",
		"label_atom_id", "auth_atom_id", "type_symbol", "atom_id", "atom_index");
}
