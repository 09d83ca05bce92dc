package works.mvs.structure;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;
import works.mvs.exceptions.InvalidSelectorException;

/**
 * Compiles a small subset of the MolScript text language into an atom predicate.
 * <p>
 * Supported forms:
 * <pre>
 * (sel.atom.all)
 * (sel.atom.atom-groups :entity-test P :chain-test P :residue-test P :atom-test P)
 * </pre>
 * where each test <code>P</code> is built from
 * {@code (= atom.<column> value)}, {@code (in-range atom.<column> min max)},
 * {@code (and P...)}, {@code (or P...)} and {@code (not P)}.
 * All tests given to {@code atom-groups} must hold.
 */
public final class MolScriptQuery {
	public static final String LANGUAGE = "mol-script";

	private MolScriptQuery() { }

	private static final Map<String, Function<Atom, Object>> COLUMNS = new HashMap<>();
	static {
		COLUMNS.put("label_entity_id", Atom::labelEntityId);
		COLUMNS.put("label_asym_id", Atom::labelAsymId);
		COLUMNS.put("auth_asym_id", Atom::authAsymId);
		COLUMNS.put("label_seq_id", Atom::labelSeqId);
		COLUMNS.put("auth_seq_id", Atom::authSeqId);
		COLUMNS.put("pdbx_PDB_ins_code", Atom::pdbxPdbInsCode);
		COLUMNS.put("label_comp_id", Atom::labelCompId);
		COLUMNS.put("label_atom_id", Atom::labelAtomId);
		COLUMNS.put("auth_atom_id", Atom::authAtomId);
		COLUMNS.put("type_symbol", Atom::typeSymbol);
		COLUMNS.put("id", Atom::atomId);
	}

	/**
	 * @throws InvalidSelectorException if the text is malformed or uses an unsupported form
	 */
	public static Predicate<Atom> compile(String text) {
		Tokenizer tokenizer = new Tokenizer(text);
		Object expression = tokenizer.readExpression();
		if (tokenizer.hasMore()) {
			throw new InvalidSelectorException("Unexpected text after query: \"" + text + "\"");
		}
		return selection(expression);
	}

	private static Predicate<Atom> selection(Object expression) {
		List<?> list = asList(expression);
		String head = headSymbol(list);
		switch (head) {
			case "sel.atom.all":
				return atom -> true;
			case "sel.atom.atom-groups":
				Predicate<Atom> result = atom -> true;
				for (int i = 1; i < list.size(); i += 2) {
					if (!(list.get(i) instanceof Keyword) || i + 1 >= list.size()) {
						throw new InvalidSelectorException("Expected keyword argument pairs in atom-groups, found " + list);
					}
					String keyword = ((Keyword) list.get(i)).name;
					switch (keyword) {
						case "entity-test":
						case "chain-test":
						case "residue-test":
						case "atom-test":
							result = result.and(test(list.get(i + 1)));
							break;
						default:
							throw new InvalidSelectorException("Unsupported atom-groups argument :" + keyword);
					}
				}
				return result;
			default:
				throw new InvalidSelectorException("Unsupported selection \"" + head + "\"");
		}
	}

	private static Predicate<Atom> test(Object expression) {
		List<?> list = asList(expression);
		String head = headSymbol(list);
		switch (head) {
			case "=":
				requireArity(list, 3);
				return equalTo(column(list.get(1)), list.get(2));
			case "in-range":
				requireArity(list, 4);
				Function<Atom, Object> column = column(list.get(1));
				double min = number(list.get(2));
				double max = number(list.get(3));
				return atom -> {
					Object value = column.apply(atom);
					return value instanceof Number && ((Number) value).doubleValue() >= min && ((Number) value).doubleValue() <= max;
				};
			case "and":
				return list.subList(1, list.size()).stream().map(MolScriptQuery::test).reduce(atom -> true, Predicate::and);
			case "or":
				return list.subList(1, list.size()).stream().map(MolScriptQuery::test).reduce(atom -> false, Predicate::or);
			case "not":
				requireArity(list, 2);
				return test(list.get(1)).negate();
			default:
				throw new InvalidSelectorException("Unsupported test \"" + head + "\"");
		}
	}

	private static Predicate<Atom> equalTo(Function<Atom, Object> column, Object literal) {
		String expected = literalText(literal);
		return atom -> {
			Object value = column.apply(atom);
			if (value == null) {
				return false;
			} else if (value instanceof Number) {
				try {
					return ((Number) value).doubleValue() == Double.parseDouble(expected);
				} catch (NumberFormatException e) {
					return false;
				}
			} else {
				return value.toString().equals(expected);
			}
		};
	}

	private static Function<Atom, Object> column(Object expression) {
		Object symbol = expression;
		if (expression instanceof List && ((List<?>) expression).size() == 1) {
			symbol = ((List<?>) expression).get(0);
		}
		if (symbol instanceof Symbol && ((Symbol) symbol).name.startsWith("atom.")) {
			String columnName = ((Symbol) symbol).name.substring("atom.".length());
			Function<Atom, Object> result = COLUMNS.get(columnName);
			if (result != null) {
				return result;
			}
		}
		throw new InvalidSelectorException("Unsupported column " + expression);
	}

	private static double number(Object literal) {
		try {
			return Double.parseDouble(literalText(literal));
		} catch (NumberFormatException e) {
			throw new InvalidSelectorException("Expected a number, found " + literal, e);
		}
	}

	private static String literalText(Object literal) {
		if (literal instanceof Symbol) {
			return ((Symbol) literal).name;
		} else if (literal instanceof String) {
			return (String) literal;
		}
		throw new InvalidSelectorException("Expected a literal value, found " + literal);
	}

	private static List<?> asList(Object expression) {
		if (expression instanceof List && !((List<?>) expression).isEmpty()) {
			return (List<?>) expression;
		}
		throw new InvalidSelectorException("Expected a non-empty list expression, found " + expression);
	}

	private static String headSymbol(List<?> list) {
		if (list.get(0) instanceof Symbol) {
			return ((Symbol) list.get(0)).name;
		}
		throw new InvalidSelectorException("Expected a symbol at the start of " + list);
	}

	private static void requireArity(List<?> list, int size) {
		if (list.size() != size) {
			throw new InvalidSelectorException("Expected " + (size - 1) + " arguments in " + list);
		}
	}

	private record Symbol(String name) {
		@Override
		public String toString() {
			return name;
		}
	}

	private record Keyword(String name) {
		@Override
		public String toString() {
			return ":" + name;
		}
	}

	/**
	 * Reads S-expressions made of lists, symbols, keywords and double-quoted strings.
	 */
	private static final class Tokenizer {
		final String text;
		int pos = 0;

		Tokenizer(String text) {
			this.text = text;
		}

		boolean hasMore() {
			skipWhitespace();
			return pos < text.length();
		}

		Object readExpression() {
			skipWhitespace();
			if (pos >= text.length()) {
				throw new InvalidSelectorException("Unexpected end of query: \"" + text + "\"");
			}
			char c = text.charAt(pos);
			if (c == '(') {
				pos++;
				List<Object> items = new ArrayList<>();
				while (true) {
					skipWhitespace();
					if (pos >= text.length()) {
						throw new InvalidSelectorException("Unbalanced parentheses in \"" + text + "\"");
					}
					if (text.charAt(pos) == ')') {
						pos++;
						return items;
					}
					items.add(readExpression());
				}
			} else if (c == ')') {
				throw new InvalidSelectorException("Unexpected ')' at position " + pos + " in \"" + text + "\"");
			} else if (c == '"') {
				int end = text.indexOf('"', pos + 1);
				if (end < 0) {
					throw new InvalidSelectorException("Unterminated string in \"" + text + "\"");
				}
				String result = text.substring(pos + 1, end);
				pos = end + 1;
				return result;
			} else {
				int start = pos;
				while (pos < text.length() && !Character.isWhitespace(text.charAt(pos)) && text.charAt(pos) != '(' && text.charAt(pos) != ')') {
					pos++;
				}
				String token = text.substring(start, pos);
				return token.startsWith(":") ? new Keyword(token.substring(1)) : new Symbol(token);
			}
		}

		void skipWhitespace() {
			while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
				pos++;
			}
		}
	}
}
