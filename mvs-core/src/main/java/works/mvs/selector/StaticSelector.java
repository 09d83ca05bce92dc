package works.mvs.selector;

import java.util.Arrays;
import java.util.Map;
import works.mvs.exceptions.InvalidParameterException;

import static java.util.function.Function.identity;
import static java.util.stream.Collectors.toMap;

/**
 * Named parts of a structure that every structure query engine is expected to understand.
 */
public enum StaticSelector {
	ALL("all"),
	POLYMER("polymer"),
	PROTEIN("protein"),
	NUCLEIC("nucleic"),
	WATER("water"),
	ION("ion"),
	LIPID("lipid"),
	BRANCHED("branched"),
	LIGAND("ligand"),
	NON_STANDARD("non-standard"),
	COARSE("coarse"),
	;

	private final String selectorName;

	StaticSelector(String selectorName) {
		this.selectorName = selectorName;
	}

	public String selectorName() {
		return selectorName;
	}

	/**
	 * @throws InvalidParameterException if there is no such selector
	 */
	public static StaticSelector fromName(String name) {
		StaticSelector result = BY_NAME.get(name);
		if (result == null) {
			throw new InvalidParameterException("selector", "Unknown static selector \"" + name + "\"; expected one of " + BY_NAME.keySet());
		}
		return result;
	}

	private static final Map<String, StaticSelector> BY_NAME = Arrays.stream(values()).collect(toMap(StaticSelector::selectorName, identity()));
}
