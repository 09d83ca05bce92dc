package works.mvs.selector;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import works.mvs.structure.Structure;
import works.mvs.structure.StructureQueryEngine;

/**
 * Resolved selection: for each model, a strictly increasing array of element indices.
 * Supports {@link #has membership tests} in logarithmic time.
 * <p>
 * Immutable.
 */
public final class ElementSet {
	private final Map<String, int[]> elementsByModel;

	public static final ElementSet EMPTY = new ElementSet(Map.of());

	private ElementSet(Map<String, int[]> elementsByModel) {
		this.elementsByModel = elementsByModel;
	}

	/**
	 * @param elementsByModel element indices per model id, in any order and possibly with duplicates
	 */
	public static ElementSet of(Map<String, int[]> elementsByModel) {
		Map<String, int[]> normalized = new LinkedHashMap<>();
		elementsByModel.forEach((modelId, elements) -> normalized.put(modelId, sortedUnique(elements.clone())));
		return new ElementSet(Collections.unmodifiableMap(normalized));
	}

	/**
	 * Resolves <code>selector</code> against <code>structure</code> using <code>engine</code>.
	 *
	 * @return the selected elements; empty if <code>structure</code> is null or has no units
	 */
	public static ElementSet fromSelector(@Nullable Structure structure, Selector selector, StructureQueryEngine engine) {
		if (structure == null || structure.units().isEmpty()) {
			return EMPTY;
		}
		return ofStructure(engine.substructure(structure, selector));
	}

	/**
	 * @return all elements of <code>structure</code>
	 */
	public static ElementSet ofStructure(Structure structure) {
		Map<String, IntList> arrays = new LinkedHashMap<>();
		for (Structure.Unit unit : structure.units()) {
			arrays.computeIfAbsent(unit.modelId(), k -> new IntList()).addAll(unit.elements());
		}
		Map<String, int[]> result = new LinkedHashMap<>();
		arrays.forEach((modelId, list) -> result.put(modelId, sortedUnique(list.toArray())));
		return new ElementSet(Collections.unmodifiableMap(result));
	}

	public boolean has(ElementLocation location) {
		int[] array = elementsByModel.get(location.modelId());
		return array != null && Arrays.binarySearch(array, location.element()) >= 0;
	}

	public boolean has(String modelId, int element) {
		return has(new ElementLocation(modelId, element));
	}

	public Set<String> modelIds() {
		return elementsByModel.keySet();
	}

	/**
	 * @return a copy of the sorted indices for the given model; empty if the model has none
	 */
	public int[] elements(String modelId) {
		int[] array = elementsByModel.get(modelId);
		return array == null ? new int[0] : array.clone();
	}

	public int size() {
		int result = 0;
		for (int[] array : elementsByModel.values()) {
			result += array.length;
		}
		return result;
	}

	public boolean isEmpty() {
		return size() == 0;
	}

	/**
	 * Sorts only when needed; most structures already list their elements in order.
	 */
	private static int[] sortedUnique(int[] array) {
		if (!isSorted(array)) {
			Arrays.sort(array);
		}
		int n = 0;
		for (int i = 0; i < array.length; i++) {
			if (n == 0 || array[n - 1] != array[i]) {
				array[n++] = array[i];
			}
		}
		return (n == array.length) ? array : Arrays.copyOf(array, n);
	}

	private static boolean isSorted(int[] array) {
		for (int i = 1; i < array.length; i++) {
			if (array[i - 1] > array[i]) {
				return false;
			}
		}
		return true;
	}

	@Override
	public boolean equals(Object o) {
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		ElementSet that = (ElementSet) o;
		if (!this.elementsByModel.keySet().equals(that.elementsByModel.keySet())) {
			return false;
		}
		for (Map.Entry<String, int[]> entry : elementsByModel.entrySet()) {
			if (!Arrays.equals(entry.getValue(), that.elementsByModel.get(entry.getKey()))) {
				return false;
			}
		}
		return true;
	}

	@Override
	public int hashCode() {
		int result = 0;
		for (Map.Entry<String, int[]> entry : elementsByModel.entrySet()) {
			result += entry.getKey().hashCode() ^ Arrays.hashCode(entry.getValue());
		}
		return result;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("ElementSet{");
		elementsByModel.forEach((modelId, array) -> sb.append(modelId).append(": ").append(array.length).append(" elements; "));
		return sb.append('}').toString();
	}

	private static final class IntList {
		int[] items = new int[16];
		int size = 0;

		void addAll(int[] values) {
			if (size + values.length > items.length) {
				items = Arrays.copyOf(items, Math.max(items.length * 2, size + values.length));
			}
			System.arraycopy(values, 0, items, size, values.length);
			size += values.length;
		}

		int[] toArray() {
			return Arrays.copyOf(items, size);
		}
	}
}
