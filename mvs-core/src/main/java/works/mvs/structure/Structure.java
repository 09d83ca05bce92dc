package works.mvs.structure;

import java.util.List;

/**
 * Structural data as the interpreter sees it: a list of units, each holding
 * element indices of one model.
 * <p>
 * How the data was decoded, and what else it holds, is up to the implementation.
 */
public interface Structure {
	List<Unit> units();

	Structure EMPTY = List::of;

	/**
	 * A group of elements from a single model.
	 * Element indices are unique within a model but need not be sorted,
	 * and different units of the same model may hold interleaved ranges.
	 */
	record Unit(String modelId, int[] elements) {
		public Unit {
			elements = elements.clone();
		}

		@Override
		public int[] elements() {
			return elements.clone();
		}

		public int size() {
			return elements.length;
		}
	}
}
