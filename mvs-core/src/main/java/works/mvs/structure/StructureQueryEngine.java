package works.mvs.structure;

import works.mvs.selector.Selector;

/**
 * The host's facility for carving substructures out of a structure.
 */
public interface StructureQueryEngine {
	/**
	 * @return the part of <code>structure</code> selected by <code>selector</code>;
	 * {@link Structure#EMPTY} or an equivalent if nothing matches
	 * @throws works.mvs.exceptions.InvalidSelectorException if the selector cannot be evaluated by this engine
	 */
	Structure substructure(Structure structure, Selector selector);
}
