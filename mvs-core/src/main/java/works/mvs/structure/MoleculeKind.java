package works.mvs.structure;

/**
 * Coarse classification of the molecule an atom belongs to,
 * used to evaluate {@link works.mvs.selector.StaticSelector static selectors}.
 */
public enum MoleculeKind {
	PROTEIN,
	NUCLEIC,
	WATER,
	ION,
	LIPID,
	BRANCHED,
	LIGAND,
	COARSE,
}
