package works.mvs.structure;

import java.util.Objects;
import lombok.Builder;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import works.mvs.selector.ComponentExpression;
import works.mvs.selector.ElementLocation;

/**
 * One row of an {@link AtomTable}, with the mmCIF {@code atom_site} columns that selectors can refer to.
 *
 * @param index element index within the model; unique per model
 * @param nonStandard true for modified residues and other non-standard monomers within polymers
 */
@Builder(toBuilder = true)
public record Atom(
	@NotNull String modelId,
	int index,
	@Nullable String labelEntityId,
	@Nullable String labelAsymId,
	@Nullable String authAsymId,
	@Nullable Integer labelSeqId,
	@Nullable Integer authSeqId,
	@Nullable String pdbxPdbInsCode,
	@Nullable String labelCompId,
	@Nullable String labelAtomId,
	@Nullable String authAtomId,
	@Nullable String typeSymbol,
	int atomId,
	@NotNull MoleculeKind moleculeKind,
	boolean nonStandard
) {
	public ElementLocation location() {
		return new ElementLocation(modelId, index);
	}

	/**
	 * @return true if this atom satisfies every field of <code>row</code> that is set
	 */
	public boolean matches(ComponentExpression row) {
		return eq(row.labelEntityId(), labelEntityId)
			&& eq(row.labelAsymId(), labelAsymId)
			&& eq(row.authAsymId(), authAsymId)
			&& eq(row.labelSeqId(), labelSeqId)
			&& eq(row.authSeqId(), authSeqId)
			&& eq(row.pdbxPdbInsCode(), pdbxPdbInsCode)
			&& inRange(labelSeqId, row.begLabelSeqId(), row.endLabelSeqId())
			&& inRange(authSeqId, row.begAuthSeqId(), row.endAuthSeqId())
			&& eq(row.labelAtomId(), labelAtomId)
			&& eq(row.authAtomId(), authAtomId)
			&& (row.typeSymbol() == null || row.typeSymbol().equalsIgnoreCase(typeSymbol))
			&& (row.atomId() == null || row.atomId() == atomId)
			&& (row.atomIndex() == null || row.atomIndex() == index);
	}

	private static boolean eq(@Nullable Object required, @Nullable Object actual) {
		return required == null || Objects.equals(required, actual);
	}

	private static boolean inRange(@Nullable Integer value, @Nullable Integer beg, @Nullable Integer end) {
		if (beg == null && end == null) {
			return true;
		} else if (value == null) {
			return false;
		} else {
			return (beg == null || value >= beg) && (end == null || value <= end);
		}
	}
}
