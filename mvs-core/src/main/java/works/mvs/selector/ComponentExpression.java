package works.mvs.selector;

import lombok.Builder;
import org.jetbrains.annotations.Nullable;

/**
 * One row of a structural query: an element matches if it satisfies every non-null field.
 * A row with no fields set matches everything.
 * <p>
 * Ranges ({@code beg_*}/{@code end_*}) are inclusive.
 */
@Builder(toBuilder = true)
public record ComponentExpression(
	@Nullable String labelEntityId,
	@Nullable String labelAsymId,
	@Nullable String authAsymId,
	@Nullable Integer labelSeqId,
	@Nullable Integer authSeqId,
	@Nullable String pdbxPdbInsCode,
	@Nullable Integer begLabelSeqId,
	@Nullable Integer endLabelSeqId,
	@Nullable Integer begAuthSeqId,
	@Nullable Integer endAuthSeqId,
	@Nullable String labelAtomId,
	@Nullable String authAtomId,
	@Nullable String typeSymbol,
	@Nullable Integer atomId,
	@Nullable Integer atomIndex
) {
	public static final ComponentExpression ANY = ComponentExpression.builder().build();

	public boolean isEmpty() {
		return this.equals(ANY);
	}
}
