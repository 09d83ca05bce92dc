package works.mvs.jackson;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import works.mvs.tree.MvsNode;

import static java.util.Objects.requireNonNull;

/**
 * The top-level object of an MVS file: a tree plus the format version it was written for.
 *
 * @param version null if the file was a bare tree
 */
public record MvsDocument(@Nullable String version, @NotNull MvsNode root) {
	public MvsDocument {
		requireNonNull(root);
	}
}
