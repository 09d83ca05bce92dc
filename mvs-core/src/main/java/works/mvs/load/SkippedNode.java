package works.mvs.load;

import org.jetbrains.annotations.NotNull;

import static java.util.Objects.requireNonNull;

/**
 * A node that contributed nothing to the scene, and why.
 *
 * @param path location of the node, as given by {@link works.mvs.tree.Trees#pathTo}
 */
public record SkippedNode(@NotNull String kind, @NotNull String path, @NotNull Reason reason) {
	public SkippedNode {
		requireNonNull(kind);
		requireNonNull(path);
		requireNonNull(reason);
	}

	public enum Reason {
		/**
		 * The node's kind is not one of the {@link works.mvs.tree.MvsKind known kinds}.
		 */
		UNKNOWN_KIND,

		/**
		 * The node's parent produced no scene object to attach to.
		 */
		NO_TARGET,
	}
}
