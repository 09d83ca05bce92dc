package works.mvs.tree;

import java.util.Map;

/**
 * Looks up node {@link Trees#pathTo locations} within one tree,
 * computing them all on the first lookup.
 * <p>
 * Not thread-safe.
 */
public final class TreePaths<N extends TreeNode<N>> {
	private final N root;
	private Map<N, String> paths;

	public TreePaths(N root) {
		this.root = root;
	}

	/**
	 * @return the location of <code>node</code>, or just its kind if it is not in the tree
	 */
	public String of(N node) {
		if (paths == null) {
			paths = Trees.paths(root);
		}
		String result = paths.get(node);
		return (result == null) ? node.kind() : result;
	}
}
