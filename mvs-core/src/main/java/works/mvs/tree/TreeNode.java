package works.mvs.tree;

import java.util.List;

/**
 * One vertex of an ordered, immutable tree whose nodes are distinguished by a string {@link #kind() kind}.
 * <p>
 * Implementations must not override {@link Object#equals} or {@link Object#hashCode}:
 * nodes are identified by reference, so two structurally identical nodes at different
 * positions in a tree are different keys for any side table.
 *
 * @param <N> the node type of the tree
 */
public interface TreeNode<N extends TreeNode<N>> {
	String kind();

	/**
	 * @return the children in document order; never null
	 */
	List<N> children();
}
