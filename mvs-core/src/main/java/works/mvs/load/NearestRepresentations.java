package works.mvs.load;

import java.util.IdentityHashMap;
import java.util.Map;
import works.mvs.tree.MvsKind;
import works.mvs.tree.MvsNode;
import works.mvs.tree.Trees;

/**
 * Links each node to the representation whose colors it should borrow,
 * such as a label placed next to a colored cartoon.
 */
public final class NearestRepresentations {
	private NearestRepresentations() { }

	/**
	 * Every representation maps to itself.
	 * Other nodes map to the lowest representation among their descendants,
	 * and otherwise to their parent's mapping.
	 * Representations never propagate upward past a {@code structure} node.
	 *
	 * @return an identity map; nodes with no nearest representation are absent
	 */
	public static Map<MvsNode, MvsNode> of(MvsNode tree) {
		Map<MvsNode, MvsNode> map = new IdentityHashMap<>();

		// Upward, in post-order
		Trees.dfs(tree, null, (node, parent) -> {
			if (node.is(MvsKind.REPRESENTATION)) {
				map.put(node, node);
			}
			if (parent != null && !node.is(MvsKind.STRUCTURE) && map.containsKey(node) && !map.containsKey(parent)) {
				map.put(parent, map.get(node));
			}
		});

		// Downward, in pre-order
		Trees.dfs(tree, (node, parent) -> {
			if (parent != null && !map.containsKey(node) && map.containsKey(parent)) {
				map.put(node, map.get(parent));
			}
		});

		return map;
	}
}
