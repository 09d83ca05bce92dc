package works.mvs.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;
import org.jetbrains.annotations.Nullable;

/**
 * Traversal and inspection utilities for {@link TreeNode trees}.
 */
public final class Trees {
	private Trees() { }

	/**
	 * Visits every node of <code>root</code> exactly once, depth first, in document order.
	 * <p>
	 * <code>preVisit</code> sees a node before any of its descendants;
	 * <code>postVisit</code> sees it after all of them.
	 * Both receive the node and its parent, which is null for <code>root</code>.
	 * <p>
	 * Uses an explicit stack, so the depth of the tree is not limited by the call stack.
	 *
	 * @param preVisit may be null
	 * @param postVisit may be null
	 */
	public static <N extends TreeNode<N>> void dfs(
		N root,
		@Nullable BiConsumer<? super N, ? super N> preVisit,
		@Nullable BiConsumer<? super N, ? super N> postVisit
	) {
		Deque<Frame<N>> stack = new ArrayDeque<>();
		stack.push(new Frame<>(root, null));
		while (!stack.isEmpty()) {
			Frame<N> frame = stack.peek();
			if (frame.expanded) {
				stack.pop();
				if (postVisit != null) {
					postVisit.accept(frame.node, frame.parent);
				}
			} else {
				frame.expanded = true;
				if (preVisit != null) {
					preVisit.accept(frame.node, frame.parent);
				}
				List<N> children = frame.node.children();
				for (int i = children.size() - 1; i >= 0; i--) {
					stack.push(new Frame<>(children.get(i), frame.node));
				}
			}
		}
	}

	public static <N extends TreeNode<N>> void dfs(N root, BiConsumer<? super N, ? super N> preVisit) {
		dfs(root, preVisit, null);
	}

	private static final class Frame<N> {
		final N node;
		final N parent;
		boolean expanded = false;

		Frame(N node, N parent) {
			this.node = node;
			this.parent = parent;
		}
	}

	public static <N extends TreeNode<N>> int count(N root) {
		int[] result = {0};
		dfs(root, (n, p) -> result[0]++);
		return result[0];
	}

	/**
	 * @return a human-readable location of <code>target</code> within <code>root</code>,
	 * like {@code root/download[0]/parse[0]}, or empty if <code>target</code> is not in the tree.
	 * @see TreePaths
	 */
	public static <N extends TreeNode<N>> Optional<String> pathTo(N root, N target) {
		return Optional.ofNullable(paths(root).get(target));
	}

	/**
	 * @return the {@link #pathTo location} of every node of <code>root</code>, keyed by identity
	 */
	public static <N extends TreeNode<N>> Map<N, String> paths(N root) {
		Map<N, String> result = new IdentityHashMap<>();
		Deque<N> stack = new ArrayDeque<>();
		result.put(root, root.kind());
		stack.push(root);
		while (!stack.isEmpty()) {
			N node = stack.pop();
			String prefix = result.get(node) + "/";
			List<N> children = node.children();
			List<N> fresh = new ArrayList<>(children.size());
			for (int i = 0; i < children.size(); i++) {
				N child = children.get(i);
				// An instance occurring more than once keeps the first path assigned to it
				if (result.putIfAbsent(child, prefix + child.kind() + "[" + i + "]") == null) {
					fresh.add(child);
				}
			}
			for (int i = fresh.size() - 1; i >= 0; i--) {
				stack.push(fresh.get(i));
			}
		}
		return result;
	}

	/**
	 * @return the nodes of <code>root</code> in pre-order
	 */
	public static <N extends TreeNode<N>> List<N> preOrder(N root) {
		List<N> result = new ArrayList<>();
		dfs(root, (node, parent) -> result.add(node));
		return result;
	}

	/**
	 * One line per node, indented by depth. Intended for logs and error messages.
	 */
	public static String toPrettyString(MvsNode root) {
		StringBuilder sb = new StringBuilder();
		Map<MvsNode, Integer> depths = new IdentityHashMap<>();
		dfs(root, (node, parent) -> {
			int depth = (parent == null) ? 0 : depths.get(parent) + 1;
			depths.put(node, depth);
			sb.append("  ".repeat(depth))
				.append("- ")
				.append(node.kind());
			if (!(node.params() instanceof NodeParams.None)) {
				sb.append(' ').append(node.params());
			}
			sb.append('\n');
		});
		return sb.toString();
	}
}
