package works.mvs.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Checks whether a tree conforms to the {@link MvsKind} vocabulary.
 * <p>
 * The loader itself tolerates non-conforming trees (unknown kinds are skipped);
 * this is for callers that want to reject them up front.
 */
public final class TreeSchema {
	private TreeSchema() { }

	private static final Set<String> STRUCTURE_TYPES = Set.of("model", "assembly", "symmetry", "symmetry_mates");

	/**
	 * @return a description of every problem found, in document order; empty if the tree conforms
	 */
	public static List<String> validationIssues(MvsNode root) {
		List<String> issues = new ArrayList<>();
		if (!root.is(MvsKind.ROOT)) {
			issues.add("Root node must be of kind \"root\", not \"" + root.kind() + "\"");
		}
		TreePaths<MvsNode> paths = new TreePaths<>(root);
		Trees.dfs(root, (node, parent) -> {
			Optional<MvsKind> kind = node.knownKind();
			Supplier<String> where = () -> paths.of(node);
			if (kind.isEmpty()) {
				issues.add(where.get() + ": unknown node kind \"" + node.kind() + "\"");
				return;
			}
			if (parent != null && kind.get() == MvsKind.ROOT) {
				issues.add(where.get() + ": \"root\" may only appear at the top of the tree");
			}
			if (!kind.get().paramsClass().isInstance(node.params())) {
				issues.add(where.get() + ": expected " + kind.get().paramsClass().getSimpleName() + " params, found " + node.params().getClass().getSimpleName());
				return;
			}
			paramIssue(node).ifPresent(issue -> issues.add(where.get() + ": " + issue));
		});
		return issues;
	}

	private static Optional<String> paramIssue(MvsNode node) {
		NodeParams params = node.params();
		if (params instanceof NodeParams.Structure) {
			NodeParams.Structure p = (NodeParams.Structure) params;
			if (!STRUCTURE_TYPES.contains(p.type())) {
				return Optional.of("unknown structure type \"" + p.type() + "\"");
			}
			if (p.ijkMin() != null && p.ijkMin().size() != 3) {
				return Optional.of("ijk_min must have 3 elements");
			}
			if (p.ijkMax() != null && p.ijkMax().size() != 3) {
				return Optional.of("ijk_max must have 3 elements");
			}
		} else if (params instanceof NodeParams.Transform) {
			NodeParams.Transform p = (NodeParams.Transform) params;
			if (p.rotation() != null && p.rotation().size() != 9) {
				return Optional.of("rotation must have 9 elements");
			}
			if (p.translation() != null && p.translation().size() != 3) {
				return Optional.of("translation must have 3 elements");
			}
		} else if (params instanceof NodeParams.Camera) {
			NodeParams.Camera p = (NodeParams.Camera) params;
			if (p.target().size() != 3 || p.position().size() != 3 || (p.up() != null && p.up().size() != 3)) {
				return Optional.of("camera vectors must have 3 elements");
			}
		}
		return Optional.empty();
	}
}
