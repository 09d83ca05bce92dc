package works.mvs.tree;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.jetbrains.annotations.NotNull;
import org.pcollections.PVector;
import org.pcollections.TreePVector;
import works.mvs.exceptions.InvalidParameterException;

import static java.util.Objects.requireNonNull;

/**
 * A node of a molecular view specification tree.
 * <p>
 * Nodes are immutable and compare by value. Code that tracks individual nodes
 * within a tree, where identical subtrees may occur more than once, keys them by identity.
 */
public final class MvsNode implements TreeNode<MvsNode> {
	@NotNull private final String kind;
	@NotNull private final NodeParams params;
	@NotNull private final PVector<MvsNode> children;

	private MvsNode(String kind, NodeParams params, PVector<MvsNode> children) {
		this.kind = requireNonNull(kind);
		this.params = requireNonNull(params);
		this.children = requireNonNull(children);
	}

	public static MvsNode of(MvsKind kind, NodeParams params, MvsNode... children) {
		return of(kind, params, List.of(children));
	}

	public static MvsNode of(MvsKind kind, NodeParams params, List<MvsNode> children) {
		if (!kind.paramsClass().isInstance(params)) {
			throw new InvalidParameterException("params", "Node of kind \"" + kind.tag() + "\" expects " + kind.paramsClass().getSimpleName() + ", not " + params.getClass().getSimpleName());
		}
		return new MvsNode(kind.tag(), params, TreePVector.from(children));
	}

	public static MvsNode root(MvsNode... children) {
		return of(MvsKind.ROOT, NodeParams.None.INSTANCE, children);
	}

	public static MvsNode root(List<MvsNode> children) {
		return of(MvsKind.ROOT, NodeParams.None.INSTANCE, children);
	}

	/**
	 * Builds a node without checking that <code>params</code> fit <code>kind</code>.
	 * Used for trees read from external sources, which may contain kinds this library does not know.
	 */
	public static MvsNode unchecked(String kind, NodeParams params, List<MvsNode> children) {
		return new MvsNode(kind, params, TreePVector.from(children));
	}

	@Override
	public String kind() {
		return kind;
	}

	public NodeParams params() {
		return params;
	}

	/**
	 * @throws InvalidParameterException if the params are not of the given type
	 */
	public <P extends NodeParams> P params(Class<P> expectedType) {
		if (expectedType.isInstance(params)) {
			return expectedType.cast(params);
		}
		throw new InvalidParameterException("params", "Node of kind \"" + kind + "\" has " + params.getClass().getSimpleName() + " params; expected " + expectedType.getSimpleName());
	}

	@Override
	public PVector<MvsNode> children() {
		return children;
	}

	public Optional<MvsKind> knownKind() {
		return MvsKind.fromTag(kind);
	}

	public boolean is(MvsKind kind) {
		return this.kind.equals(kind.tag());
	}

	public MvsNode withChildren(List<MvsNode> newChildren) {
		return new MvsNode(kind, params, TreePVector.from(newChildren));
	}

	/**
	 * Nodes are equal if their kinds, params and children are equal.
	 */
	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof MvsNode)) {
			return false;
		}
		MvsNode other = (MvsNode) o;
		return kind.equals(other.kind) && params.equals(other.params) && children.equals(other.children);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, params, children);
	}

	@Override
	public String toString() {
		return "MvsNode{" + kind + ", " + params + ", " + children.size() + " children}";
	}
}
