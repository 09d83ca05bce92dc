package works.mvs.load;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import works.mvs.host.SceneRef;
import works.mvs.tree.MvsNode;

/**
 * The outcome of {@link TreeLoader#loadTree}.
 */
public final class LoadResult {
	private final Map<MvsNode, SceneRef> results;
	private final List<MvsNode> loadedNodes;
	private final List<SkippedNode> skipped;
	private final CompletableFuture<Void> committed;

	LoadResult(IdentityHashMap<MvsNode, SceneRef> results, List<MvsNode> loadedNodes, List<SkippedNode> skipped, CompletableFuture<Void> committed) {
		this.results = Collections.unmodifiableMap(results);
		this.loadedNodes = List.copyOf(loadedNodes);
		this.skipped = List.copyOf(skipped);
		this.committed = committed;
	}

	/**
	 * @return the scene object the node's children attached to; empty for skipped nodes
	 */
	public Optional<SceneRef> resultOf(MvsNode node) {
		return Optional.ofNullable(results.get(node));
	}

	/**
	 * @return the nodes whose actions ran, in the order they ran
	 */
	public List<MvsNode> loadedNodes() {
		return loadedNodes;
	}

	public List<SkippedNode> skipped() {
		return skipped;
	}

	/**
	 * @return completes when the host has applied the batch
	 */
	public CompletableFuture<Void> committed() {
		return committed;
	}

	@Override
	public String toString() {
		return "LoadResult{" + loadedNodes.size() + " loaded, " + skipped.size() + " skipped}";
	}
}
