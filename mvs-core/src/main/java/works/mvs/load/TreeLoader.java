package works.mvs.load;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.mvs.exceptions.InvalidParameterException;
import works.mvs.exceptions.TreeLoadingException;
import works.mvs.host.SceneBatch;
import works.mvs.host.SceneHost;
import works.mvs.host.SceneRef;
import works.mvs.tree.MvsKind;
import works.mvs.tree.MvsNode;
import works.mvs.tree.TreePaths;
import works.mvs.tree.Trees;

/**
 * Walks a tree once, applying the action for each node's kind,
 * and commits everything as a single batch.
 */
public final class TreeLoader {
	private TreeLoader() { }

	/**
	 * @param deletePrevious if true, the existing children of the host's anchor are deleted in the same batch
	 * @throws TreeLoadingException if any action rejects its node's params; nothing is committed in that case
	 */
	public static <C> LoadResult loadTree(
		SceneHost host,
		MvsNode tree,
		LoadingActions<C> actions,
		C context,
		boolean deletePrevious
	) throws TreeLoadingException {
		SceneBatch batch = host.beginBatch();
		IdentityHashMap<MvsNode, SceneRef> results = new IdentityHashMap<>();
		List<MvsNode> loadedNodes = new ArrayList<>();
		List<SkippedNode> skipped = new ArrayList<>();
		TreePaths<MvsNode> paths = new TreePaths<>(tree);
		try {
			SceneRef anchor = batch.anchor();
			if (deletePrevious) {
				List<SceneRef> previous = batch.children(anchor);
				LOGGER.debug("Deleting {} previous objects", previous.size());
				previous.forEach(batch::delete);
			}
			Trees.dfs(tree, (node, parent) -> {
				SceneRef parentResult = (parent == null) ? anchor : results.get(parent);
				Optional<MvsKind> kind = node.knownKind();
				if (kind.isEmpty()) {
					LOGGER.warn("Skipping node of unknown kind \"{}\"", node.kind());
					skipped.add(new SkippedNode(node.kind(), paths.of(node), SkippedNode.Reason.UNKNOWN_KIND));
					return;
				}
				if (parentResult == null) {
					LOGGER.warn("No target found for this \"{}\" node", node.kind());
					skipped.add(new SkippedNode(node.kind(), paths.of(node), SkippedNode.Reason.NO_TARGET));
					return;
				}
				Optional<LoadingAction<C>> action = actions.actionFor(kind.get());
				if (action.isEmpty()) {
					results.put(node, parentResult);
					return;
				}
				try {
					action.get().apply(batch, parentResult, node, context)
						.ifPresent(result -> results.put(node, result));
					loadedNodes.add(node);
				} catch (InvalidParameterException e) {
					throw new NodeFailure(node, e);
				}
			});
		} catch (NodeFailure f) {
			batch.discard();
			String path = paths.of(f.node);
			LOGGER.debug("Load failed at {}", path, f.getCause());
			throw new TreeLoadingException(f.node.kind(), path, f.getCause());
		} catch (RuntimeException | Error e) {
			batch.discard();
			throw e;
		}
		LOGGER.debug("Committing: {} nodes loaded, {} skipped", loadedNodes.size(), skipped.size());
		CompletableFuture<Void> committed = batch.commit();
		return new LoadResult(results, loadedNodes, skipped, committed);
	}

	/**
	 * Carries an action's failure out of the traversal callback.
	 */
	private static final class NodeFailure extends RuntimeException {
		final transient MvsNode node;

		NodeFailure(MvsNode node, InvalidParameterException cause) {
			super(cause);
			this.node = node;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TreeLoader.class);
}
