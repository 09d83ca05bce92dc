package works.mvs.host;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * A set of changes to a {@link SceneHost}'s scene, applied all at once by {@link #commit}.
 * <p>
 * Batches are not thread-safe. Each one must end with exactly one call to either
 * {@link #commit} or {@link #discard}.
 */
public interface SceneBatch {
	/**
	 * @return the object under which a loaded tree's root is placed
	 */
	SceneRef anchor();

	/**
	 * @return the committed children of <code>parent</code>, not including changes staged in this batch
	 */
	List<SceneRef> children(SceneRef parent);

	/**
	 * Stages the creation of a new object.
	 *
	 * @return a reference that later calls in this batch can use as a parent
	 */
	SceneRef addChild(SceneRef parent, SceneAction action);

	/**
	 * Stages the removal of <code>target</code> and all its descendants.
	 */
	void delete(SceneRef target);

	/**
	 * Stages replacement of the custom properties of <code>target</code>.
	 */
	void setProperties(SceneRef target, SceneAction.StructureProperties properties);

	/**
	 * Applies the staged changes.
	 *
	 * @return completes when the changes are visible in the scene
	 */
	CompletableFuture<Void> commit();

	/**
	 * Abandons the staged changes.
	 */
	default void discard() { }
}
