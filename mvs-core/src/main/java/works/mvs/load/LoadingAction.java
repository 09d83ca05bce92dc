package works.mvs.load;

import java.util.Optional;
import works.mvs.exceptions.InvalidParameterException;
import works.mvs.host.SceneBatch;
import works.mvs.host.SceneRef;
import works.mvs.tree.MvsNode;

/**
 * Turns one node into changes to the scene.
 *
 * @param <C> the loading context type
 */
@FunctionalInterface
public interface LoadingAction<C> {
	/**
	 * @param parentResult the scene object created for the node's parent,
	 *                     or the batch's {@link SceneBatch#anchor() anchor} for the root
	 * @return the scene object that the node's children should attach to;
	 * empty if the children should not be loaded
	 * @throws InvalidParameterException if the node's params cannot be realized;
	 * this aborts the whole load
	 */
	Optional<SceneRef> apply(SceneBatch batch, SceneRef parentResult, MvsNode node, C context);
}
