package works.mvs.host;

/**
 * The collaborator that owns a scene hierarchy and applies changes to it.
 * <p>
 * All changes go through a {@link SceneBatch}, which the host applies atomically.
 */
public interface SceneHost {
	/**
	 * Starts recording a set of changes.
	 * Nothing is visible in the scene until the batch is {@link SceneBatch#commit committed}.
	 */
	SceneBatch beginBatch();
}
