package works.mvs.host;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Implements all {@link SceneBatch} methods by calling the corresponding
 * methods on another batch.
 */
public class ForwardingSceneBatch implements SceneBatch {
	protected final SceneBatch downstream;

	public ForwardingSceneBatch(SceneBatch downstream) {
		this.downstream = downstream;
	}

	@Override
	public SceneRef anchor() {
		return downstream.anchor();
	}

	@Override
	public List<SceneRef> children(SceneRef parent) {
		return downstream.children(parent);
	}

	@Override
	public SceneRef addChild(SceneRef parent, SceneAction action) {
		return downstream.addChild(parent, action);
	}

	@Override
	public void delete(SceneRef target) {
		downstream.delete(target);
	}

	@Override
	public void setProperties(SceneRef target, SceneAction.StructureProperties properties) {
		downstream.setProperties(target, properties);
	}

	@Override
	public CompletableFuture<Void> commit() {
		return downstream.commit();
	}

	@Override
	public void discard() {
		downstream.discard();
	}

	@Override
	public String toString() {
		return "ForwardingSceneBatch{" +
			"downstream=" + downstream +
			'}';
	}
}
