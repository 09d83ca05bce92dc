package works.mvs.host;

import works.mvs.HostFactory;

/**
 * Implements {@link SceneHost} by calling another host.
 * Useful for overriding one or two methods while leaving the rest unchanged.
 *
 * @see ForwardingSceneBatch
 */
public class ForwardingSceneHost implements SceneHost {
	protected final SceneHost downstream;

	public ForwardingSceneHost(SceneHost downstream) {
		this.downstream = downstream;
	}

	public static HostFactory factory() {
		return (i, d) -> new ForwardingSceneHost(d);
	}

	@Override
	public SceneBatch beginBatch() {
		return downstream.beginBatch();
	}

	@Override
	public String toString() {
		return "ForwardingSceneHost{" +
			"downstream=" + downstream +
			'}';
	}
}
