package works.mvs.testing.hosts;

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import works.mvs.host.InMemorySceneHost;
import works.mvs.host.InMemorySceneHost.SceneObject;
import works.mvs.host.SceneAction;
import works.mvs.host.SceneRef;

/**
 * The contents of an {@link InMemorySceneHost} with the host-assigned refs left out,
 * so that scenes built by different hosts can be compared with {@link #equals}.
 */
public record SceneShape(
	@Nullable SceneAction action,
	@Nullable SceneAction.StructureProperties properties,
	List<SceneShape> children
) {
	public SceneShape {
		children = List.copyOf(children);
	}

	public static SceneShape of(InMemorySceneHost host) {
		return of(host, InMemorySceneHost.ROOT);
	}

	private static SceneShape of(InMemorySceneHost host, SceneRef ref) {
		SceneObject object = host.get(ref)
			.orElseThrow(() -> new AssertionError("Scene has no object " + ref));
		List<SceneShape> children = new ArrayList<>();
		for (SceneRef child : object.children()) {
			children.add(of(host, child));
		}
		return new SceneShape(object.action(), object.properties(), children);
	}
}
