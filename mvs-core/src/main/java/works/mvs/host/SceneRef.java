package works.mvs.host;

import org.jetbrains.annotations.NotNull;

import static java.util.Objects.requireNonNull;

/**
 * Opaque handle to one object in a host's scene hierarchy.
 * Only meaningful to the host that issued it.
 */
public record SceneRef(@NotNull String id) {
	public SceneRef {
		requireNonNull(id);
	}

	@Override
	public String toString() {
		return id;
	}
}
