package works.mvs;

import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import works.mvs.color.Color;
import works.mvs.exceptions.InvalidParameterException;
import works.mvs.host.SceneRef;
import works.mvs.load.LoadResult;
import works.mvs.tree.MvsKind;
import works.mvs.tree.MvsNode;
import works.mvs.tree.NodeParams;
import works.mvs.tree.Trees;

/**
 * How the loaded scene should be viewed, from the tree's {@code canvas}, {@code camera}, and {@code focus} nodes.
 * Where a tree has several nodes of one of these kinds, the last one wins.
 */
public final class ViewSettings {
	@Nullable private final Color backgroundColor;
	@Nullable private final NodeParams.Camera camera;
	@Nullable private final SceneRef focus;

	private ViewSettings(@Nullable Color backgroundColor, @Nullable NodeParams.Camera camera, @Nullable SceneRef focus) {
		this.backgroundColor = backgroundColor;
		this.camera = camera;
		this.focus = focus;
	}

	public static final ViewSettings NONE = new ViewSettings(null, null, null);

	/**
	 * @throws InvalidParameterException if a {@code canvas} node's color cannot be decoded
	 */
	static ViewSettings beforeLoading(MvsNode tree) {
		Color[] background = {null};
		NodeParams.Camera[] camera = {null};
		Trees.dfs(tree, (node, parent) -> {
			if (node.is(MvsKind.CANVAS)) {
				String colorString = node.params(NodeParams.Canvas.class).backgroundColor();
				background[0] = Color.decode(colorString)
					.orElseThrow(() -> new InvalidParameterException("background_color", "Not a color name or hex code: \"" + colorString + "\""));
			} else if (node.is(MvsKind.CAMERA)) {
				camera[0] = node.params(NodeParams.Camera.class);
			}
		});
		return new ViewSettings(background[0], camera[0], null);
	}

	/**
	 * @return these settings plus the scene object targeted by the last {@code focus} node whose parent was loaded
	 */
	ViewSettings withFocus(MvsNode tree, LoadResult result) {
		SceneRef[] focusTarget = {null};
		Trees.dfs(tree, (node, parent) -> {
			if (parent != null && node.is(MvsKind.FOCUS)) {
				result.resultOf(parent).ifPresent(ref -> focusTarget[0] = ref);
			}
		});
		return new ViewSettings(backgroundColor, camera, focusTarget[0]);
	}

	public Optional<Color> backgroundColor() {
		return Optional.ofNullable(backgroundColor);
	}

	public Optional<NodeParams.Camera> camera() {
		return Optional.ofNullable(camera);
	}

	public Optional<SceneRef> focus() {
		return Optional.ofNullable(focus);
	}

	@Override
	public String toString() {
		return "ViewSettings{" +
			"backgroundColor=" + backgroundColor +
			", camera=" + camera +
			", focus=" + focus +
			'}';
	}
}
