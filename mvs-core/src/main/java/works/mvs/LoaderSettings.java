package works.mvs;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class LoaderSettings {
	/**
	 * Whether each load replaces what the previous loads put in the scene.
	 * If false, loaded trees accumulate.
	 */
	@Default boolean deletePrevious = true;

	/**
	 * Color of representations that have no color nodes.
	 * An X11 color name or hex code.
	 */
	@Default String defaultColor = "white";

	/**
	 * How far the rotation of a {@code transform} node may deviate from
	 * an orthonormal matrix with determinant 1.
	 */
	@Default double rotationTolerance = 1e-6;

	/**
	 * If true, trees with unknown kinds or malformed params are rejected before loading
	 * instead of having the offending nodes skipped.
	 */
	@Default boolean strict = false;

	public static LoaderSettings defaults() {
		return builder().build();
	}
}
