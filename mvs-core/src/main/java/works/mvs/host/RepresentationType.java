package works.mvs.host;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * Supported visual representations, with the host-side parameters each one implies.
 */
public enum RepresentationType {
	CARTOON("cartoon", "cartoon", Map.of(), null, Map.of()),
	BALL_AND_STICK("ball_and_stick", "ball-and-stick", Map.of("sizeFactor", 0.5, "sizeAspectRatio", 0.5), null, Map.of()),
	SURFACE("surface", "molecular-surface", Map.of(), "physical", Map.of("scale", 1)),
	;

	private final String treeName;
	private final String hostName;
	private final Map<String, Object> typeParams;
	@Nullable private final String sizeTheme;
	private final Map<String, Object> sizeThemeParams;

	RepresentationType(String treeName, String hostName, Map<String, Object> typeParams, @Nullable String sizeTheme, Map<String, Object> sizeThemeParams) {
		this.treeName = treeName;
		this.hostName = hostName;
		this.typeParams = typeParams;
		this.sizeTheme = sizeTheme;
		this.sizeThemeParams = sizeThemeParams;
	}

	/**
	 * @return the name used in {@code representation} nodes, like {@code ball_and_stick}
	 */
	public String treeName() {
		return treeName;
	}

	public String hostName() {
		return hostName;
	}

	public Map<String, Object> typeParams() {
		return typeParams;
	}

	/**
	 * @return empty if the host's default size theme applies
	 */
	public Optional<String> sizeTheme() {
		return Optional.ofNullable(sizeTheme);
	}

	public Map<String, Object> sizeThemeParams() {
		return sizeThemeParams;
	}

	public static Optional<RepresentationType> fromTreeName(String name) {
		return Arrays.stream(values())
			.filter(t -> t.treeName.equals(name))
			.findFirst();
	}
}
