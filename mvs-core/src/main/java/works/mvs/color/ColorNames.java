package works.mvs.color;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * The X11 color names, loaded from {@code x11-colors.properties}.
 */
final class ColorNames {
	private ColorNames() { }

	private static final Map<String, Color> COLORS = load();

	static Optional<Color> lookup(String lowerCaseName) {
		return Optional.ofNullable(COLORS.get(lowerCaseName));
	}

	private static Map<String, Color> load() {
		Properties properties = new Properties();
		try (InputStream in = ColorNames.class.getResourceAsStream("x11-colors.properties")) {
			if (in == null) {
				throw new IllegalStateException("Missing resource x11-colors.properties");
			}
			properties.load(in);
		} catch (IOException e) {
			throw new UncheckedIOException("Unable to read color names", e);
		}
		Map<String, Color> result = new HashMap<>();
		properties.forEach((name, hex) -> result.put((String) name, new Color(Integer.decode((String) hex))));
		return Map.copyOf(result);
	}
}
