package works.mvs.color;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;

/**
 * A 24-bit RGB color, or {@link #NO_COLOR}.
 */
public record Color(int value) {
	/**
	 * Marks the absence of a color; for instance, the background of annotation themes,
	 * so elements without annotation data are left to lower layers.
	 */
	public static final Color NO_COLOR = new Color(-1);

	public Color {
		if (value != -1 && (value & ~0xFFFFFF) != 0) {
			throw new IllegalArgumentException("Color value out of range: " + Integer.toHexString(value));
		}
	}

	public static Color fromRgb(int r, int g, int b) {
		return new Color(((r & 0xFF) << 16) | ((g & 0xFF) << 8) | (b & 0xFF));
	}

	/**
	 * Accepts X11 color names, case-insensitively, and hex codes like {@code #ff00ff} or {@code #f0f}.
	 *
	 * @return empty if <code>colorString</code> is null or not a color
	 */
	public static Optional<Color> decode(@Nullable String colorString) {
		if (colorString == null) {
			return Optional.empty();
		}
		if (HEX_COLOR.matcher(colorString).matches()) {
			String digits = colorString.substring(1);
			if (digits.length() == 3) {
				digits = "" + digits.charAt(0) + digits.charAt(0) + digits.charAt(1) + digits.charAt(1) + digits.charAt(2) + digits.charAt(2);
			}
			return Optional.of(new Color(Integer.parseInt(digits, 16)));
		}
		return ColorNames.lookup(colorString.toLowerCase(Locale.ROOT));
	}

	public static boolean isHexColorString(@Nullable String s) {
		return s != null && HEX_COLOR.matcher(s).matches();
	}

	public boolean isNone() {
		return value == -1;
	}

	/**
	 * @return like {@code #ff0000}, or {@code none} for {@link #NO_COLOR}
	 */
	public String toHexString() {
		return isNone() ? "none" : String.format("#%06x", value);
	}

	@Override
	public String toString() {
		return "Color(" + toHexString() + ")";
	}

	private static final Pattern HEX_COLOR = Pattern.compile("^#([0-9A-F]{3}){1,2}$", Pattern.CASE_INSENSITIVE);
}
