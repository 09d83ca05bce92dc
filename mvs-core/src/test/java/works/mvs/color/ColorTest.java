package works.mvs.color;

import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ColorTest {

	@Test
	void names_caseInsensitive() {
		assertEquals(Optional.of(new Color(0xFF0000)), Color.decode("red"));
		assertEquals(Optional.of(new Color(0xFF0000)), Color.decode("RED"));
		assertEquals(Optional.of(new Color(0xFFFFFF)), Color.decode("White"));
	}

	@Test
	void hex_shortAndLong() {
		assertEquals(Optional.of(new Color(0x11AAFF)), Color.decode("#1af"));
		assertEquals(Optional.of(new Color(0x11AAFF)), Color.decode("#11aaff"));
		assertEquals(Optional.of(new Color(0x11AAFF)), Color.decode("#11AAFF"));
	}

	@ParameterizedTest
	@ValueSource(strings = {"", "#", "#12", "#1234", "#gggggg", "11aaff", "notacolor"})
	void undecodable_empty(String text) {
		assertEquals(Optional.empty(), Color.decode(text));
	}

	@Test
	void null_empty() {
		assertEquals(Optional.empty(), Color.decode(null));
	}

	@Test
	void isHexColorString() {
		assertTrue(Color.isHexColorString("#abc"));
		assertFalse(Color.isHexColorString("abc"));
		assertFalse(Color.isHexColorString(null));
	}

	@Test
	void toHexString() {
		assertEquals("#00ff00", Color.fromRgb(0, 255, 0).toHexString());
		assertEquals("none", Color.NO_COLOR.toHexString());
		assertTrue(Color.NO_COLOR.isNone());
	}

	@Test
	void outOfRange_throws() {
		assertThrows(IllegalArgumentException.class, () -> new Color(0x1000000));
		assertThrows(IllegalArgumentException.class, () -> new Color(-2));
	}
}
