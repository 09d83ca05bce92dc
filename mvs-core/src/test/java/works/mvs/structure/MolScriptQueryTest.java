package works.mvs.structure;

import java.util.function.Predicate;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import works.mvs.exceptions.InvalidSelectorException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MolScriptQueryTest {
	final AtomTable structure = SampleStructures.small();

	@Test
	void all_matchesEverything() {
		assertEquals(structure.size(), count("(sel.atom.all)"));
	}

	@Test
	void orOfEqualities() {
		assertEquals(3, count("(sel.atom.atom-groups :chain-test (or (= atom.label_asym_id B) (= atom.label_asym_id \"C\")))"));
	}

	@Test
	void numericEquality_onIntegerColumn() {
		assertEquals(1, count("(sel.atom.atom-groups :atom-test (= atom.id 12))"));
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"",
		"(sel.atom.all",
		"(sel.atom.all))",
		"(sel.atom.res)",
		"(sel.atom.atom-groups :chain-test)",
		"(sel.atom.atom-groups :ligand-test (= atom.id 1))",
		"(sel.atom.atom-groups :atom-test (= atom.color red))",
		"(sel.atom.atom-groups :atom-test (in-range atom.id one 3))",
	})
	void malformed_throws(String text) {
		assertThrows(InvalidSelectorException.class, () -> MolScriptQuery.compile(text));
	}

	private long count(String text) {
		Predicate<Atom> predicate = MolScriptQuery.compile(text);
		return structure.atoms().stream().filter(predicate).count();
	}
}
