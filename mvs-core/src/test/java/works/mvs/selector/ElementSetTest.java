package works.mvs.selector;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import works.mvs.structure.AtomTable;
import works.mvs.structure.AtomTableQueryEngine;
import works.mvs.structure.SampleStructures;
import works.mvs.structure.Structure;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ElementSetTest {
	final AtomTable structure = SampleStructures.small();
	final AtomTableQueryEngine engine = new AtomTableQueryEngine();

	@Test
	void all_coversEveryElementInOrder() {
		ElementSet set = ElementSet.fromSelector(structure, Selector.ALL, engine);
		assertEquals(structure.size(), set.size());
		for (String modelId : set.modelIds()) {
			int[] elements = set.elements(modelId);
			for (int i = 1; i < elements.length; i++) {
				assertTrue(elements[i - 1] < elements[i], "Strictly increasing");
			}
		}
		structure.atoms().forEach(a -> assertTrue(set.has(a.location())));
		assertFalse(set.has("1", 12));
		assertFalse(set.has("2", 0));
	}

	@Test
	void nullStructure_empty() {
		assertSame(ElementSet.EMPTY, ElementSet.fromSelector(null, Selector.ALL, engine));
	}

	@Test
	void emptyStructure_emptyForEverySelectorKind() {
		List<Selector> selectors = List.of(
			Selector.ALL,
			new Selector.Static(StaticSelector.PROTEIN),
			Selector.Expression.of(ComponentExpression.builder().labelAsymId("A").build()),
			new Selector.Script("mol-script", "(sel.atom.atom-groups :chain-test (= atom.label_asym_id A))"));
		for (Selector selector : selectors) {
			assertSame(ElementSet.EMPTY, ElementSet.fromSelector(Structure.EMPTY, selector, engine), selector.toString());
			assertTrue(engine.substructure(Structure.EMPTY, selector).units().isEmpty(), selector.toString());
		}
	}

	@Test
	void structureWithoutUnits_notAnAtomTable_empty() {
		Structure noUnits = List::of;
		ElementSet set = ElementSet.fromSelector(noUnits, new Selector.Static(StaticSelector.LIGAND), engine);
		assertEquals(0, set.size());
	}

	@Test
	void of_sortsAndRemovesDuplicates() {
		ElementSet set = ElementSet.of(Map.of("m", new int[]{5, 1, 3, 1, 5}));
		assertArrayEquals(new int[]{1, 3, 5}, set.elements("m"));
		assertEquals(ElementSet.of(Map.of("m", new int[]{1, 3, 5})), set);
	}

	@Test
	void unitsSpanningModels_groupedByModel() {
		Structure s = () -> List.of(
			new Structure.Unit("a", new int[]{4, 2}),
			new Structure.Unit("b", new int[]{0}),
			new Structure.Unit("a", new int[]{3}));
		ElementSet set = ElementSet.ofStructure(s);
		assertArrayEquals(new int[]{2, 3, 4}, set.elements("a"));
		assertArrayEquals(new int[]{0}, set.elements("b"));
	}

	@Test
	void elements_returnsCopy() {
		ElementSet set = ElementSet.of(Map.of("m", new int[]{1, 2}));
		set.elements("m")[0] = 99;
		assertTrue(set.has("m", 1));
	}

	@Test
	void bundle_intersectsWithStructure() {
		ElementSet bundle = ElementSet.of(Map.of("1", new int[]{0, 11, 40}));
		ElementSet set = ElementSet.fromSelector(structure, new Selector.Bundle(bundle), engine);
		assertArrayEquals(new int[]{0, 11}, set.elements("1"));
	}
}
