package works.mvs.load;

import java.util.Map;
import org.junit.jupiter.api.Test;
import works.mvs.selector.Selector;
import works.mvs.tree.MvsNode;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static works.mvs.tree.Nodes.color;
import static works.mvs.tree.Nodes.component;
import static works.mvs.tree.Nodes.label;
import static works.mvs.tree.Nodes.representation;
import static works.mvs.tree.Nodes.root;
import static works.mvs.tree.Nodes.structure;

class NearestRepresentationsTest {

	@Test
	void labelBesideRepresentation_borrowsIt() {
		MvsNode cartoon = representation("cartoon", color("red"));
		MvsNode sticks = representation("ball_and_stick");
		MvsNode label = label("here");
		MvsNode comp = component(Selector.ALL, cartoon, sticks, label);
		MvsNode tree = root(structure("model", comp));

		Map<MvsNode, MvsNode> map = NearestRepresentations.of(tree);
		assertSame(cartoon, map.get(cartoon));
		assertSame(sticks, map.get(sticks));
		assertSame(cartoon, map.get(comp), "First representation wins");
		assertSame(cartoon, map.get(label));
	}

	@Test
	void representationsStopAtStructure() {
		MvsNode label = label("inner");
		MvsNode r1 = representation("cartoon");
		MvsNode inner = structure("model", component(null, label));
		MvsNode outer = structure("model", component(null, r1), inner);
		MvsNode tree = root(outer);

		Map<MvsNode, MvsNode> map = NearestRepresentations.of(tree);
		assertSame(r1, map.get(outer));
		assertSame(r1, map.get(inner), "Inherited downward from the outer structure");
		assertSame(r1, map.get(label));
		assertFalse(map.containsKey(tree), "Never propagates above a structure");
	}

	@Test
	void ownRepresentation_beatsInherited() {
		MvsNode label = label("inner");
		MvsNode r1 = representation("cartoon");
		MvsNode r2 = representation("surface");
		MvsNode inner = structure("model", component(null, r2), component(null, label));
		MvsNode outer = structure("model", component(null, r1), inner);

		Map<MvsNode, MvsNode> map = NearestRepresentations.of(root(outer));
		assertSame(r2, map.get(inner));
		assertSame(r2, map.get(label));
		assertSame(r1, map.get(outer));
	}

	@Test
	void noRepresentations_emptyMap() {
		MvsNode tree = root(structure("model", component(null, label("x"))));
		assertFalse(NearestRepresentations.of(tree).containsKey(tree.children().get(0)));
	}
}
