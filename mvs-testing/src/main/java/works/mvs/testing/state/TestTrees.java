package works.mvs.testing.state;

import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.params.provider.Arguments;
import works.mvs.selector.ComponentExpression;
import works.mvs.selector.Selector;
import works.mvs.tree.MvsNode;
import works.mvs.tree.NodeParams;

import static org.junit.jupiter.params.provider.Arguments.arguments;
import static works.mvs.tree.Nodes.color;
import static works.mvs.tree.Nodes.colorFromUri;
import static works.mvs.tree.Nodes.component;
import static works.mvs.tree.Nodes.componentFromUri;
import static works.mvs.tree.Nodes.canvas;
import static works.mvs.tree.Nodes.download;
import static works.mvs.tree.Nodes.focus;
import static works.mvs.tree.Nodes.label;
import static works.mvs.tree.Nodes.parse;
import static works.mvs.tree.Nodes.representation;
import static works.mvs.tree.Nodes.root;
import static works.mvs.tree.Nodes.structure;
import static works.mvs.tree.Nodes.tooltip;
import static works.mvs.tree.Nodes.transform;

/**
 * Trees that exercise the loader in various ways.
 * Every method returns a new tree, so callers may compare results by identity.
 */
public final class TestTrees {
	private TestTrees() { }

	public static final String STRUCTURE_URL = "https://files.example.org/1cbs.bcif";
	public static final String ANNOTATION_URL = "https://files.example.org/1cbs-domains.json";

	public static final Selector CHAIN_A = Selector.Expression.of(ComponentExpression.builder().labelAsymId("A").build());

	public static MvsNode empty() {
		return root();
	}

	/**
	 * One cartoon, colored red.
	 */
	public static MvsNode minimal() {
		return root(
			download(STRUCTURE_URL,
				parse("bcif",
					structure("model",
						component(Selector.ALL,
							representation("cartoon",
								color("red")))))));
	}

	public static MvsNode fullScene() {
		return root(
			canvas("white"),
			download(STRUCTURE_URL,
				parse("bcif",
					structure("model",
						transform(List.of(
							0.0, -1.0, 0.0,
							1.0, 0.0, 0.0,
							0.0, 0.0, 1.0), List.of(1.0, 2.0, 3.0)),
						component(Selector.Static.named("polymer"),
							representation("cartoon",
								color("green"),
								color("#ff0000", CHAIN_A))),
						component(Selector.Static.named("ligand"),
							representation("ball_and_stick"),
							label("Ligand"),
							tooltip("Retinoic acid"),
							focus())))));
	}

	/**
	 * A component with only tooltips under it, which becomes a property of its structure.
	 */
	public static MvsNode withTooltips() {
		return root(
			download(STRUCTURE_URL,
				parse("bcif",
					structure("model",
						component(CHAIN_A,
							tooltip("Chain A")),
						component(Selector.ALL,
							representation("surface"))))));
	}

	public static MvsNode withAnnotations() {
		return root(
			download(STRUCTURE_URL,
				parse("bcif",
					structure("model",
						componentFromUri(ANNOTATION_URL, "json", "domain", List.of("N-term"),
							representation("surface",
								colorFromUri(ANNOTATION_URL, "json", "color")))))));
	}

	/**
	 * A valid structure next to a node of unknown kind with one child.
	 * Loading this logs two warnings.
	 */
	public static MvsNode withUnknownKind() {
		return root(
			download(STRUCTURE_URL,
				parse("bcif",
					structure("model"))),
			MvsNode.unchecked("mystery", NodeParams.Raw.EMPTY, List.of(
				component(Selector.ALL))));
	}

	/**
	 * @return each tree above, named for use with {@link org.junit.jupiter.params.provider.MethodSource}
	 */
	public static Stream<Arguments> allTrees() {
		return Stream.of(
			arguments("empty", empty()),
			arguments("minimal", minimal()),
			arguments("fullScene", fullScene()),
			arguments("withTooltips", withTooltips()),
			arguments("withAnnotations", withAnnotations()),
			arguments("withUnknownKind", withUnknownKind())
		);
	}
}
