package works.mvs.load;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import works.mvs.annotation.InlineTooltip;
import works.mvs.color.Color;
import works.mvs.color.ColorTheme;
import works.mvs.exceptions.TreeLoadingException;
import works.mvs.exceptions.UnsupportedParameterException;
import works.mvs.host.InMemorySceneHost;
import works.mvs.host.InMemorySceneHost.SceneObject;
import works.mvs.host.RepresentationType;
import works.mvs.host.SceneAction;
import works.mvs.host.StructureType;
import works.mvs.selector.Selector;
import works.mvs.selector.StaticSelector;
import works.mvs.tree.MvsKind;
import works.mvs.tree.MvsNode;
import works.mvs.tree.NodeParams;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.mvs.tree.Nodes.color;
import static works.mvs.tree.Nodes.component;
import static works.mvs.tree.Nodes.download;
import static works.mvs.tree.Nodes.label;
import static works.mvs.tree.Nodes.parse;
import static works.mvs.tree.Nodes.representation;
import static works.mvs.tree.Nodes.root;
import static works.mvs.tree.Nodes.structure;
import static works.mvs.tree.Nodes.tooltip;
import static works.mvs.tree.Nodes.transform;

class TreeLoaderTest {
	static final String URL = "https://example.com/1cbs.cif";
	static final Color RED = new Color(0xFF0000);

	InMemorySceneHost host;

	@BeforeEach
	void setupHost() {
		host = new InMemorySceneHost();
	}

	@Test
	void simpleTree_buildsChainOfObjects() throws TreeLoadingException {
		load(root(download(URL, parse("mmcif", structure("model",
			component(Selector.ALL, representation("cartoon", color("red"))))))));

		assertEquals(List.of(
			new SceneAction.Download(URL, false),
			new SceneAction.Parse("mmcif"),
			new SceneAction.TrajectoryFromFormat("mmcif"),
			new SceneAction.ModelFromTrajectory(0),
			new SceneAction.StructureFromModel(new StructureType.Model()),
			new SceneAction.Component(Selector.ALL),
			new SceneAction.Representation(RepresentationType.CARTOON, new ColorTheme.Uniform(RED))
		), host.actions());
		assertEquals(1, host.commitCount());
	}

	@Test
	void binaryParse_downloadIsBinary() throws TreeLoadingException {
		load(root(download(URL, parse("bcif"))));
		assertEquals(new SceneAction.Download(URL, true), host.actions().get(0));
	}

	@Test
	void passThroughKinds_childrenAttachToGrandparent() throws TreeLoadingException {
		MvsNode comp = component(null, label("hello"));
		MvsNode focusNode = MvsNode.of(MvsKind.FOCUS, NodeParams.None.INSTANCE, comp);
		MvsNode structureNode = structure("model", focusNode);
		LoadResult result = load(root(download(URL, parse("mmcif", structureNode))));

		assertEquals(result.resultOf(structureNode), result.resultOf(focusNode));
		SceneObject componentObject = host.get(result.resultOf(comp).orElseThrow()).orElseThrow();
		assertEquals(result.resultOf(structureNode).orElseThrow(), componentObject.parent());
		assertFalse(result.loadedNodes().contains(focusNode));
	}

	@Test
	void unknownKind_skippedWithDescendants() throws TreeLoadingException {
		MvsNode orphan = component(null);
		MvsNode mystery = MvsNode.unchecked("mystery", NodeParams.Raw.EMPTY, List.of(orphan));
		LoadResult result = load(root(download(URL), mystery));

		assertEquals(List.of(
			new SkippedNode("mystery", "root/mystery[1]", SkippedNode.Reason.UNKNOWN_KIND),
			new SkippedNode("component", "root/mystery[1]/component[0]", SkippedNode.Reason.NO_TARGET)
		), result.skipped());
		assertEquals(Optional.empty(), result.resultOf(mystery));
		assertEquals(List.of(new SceneAction.Download(URL, false)), host.actions());
	}

	@Test
	@Timeout(30)
	void wideUnknownSubtree_everyDescendantSkippedOnce() throws TreeLoadingException {
		int width = 5_000;
		List<MvsNode> children = new ArrayList<>(width);
		for (int i = 0; i < width; i++) {
			children.add(component(null, label("child " + i)));
		}
		MvsNode mystery = MvsNode.unchecked("mystery", NodeParams.Raw.EMPTY, children);
		LoadResult result = load(root(mystery));

		assertEquals(1 + 2 * width, result.skipped().size());
		assertEquals(new SkippedNode("mystery", "root/mystery[0]", SkippedNode.Reason.UNKNOWN_KIND), result.skipped().get(0));
		assertEquals(new SkippedNode("label", "root/mystery[0]/component[" + (width - 1) + "]/label[0]", SkippedNode.Reason.NO_TARGET),
			result.skipped().get(2 * width));
		assertTrue(host.actions().isEmpty());
	}

	@Test
	void invalidParam_nothingCommitted() throws TreeLoadingException {
		load(root(download(URL, parse("mmcif"))));
		List<SceneAction> before = host.actions();

		MvsNode tree = root(download(URL, parse("xyz", structure("model"))));
		TreeLoadingException e = assertThrows(TreeLoadingException.class, () -> load(tree));

		assertEquals("parse", e.nodeKind());
		assertEquals("root/download[0]/parse[0]", e.nodePath());
		assertInstanceOf(UnsupportedParameterException.class, e.getCause());
		assertEquals(before, host.actions());
		assertEquals(1, host.commitCount());
	}

	@Test
	void invalidTransform_nothingCommitted() {
		MvsNode tree = root(download(URL, parse("mmcif", structure("model",
			transform(List.of(1.0, 2.0), null)))));
		TreeLoadingException e = assertThrows(TreeLoadingException.class, () -> load(tree));
		assertEquals("structure", e.nodeKind());
		assertEquals(0, host.size());
		assertEquals(0, host.commitCount());
	}

	@Test
	void deletePrevious_replacesScene() throws TreeLoadingException {
		load(root(download(URL)));
		load(root(download("https://example.com/other.cif")));
		assertEquals(List.of(new SceneAction.Download("https://example.com/other.cif", false)), host.actions());
	}

	@Test
	void keepPrevious_accumulates() throws TreeLoadingException {
		MvsNode tree = root(download(URL));
		load(tree);
		TreeLoader.loadTree(host, tree, new SceneLoadingActions(), context(tree), false);
		assertEquals(2, host.size());
	}

	@Test
	void transforms_chainedAfterStructure() throws TreeLoadingException {
		List<Double> identity = List.of(1.0, 0.0, 0.0, 0.0, 1.0, 0.0, 0.0, 0.0, 1.0);
		MvsNode comp = component(null);
		load(root(download(URL, parse("mmcif", structure("model",
			transform(identity, List.of(1.0, 0.0, 0.0)),
			transform(null, List.of(0.0, 1.0, 0.0)),
			comp)))));

		List<SceneAction> actions = host.actions();
		assertThat(actions.subList(4, 8), contains(
			instanceOf(SceneAction.StructureFromModel.class),
			instanceOf(SceneAction.TransformConformation.class),
			instanceOf(SceneAction.TransformConformation.class),
			instanceOf(SceneAction.Component.class)));
		assertEquals(0.0, ((SceneAction.TransformConformation) actions.get(6)).matrix().m03);
		assertEquals(1.0, ((SceneAction.TransformConformation) actions.get(6)).matrix().m13);
	}

	@Test
	void tooltipOnlyComponent_notCreated() throws TreeLoadingException {
		Selector ligand = new Selector.Static(StaticSelector.LIGAND);
		MvsNode phantom = component(ligand, tooltip("Ligand"));
		MvsNode structureNode = structure("model", phantom);
		LoadResult result = load(root(download(URL, parse("mmcif", structureNode))));

		assertEquals(result.resultOf(structureNode), result.resultOf(phantom));
		assertTrue(host.actions().stream().noneMatch(a -> a instanceof SceneAction.Component));
		SceneObject structureObject = host.get(result.resultOf(structureNode).orElseThrow()).orElseThrow();
		assertEquals(List.of(new InlineTooltip("Ligand", ligand)),
			structureObject.properties().inlineTooltips());
	}

	@Test
	void label_usesNearestRepresentationColors() throws TreeLoadingException {
		load(root(download(URL, parse("mmcif", structure("model",
			component(null, representation("cartoon", color("red")), label("Here")))))));
		assertEquals(new SceneAction.InlineLabel("Here", new ColorTheme.Uniform(RED)),
			host.actions().get(host.actions().size() - 1));
	}

	@Test
	void unsupportedRepresentation_fails() {
		MvsNode tree = root(download(URL, parse("mmcif", structure("model",
			component(null, representation("wireframe"))))));
		TreeLoadingException e = assertThrows(TreeLoadingException.class, () -> load(tree));
		assertEquals("representation", e.nodeKind());
	}

	@Test
	void sameTree_sameActions() throws TreeLoadingException {
		MvsNode tree = root(download(URL, parse("mmcif", structure("model",
			component(new Selector.Static(StaticSelector.PROTEIN), representation("cartoon", color("red"))),
			component(new Selector.Static(StaticSelector.LIGAND), representation("ball_and_stick"))))));
		List<List<SceneAction>> runs = new ArrayList<>();
		for (int i = 0; i < 3; i++) {
			InMemorySceneHost fresh = new InMemorySceneHost();
			TreeLoader.loadTree(fresh, tree, new SceneLoadingActions(), context(tree), true);
			runs.add(fresh.actions());
		}
		assertEquals(runs.get(0), runs.get(1));
		assertEquals(runs.get(0), runs.get(2));
	}

	@Test
	void rootResult_isAnchor() throws TreeLoadingException {
		MvsNode tree = root();
		LoadResult result = load(tree);
		assertEquals(Optional.of(InMemorySceneHost.ROOT), result.resultOf(tree));
		assertTrue(result.committed().isDone());
	}

	private LoadResult load(MvsNode tree) throws TreeLoadingException {
		return TreeLoader.loadTree(host, tree, new SceneLoadingActions(), context(tree), true);
	}

	private static LoadingContext context(MvsNode tree) {
		return LoadingContext.forTree(tree, LoadingContext.DEFAULT_COLOR, LoadingContext.DEFAULT_ROTATION_TOLERANCE);
	}
}
