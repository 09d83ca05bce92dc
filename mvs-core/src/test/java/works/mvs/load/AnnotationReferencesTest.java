package works.mvs.load;

import java.util.List;
import org.junit.jupiter.api.Test;
import works.mvs.annotation.AnnotationSpec;
import works.mvs.annotation.AnnotationTooltip;
import works.mvs.annotation.InlineTooltip;
import works.mvs.selector.Selector;
import works.mvs.selector.StaticSelector;
import works.mvs.tree.MvsNode;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.mvs.tree.Nodes.colorFromSource;
import static works.mvs.tree.Nodes.colorFromUri;
import static works.mvs.tree.Nodes.component;
import static works.mvs.tree.Nodes.componentFromUri;
import static works.mvs.tree.Nodes.representation;
import static works.mvs.tree.Nodes.root;
import static works.mvs.tree.Nodes.structure;
import static works.mvs.tree.Nodes.tooltip;
import static works.mvs.tree.Nodes.tooltipFromUri;

class AnnotationReferencesTest {
	static final String URL = "https://example.com/annotations.json";

	@Test
	void sameSource_sameId() {
		MvsNode first = colorFromUri(URL, "json", "color");
		MvsNode second = tooltipFromUri(URL, "json", "name");
		MvsNode other = colorFromUri(URL, "cif", "color");
		MvsNode fromSource = colorFromSource("my_category", null);
		MvsNode tree = root(structure("model",
			component(null, representation("cartoon", first, other, fromSource)),
			component(null, second)));
		LoadingContext context = LoadingContext.withDefaults();

		List<AnnotationSpec> specs = AnnotationReferences.collect(tree, context);

		assertEquals(3, specs.size());
		assertEquals(context.annotationId(first), context.annotationId(second));
		assertNotEquals(context.annotationId(first), context.annotationId(other));
		assertEquals(specs, context.annotationSpecs());
		assertEquals(specs.get(0).id(), context.annotationId(first).orElseThrow(), "First referenced comes first");
		assertEquals(new AnnotationSpec.SourceCif(), specs.get(2).source());
		assertEquals("my_category", specs.get(2).cifCategory());
	}

	@Test
	void nodesWithoutAnnotations_noId() {
		MvsNode comp = component(null);
		LoadingContext context = LoadingContext.withDefaults();
		AnnotationReferences.collect(root(structure("model", comp)), context);
		assertTrue(context.annotationId(comp).isEmpty());
		assertTrue(context.annotationSpecs().isEmpty());
	}

	@Test
	void fieldName_defaultsByKind() {
		assertEquals("color", AnnotationReferences.fieldNameOf(colorFromUri(URL, "json", null)).orElseThrow());
		assertEquals("tooltip", AnnotationReferences.fieldNameOf(tooltipFromUri(URL, "json", null)).orElseThrow());
		assertEquals("component", AnnotationReferences.fieldNameOf(componentFromUri(URL, "json", null, null)).orElseThrow());
		assertEquals("my_field", AnnotationReferences.fieldNameOf(colorFromUri(URL, "json", "my_field")).orElseThrow());
		assertTrue(AnnotationReferences.fieldNameOf(representation("cartoon")).isEmpty());
	}

	@Test
	void annotationTooltips_distinct() {
		MvsNode structure = structure("model",
			component(null, tooltipFromUri(URL, "json", "name")),
			component(null, tooltipFromUri(URL, "json", "name")),
			component(null, tooltipFromUri(URL, "json", "other")));
		LoadingContext context = LoadingContext.forTree(root(structure), LoadingContext.DEFAULT_COLOR, LoadingContext.DEFAULT_ROTATION_TOLERANCE);
		String id = context.annotationSpecs().get(0).id();

		assertEquals(List.of(
			new AnnotationTooltip(id, "name"),
			new AnnotationTooltip(id, "other")
		), AnnotationReferences.annotationTooltips(structure, context));
	}

	@Test
	void inlineTooltips_carryParentSelection() {
		Selector ligand = new Selector.Static(StaticSelector.LIGAND);
		MvsNode structure = structure("model",
			component(ligand, tooltip("A ligand")),
			component(null, tooltip("Everything")),
			componentFromUri(URL, "json", "kind", List.of("x"), tooltip("Annotated")));
		LoadingContext context = LoadingContext.forTree(root(structure), LoadingContext.DEFAULT_COLOR, LoadingContext.DEFAULT_ROTATION_TOLERANCE);
		String id = context.annotationSpecs().get(0).id();

		assertEquals(List.of(
			new InlineTooltip("A ligand", ligand),
			new InlineTooltip("Everything", Selector.ALL),
			new InlineTooltip("Annotated", new Selector.Annotation(id, "kind", List.of("x")))
		), AnnotationReferences.inlineTooltips(structure, context));
	}
}
