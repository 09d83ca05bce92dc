package works.mvs.load;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import works.mvs.annotation.AnnotationSpec;
import works.mvs.annotation.AnnotationTooltip;
import works.mvs.annotation.InlineTooltip;
import works.mvs.selector.Selector;
import works.mvs.tree.MvsKind;
import works.mvs.tree.MvsNode;
import works.mvs.tree.NodeParams;
import works.mvs.tree.Trees;

/**
 * Finds the annotations a tree refers to, and the tooltips that display them.
 */
public final class AnnotationReferences {
	private AnnotationReferences() { }

	/**
	 * Records in <code>context</code> the annotation id of every node that refers to an annotation.
	 * Nodes whose source, schema, block and category are equal get the same id.
	 *
	 * @return the distinct specs, in order of first reference
	 */
	public static List<AnnotationSpec> collect(MvsNode tree, LoadingContext context) {
		Map<String, AnnotationSpec> distinctSpecs = new LinkedHashMap<>();
		Trees.dfs(tree, (node, parent) -> {
			specFor(node).ifPresent(spec -> {
				AnnotationSpec existing = distinctSpecs.putIfAbsent(spec.canonicalKey(), spec);
				AnnotationSpec canonical = (existing == null) ? spec : existing;
				if (existing == null) {
					context.addAnnotationSpec(canonical);
				}
				context.putAnnotation(node, canonical);
			});
		});
		return List.copyOf(distinctSpecs.values());
	}

	static Optional<AnnotationSpec> specFor(MvsNode node) {
		Optional<MvsKind> kind = node.knownKind();
		if (kind.isEmpty()) {
			return Optional.empty();
		}
		if (MvsKind.ANNOTATION_FROM_URI.contains(kind.get())) {
			NodeParams.AnnotationFromUri p = node.params(NodeParams.AnnotationFromUri.class);
			return Optional.of(AnnotationSpec.create(
				new AnnotationSpec.Url(p.uri(), p.format()),
				p.schema(),
				AnnotationSpec.CifBlock.of(p.blockHeader(), p.blockIndex()),
				p.categoryName()));
		} else if (MvsKind.ANNOTATION_FROM_SOURCE.contains(kind.get())) {
			NodeParams.AnnotationFromSource p = node.params(NodeParams.AnnotationFromSource.class);
			return Optional.of(AnnotationSpec.create(
				new AnnotationSpec.SourceCif(),
				p.schema(),
				AnnotationSpec.CifBlock.of(p.blockHeader(), p.blockIndex()),
				p.categoryName()));
		} else {
			return Optional.empty();
		}
	}

	/**
	 * @return the distinct annotation fields shown by {@code tooltip_from_*} nodes under <code>structure</code>
	 */
	public static List<AnnotationTooltip> annotationTooltips(MvsNode structure, LoadingContext context) {
		Set<AnnotationTooltip> result = new LinkedHashSet<>();
		Trees.dfs(structure, (node, parent) -> {
			if (node.is(MvsKind.TOOLTIP_FROM_URI) || node.is(MvsKind.TOOLTIP_FROM_SOURCE)) {
				Optional<String> annotationId = context.annotationId(node);
				Optional<String> fieldName = fieldNameOf(node);
				if (annotationId.isPresent() && fieldName.isPresent()) {
					result.add(new AnnotationTooltip(annotationId.get(), fieldName.get()));
				}
			}
		});
		return List.copyOf(result);
	}

	/**
	 * @return the {@code tooltip} nodes under <code>structure</code> whose parent is a component,
	 * each paired with the parent's selection
	 */
	public static List<InlineTooltip> inlineTooltips(MvsNode structure, LoadingContext context) {
		List<InlineTooltip> result = new ArrayList<>();
		Trees.dfs(structure, (node, parent) -> {
			if (parent == null || !node.is(MvsKind.TOOLTIP)) {
				return;
			}
			String text = node.params(NodeParams.Text.class).text();
			if (parent.is(MvsKind.COMPONENT)) {
				Selector selector = Selector.orAll(parent.params(NodeParams.Component.class).selector());
				result.add(new InlineTooltip(text, selector));
			} else if (parent.is(MvsKind.COMPONENT_FROM_URI) || parent.is(MvsKind.COMPONENT_FROM_SOURCE)) {
				annotationSelector(parent, context)
					.ifPresent(selector -> result.add(new InlineTooltip(text, selector)));
			}
		});
		return result;
	}

	/**
	 * @return empty if the node has no annotation id in <code>context</code>
	 */
	static Optional<Selector.Annotation> annotationSelector(MvsNode componentFromX, LoadingContext context) {
		NodeParams.AnnotationRef p = componentFromX.params(NodeParams.AnnotationRef.class);
		Optional<String> annotationId = context.annotationId(componentFromX);
		Optional<String> fieldName = fieldNameOf(componentFromX);
		if (annotationId.isEmpty() || fieldName.isEmpty()) {
			return Optional.empty();
		}
		return Optional.of(new Selector.Annotation(annotationId.get(), fieldName.get(), p.fieldValues()));
	}

	/**
	 * @return the annotation field that <code>node</code> reads, which defaults by kind;
	 * empty if the node does not refer to an annotation
	 */
	public static Optional<String> fieldNameOf(MvsNode node) {
		if (node.params() instanceof NodeParams.AnnotationRef) {
			String fieldName = ((NodeParams.AnnotationRef) node.params()).fieldName();
			if (fieldName != null) {
				return Optional.of(fieldName);
			}
		}
		return node.knownKind().flatMap(MvsKind::defaultFieldName);
	}
}
