package works.mvs.load;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import javax.vecmath.Matrix4d;
import works.mvs.annotation.AnnotationSpec;
import works.mvs.color.ColorTheme;
import works.mvs.color.ColorThemes;
import works.mvs.exceptions.UnsupportedParameterException;
import works.mvs.geometry.Transforms;
import works.mvs.host.RepresentationType;
import works.mvs.host.SceneAction;
import works.mvs.host.SceneBatch;
import works.mvs.host.SceneRef;
import works.mvs.host.StructureType;
import works.mvs.selector.Selector;
import works.mvs.tree.MvsKind;
import works.mvs.tree.MvsNode;
import works.mvs.tree.NodeParams;
import works.mvs.tree.Trees;

import static java.util.stream.Collectors.toList;

/**
 * The actions that build a molecular scene from an MVS tree.
 * <p>
 * {@code color}, {@code tooltip}, and {@code transform} nodes have no actions of their own:
 * they are consumed by the actions of their parents.
 * Neither do {@code focus}, {@code camera}, and {@code canvas}, which describe the view rather than the scene.
 */
public final class SceneLoadingActions implements LoadingActions<LoadingContext> {
	public static final Set<String> SUPPORTED_FORMATS = Set.of("mmcif", "bcif", "pdb");

	@Override
	public Optional<LoadingAction<LoadingContext>> actionFor(MvsKind kind) {
		switch (kind) {
			case ROOT:
				return action(this::root);
			case DOWNLOAD:
				return action(this::download);
			case PARSE:
				return action(this::parse);
			case STRUCTURE:
				return action(this::structure);
			case COMPONENT:
				return action(this::component);
			case COMPONENT_FROM_URI:
			case COMPONENT_FROM_SOURCE:
				return action(this::componentFromAnnotation);
			case REPRESENTATION:
				return action(this::representation);
			case LABEL:
				return action(this::label);
			case LABEL_FROM_URI:
			case LABEL_FROM_SOURCE:
				return action(this::labelFromAnnotation);
			case TRANSFORM:
			case COLOR:
			case COLOR_FROM_URI:
			case COLOR_FROM_SOURCE:
			case TOOLTIP:
			case TOOLTIP_FROM_URI:
			case TOOLTIP_FROM_SOURCE:
			case FOCUS:
			case CAMERA:
			case CANVAS:
				return Optional.empty();
		}
		throw new AssertionError("Unexpected kind: " + kind);
	}

	private static Optional<LoadingAction<LoadingContext>> action(LoadingAction<LoadingContext> action) {
		return Optional.of(action);
	}

	Optional<SceneRef> root(SceneBatch batch, SceneRef anchor, MvsNode node, LoadingContext context) {
		return Optional.of(anchor);
	}

	Optional<SceneRef> download(SceneBatch batch, SceneRef parent, MvsNode node, LoadingContext context) {
		NodeParams.Download params = node.params(NodeParams.Download.class);
		boolean isBinary = node.children().stream()
			.filter(c -> c.is(MvsKind.PARSE))
			.findFirst()
			.map(c -> c.params(NodeParams.Parse.class).binary())
			.orElse(false);
		return Optional.of(batch.addChild(parent, new SceneAction.Download(params.url(), isBinary)));
	}

	Optional<SceneRef> parse(SceneBatch batch, SceneRef parent, MvsNode node, LoadingContext context) {
		String format = node.params(NodeParams.Parse.class).format();
		if (!SUPPORTED_FORMATS.contains(format)) {
			throw new UnsupportedParameterException(node.kind(), "format", format);
		}
		SceneRef data = batch.addChild(parent, new SceneAction.Parse(format));
		return Optional.of(batch.addChild(data, new SceneAction.TrajectoryFromFormat(format)));
	}

	Optional<SceneRef> structure(SceneBatch batch, SceneRef parent, MvsNode node, LoadingContext context) {
		NodeParams.Structure params = node.params(NodeParams.Structure.class);
		StructureType type = structureType(node.kind(), params);
		int modelIndex = params.modelIndex() == null ? 0 : params.modelIndex();
		SceneRef model = batch.addChild(parent, new SceneAction.ModelFromTrajectory(modelIndex));
		SceneRef result = batch.addChild(model, new SceneAction.StructureFromModel(type));
		for (Matrix4d matrix : Transforms.forStructure(node, context.rotationTolerance())) {
			result = batch.addChild(result, new SceneAction.TransformConformation(matrix));
		}
		SceneAction.StructureProperties properties = new SceneAction.StructureProperties(
			annotationsUnder(node, context),
			AnnotationReferences.annotationTooltips(node, context),
			AnnotationReferences.inlineTooltips(node, context));
		if (!properties.isEmpty()) {
			batch.setProperties(result, properties);
		}
		return Optional.of(result);
	}

	static StructureType structureType(String nodeKind, NodeParams.Structure params) {
		switch (params.type()) {
			case "model":
				return new StructureType.Model();
			case "assembly":
				return new StructureType.Assembly(params.assemblyId());
			case "symmetry":
				return new StructureType.Symmetry(params.ijkMin(), params.ijkMax());
			case "symmetry_mates":
				return new StructureType.SymmetryMates(params.radius());
			default:
				throw new UnsupportedParameterException(nodeKind, "type", params.type());
		}
	}

	private static List<AnnotationSpec> annotationsUnder(MvsNode structure, LoadingContext context) {
		Set<String> ids = new LinkedHashSet<>();
		Trees.dfs(structure, (node, parent) -> context.annotationId(node).ifPresent(ids::add));
		return context.annotationSpecs().stream()
			.filter(spec -> ids.contains(spec.id()))
			.collect(toList());
	}

	Optional<SceneRef> component(SceneBatch batch, SceneRef parent, MvsNode node, LoadingContext context) {
		if (isPhantomComponent(node)) {
			return Optional.of(parent);
		}
		Selector selector = Selector.orAll(node.params(NodeParams.Component.class).selector());
		return Optional.of(batch.addChild(parent, new SceneAction.Component(selector)));
	}

	Optional<SceneRef> componentFromAnnotation(SceneBatch batch, SceneRef parent, MvsNode node, LoadingContext context) {
		if (isPhantomComponent(node)) {
			return Optional.of(parent);
		}
		Selector.Annotation selector = AnnotationReferences.annotationSelector(node, context)
			.orElseThrow(() -> new IllegalStateException("Annotation references have not been collected for " + node));
		return Optional.of(batch.addChild(parent, new SceneAction.AnnotationComponent(
			selector.annotationId(), selector.fieldName(), selector.fieldValues())));
	}

	/**
	 * A component whose only children are tooltips exists just to say where the tooltips go.
	 * The tooltips are {@link SceneAction.StructureProperties properties} of the structure,
	 * so the component itself is never created.
	 */
	static boolean isPhantomComponent(MvsNode node) {
		return !node.children().isEmpty() && node.children().stream()
			.allMatch(c -> c.knownKind().map(MvsKind.TOOLTIPS::contains).orElse(false));
	}

	Optional<SceneRef> representation(SceneBatch batch, SceneRef parent, MvsNode node, LoadingContext context) {
		String typeName = node.params(NodeParams.Representation.class).type();
		RepresentationType type = RepresentationType.fromTreeName(typeName)
			.orElseThrow(() -> new UnsupportedParameterException(node.kind(), "type", typeName));
		ColorTheme colorTheme = ColorThemes.forNode(node, context);
		return Optional.of(batch.addChild(parent, new SceneAction.Representation(type, colorTheme)));
	}

	Optional<SceneRef> label(SceneBatch batch, SceneRef parent, MvsNode node, LoadingContext context) {
		String text = node.params(NodeParams.Text.class).text();
		return Optional.of(batch.addChild(parent, new SceneAction.InlineLabel(text, nearestColorTheme(node, context))));
	}

	Optional<SceneRef> labelFromAnnotation(SceneBatch batch, SceneRef parent, MvsNode node, LoadingContext context) {
		String annotationId = context.annotationId(node)
			.orElseThrow(() -> new IllegalStateException("Annotation references have not been collected for " + node));
		String fieldName = AnnotationReferences.fieldNameOf(node).orElseThrow();
		return Optional.of(batch.addChild(parent, new SceneAction.AnnotationLabel(annotationId, fieldName, nearestColorTheme(node, context))));
	}

	private static ColorTheme nearestColorTheme(MvsNode node, LoadingContext context) {
		return ColorThemes.forNode(context.nearestRepresentation(node).orElse(null), context);
	}

	@Override
	public String toString() {
		return "SceneLoadingActions";
	}
}
