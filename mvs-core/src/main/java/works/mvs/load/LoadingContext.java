package works.mvs.load;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import works.mvs.annotation.AnnotationSpec;
import works.mvs.color.Color;
import works.mvs.tree.MvsNode;

import static java.util.Objects.requireNonNull;

/**
 * Auxiliary state for one run of the loader.
 * <p>
 * The node maps are keyed by node identity; a context must not be shared between runs.
 */
public final class LoadingContext {
	private final Color defaultColor;
	private final double rotationTolerance;
	private final Map<MvsNode, String> annotationMap = new IdentityHashMap<>();
	private final List<AnnotationSpec> annotationSpecs = new ArrayList<>();
	private final Map<MvsNode, MvsNode> nearestReprMap = new IdentityHashMap<>();

	public LoadingContext(Color defaultColor, double rotationTolerance) {
		this.defaultColor = requireNonNull(defaultColor);
		this.rotationTolerance = rotationTolerance;
	}

	public static LoadingContext withDefaults() {
		return new LoadingContext(DEFAULT_COLOR, DEFAULT_ROTATION_TOLERANCE);
	}

	/**
	 * A context with the annotation references and nearest representations of <code>tree</code> filled in.
	 */
	public static LoadingContext forTree(MvsNode tree, Color defaultColor, double rotationTolerance) {
		LoadingContext result = new LoadingContext(defaultColor, rotationTolerance);
		AnnotationReferences.collect(tree, result);
		result.putNearestRepresentations(NearestRepresentations.of(tree));
		return result;
	}

	public static final Color DEFAULT_COLOR = new Color(0xFFFFFF);
	public static final double DEFAULT_ROTATION_TOLERANCE = 1e-6;

	/**
	 * Color of representations with no color nodes.
	 */
	public Color defaultColor() {
		return defaultColor;
	}

	public double rotationTolerance() {
		return rotationTolerance;
	}

	public Optional<String> annotationId(MvsNode node) {
		return Optional.ofNullable(annotationMap.get(node));
	}

	/**
	 * @return the distinct annotations referenced by the tree, in order of first reference
	 */
	public List<AnnotationSpec> annotationSpecs() {
		return List.copyOf(annotationSpecs);
	}

	public Optional<MvsNode> nearestRepresentation(MvsNode node) {
		return Optional.ofNullable(nearestReprMap.get(node));
	}

	void putAnnotation(MvsNode node, AnnotationSpec spec) {
		annotationMap.put(node, spec.id());
	}

	void addAnnotationSpec(AnnotationSpec spec) {
		annotationSpecs.add(spec);
	}

	void putNearestRepresentations(Map<MvsNode, MvsNode> map) {
		nearestReprMap.putAll(map);
	}

	@Override
	public String toString() {
		return "LoadingContext{"
			+ annotationSpecs.size() + " annotations, "
			+ nearestReprMap.size() + " nodes near a representation}";
	}
}
