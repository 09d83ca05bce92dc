package works.mvs.jackson;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.vecmath.Matrix4d;
import works.mvs.annotation.AnnotationSpec;
import works.mvs.annotation.AnnotationTooltip;
import works.mvs.annotation.InlineTooltip;
import works.mvs.color.ColorTheme;
import works.mvs.host.SceneAction;
import works.mvs.host.StructureType;
import works.mvs.selector.ElementSet;
import works.mvs.selector.Selector;
import works.mvs.selector.Selectors;

/**
 * Plain-Java renderings of {@link SceneAction}s, ready for an {@link tools.jackson.databind.ObjectMapper}.
 * Each action becomes <code>{"action": name, "params": {...}}</code>.
 */
final class SceneActionJson {
	private SceneActionJson() { }

	static Map<String, Object> toValue(SceneAction action) {
		Map<String, Object> params = new LinkedHashMap<>();
		String name;
		if (action instanceof SceneAction.Download) {
			SceneAction.Download a = (SceneAction.Download) action;
			name = "download";
			params.put("url", a.url());
			params.put("is_binary", a.isBinary());
		} else if (action instanceof SceneAction.Parse) {
			name = "parse";
			params.put("format", ((SceneAction.Parse) action).format());
		} else if (action instanceof SceneAction.TrajectoryFromFormat) {
			name = "trajectory_from_format";
			params.put("format", ((SceneAction.TrajectoryFromFormat) action).format());
		} else if (action instanceof SceneAction.ModelFromTrajectory) {
			name = "model_from_trajectory";
			params.put("model_index", ((SceneAction.ModelFromTrajectory) action).modelIndex());
		} else if (action instanceof SceneAction.StructureFromModel) {
			name = "structure_from_model";
			params.putAll(structureType(((SceneAction.StructureFromModel) action).type()));
		} else if (action instanceof SceneAction.TransformConformation) {
			name = "transform_conformation";
			params.put("matrix", rowMajor(((SceneAction.TransformConformation) action).matrix()));
		} else if (action instanceof SceneAction.StructureProperties) {
			name = "structure_properties";
			params.putAll(properties((SceneAction.StructureProperties) action));
		} else if (action instanceof SceneAction.Component) {
			name = "component";
			params.put("selector", selector(((SceneAction.Component) action).selector()));
		} else if (action instanceof SceneAction.AnnotationComponent) {
			SceneAction.AnnotationComponent a = (SceneAction.AnnotationComponent) action;
			name = "annotation_component";
			params.put("annotation_id", a.annotationId());
			params.put("field_name", a.fieldName());
			params.put("field_values", a.fieldValues());
		} else if (action instanceof SceneAction.Representation) {
			SceneAction.Representation a = (SceneAction.Representation) action;
			name = "representation";
			params.put("type", a.type().hostName());
			params.put("type_params", a.type().typeParams());
			a.type().sizeTheme().ifPresent(t -> {
				params.put("size_theme", t);
				params.put("size_theme_params", a.type().sizeThemeParams());
			});
			params.put("color_theme", colorTheme(a.colorTheme()));
		} else if (action instanceof SceneAction.AnnotationLabel) {
			SceneAction.AnnotationLabel a = (SceneAction.AnnotationLabel) action;
			name = "annotation_label";
			params.put("annotation_id", a.annotationId());
			params.put("field_name", a.fieldName());
			params.put("color_theme", colorTheme(a.colorTheme()));
		} else if (action instanceof SceneAction.InlineLabel) {
			SceneAction.InlineLabel a = (SceneAction.InlineLabel) action;
			name = "inline_label";
			params.put("text", a.text());
			params.put("color_theme", colorTheme(a.colorTheme()));
		} else {
			throw new IllegalArgumentException("Unexpected action: " + action);
		}
		Map<String, Object> result = new LinkedHashMap<>();
		result.put("action", name);
		result.put("params", params);
		return result;
	}

	static Map<String, Object> properties(SceneAction.StructureProperties properties) {
		List<Object> annotations = new ArrayList<>();
		for (AnnotationSpec spec : properties.annotations()) {
			Map<String, Object> item = new LinkedHashMap<>();
			item.put("id", spec.id());
			item.put("source", spec.source().toMap());
			item.put("schema", spec.schema());
			item.put("cif_block", spec.cifBlock().toMap());
			item.put("cif_category", spec.cifCategory());
			annotations.add(item);
		}
		List<Object> annotationTooltips = new ArrayList<>();
		for (AnnotationTooltip tooltip : properties.annotationTooltips()) {
			annotationTooltips.add(Map.of("annotation_id", tooltip.annotationId(), "field_name", tooltip.fieldName()));
		}
		List<Object> inlineTooltips = new ArrayList<>();
		for (InlineTooltip tooltip : properties.inlineTooltips()) {
			inlineTooltips.add(Map.of("text", tooltip.text(), "selector", selector(tooltip.selector())));
		}
		Map<String, Object> result = new LinkedHashMap<>();
		result.put("annotations", annotations);
		result.put("annotation_tooltips", annotationTooltips);
		result.put("inline_tooltips", inlineTooltips);
		return result;
	}

	private static Map<String, Object> structureType(StructureType type) {
		Map<String, Object> result = new LinkedHashMap<>();
		result.put("type", type.hostName());
		if (type instanceof StructureType.Assembly) {
			result.put("assembly_id", ((StructureType.Assembly) type).id());
		} else if (type instanceof StructureType.Symmetry) {
			result.put("ijk_min", ((StructureType.Symmetry) type).ijkMin());
			result.put("ijk_max", ((StructureType.Symmetry) type).ijkMax());
		} else if (type instanceof StructureType.SymmetryMates) {
			result.put("radius", ((StructureType.SymmetryMates) type).radius());
		}
		return result;
	}

	static Object selector(Selector selector) {
		if (selector instanceof Selector.Static || selector instanceof Selector.Expression) {
			return Selectors.toParams(selector);
		} else if (selector instanceof Selector.Script) {
			Selector.Script s = (Selector.Script) selector;
			return Map.of("language", s.language(), "expression", s.expression());
		} else if (selector instanceof Selector.Annotation) {
			Selector.Annotation s = (Selector.Annotation) selector;
			Map<String, Object> result = new LinkedHashMap<>();
			result.put("annotation_id", s.annotationId());
			result.put("field_name", s.fieldName());
			result.put("field_values", s.fieldValues());
			return result;
		} else {
			ElementSet elements = ((Selector.Bundle) selector).elements();
			Map<String, Object> result = new LinkedHashMap<>();
			for (String modelId : elements.modelIds()) {
				List<Integer> indices = new ArrayList<>();
				for (int element : elements.elements(modelId)) {
					indices.add(element);
				}
				result.put(modelId, indices);
			}
			return Map.of("elements", result);
		}
	}

	static Object colorTheme(ColorTheme theme) {
		Map<String, Object> result = new LinkedHashMap<>();
		if (theme instanceof ColorTheme.Uniform) {
			result.put("name", "uniform");
			result.put("color", ((ColorTheme.Uniform) theme).color().toHexString());
		} else if (theme instanceof ColorTheme.AnnotationDriven) {
			ColorTheme.AnnotationDriven t = (ColorTheme.AnnotationDriven) theme;
			result.put("name", "annotation");
			result.put("annotation_id", t.annotationId());
			result.put("field_name", t.fieldName());
			result.put("background", t.background().toHexString());
		} else {
			List<Object> layers = new ArrayList<>();
			for (ColorTheme.Layer layer : ((ColorTheme.Layered) theme).layers()) {
				Map<String, Object> item = new LinkedHashMap<>();
				item.put("theme", colorTheme(layer.theme()));
				item.put("selection", selector(layer.selection()));
				layers.add(item);
			}
			result.put("name", "layered");
			result.put("layers", layers);
		}
		return result;
	}

	private static List<Double> rowMajor(Matrix4d matrix) {
		List<Double> result = new ArrayList<>(16);
		for (int row = 0; row < 4; row++) {
			for (int col = 0; col < 4; col++) {
				result.add(matrix.getElement(row, col));
			}
		}
		return result;
	}
}
