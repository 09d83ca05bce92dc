package works.mvs.jackson;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.mvs.selector.Selectors;
import works.mvs.tree.MvsNode;
import works.mvs.tree.NodeParams;

/**
 * Writes MVS trees as JSON, in the form {@link MvsJsonReader} reads.
 * Absent optional params are left out, as are empty {@code params} and {@code children}.
 */
public final class MvsJsonWriter {
	private final ObjectMapper mapper;

	public MvsJsonWriter() {
		this(JsonMapper.builder().build());
	}

	public MvsJsonWriter(ObjectMapper mapper) {
		this.mapper = mapper;
	}

	public String writeTree(MvsNode tree) {
		return mapper.writeValueAsString(toValue(tree));
	}

	public String writeDocument(MvsDocument document) {
		Map<String, Object> result = new LinkedHashMap<>();
		if (document.version() != null) {
			result.put("version", document.version());
		}
		result.put("root", toValue(document.root()));
		return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(result);
	}

	/**
	 * @return the plain-Java form of <code>node</code>, made of maps, lists, strings, numbers and booleans
	 */
	public Map<String, Object> toValue(MvsNode node) {
		Map<String, Object> result = new LinkedHashMap<>();
		result.put("kind", node.kind());
		Map<String, Object> params = paramsToValue(node.params());
		if (!params.isEmpty()) {
			result.put("params", params);
		}
		if (!node.children().isEmpty()) {
			List<Object> children = new ArrayList<>(node.children().size());
			for (MvsNode child : node.children()) {
				children.add(toValue(child));
			}
			result.put("children", children);
		}
		return result;
	}

	static Map<String, Object> paramsToValue(NodeParams params) {
		Map<String, Object> result = new LinkedHashMap<>();
		if (params instanceof NodeParams.Download) {
			result.put("url", ((NodeParams.Download) params).url());
		} else if (params instanceof NodeParams.Parse) {
			NodeParams.Parse p = (NodeParams.Parse) params;
			result.put("format", p.format());
			putIfPresent(result, "is_binary", p.isBinary());
		} else if (params instanceof NodeParams.Structure) {
			NodeParams.Structure p = (NodeParams.Structure) params;
			result.put("type", p.type());
			putIfPresent(result, "model_index", p.modelIndex());
			putIfPresent(result, "assembly_id", p.assemblyId());
			putIfPresent(result, "radius", p.radius());
			putIfPresent(result, "ijk_min", p.ijkMin());
			putIfPresent(result, "ijk_max", p.ijkMax());
			putIfPresent(result, "block_header", p.blockHeader());
			putIfPresent(result, "block_index", p.blockIndex());
		} else if (params instanceof NodeParams.Transform) {
			NodeParams.Transform p = (NodeParams.Transform) params;
			putIfPresent(result, "rotation", p.rotation());
			putIfPresent(result, "translation", p.translation());
		} else if (params instanceof NodeParams.Component) {
			NodeParams.Component p = (NodeParams.Component) params;
			if (p.selector() != null) {
				result.put("selector", Selectors.toParams(p.selector()));
			}
		} else if (params instanceof NodeParams.Representation) {
			result.put("type", ((NodeParams.Representation) params).type());
		} else if (params instanceof NodeParams.Color) {
			NodeParams.Color p = (NodeParams.Color) params;
			result.put("color", p.color());
			if (p.selector() != null) {
				result.put("selector", Selectors.toParams(p.selector()));
			}
		} else if (params instanceof NodeParams.AnnotationFromUri) {
			NodeParams.AnnotationFromUri p = (NodeParams.AnnotationFromUri) params;
			result.put("uri", p.uri());
			result.put("format", p.format());
			putAnnotationRef(result, p);
		} else if (params instanceof NodeParams.AnnotationFromSource) {
			putAnnotationRef(result, (NodeParams.AnnotationFromSource) params);
		} else if (params instanceof NodeParams.Text) {
			result.put("text", ((NodeParams.Text) params).text());
		} else if (params instanceof NodeParams.Camera) {
			NodeParams.Camera p = (NodeParams.Camera) params;
			result.put("target", p.target());
			result.put("position", p.position());
			putIfPresent(result, "up", p.up());
		} else if (params instanceof NodeParams.Canvas) {
			result.put("background_color", ((NodeParams.Canvas) params).backgroundColor());
		} else if (params instanceof NodeParams.Raw) {
			result.putAll(((NodeParams.Raw) params).values());
		}
		return result;
	}

	private static void putAnnotationRef(Map<String, Object> result, NodeParams.AnnotationRef p) {
		putIfPresent(result, "schema", p.schema());
		putIfPresent(result, "block_header", p.blockHeader());
		putIfPresent(result, "block_index", p.blockIndex());
		putIfPresent(result, "category_name", p.categoryName());
		putIfPresent(result, "field_name", p.fieldName());
		putIfPresent(result, "field_values", p.fieldValues());
	}

	private static void putIfPresent(Map<String, Object> map, String key, @Nullable Object value) {
		if (value != null) {
			map.put(key, value);
		}
	}
}
