package works.mvs.jackson;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.mvs.exceptions.InvalidParameterException;
import works.mvs.exceptions.TreeFormatException;
import works.mvs.selector.Selector;
import works.mvs.selector.Selectors;
import works.mvs.tree.MvsKind;
import works.mvs.tree.MvsNode;
import works.mvs.tree.NodeParams;

/**
 * Reads MVS trees from JSON.
 * <p>
 * Accepts either a document, <code>{"version": ..., "root": {...}}</code>,
 * or a bare node, <code>{"kind": ..., "params": {...}, "children": [...]}</code>.
 * Param names are snake_case, as in the files written by other MVS tools.
 * Nodes of unknown kinds are kept with {@link NodeParams.Raw} params.
 */
public final class MvsJsonReader {
	private final ObjectMapper mapper;

	public MvsJsonReader() {
		this(JsonMapper.builder().build());
	}

	public MvsJsonReader(ObjectMapper mapper) {
		this.mapper = mapper;
	}

	public MvsDocument readDocument(String json) throws TreeFormatException {
		Object value;
		try {
			value = mapper.readValue(json, Object.class);
		} catch (JacksonException e) {
			throw new TreeFormatException("Malformed JSON: " + e.getMessage(), e);
		}
		return documentFromValue(value);
	}

	public MvsDocument readDocument(InputStream json) throws TreeFormatException {
		Object value;
		try {
			value = mapper.readValue(json, Object.class);
		} catch (JacksonException e) {
			throw new TreeFormatException("Malformed JSON: " + e.getMessage(), e);
		}
		return documentFromValue(value);
	}

	public MvsNode readTree(String json) throws TreeFormatException {
		return readDocument(json).root();
	}

	public MvsNode readTree(InputStream json) throws TreeFormatException {
		return readDocument(json).root();
	}

	/**
	 * @param value the plain-Java form of a document or node, made of maps, lists, strings, numbers and booleans
	 */
	public MvsDocument documentFromValue(@Nullable Object value) throws TreeFormatException {
		Map<?, ?> object = asObject(value, "document");
		if (object.containsKey("root")) {
			Object version = object.get("version");
			MvsNode root = nodeFromValue(object.get("root"), "root");
			LOGGER.debug("Read document version {}", version);
			return new MvsDocument(version == null ? null : String.valueOf(version), root);
		} else {
			return new MvsDocument(null, nodeFromValue(object, "root"));
		}
	}

	MvsNode nodeFromValue(@Nullable Object value, String path) throws TreeFormatException {
		Map<?, ?> object = asObject(value, path);
		Object kindValue = object.get("kind");
		if (!(kindValue instanceof String)) {
			throw new TreeFormatException(path + ": node must have a string \"kind\"; found " + kindValue);
		}
		String kind = (String) kindValue;
		Params params = new Params(kind, path, asObject(((Map<?, Object>) object).getOrDefault("params", Map.of()), path + ".params"));

		List<MvsNode> children = new ArrayList<>();
		Object childrenValue = object.get("children");
		if (childrenValue != null) {
			if (!(childrenValue instanceof List)) {
				throw new TreeFormatException(path + ": \"children\" must be an array");
			}
			List<?> list = (List<?>) childrenValue;
			for (int i = 0; i < list.size(); i++) {
				children.add(nodeFromValue(list.get(i), path + "/" + childKind(list.get(i)) + "[" + i + "]"));
			}
		}

		Optional<MvsKind> known = MvsKind.fromTag(kind);
		if (known.isEmpty()) {
			LOGGER.debug("{}: keeping node of unknown kind \"{}\"", path, kind);
			return MvsNode.unchecked(kind, params.raw(), children);
		}
		NodeParams nodeParams;
		try {
			nodeParams = paramsFor(known.get(), params);
		} catch (InvalidParameterException e) {
			throw new TreeFormatException(path + ": invalid \"" + e.parameterName() + "\": " + e.getMessage(), e);
		}
		return MvsNode.of(known.get(), nodeParams, children);
	}

	private static NodeParams paramsFor(MvsKind kind, Params p) throws TreeFormatException {
		switch (kind) {
			case ROOT:
			case FOCUS:
				return NodeParams.None.INSTANCE;
			case DOWNLOAD:
				return new NodeParams.Download(p.requiredString("url"));
			case PARSE:
				return new NodeParams.Parse(p.requiredString("format"), p.bool("is_binary"));
			case STRUCTURE:
				return new NodeParams.Structure(
					structureType(p),
					p.integer("model_index"),
					p.string("assembly_id"),
					p.number("radius"),
					p.integerList("ijk_min"),
					p.integerList("ijk_max"),
					p.string("block_header"),
					p.integer("block_index"));
			case TRANSFORM:
				return new NodeParams.Transform(p.numberList("rotation"), p.numberList("translation"));
			case COMPONENT:
				return new NodeParams.Component(p.selector("selector"));
			case REPRESENTATION:
				return new NodeParams.Representation(p.requiredString("type"));
			case COLOR:
				return new NodeParams.Color(p.requiredString("color"), p.selector("selector"));
			case COMPONENT_FROM_URI:
			case COLOR_FROM_URI:
			case LABEL_FROM_URI:
			case TOOLTIP_FROM_URI:
				return new NodeParams.AnnotationFromUri(
					p.requiredString("uri"),
					p.requiredString("format"),
					p.string("schema"),
					p.string("block_header"),
					p.integer("block_index"),
					p.string("category_name"),
					p.string("field_name"),
					p.stringList("field_values"));
			case COMPONENT_FROM_SOURCE:
			case COLOR_FROM_SOURCE:
			case LABEL_FROM_SOURCE:
			case TOOLTIP_FROM_SOURCE:
				return new NodeParams.AnnotationFromSource(
					p.string("schema"),
					p.string("block_header"),
					p.integer("block_index"),
					p.string("category_name"),
					p.string("field_name"),
					p.stringList("field_values"));
			case LABEL:
			case TOOLTIP:
				return new NodeParams.Text(p.requiredString("text"));
			case CAMERA:
				return new NodeParams.Camera(
					p.requiredNumberList("target"),
					p.requiredNumberList("position"),
					p.numberList("up"));
			case CANVAS:
				return new NodeParams.Canvas(p.requiredString("background_color"));
		}
		throw new AssertionError("Unexpected kind: " + kind);
	}

	/**
	 * Older files call the structure type "kind".
	 */
	private static String structureType(Params p) throws TreeFormatException {
		String type = p.string("type");
		if (type == null) {
			type = p.string("kind");
		}
		if (type == null) {
			throw new TreeFormatException(p.path + ": \"structure\" node is missing required param \"type\"");
		}
		return type;
	}

	private static Object childKind(Object child) {
		if (child instanceof Map) {
			return ((Map<?, ?>) child).get("kind");
		} else {
			return "?";
		}
	}

	private static Map<?, ?> asObject(@Nullable Object value, String path) throws TreeFormatException {
		if (value instanceof Map) {
			return (Map<?, ?>) value;
		}
		throw new TreeFormatException(path + ": expected a JSON object; found " + value);
	}

	/**
	 * The params object of one node, with accessors that report the node's location on failure.
	 */
	private static final class Params {
		final String kind;
		final String path;
		final Map<?, ?> values;

		Params(String kind, String path, Map<?, ?> values) {
			this.kind = kind;
			this.path = path;
			this.values = values;
		}

		String requiredString(String name) throws TreeFormatException {
			String result = string(name);
			if (result == null) {
				throw new TreeFormatException(path + ": \"" + kind + "\" node is missing required param \"" + name + "\"");
			}
			return result;
		}

		@Nullable
		String string(String name) throws TreeFormatException {
			Object value = values.get(name);
			if (value == null || value instanceof String) {
				return (String) value;
			}
			throw wrongType(name, "a string", value);
		}

		@Nullable
		Boolean bool(String name) throws TreeFormatException {
			Object value = values.get(name);
			if (value == null || value instanceof Boolean) {
				return (Boolean) value;
			}
			throw wrongType(name, "a boolean", value);
		}

		@Nullable
		Integer integer(String name) throws TreeFormatException {
			Object value = values.get(name);
			if (value == null) {
				return null;
			}
			return toInteger(name, value);
		}

		@Nullable
		Double number(String name) throws TreeFormatException {
			Object value = values.get(name);
			if (value == null) {
				return null;
			} else if (value instanceof Number) {
				return ((Number) value).doubleValue();
			}
			throw wrongType(name, "a number", value);
		}

		@Nullable
		List<Double> numberList(String name) throws TreeFormatException {
			List<?> list = list(name);
			if (list == null) {
				return null;
			}
			List<Double> result = new ArrayList<>(list.size());
			for (Object item : list) {
				if (!(item instanceof Number)) {
					throw wrongType(name, "an array of numbers", list);
				}
				result.add(((Number) item).doubleValue());
			}
			return result;
		}

		List<Double> requiredNumberList(String name) throws TreeFormatException {
			List<Double> result = numberList(name);
			if (result == null) {
				throw new TreeFormatException(path + ": \"" + kind + "\" node is missing required param \"" + name + "\"");
			}
			return result;
		}

		@Nullable
		List<Integer> integerList(String name) throws TreeFormatException {
			List<?> list = list(name);
			if (list == null) {
				return null;
			}
			List<Integer> result = new ArrayList<>(list.size());
			for (Object item : list) {
				result.add(toInteger(name, item));
			}
			return result;
		}

		@Nullable
		List<String> stringList(String name) throws TreeFormatException {
			List<?> list = list(name);
			if (list == null) {
				return null;
			}
			List<String> result = new ArrayList<>(list.size());
			for (Object item : list) {
				if (!(item instanceof String)) {
					throw wrongType(name, "an array of strings", list);
				}
				result.add((String) item);
			}
			return result;
		}

		@Nullable
		Selector selector(String name) {
			Object value = values.get(name);
			return value == null ? null : Selectors.fromParams(value);
		}

		/**
		 * Null-valued entries are dropped.
		 */
		NodeParams.Raw raw() {
			Map<String, Object> result = new LinkedHashMap<>();
			values.forEach((k, v) -> {
				if (v != null) {
					result.put(String.valueOf(k), v);
				}
			});
			return result.isEmpty() ? NodeParams.Raw.EMPTY : new NodeParams.Raw(result);
		}

		@Nullable
		private List<?> list(String name) throws TreeFormatException {
			Object value = values.get(name);
			if (value == null || value instanceof List) {
				return (List<?>) value;
			}
			throw wrongType(name, "an array", value);
		}

		private Integer toInteger(String name, Object value) throws TreeFormatException {
			if (value instanceof Integer || value instanceof Long || value instanceof Short) {
				return ((Number) value).intValue();
			}
			throw wrongType(name, "an integer", value);
		}

		private TreeFormatException wrongType(String name, String expected, Object actual) {
			return new TreeFormatException(path + ": param \"" + name + "\" of \"" + kind + "\" node must be " + expected + "; found " + actual);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(MvsJsonReader.class);
}
