package works.mvs.jackson;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.mvs.annotation.AnnotationRow;
import works.mvs.annotation.AnnotationSource;
import works.mvs.annotation.AnnotationSpec;
import works.mvs.annotation.AnnotationTable;
import works.mvs.exceptions.InvalidParameterException;
import works.mvs.selector.ComponentExpression;
import works.mvs.selector.Selectors;

/**
 * Resolves annotations stored as JSON.
 * <p>
 * Accepted shapes are an array of row objects, or an object of equally long column arrays.
 * Either may be wrapped in an object keyed by the spec's category name.
 * Keys that are {@link Selectors#COLUMNS selector columns} say which elements a row applies to;
 * every other key is a field, whose values are kept as strings.
 */
public final class JsonAnnotationSource implements AnnotationSource {
	private final Fetcher fetcher;
	private final ObjectMapper mapper;

	/**
	 * Obtains the raw text of an annotation, typically by downloading {@link AnnotationSpec.Url#url()}.
	 */
	@FunctionalInterface
	public interface Fetcher {
		String fetch(AnnotationSpec spec) throws IOException;
	}

	public JsonAnnotationSource(Fetcher fetcher) {
		this.fetcher = fetcher;
		this.mapper = JsonMapper.builder().build();
	}

	/**
	 * @throws IOException if the spec is not a JSON URL, or its data cannot be fetched or understood
	 */
	@Override
	public AnnotationTable resolve(AnnotationSpec spec) throws IOException {
		if (!(spec.source() instanceof AnnotationSpec.Url)) {
			throw new IOException("Annotation " + spec.id() + " is not a separate file; its data must come from the structure");
		}
		String format = ((AnnotationSpec.Url) spec.source()).format();
		if (!"json".equals(format)) {
			throw new IOException("Unsupported annotation format \"" + format + "\" for annotation " + spec.id());
		}
		String text = fetcher.fetch(spec);
		Object value;
		try {
			value = mapper.readValue(text, Object.class);
		} catch (JacksonException e) {
			throw new IOException("Malformed JSON in annotation " + spec.id(), e);
		}
		try {
			AnnotationTable result = new AnnotationTable(rows(unwrap(value, spec.cifCategory())));
			LOGGER.debug("Annotation {} has {} rows", spec.id(), result.rows().size());
			return result;
		} catch (InvalidParameterException e) {
			throw new IOException("Invalid row in annotation " + spec.id() + ": " + e.getMessage(), e);
		}
	}

	private static Object unwrap(Object value, @Nullable String categoryName) {
		if (categoryName != null && value instanceof Map && ((Map<?, ?>) value).containsKey(categoryName)) {
			return ((Map<?, ?>) value).get(categoryName);
		}
		return value;
	}

	private static List<AnnotationRow> rows(Object value) throws IOException {
		List<AnnotationRow> result = new ArrayList<>();
		if (value instanceof List) {
			for (Object row : (List<?>) value) {
				if (!(row instanceof Map)) {
					throw new IOException("Annotation rows must be objects; found " + row);
				}
				result.add(row((Map<?, ?>) row));
			}
		} else if (value instanceof Map) {
			Map<?, ?> columns = (Map<?, ?>) value;
			int size = -1;
			for (Map.Entry<?, ?> entry : columns.entrySet()) {
				if (!(entry.getValue() instanceof List)) {
					throw new IOException("Annotation column \"" + entry.getKey() + "\" must be an array");
				}
				int columnSize = ((List<?>) entry.getValue()).size();
				if (size >= 0 && columnSize != size) {
					throw new IOException("Annotation columns have different lengths: " + size + " and " + columnSize);
				}
				size = columnSize;
			}
			for (int i = 0; i < size; i++) {
				Map<Object, Object> row = new LinkedHashMap<>();
				for (Map.Entry<?, ?> entry : columns.entrySet()) {
					row.put(entry.getKey(), ((List<?>) entry.getValue()).get(i));
				}
				result.add(row(row));
			}
		} else {
			throw new IOException("Annotation data must be an array of rows or an object of columns");
		}
		return result;
	}

	private static AnnotationRow row(Map<?, ?> row) {
		Map<Object, Object> selectorColumns = new LinkedHashMap<>();
		Map<String, String> fields = new LinkedHashMap<>();
		row.forEach((key, value) -> {
			if (value == null) {
				return;
			}
			if (Selectors.COLUMNS.contains(key)) {
				selectorColumns.put(key, value);
			} else {
				fields.put(String.valueOf(key), String.valueOf(value));
			}
		});
		ComponentExpression selector = Selectors.rowFromParams(selectorColumns);
		return new AnnotationRow(selector, fields);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JsonAnnotationSource.class);
}
