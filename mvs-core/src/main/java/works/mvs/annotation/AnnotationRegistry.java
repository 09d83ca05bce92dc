package works.mvs.annotation;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolved annotation data, keyed by {@link AnnotationSpec#id() annotation id}.
 * <p>
 * Immutable once built.
 */
public final class AnnotationRegistry {
	private final Map<String, AnnotationTable> tablesById;

	private AnnotationRegistry(Map<String, AnnotationTable> tablesById) {
		this.tablesById = Map.copyOf(tablesById);
	}

	public static AnnotationRegistry empty() {
		return new AnnotationRegistry(Map.of());
	}

	public static AnnotationRegistry of(Map<String, AnnotationTable> tablesById) {
		return new AnnotationRegistry(tablesById);
	}

	/**
	 * Resolves every spec using <code>source</code>.
	 * A spec that fails to resolve is logged and left out,
	 * so elements that would have been colored by it get the background color instead.
	 */
	public static AnnotationRegistry load(List<AnnotationSpec> specs, AnnotationSource source) {
		Map<String, AnnotationTable> tables = new LinkedHashMap<>();
		for (AnnotationSpec spec : specs) {
			try {
				tables.put(spec.id(), source.resolve(spec));
			} catch (IOException e) {
				LOGGER.warn("Unable to load annotation {} from {}", spec.id(), spec.source(), e);
			}
		}
		LOGGER.debug("Loaded {} of {} annotations", tables.size(), specs.size());
		return new AnnotationRegistry(tables);
	}

	public Optional<AnnotationTable> table(String annotationId) {
		return Optional.ofNullable(tablesById.get(annotationId));
	}

	public int size() {
		return tablesById.size();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(AnnotationRegistry.class);
}
