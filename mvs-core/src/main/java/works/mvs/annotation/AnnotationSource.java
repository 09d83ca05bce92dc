package works.mvs.annotation;

import java.io.IOException;

/**
 * The host's facility for turning an {@link AnnotationSpec} into data.
 * The interpreter itself never fetches or parses annotation data.
 */
public interface AnnotationSource {
	AnnotationTable resolve(AnnotationSpec spec) throws IOException;
}
