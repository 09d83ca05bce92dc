package works.mvs.annotation;

import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AnnotationRegistryTest {

	@Test
	void failedSource_leftOut() {
		AnnotationSpec good = AnnotationSpec.create(new AnnotationSpec.Url("good", "json"), null, AnnotationSpec.CifBlock.of(null, null), null);
		AnnotationSpec bad = AnnotationSpec.create(new AnnotationSpec.Url("bad", "json"), null, AnnotationSpec.CifBlock.of(null, null), null);
		AnnotationRegistry registry = AnnotationRegistry.load(List.of(good, bad), spec -> {
			if (spec == bad) {
				throw new IOException("Simulated fetch failure");
			}
			return AnnotationTable.empty();
		});
		assertEquals(1, registry.size());
		assertTrue(registry.table(good.id()).isPresent());
		assertTrue(registry.table(bad.id()).isEmpty());
	}
}
