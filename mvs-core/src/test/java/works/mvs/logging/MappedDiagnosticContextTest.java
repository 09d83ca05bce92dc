package works.mvs.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import works.mvs.logging.MappedDiagnosticContext.MDCScope;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static works.mvs.logging.MdcKeys.LOADER_INSTANCE_ID;
import static works.mvs.logging.MdcKeys.LOADER_NAME;
import static works.mvs.logging.MdcKeys.RUN_ID;

class MappedDiagnosticContextTest {

	@AfterEach
	void clearMDC() {
		MDC.clear();
	}

	@Test
	void scope_setsAndClears() {
		try (MDCScope scope = MappedDiagnosticContext.setupMDC("name", "id", "name#1")) {
			assertEquals("name", MDC.get(LOADER_NAME));
			assertEquals("id", MDC.get(LOADER_INSTANCE_ID));
			assertEquals("name#1", MDC.get(RUN_ID));
		}
		assertNull(MDC.get(LOADER_NAME));
		assertNull(MDC.get(LOADER_INSTANCE_ID));
		assertNull(MDC.get(RUN_ID));
	}

	@Test
	void nestedScopes_restoreOuterValues() {
		try (MDCScope outer = MappedDiagnosticContext.setupMDC("outer", "id1", "outer#1")) {
			try (MDCScope inner = MappedDiagnosticContext.setupMDC("inner", "id2")) {
				assertEquals("inner", MDC.get(LOADER_NAME));
				assertEquals("outer#1", MDC.get(RUN_ID), "Inner scope does not touch the run");
			}
			assertEquals("outer", MDC.get(LOADER_NAME));
			assertEquals("id1", MDC.get(LOADER_INSTANCE_ID));
		}
		assertNull(MDC.get(LOADER_NAME));
	}
}
