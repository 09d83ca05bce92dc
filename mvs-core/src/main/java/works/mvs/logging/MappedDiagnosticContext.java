package works.mvs.logging;

import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.MDC;

import static works.mvs.logging.MdcKeys.LOADER_INSTANCE_ID;
import static works.mvs.logging.MdcKeys.LOADER_NAME;
import static works.mvs.logging.MdcKeys.RUN_ID;

public final class MappedDiagnosticContext {
	private MappedDiagnosticContext() { }

	public static MDCScope setupMDC(String loaderName, String instanceId) {
		MDCScope result = new MDCScope();
		result.put(LOADER_NAME, loaderName);
		result.put(LOADER_INSTANCE_ID, instanceId);
		return result;
	}

	public static MDCScope setupMDC(String loaderName, String instanceId, String runId) {
		MDCScope result = setupMDC(loaderName, instanceId);
		result.put(RUN_ID, runId);
		return result;
	}

	/**
	 * Restores the previous values of the entries it set when closed.
	 * Must be closed on the thread that created it.
	 */
	public static final class MDCScope implements AutoCloseable {
		private final Map<String, String> previousValues = new LinkedHashMap<>();

		MDCScope() { }

		void put(String key, String value) {
			if (!previousValues.containsKey(key)) {
				previousValues.put(key, MDC.get(key));
			}
			MDC.put(key, value);
		}

		@Override
		public void close() {
			previousValues.forEach((key, oldValue) -> {
				if (oldValue == null) {
					MDC.remove(key);
				} else {
					MDC.put(key, oldValue);
				}
			});
		}
	}
}
