package works.mvs.logback;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.jetbrains.annotations.Nullable;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.slf4j.Marker;
import works.mvs.HostFactory;
import works.mvs.MvsLoader;

import static ch.qos.logback.core.spi.FilterReply.DENY;
import static ch.qos.logback.core.spi.FilterReply.NEUTRAL;
import static works.mvs.logging.MdcKeys.LOADER_INSTANCE_ID;

/**
 * Per-loader log thresholds, so a test can quiet the warnings it provokes on purpose
 * (unknown kinds, unresolvable references) without muting every other loader in the JVM.
 * <p>
 * Install this class as a {@code <turboFilter>} in the Logback configuration,
 * and add {@link #withController} to the loader's host stack.
 * Events are matched to a loader through {@link works.mvs.logging.MdcKeys#LOADER_INSTANCE_ID}.
 * <p>
 * A level set on the logger itself in the Logback configuration is never overridden.
 */
public class MvsLogFilter extends TurboFilter {
	private static final Map<String, LogController> CONTROLLERS = new ConcurrentHashMap<>();

	/**
	 * Minimum levels, keyed by logger name or by a package prefix of it.
	 * The longest matching name applies.
	 * One controller may serve several loaders.
	 */
	public static final class LogController {
		private final Map<String, Level> minimumLevels = new ConcurrentHashMap<>();

		public void setLogging(Level minimum, Class<?>... loggers) {
			for (Class<?> c : loggers) {
				minimumLevels.put(c.getName(), minimum);
			}
		}

		public void setLogging(Level minimum, String... loggerNamesOrPrefixes) {
			for (String name : loggerNamesOrPrefixes) {
				minimumLevels.put(name, minimum);
			}
		}

		public void clear() {
			minimumLevels.clear();
		}

		@Nullable Level minimumFor(String loggerName) {
			for (String name = loggerName; !name.isEmpty(); name = parentName(name)) {
				Level level = minimumLevels.get(name);
				if (level != null) {
					return level;
				}
			}
			return null;
		}

		private static String parentName(String loggerName) {
			int dot = loggerName.lastIndexOf('.');
			return (dot < 0) ? "" : loggerName.substring(0, dot);
		}
	}

	/**
	 * @return a {@link HostFactory} that attaches <code>controller</code> to the loader being built
	 * and passes the downstream host through unchanged
	 */
	public static HostFactory withController(LogController controller) {
		return (info, downstream) -> {
			LogController previous = CONTROLLERS.put(info.instanceId(), controller);
			if (previous != null && previous != controller) {
				LOGGER.warn("Loader \"{}\" had a log controller already; replacing it", info.name());
			}
			return downstream;
		};
	}

	public static void unregister(MvsLoader loader) {
		CONTROLLERS.remove(loader.instanceId());
	}

	@Override
	public FilterReply decide(Marker marker, Logger logger, Level level, String format, Object[] params, Throwable t) {
		if (logger.getLevel() != null) {
			return NEUTRAL;
		}
		String loaderID = MDC.get(LOADER_INSTANCE_ID);
		LogController controller = (loaderID == null) ? null : CONTROLLERS.get(loaderID);
		Level minimum = (controller == null) ? null : controller.minimumFor(logger.getName());
		if (minimum == null || level.isGreaterOrEqual(minimum)) {
			return NEUTRAL;
		}
		return DENY;
	}

	private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(MvsLogFilter.class);
}
