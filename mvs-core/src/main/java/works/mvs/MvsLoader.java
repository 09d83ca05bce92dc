package works.mvs;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.mvs.color.Color;
import works.mvs.exceptions.InvalidParameterException;
import works.mvs.exceptions.TreeLoadingException;
import works.mvs.host.SceneHost;
import works.mvs.load.LoadResult;
import works.mvs.load.LoadingContext;
import works.mvs.load.SceneLoadingActions;
import works.mvs.load.TreeLoader;
import works.mvs.logging.MappedDiagnosticContext.MDCScope;
import works.mvs.tree.MvsNode;
import works.mvs.tree.TreeSchema;
import works.mvs.tree.Trees;

import static works.mvs.logging.MappedDiagnosticContext.setupMDC;

/**
 * Loads MVS trees into a {@link SceneHost}.
 * <p>
 * Each call to {@link #load} is independent: it builds a fresh {@link LoadingContext},
 * walks the tree once, and commits the resulting changes to the host as one batch.
 * Loads may be issued from multiple threads; whether their batches may overlap
 * is up to the host stack (see {@link works.mvs.host.SerialCommitHost}).
 */
public final class MvsLoader {
	private final LoaderInfo info;
	private final SceneHost host;
	private final LoaderSettings settings;
	private final Color defaultColor;
	private final SceneLoadingActions actions = new SceneLoadingActions();
	private final AtomicLong runCounter = new AtomicLong(0);

	/**
	 * @param baseHost the host that owns the scene, at the bottom of the host stack
	 * @throws InvalidParameterException if the configured default color cannot be decoded
	 */
	public MvsLoader(String name, SceneHost baseHost, MvsConfig config) {
		this.info = new LoaderInfo(name, UUID.randomUUID().toString());
		this.settings = config.settings();
		this.defaultColor = Color.decode(settings.getDefaultColor())
			.orElseThrow(() -> new InvalidParameterException("defaultColor", "Not a color name or hex code: \"" + settings.getDefaultColor() + "\""));
		try (MDCScope scope = setupMDC(info.name(), info.instanceId())) {
			this.host = config.hostFactory().build(info, baseHost);
			LOGGER.debug("Host stack: {}", host);
		}
	}

	public MvsLoader(String name, SceneHost baseHost) {
		this(name, baseHost, MvsConfig.simple());
	}

	public String name() {
		return info.name();
	}

	public String instanceId() {
		return info.instanceId();
	}

	public LoaderSettings settings() {
		return settings;
	}

	/**
	 * Turns <code>tree</code> into one batch of changes and commits it to the host.
	 *
	 * @return completes when the host has applied the batch
	 * @throws TreeLoadingException if the tree cannot be loaded; the host is left unchanged
	 */
	public CompletableFuture<LoadReport> load(MvsNode tree) throws TreeLoadingException {
		String runId = info.name() + "#" + runCounter.incrementAndGet();
		try (MDCScope scope = setupMDC(info.name(), info.instanceId(), runId)) {
			LOGGER.debug("Loading tree with {} nodes", Trees.count(tree));
			if (LOGGER.isTraceEnabled()) {
				LOGGER.trace("Tree:\n{}", Trees.toPrettyString(tree));
			}
			if (settings.isStrict()) {
				List<String> issues = TreeSchema.validationIssues(tree);
				if (!issues.isEmpty()) {
					throw new TreeLoadingException("Tree has " + issues.size() + " schema issue(s): " + String.join("; ", issues));
				}
			}
			ViewSettings view;
			LoadingContext context;
			try {
				view = ViewSettings.beforeLoading(tree);
				context = LoadingContext.forTree(tree, defaultColor, settings.getRotationTolerance());
			} catch (InvalidParameterException e) {
				throw new TreeLoadingException("Unable to prepare tree: " + e.getMessage(), e);
			}
			LoadResult result = TreeLoader.loadTree(host, tree, actions, context, settings.isDeletePrevious());
			LoadReport report = new LoadReport(runId, result, context.annotationSpecs(), view.withFocus(tree, result));
			if (!result.skipped().isEmpty()) {
				LOGGER.info("Skipped {} node(s) while loading", result.skipped().size());
			}
			return result.committed().thenApply(v -> report);
		}
	}

	/**
	 * Like {@link #load}, but waits for the host to apply the changes.
	 *
	 * @throws TreeLoadingException if the tree cannot be loaded, or if the host fails to apply it
	 */
	public LoadReport loadAndWait(MvsNode tree) throws TreeLoadingException, InterruptedException {
		CompletableFuture<LoadReport> future = load(tree);
		try {
			return future.get();
		} catch (ExecutionException e) {
			throw new TreeLoadingException("Scene host failed to commit: " + e.getCause().getMessage(), e.getCause());
		}
	}

	@Override
	public String toString() {
		return "MvsLoader{" + info.name() + "}";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(MvsLoader.class);
}
