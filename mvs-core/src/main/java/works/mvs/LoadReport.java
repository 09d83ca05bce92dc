package works.mvs;

import java.util.List;
import java.util.Optional;
import works.mvs.annotation.AnnotationSpec;
import works.mvs.host.SceneRef;
import works.mvs.load.LoadResult;
import works.mvs.load.SkippedNode;
import works.mvs.tree.MvsNode;

/**
 * What one {@link MvsLoader#load load} did.
 */
public final class LoadReport {
	private final String runId;
	private final LoadResult result;
	private final List<AnnotationSpec> annotations;
	private final ViewSettings viewSettings;

	LoadReport(String runId, LoadResult result, List<AnnotationSpec> annotations, ViewSettings viewSettings) {
		this.runId = runId;
		this.result = result;
		this.annotations = List.copyOf(annotations);
		this.viewSettings = viewSettings;
	}

	/**
	 * @return the value of the {@link works.mvs.logging.MdcKeys#RUN_ID} MDC entry during the load
	 */
	public String runId() {
		return runId;
	}

	public Optional<SceneRef> resultOf(MvsNode node) {
		return result.resultOf(node);
	}

	public List<MvsNode> loadedNodes() {
		return result.loadedNodes();
	}

	public List<SkippedNode> skipped() {
		return result.skipped();
	}

	/**
	 * @return the distinct annotations referenced by the tree, which the host should make available
	 */
	public List<AnnotationSpec> annotations() {
		return annotations;
	}

	public ViewSettings viewSettings() {
		return viewSettings;
	}

	@Override
	public String toString() {
		return "LoadReport{" +
			"runId=" + runId +
			", " + result +
			", annotations=" + annotations.size() +
			", viewSettings=" + viewSettings +
			'}';
	}
}
