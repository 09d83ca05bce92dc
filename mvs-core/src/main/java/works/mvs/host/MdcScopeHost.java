package works.mvs.host;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import works.mvs.HostFactory;
import works.mvs.LoaderInfo;
import works.mvs.logging.MappedDiagnosticContext;
import works.mvs.logging.MappedDiagnosticContext.MDCScope;

/**
 * Sets an {@link MDCScope} around each host and batch operation
 * based on a user-supplied function,
 * so that log messages from downstream hosts carry the loader's diagnostic context.
 */
public final class MdcScopeHost implements SceneHost {
	final SceneHost downstream;
	final LoaderInfo loaderInfo;
	final Function<LoaderInfo, MDCScope> scopeSupplier;

	private MdcScopeHost(SceneHost downstream, LoaderInfo loaderInfo, Function<LoaderInfo, MDCScope> scopeSupplier) {
		this.downstream = downstream;
		this.loaderInfo = loaderInfo;
		this.scopeSupplier = scopeSupplier;
	}

	public static HostFactory factory(Function<LoaderInfo, MDCScope> scopeSupplier) {
		return (i, d) -> new MdcScopeHost(d, i, scopeSupplier);
	}

	/**
	 * Sets the loader name and instance ID.
	 */
	public static HostFactory factory() {
		return factory(i -> MappedDiagnosticContext.setupMDC(i.name(), i.instanceId()));
	}

	@Override
	public SceneBatch beginBatch() {
		try (MDCScope scope = scopeSupplier.apply(loaderInfo)) {
			return new ScopedBatch(downstream.beginBatch());
		}
	}

	private final class ScopedBatch implements SceneBatch {
		final SceneBatch batch;

		ScopedBatch(SceneBatch batch) {
			this.batch = batch;
		}

		@Override
		public SceneRef anchor() {
			try (MDCScope scope = scopeSupplier.apply(loaderInfo)) {
				return batch.anchor();
			}
		}

		@Override
		public List<SceneRef> children(SceneRef parent) {
			try (MDCScope scope = scopeSupplier.apply(loaderInfo)) {
				return batch.children(parent);
			}
		}

		@Override
		public SceneRef addChild(SceneRef parent, SceneAction action) {
			try (MDCScope scope = scopeSupplier.apply(loaderInfo)) {
				return batch.addChild(parent, action);
			}
		}

		@Override
		public void delete(SceneRef target) {
			try (MDCScope scope = scopeSupplier.apply(loaderInfo)) {
				batch.delete(target);
			}
		}

		@Override
		public void setProperties(SceneRef target, SceneAction.StructureProperties properties) {
			try (MDCScope scope = scopeSupplier.apply(loaderInfo)) {
				batch.setProperties(target, properties);
			}
		}

		@Override
		public CompletableFuture<Void> commit() {
			try (MDCScope scope = scopeSupplier.apply(loaderInfo)) {
				return batch.commit();
			}
		}

		@Override
		public void discard() {
			try (MDCScope scope = scopeSupplier.apply(loaderInfo)) {
				batch.discard();
			}
		}
	}
}
