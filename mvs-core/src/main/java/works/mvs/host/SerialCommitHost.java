package works.mvs.host;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.mvs.HostFactory;

/**
 * Allows only one batch at a time: {@link #beginBatch} blocks until the previous batch
 * has been discarded or its commit has completed.
 * <p>
 * This makes concurrent loads against the same host behave as if they ran one after another,
 * so that each load sees the scene as the previous one left it.
 */
public final class SerialCommitHost implements SceneHost {
	private final SceneHost downstream;
	private final Semaphore permit = new Semaphore(1, true);

	public SerialCommitHost(SceneHost downstream) {
		this.downstream = downstream;
	}

	public static HostFactory factory() {
		return (i, d) -> new SerialCommitHost(d);
	}

	@Override
	public SceneBatch beginBatch() {
		permit.acquireUninterruptibly();
		LOGGER.trace("Acquired batch permit");
		try {
			return new SerialBatch(downstream.beginBatch());
		} catch (RuntimeException | Error e) {
			permit.release();
			throw e;
		}
	}

	private final class SerialBatch extends ForwardingSceneBatch {
		private final AtomicBoolean finished = new AtomicBoolean(false);

		SerialBatch(SceneBatch downstream) {
			super(downstream);
		}

		@Override
		public CompletableFuture<Void> commit() {
			CompletableFuture<Void> result;
			try {
				result = super.commit();
			} catch (RuntimeException | Error e) {
				release();
				throw e;
			}
			return result.whenComplete((v, e) -> release());
		}

		@Override
		public void discard() {
			try {
				super.discard();
			} finally {
				release();
			}
		}

		private void release() {
			if (finished.compareAndSet(false, true)) {
				LOGGER.trace("Released batch permit");
				permit.release();
			}
		}
	}

	@Override
	public String toString() {
		return "SerialCommitHost{" +
			"downstream=" + downstream +
			'}';
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SerialCommitHost.class);
}
