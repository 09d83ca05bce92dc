package works.mvs.host;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * A {@link SceneHost} that keeps its scene in memory, for tests and for callers
 * that want to inspect the result of a load without a real viewer.
 * <p>
 * Each batch's changes are applied under a lock, so readers never see half a batch.
 * With an {@link Executor}, commits are applied asynchronously on that executor;
 * otherwise they are applied before {@link SceneBatch#commit} returns.
 */
public final class InMemorySceneHost implements SceneHost {
	public static final SceneRef ROOT = new SceneRef("root");

	private final Map<SceneRef, SceneObject> objects = new HashMap<>();
	private final AtomicLong nextId = new AtomicLong(1);
	@Nullable private final Executor executor;
	private long commitCount = 0;

	public InMemorySceneHost() {
		this(null);
	}

	public InMemorySceneHost(@Nullable Executor executor) {
		this.executor = executor;
		objects.put(ROOT, new SceneObject(ROOT, null, null, List.of(), null));
	}

	/**
	 * One object in the scene, as of some commit.
	 *
	 * @param action null for {@link #ROOT}
	 */
	public record SceneObject(
		SceneRef ref,
		@Nullable SceneRef parent,
		@Nullable SceneAction action,
		List<SceneRef> children,
		@Nullable SceneAction.StructureProperties properties
	) {
		public SceneObject {
			children = List.copyOf(children);
		}

		SceneObject withChildren(List<SceneRef> newChildren) {
			return new SceneObject(ref, parent, action, newChildren, properties);
		}

		SceneObject withProperties(SceneAction.StructureProperties newProperties) {
			return new SceneObject(ref, parent, action, children, newProperties);
		}
	}

	@Override
	public SceneBatch beginBatch() {
		return new Batch();
	}

	public synchronized Optional<SceneObject> get(SceneRef ref) {
		return Optional.ofNullable(objects.get(ref));
	}

	public synchronized List<SceneRef> childrenOf(SceneRef ref) {
		SceneObject object = objects.get(ref);
		return object == null ? List.of() : object.children();
	}

	/**
	 * @return every object except {@link #ROOT}, depth first in creation order
	 */
	public synchronized List<SceneObject> objects() {
		List<SceneObject> result = new ArrayList<>();
		collect(ROOT, result);
		return result;
	}

	private void collect(SceneRef ref, List<SceneObject> result) {
		Deque<SceneRef> stack = new ArrayDeque<>();
		pushChildren(stack, objects.get(ref));
		while (!stack.isEmpty()) {
			SceneObject object = objects.get(stack.pop());
			result.add(object);
			pushChildren(stack, object);
		}
	}

	private static void pushChildren(Deque<SceneRef> stack, SceneObject object) {
		List<SceneRef> children = object.children();
		for (int i = children.size() - 1; i >= 0; i--) {
			stack.push(children.get(i));
		}
	}

	/**
	 * @return the actions of every object except {@link #ROOT}, depth first in creation order
	 */
	public List<SceneAction> actions() {
		List<SceneAction> result = new ArrayList<>();
		for (SceneObject object : objects()) {
			result.add(object.action());
		}
		return result;
	}

	public synchronized int size() {
		return objects.size() - 1;
	}

	public synchronized long commitCount() {
		return commitCount;
	}

	private synchronized void apply(List<Consumer<Map<SceneRef, SceneObject>>> changes) {
		// Work on a copy so a failing change leaves the scene untouched
		Map<SceneRef, SceneObject> working = new HashMap<>(objects);
		changes.forEach(c -> c.accept(working));
		objects.clear();
		objects.putAll(working);
		commitCount++;
		LOGGER.debug("Applied {} changes; scene now has {} objects", changes.size(), objects.size() - 1);
	}

	private final class Batch implements SceneBatch {
		private final List<Consumer<Map<SceneRef, SceneObject>>> changes = new ArrayList<>();
		private boolean finished = false;

		@Override
		public SceneRef anchor() {
			return ROOT;
		}

		@Override
		public List<SceneRef> children(SceneRef parent) {
			return childrenOf(parent);
		}

		@Override
		public SceneRef addChild(SceneRef parent, SceneAction action) {
			requireNonNull(parent);
			requireNonNull(action);
			checkOpen();
			SceneRef ref = new SceneRef("obj" + nextId.getAndIncrement());
			changes.add(scene -> {
				SceneObject parentObject = scene.get(parent);
				if (parentObject == null) {
					throw new IllegalStateException("No such parent object: " + parent);
				}
				List<SceneRef> siblings = new ArrayList<>(parentObject.children());
				siblings.add(ref);
				scene.put(parent, parentObject.withChildren(siblings));
				scene.put(ref, new SceneObject(ref, parent, action, List.of(), null));
			});
			return ref;
		}

		@Override
		public void delete(SceneRef target) {
			checkOpen();
			if (ROOT.equals(target)) {
				throw new IllegalArgumentException("Cannot delete the root object");
			}
			changes.add(scene -> {
				SceneObject object = scene.get(target);
				if (object == null) {
					LOGGER.debug("Object {} already deleted", target);
					return;
				}
				SceneObject parentObject = scene.get(object.parent());
				List<SceneRef> siblings = new ArrayList<>(parentObject.children());
				siblings.remove(target);
				scene.put(object.parent(), parentObject.withChildren(siblings));
				removeSubtree(scene, target);
			});
		}

		private void removeSubtree(Map<SceneRef, SceneObject> scene, SceneRef ref) {
			Deque<SceneRef> pending = new ArrayDeque<>();
			pending.push(ref);
			while (!pending.isEmpty()) {
				SceneObject removed = scene.remove(pending.pop());
				removed.children().forEach(pending::push);
			}
		}

		@Override
		public void setProperties(SceneRef target, SceneAction.StructureProperties properties) {
			requireNonNull(properties);
			checkOpen();
			changes.add(scene -> {
				SceneObject object = scene.get(target);
				if (object == null) {
					throw new IllegalStateException("No such object: " + target);
				}
				scene.put(target, object.withProperties(properties));
			});
		}

		@Override
		public CompletableFuture<Void> commit() {
			checkOpen();
			finished = true;
			List<Consumer<Map<SceneRef, SceneObject>>> toApply = List.copyOf(changes);
			if (executor == null) {
				apply(toApply);
				return CompletableFuture.completedFuture(null);
			} else {
				return CompletableFuture.runAsync(() -> apply(toApply), executor);
			}
		}

		@Override
		public void discard() {
			LOGGER.debug("Discarding {} staged changes", changes.size());
			finished = true;
			changes.clear();
		}

		private void checkOpen() {
			if (finished) {
				throw new IllegalStateException("Batch already committed or discarded");
			}
		}
	}

	@Override
	public synchronized String toString() {
		return "InMemorySceneHost{" + (objects.size() - 1) + " objects}";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(InMemorySceneHost.class);
}
