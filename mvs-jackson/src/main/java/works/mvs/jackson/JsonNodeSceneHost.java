package works.mvs.jackson;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.ObjectNode;
import works.mvs.HostFactory;
import works.mvs.host.SceneAction;
import works.mvs.host.SceneBatch;
import works.mvs.host.SceneHost;
import works.mvs.host.SceneRef;

/**
 * Maintains an in-memory representation of the scene
 * in the form of a tree of {@link JsonNode} objects,
 * while forwarding every batch to the downstream host.
 * <p>
 * Each scene object is an object node with {@code ref}, {@code action}, {@code params} and {@code children} fields,
 * plus {@code properties} once they have been set.
 * The mirror only reflects batches committed through this host.
 */
public class JsonNodeSceneHost implements SceneHost {
	final SceneHost downstream;
	final ObjectMapper mapper;
	final Map<SceneRef, ObjectNode> objectsByRef = new HashMap<>();
	final Map<SceneRef, SceneRef> parents = new HashMap<>();
	protected ObjectNode currentRoot;
	int updateNumber = 0;

	public static HostFactory factory() {
		return (i, d) -> new JsonNodeSceneHost(d);
	}

	protected JsonNodeSceneHost(SceneHost downstream) {
		this.downstream = downstream;
		this.mapper = JsonMapper.builder().build();
	}

	/**
	 * @return a copy of the mirrored scene, rooted at the anchor; null before the first batch
	 */
	public synchronized JsonNode snapshot() {
		return currentRoot == null ? null : currentRoot.deepCopy();
	}

	@Override
	public SceneBatch beginBatch() {
		return new MirroringBatch(downstream.beginBatch());
	}

	private synchronized void ensureRoot(SceneRef anchor) {
		if (currentRoot == null) {
			currentRoot = mapper.createObjectNode();
			currentRoot.put("ref", anchor.id());
			currentRoot.putArray("children");
			objectsByRef.put(anchor, currentRoot);
			traceCurrentState("After anchor");
		}
	}

	private synchronized void apply(List<Consumer<JsonNodeSceneHost>> changes) {
		traceCurrentState("Before commit");
		changes.forEach(c -> c.accept(this));
		traceCurrentState("After commit");
	}

	private void doAddChild(SceneRef parent, SceneRef child, SceneAction action) {
		ObjectNode parentNode = objectsByRef.get(parent);
		if (parentNode == null) {
			LOGGER.debug("Parent {} of {} is not mirrored; ignoring", parent, child);
			return;
		}
		ObjectNode childNode = mapper.valueToTree(SceneActionJson.toValue(action));
		childNode.put("ref", child.id());
		childNode.putArray("children");
		((ArrayNode) parentNode.get("children")).add(childNode);
		objectsByRef.put(child, childNode);
		parents.put(child, parent);
	}

	private void doDelete(SceneRef target) {
		SceneRef parent = parents.get(target);
		if (parent == null) {
			LOGGER.debug("Object {} is not mirrored; ignoring deletion", target);
			return;
		}
		ArrayNode siblings = (ArrayNode) objectsByRef.get(parent).get("children");
		ObjectNode targetNode = objectsByRef.get(target);
		for (int i = 0; i < siblings.size(); i++) {
			if (siblings.get(i) == targetNode) {
				siblings.remove(i);
				break;
			}
		}
		forget(target, targetNode);
	}

	private void forget(SceneRef ref, ObjectNode node) {
		objectsByRef.remove(ref);
		parents.remove(ref);
		List<SceneRef> descendants = new ArrayList<>();
		parents.forEach((child, parent) -> {
			if (parent.equals(ref)) {
				descendants.add(child);
			}
		});
		for (SceneRef child : descendants) {
			forget(child, objectsByRef.get(child));
		}
	}

	private void doSetProperties(SceneRef target, SceneAction.StructureProperties properties) {
		ObjectNode node = objectsByRef.get(target);
		if (node == null) {
			LOGGER.debug("Object {} is not mirrored; ignoring properties", target);
			return;
		}
		node.set("properties", mapper.valueToTree(SceneActionJson.properties(properties)));
	}

	void traceCurrentState(String description) {
		if (LOGGER.isTraceEnabled() && currentRoot != null) {
			LOGGER.trace("Scene {} {}:\n{}", ++updateNumber, description, currentRoot.toPrettyString());
		}
	}

	/**
	 * Stages mirror updates alongside the downstream batch, and applies them when the batch commits.
	 */
	private final class MirroringBatch implements SceneBatch {
		final SceneBatch batch;
		final List<Consumer<JsonNodeSceneHost>> changes = new ArrayList<>();

		MirroringBatch(SceneBatch batch) {
			this.batch = batch;
		}

		@Override
		public SceneRef anchor() {
			SceneRef result = batch.anchor();
			ensureRoot(result);
			return result;
		}

		@Override
		public List<SceneRef> children(SceneRef parent) {
			return batch.children(parent);
		}

		@Override
		public SceneRef addChild(SceneRef parent, SceneAction action) {
			SceneRef result = batch.addChild(parent, action);
			changes.add(h -> h.doAddChild(parent, result, action));
			return result;
		}

		@Override
		public void delete(SceneRef target) {
			batch.delete(target);
			changes.add(h -> h.doDelete(target));
		}

		@Override
		public void setProperties(SceneRef target, SceneAction.StructureProperties properties) {
			batch.setProperties(target, properties);
			changes.add(h -> h.doSetProperties(target, properties));
		}

		@Override
		public CompletableFuture<Void> commit() {
			CompletableFuture<Void> result = batch.commit();
			apply(changes);
			return result;
		}

		@Override
		public void discard() {
			changes.clear();
			batch.discard();
		}
	}

	@Override
	public String toString() {
		return "JsonNodeSceneHost{" +
			"downstream=" + downstream +
			'}';
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JsonNodeSceneHost.class);
}
