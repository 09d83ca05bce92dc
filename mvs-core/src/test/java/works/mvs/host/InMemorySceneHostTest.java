package works.mvs.host;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.Test;
import works.mvs.annotation.InlineTooltip;
import works.mvs.selector.Selector;

import static java.util.stream.Collectors.toList;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.mvs.host.InMemorySceneHost.ROOT;

class InMemorySceneHostTest {
	final InMemorySceneHost host = new InMemorySceneHost();
	final SceneAction download = new SceneAction.Download("https://example.com/a.cif", false);
	final SceneAction parse = new SceneAction.Parse("mmcif");

	@Test
	void stagedChanges_invisibleUntilCommit() {
		SceneBatch batch = host.beginBatch();
		SceneRef ref = batch.addChild(batch.anchor(), download);
		assertEquals(0, host.size());
		assertEquals(List.of(), batch.children(ROOT));

		batch.commit();
		assertEquals(List.of(ref), host.childrenOf(ROOT));
		assertEquals(download, host.get(ref).orElseThrow().action());
		assertEquals(ROOT, host.get(ref).orElseThrow().parent());
	}

	@Test
	void delete_removesSubtree() {
		SceneBatch first = host.beginBatch();
		SceneRef parent = first.addChild(ROOT, download);
		SceneRef child = first.addChild(parent, parse);
		first.commit();

		SceneBatch second = host.beginBatch();
		second.delete(parent);
		second.commit();
		assertEquals(0, host.size());
		assertTrue(host.get(child).isEmpty());
	}

	@Test
	void deleteRoot_throws() {
		assertThrows(IllegalArgumentException.class, () -> host.beginBatch().delete(ROOT));
	}

	@Test
	void failedChange_leavesSceneUntouched() {
		SceneBatch batch = host.beginBatch();
		batch.addChild(ROOT, download);
		batch.addChild(new SceneRef("nonexistent"), parse);
		assertThrows(IllegalStateException.class, batch::commit);
		assertEquals(0, host.size());
		assertEquals(0, host.commitCount());
	}

	@Test
	void setProperties_replacesProperties() {
		SceneBatch batch = host.beginBatch();
		SceneRef ref = batch.addChild(ROOT, download);
		SceneAction.StructureProperties properties = new SceneAction.StructureProperties(List.of(), List.of(),
			List.of(new InlineTooltip("hi", Selector.ALL)));
		batch.setProperties(ref, properties);
		batch.commit();
		assertEquals(properties, host.get(ref).orElseThrow().properties());
	}

	@Test
	void finishedBatch_rejectsFurtherUse() {
		SceneBatch committed = host.beginBatch();
		committed.commit();
		assertThrows(IllegalStateException.class, () -> committed.addChild(ROOT, download));
		assertThrows(IllegalStateException.class, committed::commit);

		SceneBatch discarded = host.beginBatch();
		discarded.addChild(ROOT, download);
		discarded.discard();
		assertThrows(IllegalStateException.class, discarded::commit);
		assertEquals(0, host.size());
	}

	@Test
	void objects_depthFirstInCreationOrder() {
		SceneBatch batch = host.beginBatch();
		SceneRef a = batch.addChild(ROOT, download);
		SceneRef b = batch.addChild(ROOT, download);
		SceneRef aChild = batch.addChild(a, parse);
		batch.commit();
		assertEquals(List.of(a, aChild, b), host.objects().stream().map(InMemorySceneHost.SceneObject::ref).collect(toList()));
	}

	@Test
	void deepScene_listedAndDeletedWithoutRecursion() {
		int depth = 100_000;
		SceneBatch batch = host.beginBatch();
		SceneRef top = batch.addChild(ROOT, download);
		SceneRef current = top;
		for (int i = 1; i < depth; i++) {
			current = batch.addChild(current, parse);
		}
		batch.commit();
		List<InMemorySceneHost.SceneObject> objects = host.objects();
		assertEquals(depth, objects.size());
		assertEquals(top, objects.get(0).ref());
		assertEquals(current, objects.get(depth - 1).ref());

		SceneBatch deletion = host.beginBatch();
		deletion.delete(top);
		deletion.commit();
		assertEquals(0, host.size());
	}

	@Test
	void executor_appliesAsynchronously() throws ExecutionException, InterruptedException {
		ExecutorService executor = Executors.newSingleThreadExecutor();
		try {
			InMemorySceneHost asyncHost = new InMemorySceneHost(executor);
			SceneBatch batch = asyncHost.beginBatch();
			batch.addChild(ROOT, download);
			CompletableFuture<Void> committed = batch.commit();
			committed.get();
			assertEquals(1, asyncHost.size());
		} finally {
			executor.shutdownNow();
		}
	}
}
