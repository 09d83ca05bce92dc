package works.mvs.testing.hosts;

import java.util.List;
import org.junit.jupiter.api.Test;
import works.mvs.MvsConfig;
import works.mvs.host.InMemorySceneHost;
import works.mvs.host.SceneAction;
import works.mvs.testing.hosts.operations.HostOperation;
import works.mvs.testing.state.TestTrees;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;

class RecordingSceneHostTest extends AbstractLoaderTest {

	@Test
	void minimalTree_recordsEachChildThenCommit() throws Exception {
		setupLoaders(MvsConfig.simpleHost());
		loadBoth(TestTrees.minimal());

		assertThat(operations, contains(
			instanceOf(HostOperation.AddChild.class),
			instanceOf(HostOperation.AddChild.class),
			instanceOf(HostOperation.AddChild.class),
			instanceOf(HostOperation.AddChild.class),
			instanceOf(HostOperation.AddChild.class),
			instanceOf(HostOperation.AddChild.class),
			instanceOf(HostOperation.AddChild.class),
			instanceOf(HostOperation.Commit.class)
		));
		HostOperation.AddChild first = (HostOperation.AddChild) operations.get(0);
		assertEquals(InMemorySceneHost.ROOT, first.parent());
		assertEquals(new SceneAction.Download(TestTrees.STRUCTURE_URL, true), first.action());
	}

	@Test
	void addChild_recordsDownstreamResult() throws Exception {
		setupLoaders(MvsConfig.simpleHost());
		loadBoth(TestTrees.minimal());

		List<HostOperation.AddChild> adds = operations.stream()
			.filter(HostOperation.AddChild.class::isInstance)
			.map(HostOperation.AddChild.class::cast)
			.toList();
		for (int i = 1; i < adds.size(); i++) {
			assertEquals(adds.get(i - 1).result(), adds.get(i).parent());
		}
		assertEquals(host.size(), adds.size());
	}

	@Test
	void secondLoad_deletesPreviousDownload() throws Exception {
		setupLoaders(MvsConfig.simpleHost());
		loadBoth(TestTrees.minimal());
		HostOperation.AddChild download = (HostOperation.AddChild) operations.get(0);
		operations.clear();

		loadBoth(TestTrees.minimal());

		assertEquals(new HostOperation.Delete(download.result()), operations.get(0));
		assertEquals(1, countOperations(HostOperation.Delete.class));
	}
}
