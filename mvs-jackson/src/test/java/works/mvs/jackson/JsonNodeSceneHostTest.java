package works.mvs.jackson;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.mvs.HostStack;
import works.mvs.exceptions.TreeLoadingException;
import works.mvs.testing.hosts.HostConformanceTest;
import works.mvs.testing.state.TestTrees;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static works.mvs.tree.Nodes.download;
import static works.mvs.tree.Nodes.parse;
import static works.mvs.tree.Nodes.root;

/**
 * The mirror must not disturb the scene downstream, and must track what was committed there.
 */
class JsonNodeSceneHostTest extends HostConformanceTest {
	final ObjectMapper mapper = JsonMapper.builder().build();
	JsonNodeSceneHost jsonHost;

	@BeforeEach
	void setupHostFactory() {
		hostFactory = HostStack.of((i, d) -> {
			jsonHost = (JsonNodeSceneHost) JsonNodeSceneHost.factory().build(i, d);
			return jsonHost;
		});
	}

	@Test
	void beforeFirstLoad_noSnapshot() {
		setupLoaders(hostFactory);
		assertNull(jsonHost.snapshot());
	}

	@Test
	void minimalTree_mirrorsActionChain() throws Exception {
		setupLoaders(hostFactory);
		loadBoth(TestTrees.minimal());

		List<String> actions = new ArrayList<>();
		Map<?, ?> object = plain(jsonHost.snapshot());
		while (!((List<?>) object.get("children")).isEmpty()) {
			object = (Map<?, ?>) ((List<?>) object.get("children")).get(0);
			actions.add((String) object.get("action"));
		}
		assertEquals(List.of(
			"download",
			"parse",
			"trajectory_from_format",
			"model_from_trajectory",
			"structure_from_model",
			"component",
			"representation"
		), actions);
	}

	@Test
	void representation_colorThemeRendered() throws Exception {
		setupLoaders(hostFactory);
		loadBoth(TestTrees.minimal());

		Map<?, ?> representation = descend(plain(jsonHost.snapshot()), 7);
		Map<?, ?> params = (Map<?, ?>) representation.get("params");
		assertEquals("cartoon", params.get("type"));
		assertEquals(Map.of("name", "uniform", "color", "#ff0000"), params.get("color_theme"));
	}

	@Test
	void secondLoad_replacesMirroredObjects() throws Exception {
		setupLoaders(hostFactory);
		loadBoth(TestTrees.minimal());
		loadBoth(TestTrees.withTooltips());

		Map<?, ?> root = plain(jsonHost.snapshot());
		assertEquals(1, ((List<?>) root.get("children")).size());
		Map<?, ?> structure = descend(root, 5);
		assertEquals("structure_from_model", structure.get("action"));
		Map<?, ?> properties = (Map<?, ?>) structure.get("properties");
		assertEquals(List.of(Map.of("text", "Chain A", "selector", Map.of("label_asym_id", "A"))), properties.get("inline_tooltips"));
	}

	@Test
	void failedLoad_mirrorUnchanged() throws Exception {
		setupLoaders(hostFactory);
		loadBoth(TestTrees.minimal());
		JsonNode before = jsonHost.snapshot();

		assertThrows(TreeLoadingException.class, () -> loader.loadAndWait(root(download(TestTrees.STRUCTURE_URL, parse("xyz")))));

		assertEquals(before.toString(), jsonHost.snapshot().toString());
	}

	/**
	 * Follows the first child <code>depth</code> times.
	 */
	private static Map<?, ?> descend(Map<?, ?> object, int depth) {
		Map<?, ?> result = object;
		for (int i = 0; i < depth; i++) {
			result = (Map<?, ?>) ((List<?>) result.get("children")).get(0);
		}
		return result;
	}

	private Map<?, ?> plain(JsonNode node) {
		return mapper.readValue(mapper.writeValueAsString(node), Map.class);
	}
}
