package works.mvs;

import java.util.ArrayList;
import java.util.List;
import works.mvs.host.SceneHost;

/**
 * A {@link HostFactory} composed of other factories.
 * The first one in the list is the furthest upstream: it sees each batch first.
 */
public final class HostStack implements HostFactory {
	private final List<HostFactory> factories;

	private HostStack(List<HostFactory> factories) {
		this.factories = List.copyOf(factories);
	}

	public static HostStack of(HostFactory... factories) {
		return new HostStack(List.of(factories));
	}

	public static HostStack of(List<HostFactory> factories) {
		return new HostStack(factories);
	}

	public HostStack with(HostFactory upstream) {
		List<HostFactory> newList = new ArrayList<>(factories.size() + 1);
		newList.add(upstream);
		newList.addAll(factories);
		return new HostStack(newList);
	}

	@Override
	public SceneHost build(LoaderInfo loaderInfo, SceneHost downstream) {
		SceneHost result = downstream;
		for (int i = factories.size() - 1; i >= 0; i--) {
			result = factories.get(i).build(loaderInfo, result);
		}
		return result;
	}

	@Override
	public String toString() {
		return "HostStack" + factories;
	}
}
