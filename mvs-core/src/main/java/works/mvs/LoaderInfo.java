package works.mvs;

import org.jetbrains.annotations.NotNull;

import static java.util.Objects.requireNonNull;

/**
 * What a {@link HostFactory} knows about the {@link MvsLoader} under construction.
 *
 * @param instanceId unique to each loader object, even those with the same <code>name</code>
 */
public record LoaderInfo(@NotNull String name, @NotNull String instanceId) {
	public LoaderInfo {
		requireNonNull(name);
		requireNonNull(instanceId);
	}
}
