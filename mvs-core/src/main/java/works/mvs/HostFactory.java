package works.mvs;

import works.mvs.host.SceneHost;

/**
 * Builds one layer of the host stack of an {@link MvsLoader}.
 * <p>
 * Each layer sees every batch the loader opens, and normally delegates to
 * the <code>downstream</code> host, which ultimately owns the scene.
 * Concerns like log context and commit ordering are layers of their own.
 *
 * @see HostStack
 */
@FunctionalInterface
public interface HostFactory {
	/**
	 * Called once, when the loader is constructed.
	 *
	 * @param downstream the next host in the stack
	 */
	SceneHost build(LoaderInfo loaderInfo, SceneHost downstream);
}
