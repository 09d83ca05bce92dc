package works.mvs.load;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import works.mvs.tree.MvsKind;

/**
 * The actions that a {@link TreeLoader} applies, by node kind.
 *
 * @param <C> the loading context type
 */
public interface LoadingActions<C> {
	/**
	 * @return empty if nodes of this kind create nothing of their own,
	 * in which case their children attach to the node's parent's result
	 */
	Optional<LoadingAction<C>> actionFor(MvsKind kind);

	static <C> LoadingActions<C> of(Map<MvsKind, LoadingAction<C>> actions) {
		Map<MvsKind, LoadingAction<C>> copy = actions.isEmpty()
			? new EnumMap<>(MvsKind.class)
			: new EnumMap<>(actions);
		return kind -> Optional.ofNullable(copy.get(kind));
	}
}
