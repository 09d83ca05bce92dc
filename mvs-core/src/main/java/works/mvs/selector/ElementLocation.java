package works.mvs.selector;

import org.jetbrains.annotations.NotNull;

/**
 * Identifies one element (atom or coarse-grained particle) of one model.
 */
public record ElementLocation(@NotNull String modelId, int element) { }
