/**
 * Exceptions thrown while reading, validating and loading trees.
 * <p>
 * Parameter problems are unchecked and abort a loading run;
 * the loader reports them to its caller as a checked {@link works.mvs.exceptions.TreeLoadingException}.
 */
package works.mvs.exceptions;
