package works.mvs.logging;

/**
 * Keys of the SLF4J MDC entries set while a loader is working.
 */
public final class MdcKeys {
	private MdcKeys() { }

	public static final String LOADER_NAME = "mvs.name";
	public static final String LOADER_INSTANCE_ID = "mvs.instanceID";

	/**
	 * Distinguishes one {@link works.mvs.MvsLoader#load load} from another on the same loader.
	 */
	public static final String RUN_ID = "mvs.run";
}
