package works.mvs;

import static java.util.Objects.requireNonNull;

public final class MvsConfig {
	private final HostFactory hostFactory;
	private final LoaderSettings settings;

	private MvsConfig(HostFactory hostFactory, LoaderSettings settings) {
		this.hostFactory = hostFactory;
		this.settings = settings;
	}

	public static MvsConfig simple() {
		return SIMPLE_CONFIG;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * @return a {@link HostFactory} that adds no layers of its own
	 */
	public static HostFactory simpleHost() {
		return SIMPLE_HOST_FACTORY;
	}

	public HostFactory hostFactory() {
		return hostFactory;
	}

	public LoaderSettings settings() {
		return settings;
	}

	public static class Builder {
		private HostFactory hostFactory;
		private LoaderSettings settings;

		Builder() {
			hostFactory = simpleHost();
			settings = LoaderSettings.defaults();
		}

		public Builder hostFactory(HostFactory hostFactory) {
			this.hostFactory = requireNonNull(hostFactory);
			return this;
		}

		public Builder settings(LoaderSettings settings) {
			this.settings = requireNonNull(settings);
			return this;
		}

		public MvsConfig build() {
			return new MvsConfig(this.hostFactory, this.settings);
		}

		@Override
		public String toString() {
			return "MvsConfig.Builder(hostFactory=" + this.hostFactory + ", settings=" + this.settings + ")";
		}
	}

	private static final HostFactory SIMPLE_HOST_FACTORY = (i, d) -> d;
	private static final MvsConfig SIMPLE_CONFIG = new MvsConfig(SIMPLE_HOST_FACTORY, LoaderSettings.defaults());
}
