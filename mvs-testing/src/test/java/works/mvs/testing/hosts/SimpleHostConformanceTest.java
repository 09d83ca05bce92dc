package works.mvs.testing.hosts;

import org.junit.jupiter.api.BeforeEach;
import works.mvs.MvsConfig;

class SimpleHostConformanceTest extends HostConformanceTest {
	@BeforeEach
	void setupHostFactory() {
		hostFactory = MvsConfig.simpleHost();
	}
}
