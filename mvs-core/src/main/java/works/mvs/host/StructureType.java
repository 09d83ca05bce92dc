package works.mvs.host;

import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Which structure to build from a model.
 */
public sealed interface StructureType {
	/**
	 * @return the host's name for this type, like {@code symmetry-mates}
	 */
	String hostName();

	record Model() implements StructureType {
		@Override
		public String hostName() {
			return "model";
		}
	}

	/**
	 * @param id null means the first assembly
	 */
	record Assembly(@Nullable String id) implements StructureType {
		@Override
		public String hostName() {
			return "assembly";
		}
	}

	record Symmetry(@Nullable List<Integer> ijkMin, @Nullable List<Integer> ijkMax) implements StructureType {
		public Symmetry {
			ijkMin = ijkMin == null ? null : List.copyOf(ijkMin);
			ijkMax = ijkMax == null ? null : List.copyOf(ijkMax);
		}

		@Override
		public String hostName() {
			return "symmetry";
		}
	}

	record SymmetryMates(@Nullable Double radius) implements StructureType {
		@Override
		public String hostName() {
			return "symmetry-mates";
		}
	}
}
