package works.mvs.structure;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.mvs.annotation.AnnotationRegistry;
import works.mvs.annotation.AnnotationTable;
import works.mvs.exceptions.InvalidSelectorException;
import works.mvs.selector.ComponentExpression;
import works.mvs.selector.ElementSet;
import works.mvs.selector.Selector;
import works.mvs.selector.StaticSelector;

/**
 * Evaluates every {@link Selector} variant against {@link AtomTable} structures.
 * <p>
 * {@link Selector.Bundle Bundles} and {@link Selector#ALL} work with any {@link Structure};
 * the other variants need per-atom data and so require an {@link AtomTable}.
 * Scripts must be in the {@link MolScriptQuery#LANGUAGE mol-script} language.
 */
public final class AtomTableQueryEngine implements StructureQueryEngine {
	private final AnnotationRegistry annotations;

	public AtomTableQueryEngine() {
		this(AnnotationRegistry.empty());
	}

	/**
	 * @param annotations used to evaluate {@link Selector.Annotation annotation selectors}
	 */
	public AtomTableQueryEngine(AnnotationRegistry annotations) {
		this.annotations = annotations;
	}

	@Override
	public Structure substructure(Structure structure, Selector selector) {
		if (selector.isAll()) {
			return structure;
		} else if (structure.units().isEmpty()) {
			return Structure.EMPTY;
		} else if (selector instanceof Selector.Bundle) {
			return intersect(structure, ((Selector.Bundle) selector).elements());
		} else if (structure instanceof AtomTable) {
			return ((AtomTable) structure).subset(predicate(selector));
		} else {
			throw new InvalidSelectorException("Selector " + selector.getClass().getSimpleName() + " requires an AtomTable, not " + structure.getClass().getSimpleName());
		}
	}

	Predicate<Atom> predicate(Selector selector) {
		if (selector instanceof Selector.Static) {
			return staticPredicate(((Selector.Static) selector).value());
		} else if (selector instanceof Selector.Expression) {
			List<ComponentExpression> rows = ((Selector.Expression) selector).rows();
			return atom -> rows.stream().anyMatch(atom::matches);
		} else if (selector instanceof Selector.Script) {
			Selector.Script script = (Selector.Script) selector;
			if (!MolScriptQuery.LANGUAGE.equals(script.language())) {
				throw new InvalidSelectorException("Unsupported query language \"" + script.language() + "\"");
			}
			return MolScriptQuery.compile(script.expression());
		} else if (selector instanceof Selector.Annotation) {
			return annotationPredicate((Selector.Annotation) selector);
		} else if (selector instanceof Selector.Bundle) {
			ElementSet elements = ((Selector.Bundle) selector).elements();
			return atom -> elements.has(atom.location());
		} else {
			throw new InvalidSelectorException("Unexpected selector " + selector);
		}
	}

	private static Predicate<Atom> staticPredicate(StaticSelector value) {
		switch (value) {
			case ALL: return atom -> true;
			case POLYMER: return atom -> atom.moleculeKind() == MoleculeKind.PROTEIN || atom.moleculeKind() == MoleculeKind.NUCLEIC;
			case PROTEIN: return kind(MoleculeKind.PROTEIN);
			case NUCLEIC: return kind(MoleculeKind.NUCLEIC);
			case WATER: return kind(MoleculeKind.WATER);
			case ION: return kind(MoleculeKind.ION);
			case LIPID: return kind(MoleculeKind.LIPID);
			case BRANCHED: return kind(MoleculeKind.BRANCHED);
			case LIGAND: return kind(MoleculeKind.LIGAND);
			case NON_STANDARD: return Atom::nonStandard;
			case COARSE: return kind(MoleculeKind.COARSE);
			default: throw new AssertionError("Unexpected static selector: " + value);
		}
	}

	private static Predicate<Atom> kind(MoleculeKind kind) {
		return atom -> atom.moleculeKind() == kind;
	}

	private Predicate<Atom> annotationPredicate(Selector.Annotation selector) {
		Optional<AnnotationTable> table = annotations.table(selector.annotationId());
		if (table.isEmpty()) {
			LOGGER.debug("No data for annotation {}; selecting nothing", selector.annotationId());
			return atom -> false;
		}
		List<String> allowed = selector.fieldValues();
		return atom -> table.get().valueFor(atom, selector.fieldName())
			.map(value -> allowed == null || allowed.contains(value))
			.orElse(false);
	}

	private static Structure intersect(Structure structure, ElementSet elements) {
		if (structure instanceof AtomTable) {
			return ((AtomTable) structure).subset(atom -> elements.has(atom.location()));
		}
		List<Structure.Unit> units = new ArrayList<>();
		for (Structure.Unit unit : structure.units()) {
			int[] kept = Arrays.stream(unit.elements())
				.filter(e -> elements.has(unit.modelId(), e))
				.toArray();
			if (kept.length > 0) {
				units.add(new Structure.Unit(unit.modelId(), kept));
			}
		}
		List<Structure.Unit> result = List.copyOf(units);
		return () -> result;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(AtomTableQueryEngine.class);
}
