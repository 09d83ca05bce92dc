package works.mvs.structure;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import works.mvs.selector.ElementLocation;

/**
 * A simple in-memory {@link Structure} holding one {@link Atom} per element.
 * <p>
 * Units are formed per model and {@code label_asym_id}, in order of first appearance.
 */
public final class AtomTable implements Structure {
	private final List<Atom> atoms;
	private final List<Unit> units;
	private final Map<ElementLocation, Atom> byLocation;

	private AtomTable(List<Atom> atoms) {
		this.atoms = List.copyOf(atoms);
		this.byLocation = new HashMap<>();
		Map<String, List<Atom>> groups = new LinkedHashMap<>();
		for (Atom atom : this.atoms) {
			Atom previous = byLocation.put(atom.location(), atom);
			if (previous != null) {
				throw new IllegalArgumentException("Duplicate element " + atom.index() + " in model " + atom.modelId());
			}
			groups.computeIfAbsent(atom.modelId() + "\u0000" + atom.labelAsymId(), k -> new ArrayList<>()).add(atom);
		}
		List<Unit> unitList = new ArrayList<>(groups.size());
		for (List<Atom> group : groups.values()) {
			int[] elements = group.stream().mapToInt(Atom::index).toArray();
			unitList.add(new Unit(group.get(0).modelId(), elements));
		}
		this.units = List.copyOf(unitList);
	}

	public static AtomTable of(List<Atom> atoms) {
		return new AtomTable(atoms);
	}

	public static AtomTable empty() {
		return new AtomTable(List.of());
	}

	@Override
	public List<Unit> units() {
		return units;
	}

	public List<Atom> atoms() {
		return atoms;
	}

	public Optional<Atom> atomAt(ElementLocation location) {
		return Optional.ofNullable(byLocation.get(location));
	}

	public AtomTable subset(Predicate<? super Atom> predicate) {
		List<Atom> selected = new ArrayList<>();
		for (Atom atom : atoms) {
			if (predicate.test(atom)) {
				selected.add(atom);
			}
		}
		return (selected.size() == atoms.size()) ? this : new AtomTable(selected);
	}

	public int size() {
		return atoms.size();
	}

	@Override
	public String toString() {
		return "AtomTable{" + atoms.size() + " atoms, " + units.size() + " units}";
	}
}
