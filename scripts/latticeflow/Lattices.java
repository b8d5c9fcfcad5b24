package latticeflow;

import java.util.Collection;
import java.util.Objects;

/**
 * Comparison operators and join helpers for any {@link Lattice}.
 */
public final class Lattices {
	private Lattices() {
	}

	/**
	 * @return Whether {@code l == r} in the lattice order.
	 */
	public static <L extends Lattice<L, T>, T> boolean equal(L l, L r) {
		return Objects.equals(l.get(), r.get());
	}

	/**
	 * @return Whether {@code l != r} in the lattice order.
	 */
	public static <L extends Lattice<L, T>, T> boolean notEqual(L l, L r) {
		return !equal(l, r);
	}

	/**
	 * Compare two lattice elements.  Neither argument is modified; the join
	 * happens on a copy of l.
	 *
	 * @return Whether {@code l <= r} in the lattice order.
	 */
	public static <L extends Lattice<L, T>, T> boolean lessOrEqual(L l, L r) {
		Objects.requireNonNull(r);
		var joined = l.copy();
		joined.join(r);
		return equal(joined, r);
	}

	/**
	 * @return Whether {@code l < r} in the lattice order.
	 */
	public static <L extends Lattice<L, T>, T> boolean lessThan(L l, L r) {
		return lessOrEqual(l, r) && notEqual(l, r);
	}

	/**
	 * @return Whether l and r are ordered with respect to each other.
	 */
	public static <L extends Lattice<L, T>, T> boolean comparable(L l, L r) {
		return lessOrEqual(l, r) || lessOrEqual(r, l);
	}

	/**
	 * @return The join of l and r, without modifying either.
	 */
	public static <L extends Lattice<L, T>, T> L join(L l, L r) {
		Objects.requireNonNull(r);
		var ret = l.copy();
		ret.join(r);
		return ret;
	}

	/**
	 * Join many others into l, updating it in-place.
	 *
	 * @return The updated l.
	 */
	public static <L extends Lattice<L, T>, T> L joinAll(L l, Collection<? extends L> others) {
		Objects.requireNonNull(l);
		for (var other : others) {
			l.join(Objects.requireNonNull(other));
		}
		return l;
	}

	/**
	 * @return The join of all the given values, as a new instance.
	 * @throws IllegalArgumentException If values is empty.
	 */
	public static <L extends Lattice<L, T>, T> L joinAll(Collection<? extends L> values) {
		var it = values.iterator();
		if (!it.hasNext()) {
			throw new IllegalArgumentException("Cannot join an empty collection");
		}

		L ret = it.next().copy();
		while (it.hasNext()) {
			ret.join(Objects.requireNonNull(it.next()));
		}
		return ret;
	}
}
