package latticeflow;

import latticeflow.util.Log;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Checks the join laws, and the order properties derived from them, on a
 * sample of lattice elements.  Lattice implementations call this from their
 * own tests.
 *
 * <p>The samples are copied on construction and every check works on fresh
 * copies, so the caller's values are never modified.
 */
public final class LatticeLaws<L extends Lattice<L, T>, T> {
	/**
	 * The properties that can be checked.
	 */
	public enum Law {
		IDEMPOTENT("join(x, x) == x"),
		COMMUTATIVE("join(x, y) == join(y, x)"),
		ASSOCIATIVE("join(x, join(y, z)) == join(join(x, y), z)"),
		REFLEXIVE("x <= x"),
		ANTISYMMETRIC("x <= y && y <= x implies x == y"),
		TRANSITIVE("x <= y && y <= z implies x <= z"),
		EQUALITY("x != y iff !(x == y)"),
		NON_MUTATING("comparison and join leave their arguments unchanged"),
		COPY_INDEPENDENT("joining into a copy leaves the original unchanged");

		private final String description;

		Law(String description) {
			this.description = description;
		}

		/**
		 * @return A description of this law.
		 */
		public String description() {
			return name() + " (" + this.description + ")";
		}
	}

	private final ImmutableList<L> samples;

	private LatticeLaws(ImmutableList<L> samples) {
		this.samples = samples;
	}

	/**
	 * @return A checker for the given samples, at most
	 *         {@link LatticeConfig#MAX_LAW_SAMPLES} of which are kept.
	 */
	public static <L extends Lattice<L, T>, T> LatticeLaws<L, T> of(Collection<? extends L> samples) {
		return of(samples, LatticeConfig.MAX_LAW_SAMPLES);
	}

	/**
	 * @return A checker for the given samples, at most maxSamples of which
	 *         are kept.
	 */
	public static <L extends Lattice<L, T>, T> LatticeLaws<L, T> of(Collection<? extends L> samples, int maxSamples) {
		if (maxSamples <= 0) {
			throw new IllegalArgumentException("maxSamples must be positive, got " + maxSamples);
		}
		if (samples.size() > maxSamples) {
			Log.warn("Checking only %d of %d samples", maxSamples, samples.size());
		}

		ImmutableList<L> copies = samples.stream()
			.limit(maxSamples)
			.map(sample -> sample.copy())
			.collect(ImmutableList.toImmutableList());
		return new LatticeLaws<>(copies);
	}

	/**
	 * @return The samples being checked.
	 */
	public List<L> samples() {
		return this.samples;
	}

	/**
	 * Check every law.
	 *
	 * @throws LatticeLawException On the first violation.
	 */
	public void checkAll() {
		checkIdempotent();
		checkCommutative();
		checkAssociative();
		checkReflexive();
		checkAntisymmetric();
		checkTransitive();
		checkEqualityConsistent();
		checkNonMutating();
		checkCopyIndependent();
	}

	public void checkIdempotent() {
		start(Law.IDEMPOTENT);
		for (var x : this.samples) {
			if (Lattices.notEqual(Lattices.join(x, x), x)) {
				throw violation(Law.IDEMPOTENT, x);
			}
		}
		pass(Law.IDEMPOTENT);
	}

	public void checkCommutative() {
		start(Law.COMMUTATIVE);
		for (var xy : pairs()) {
			var x = xy.get(0);
			var y = xy.get(1);
			if (Lattices.notEqual(Lattices.join(x, y), Lattices.join(y, x))) {
				throw violation(Law.COMMUTATIVE, x, y);
			}
		}
		pass(Law.COMMUTATIVE);
	}

	public void checkAssociative() {
		start(Law.ASSOCIATIVE);
		for (var xyz : triples()) {
			var x = xyz.get(0);
			var y = xyz.get(1);
			var z = xyz.get(2);
			var left = Lattices.join(x, Lattices.join(y, z));
			var right = Lattices.join(Lattices.join(x, y), z);
			if (Lattices.notEqual(left, right)) {
				throw violation(Law.ASSOCIATIVE, x, y, z);
			}
		}
		pass(Law.ASSOCIATIVE);
	}

	public void checkReflexive() {
		start(Law.REFLEXIVE);
		for (var x : this.samples) {
			if (!Lattices.lessOrEqual(x, x)) {
				throw violation(Law.REFLEXIVE, x);
			}
		}
		pass(Law.REFLEXIVE);
	}

	public void checkAntisymmetric() {
		start(Law.ANTISYMMETRIC);
		for (var xy : pairs()) {
			var x = xy.get(0);
			var y = xy.get(1);
			if (Lattices.lessOrEqual(x, y) && Lattices.lessOrEqual(y, x) && Lattices.notEqual(x, y)) {
				throw violation(Law.ANTISYMMETRIC, x, y);
			}
		}
		pass(Law.ANTISYMMETRIC);
	}

	public void checkTransitive() {
		start(Law.TRANSITIVE);
		for (var xyz : triples()) {
			var x = xyz.get(0);
			var y = xyz.get(1);
			var z = xyz.get(2);
			if (Lattices.lessOrEqual(x, y) && Lattices.lessOrEqual(y, z) && !Lattices.lessOrEqual(x, z)) {
				throw violation(Law.TRANSITIVE, x, y, z);
			}
		}
		pass(Law.TRANSITIVE);
	}

	/**
	 * Check that == and != are complementary, and that == is reflexive and
	 * symmetric.
	 */
	public void checkEqualityConsistent() {
		start(Law.EQUALITY);
		for (var xy : pairs()) {
			var x = xy.get(0);
			var y = xy.get(1);
			var eq = Lattices.equal(x, y);
			if (Lattices.notEqual(x, y) == eq
			    || Lattices.equal(y, x) != eq
			    || !Lattices.equal(x, x)) {
				throw violation(Law.EQUALITY, x, y);
			}
		}
		pass(Law.EQUALITY);
	}

	/**
	 * Check that comparisons modify neither side, and that join does not
	 * modify its argument.
	 */
	public void checkNonMutating() {
		start(Law.NON_MUTATING);
		for (var xy : pairs()) {
			var x = xy.get(0).copy();
			var y = xy.get(1).copy();

			Lattices.lessOrEqual(x, y);
			if (Lattices.notEqual(x, xy.get(0)) || Lattices.notEqual(y, xy.get(1))) {
				throw violation(Law.NON_MUTATING, xy.get(0), xy.get(1));
			}

			x.join(y);
			if (Lattices.notEqual(y, xy.get(1))) {
				throw violation(Law.NON_MUTATING, xy.get(0), xy.get(1));
			}
		}
		pass(Law.NON_MUTATING);
	}

	public void checkCopyIndependent() {
		start(Law.COPY_INDEPENDENT);
		for (var xy : pairs()) {
			var x = xy.get(0).copy();
			var before = x.get();
			var copy = x.copy();
			copy.join(xy.get(1));
			if (!Objects.equals(x.get(), before) || Lattices.notEqual(x, xy.get(0))) {
				throw violation(Law.COPY_INDEPENDENT, xy.get(0), xy.get(1));
			}
		}
		pass(Law.COPY_INDEPENDENT);
	}

	private List<List<L>> pairs() {
		return Lists.cartesianProduct(this.samples, this.samples);
	}

	private List<List<L>> triples() {
		return Lists.cartesianProduct(this.samples, this.samples, this.samples);
	}

	private void start(Law law) {
		Log.debug("Checking %s on %d samples", law, this.samples.size());
	}

	private void pass(Law law) {
		Log.debug("%s holds", law);
	}

	private static LatticeLawException violation(Law law, Object... witnesses) {
		var e = new LatticeLawException(law, List.of(witnesses));
		Log.warn(e);
		return e;
	}
}
