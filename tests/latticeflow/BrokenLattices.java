package latticeflow;

import java.util.Set;

/**
 * Lattice implementations that break one law each.
 */
final class BrokenLattices {
	private BrokenLattices() {
	}

	/**
	 * Joins by addition, which is not idempotent.
	 */
	static final class Sum implements Lattice<Sum, Integer> {
		private int value;

		Sum(int value) {
			this.value = value;
		}

		@Override
		public Integer get() {
			return this.value;
		}

		@Override
		public void join(Sum other) {
			this.value += other.value;
		}

		@Override
		public Sum copy() {
			return new Sum(this.value);
		}

		@Override
		public String toString() {
			return "Sum(" + this.value + ")";
		}
	}

	/**
	 * Keeps the right-hand side, which is idempotent but not commutative.
	 */
	static final class Last implements Lattice<Last, Integer> {
		private int value;

		Last(int value) {
			this.value = value;
		}

		@Override
		public Integer get() {
			return this.value;
		}

		@Override
		public void join(Last other) {
			this.value = other.value;
		}

		@Override
		public Last copy() {
			return new Last(this.value);
		}

		@Override
		public String toString() {
			return "Last(" + this.value + ")";
		}
	}

	/**
	 * A max lattice whose join also resets its argument.
	 */
	static final class Thief implements Lattice<Thief, Integer> {
		private int value;

		Thief(int value) {
			this.value = value;
		}

		@Override
		public Integer get() {
			return this.value;
		}

		@Override
		public void join(Thief other) {
			this.value = Math.max(this.value, other.value);
			other.value = 0;
		}

		@Override
		public Thief copy() {
			return new Thief(this.value);
		}

		@Override
		public String toString() {
			return "Thief(" + this.value + ")";
		}
	}

	/**
	 * A set lattice whose copies share state with the original.
	 */
	static final class Shallow implements Lattice<Shallow, Set<Integer>> {
		private final Set<Integer> set;

		Shallow(Set<Integer> set) {
			this.set = set;
		}

		@Override
		public Set<Integer> get() {
			return Set.copyOf(this.set);
		}

		@Override
		public void join(Shallow other) {
			this.set.addAll(other.set);
		}

		@Override
		public Shallow copy() {
			return new Shallow(this.set);
		}

		@Override
		public String toString() {
			return "Shallow" + this.set;
		}
	}
}
