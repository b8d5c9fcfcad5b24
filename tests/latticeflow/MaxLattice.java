package latticeflow;

/**
 * Integers ordered by max.
 */
final class MaxLattice implements Lattice<MaxLattice, Integer> {
	private int value;

	private MaxLattice(int value) {
		this.value = value;
	}

	static MaxLattice bottom() {
		return new MaxLattice(Integer.MIN_VALUE);
	}

	static MaxLattice of(int value) {
		return new MaxLattice(value);
	}

	@Override
	public Integer get() {
		return this.value;
	}

	@Override
	public void join(MaxLattice other) {
		this.value = Math.max(this.value, other.value);
	}

	@Override
	public MaxLattice copy() {
		return new MaxLattice(this.value);
	}

	@Override
	public String toString() {
		return this.value == Integer.MIN_VALUE ? "⊥" : Integer.toString(this.value);
	}
}
