package latticeflow;

/**
 * A join semi-lattice.
 *
 * <p>An implementing type {@code L} declares itself as a semi-lattice over
 * values of type {@code T}.  The join of two elements is their least upper
 * bound, and must be associative, commutative, and idempotent:
 *
 * <pre>
 *   join(x, join(y, z)) == join(join(x, y), z)
 *   join(x, y) == join(y, x)
 *   join(x, x) == x
 * </pre>
 *
 * These laws cannot be checked by the compiler.  Implementations should
 * validate them with {@link LatticeLaws}.
 *
 * <p>The join induces a partial order: {@code x <= y} if and only if
 * {@code join(x, y) == y}, where equality compares {@link #get()} values.
 * The operators in {@link Lattices} are derived from this definition.
 *
 * <p>Semi-lattices need not have a bottom element, but if they do,
 * implementations should provide a static {@code bottom()} factory.
 *
 * @param <L> The implementing type.
 * @param <T> The type of the lattice elements.
 */
public interface Lattice<L extends Lattice<L, T>, T> {
	/**
	 * @return A read-only view of the current element.
	 */
	T get();

	/**
	 * Calculate the join (least upper bound) of this and other, updating
	 * this instance in-place.  The other instance is never modified.
	 */
	void join(L other);

	/**
	 * @return A new, independent instance with the same element as this.
	 */
	L copy();
}
