package latticeflow;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Thrown when a lattice implementation violates one of the join laws, or one
 * of the order properties derived from them.
 */
public class LatticeLawException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	private final LatticeLaws.Law law;
	private final ImmutableList<Object> witnesses;

	public LatticeLawException(LatticeLaws.Law law, List<?> witnesses) {
		super(law.description() + " violated by " + witnesses);
		this.law = law;
		this.witnesses = ImmutableList.copyOf(witnesses);
	}

	/**
	 * @return The violated law.
	 */
	public LatticeLaws.Law getLaw() {
		return this.law;
	}

	/**
	 * @return The values that exhibit the violation.
	 */
	public List<Object> getWitnesses() {
		return this.witnesses;
	}
}
