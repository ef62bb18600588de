package glr.grammar;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A grammar production with a left and a right hand side.
 */
public class Production implements Serializable {

	/**
	 * Id of the production, its index in the list of productions of its grammar
	 */
	public final int id;
	/**
	 * Left hand side of the production (the associated non terminal)
	 */
	public final NonTerminal left;
	/**
	 * Right hand side of the production, empty for an epsilon production
	 */
	public final List<Symbol> right;

	public Production(int id, NonTerminal left, List<Symbol> right) {
		this.id = id;
		this.left = Objects.requireNonNull(left);
		this.right = Collections.unmodifiableList(new ArrayList<>(right));
	}

	public String formatRightSide(){
		if (right.isEmpty()){
			return "ε";
		}
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < right.size(); i++) {
			builder.append(right.get(i));
			if (i < right.size() - 1) {
				builder.append(" ");
			}
		}
		return builder.toString();
	}

	@Override
	public String toString() {
		return left + " → " + formatRightSide();
	}

	public boolean isEpsilonProduction(){
		return right.isEmpty();
	}

	/**
	 * Size of the right hand side.
	 */
	public int rightSize(){
		return right.size();
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Production)){
			return false;
		}
		Production other = (Production)obj;
		return other.id == id && other.left.equals(left) && other.right.equals(right);
	}

	@Override
	public int hashCode() {
		return Objects.hash(id, left, right);
	}
}
