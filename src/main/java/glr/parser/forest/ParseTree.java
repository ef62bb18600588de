package glr.parser.forest;

import java.util.ArrayList;
import java.util.List;

import glr.grammar.Production;
import glr.grammar.Symbol;
import glr.grammar.Terminal;

/**
 * A single derivation tree extracted from a forest
 */
public abstract class ParseTree {

	public final int start;

	public final int end;

	ParseTree(int start, int end) {
		this.start = start;
		this.end = end;
	}

	public abstract Symbol symbol();

	public abstract boolean isLeaf();

	/**
	 * @return terminals of the tree from left to right
	 */
	public List<Terminal> leaves(){
		List<Terminal> leaves = new ArrayList<>();
		collectLeaves(leaves);
		return leaves;
	}

	abstract void collectLeaves(List<Terminal> leaves);

	/**
	 * Productions of the leftmost derivation that this tree represents, in the order of their application
	 */
	public List<Production> productions(){
		List<Production> productions = new ArrayList<>();
		collectProductions(productions);
		return productions;
	}

	abstract void collectProductions(List<Production> productions);

	public int size(){
		return 1;
	}

	public int height(){
		return 0;
	}

	public String toPrettyString(){
		List<String> lines = new ArrayList<>();
		toPrettyString(lines, "");
		return String.join("\n", lines);
	}

	abstract void toPrettyString(List<String> lines, String indent);

	/**
	 * @return s-expression, e.g. {@code (S (A a) b)}
	 */
	@Override
	public abstract String toString();
}
