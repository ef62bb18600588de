package glr.parser.forest;

import java.util.List;

import glr.grammar.Symbol;

/**
 * Node of a shared packed parse forest. It covers the input terminals [start, end).
 *
 * Nodes are created and shared by a {@link Forest}, equal spans of a symbol always map to the same node,
 * therefore nodes use identity equality.
 */
public abstract class ForestNode {

	public final int start;

	public final int end;

	ForestNode(int start, int end) {
		if (start > end){
			throw new Error(String.format("Span [%d, %d) is inverted", start, end));
		}
		this.start = start;
		this.end = end;
	}

	public abstract Symbol symbol();

	public boolean isTerminalNode(){
		return false;
	}

	public boolean isEmpty(){
		return start == end;
	}

	/**
	 * Enumerates up to limit acyclic trees rooted in this node
	 *
	 * @param path symbol nodes on the way from the root to this node, they are not visited again
	 */
	abstract List<ParseTree> trees(List<SymbolNode> path, int limit);

	public String spanString(){
		return String.format("%s[%d, %d)", symbol(), start, end);
	}

	@Override
	public String toString() {
		return spanString();
	}
}
