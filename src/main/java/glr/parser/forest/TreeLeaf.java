package glr.parser.forest;

import java.util.List;
import java.util.Objects;

import glr.grammar.Production;
import glr.grammar.Terminal;

public class TreeLeaf extends ParseTree {

	public final Terminal terminal;

	public TreeLeaf(Terminal terminal, int position) {
		super(position, position + 1);
		this.terminal = terminal;
	}

	@Override
	public Terminal symbol() {
		return terminal;
	}

	@Override
	public boolean isLeaf() {
		return true;
	}

	@Override
	void collectLeaves(List<Terminal> leaves) {
		leaves.add(terminal);
	}

	@Override
	void collectProductions(List<Production> productions) {
	}

	@Override
	void toPrettyString(List<String> lines, String indent) {
		lines.add(indent + terminal);
	}

	@Override
	public String toString() {
		return terminal.toString();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof TreeLeaf && ((TreeLeaf)obj).terminal.equals(terminal) && ((TreeLeaf)obj).start == start;
	}

	@Override
	public int hashCode() {
		return Objects.hash(terminal, start);
	}
}
