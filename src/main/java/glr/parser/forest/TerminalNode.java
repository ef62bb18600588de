package glr.parser.forest;

import java.util.Collections;
import java.util.List;

import glr.grammar.Terminal;

/**
 * Leaf of the forest: the terminal at an input position
 */
public class TerminalNode extends ForestNode {

	public final Terminal terminal;

	TerminalNode(Terminal terminal, int position) {
		super(position, position + 1);
		this.terminal = terminal;
	}

	@Override
	public Terminal symbol() {
		return terminal;
	}

	@Override
	public boolean isTerminalNode() {
		return true;
	}

	@Override
	List<ParseTree> trees(List<SymbolNode> path, int limit) {
		return Collections.singletonList(new TreeLeaf(terminal, start));
	}
}
