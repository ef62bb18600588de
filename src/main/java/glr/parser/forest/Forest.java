package glr.parser.forest;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import glr.grammar.NonTerminal;
import glr.grammar.Terminal;

/**
 * Registry of the nodes of one parse: every (symbol, start, end) triple has at most one node.
 * Not thread safe, it belongs to a single parser.
 */
public class Forest {

	private static class Span {
		final NonTerminal nonTerminal;
		final int start;
		final int end;

		Span(NonTerminal nonTerminal, int start, int end) {
			this.nonTerminal = nonTerminal;
			this.start = start;
			this.end = end;
		}

		@Override
		public boolean equals(Object obj) {
			if (!(obj instanceof Span)){
				return false;
			}
			Span other = (Span)obj;
			return other.start == start && other.end == end && other.nonTerminal.equals(nonTerminal);
		}

		@Override
		public int hashCode() {
			return Objects.hash(nonTerminal, start, end);
		}
	}

	private final Map<Span, SymbolNode> symbolNodes = new LinkedHashMap<>();

	private final List<TerminalNode> terminalNodes = new ArrayList<>();

	/**
	 * Returns the leaf for the terminal at the passed position, creating it on first access.
	 * Terminals have to be registered in input order.
	 */
	public TerminalNode terminalNode(Terminal terminal, int position){
		if (position < terminalNodes.size()){
			TerminalNode node = terminalNodes.get(position);
			if (!node.terminal.equals(terminal)){
				throw new Error(String.format("Position %d already holds %s, not %s", position, node.terminal, terminal));
			}
			return node;
		}
		if (position != terminalNodes.size()){
			throw new Error(String.format("Terminal at position %d registered before position %d", position,
					terminalNodes.size()));
		}
		TerminalNode node = new TerminalNode(terminal, position);
		terminalNodes.add(node);
		return node;
	}

	public SymbolNode symbolNode(NonTerminal nonTerminal, int start, int end){
		return symbolNodes.computeIfAbsent(new Span(nonTerminal, start, end), s -> new SymbolNode(nonTerminal, start, end));
	}

	/**
	 * @return the node or null if no such node exists
	 */
	public SymbolNode getSymbolNode(NonTerminal nonTerminal, int start, int end){
		return symbolNodes.get(new Span(nonTerminal, start, end));
	}

	public Collection<SymbolNode> getSymbolNodes(){
		return Collections.unmodifiableCollection(symbolNodes.values());
	}

	public List<TerminalNode> getTerminalNodes() {
		return Collections.unmodifiableList(terminalNodes);
	}

	public int size(){
		return symbolNodes.size() + terminalNodes.size();
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (SymbolNode node : symbolNodes.values()){
			if (builder.length() > 0){
				builder.append("\n");
			}
			builder.append(node.spanString()).append(":");
			for (Derivation derivation : node.getDerivations()){
				builder.append("\n  ").append(derivation);
			}
		}
		return builder.toString();
	}
}
