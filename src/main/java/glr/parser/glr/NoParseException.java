package glr.parser.glr;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

import glr.GLRException;
import glr.grammar.Terminal;

/**
 * Signals that the input isn't a sentence of the grammar
 */
public class NoParseException extends GLRException {

	/**
	 * Number of terminals that were consumed by some stack before all stacks died
	 */
	public final int position;

	/**
	 * The terminal that no stack could shift, null if the end of the input was reached
	 */
	public final Terminal terminal;

	public final Set<Terminal> expected;

	public NoParseException(int position, Terminal terminal, Set<Terminal> expected) {
		super(createMessage(position, terminal, expected));
		this.position = position;
		this.terminal = terminal;
		this.expected = Collections.unmodifiableSet(new TreeSet<>(expected));
	}

	private static String createMessage(int position, Terminal terminal, Set<Terminal> expected){
		return String.format("Unexpected %s at position %d, expected one of %s",
				terminal == null ? "end of input" : terminal, position, new TreeSet<>(expected));
	}

	public boolean atEndOfInput(){
		return terminal == null;
	}
}
