package glr.grammar;

import glr.GLRException;

/**
 * A production references a symbol that is neither declared as a terminal nor as a non terminal.
 */
public class UndeclaredSymbolException extends GLRException {

	public final String symbolName;

	public UndeclaredSymbolException(String symbolName, String context) {
		super(String.format("Undeclared symbol '%s' in %s", symbolName, context));
		this.symbolName = symbolName;
	}
}
