package glr.grammar;

/**
 * A non terminal symbol, its productions are stored in the grammar.
 */
public class NonTerminal extends Symbol {

	public NonTerminal(String name) {
		super(name);
	}

	@Override
	public boolean isTerminal() {
		return false;
	}

	@Override
	protected int sortNum() {
		return -1;
	}
}
