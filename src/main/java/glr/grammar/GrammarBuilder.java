package glr.grammar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import glr.GLRException;

/**
 * Allows the simple creation of grammars.
 *
 * Terminals have to be declared before they're used, every left hand side of a production is implicitly
 * declared as a non terminal. Names on the right hand side are resolved when the grammar is built,
 * a name that is neither a terminal nor a non terminal leads to an {@link UndeclaredSymbolException}.
 *
 * <pre>
 *     Grammar g = new GrammarBuilder()
 *          .terminals("a")
 *          .add("S", "a", "S", "a")
 *          .add("S", "a")
 *          .toGrammar("S");
 * </pre>
 */
public class GrammarBuilder {

	private final Set<String> terminals = new LinkedHashSet<>();
	private final Set<String> nonTerminals = new LinkedHashSet<>();
	private final List<String[]> productions = new ArrayList<>();

	public GrammarBuilder terminals(String... names){
		for (String name : names){
			checkName(name);
			terminals.add(name);
		}
		return this;
	}

	public GrammarBuilder nonTerminals(String... names){
		for (String name : names){
			checkName(name);
			nonTerminals.add(name);
		}
		return this;
	}

	private void checkName(String name){
		if (name == null || name.isEmpty()){
			throw new GLRException("Symbol names have to be non empty");
		}
	}

	/**
	 * Adds a new production, an empty right hand side creates an epsilon production.
	 *
	 * @param left name of the defining non terminal on the left hand side of the production
	 * @param right names of the symbols on the right hand side
	 */
	public GrammarBuilder add(String left, String... right){
		checkName(left);
		nonTerminals.add(left);
		String[] prod = new String[right.length + 1];
		prod[0] = left;
		System.arraycopy(right, 0, prod, 1, right.length);
		productions.add(prod);
		return this;
	}

	/**
	 * Adds the production {@code left → ε}
	 */
	public GrammarBuilder epsilon(String left){
		return add(left);
	}

	/**
	 * Adds a production for each of the passed alternatives.
	 */
	public GrammarBuilder alternatives(String left, String[]... alternatives){
		for (String[] alternative : alternatives){
			add(left, alternative);
		}
		return this;
	}

	/**
	 * Builds the grammar
	 *
	 * @param startNonTerminal name of the start non terminal
	 * @throws UndeclaredSymbolException if a used symbol isn't declared
	 */
	public Grammar toGrammar(String startNonTerminal) {
		Set<Terminal> terms = new LinkedHashSet<>();
		for (String terminal : terminals){
			terms.add(new Terminal(terminal));
		}
		Set<NonTerminal> nonTerms = new LinkedHashSet<>();
		for (String nonTerminal : nonTerminals){
			nonTerms.add(new NonTerminal(nonTerminal));
		}
		List<Production> prods = new ArrayList<>();
		for (String[] prod : productions){
			List<Symbol> right = new ArrayList<>();
			for (int i = 1; i < prod.length; i++){
				right.add(resolve(prod[i], Arrays.toString(prod)));
			}
			prods.add(new Production(prods.size(), new NonTerminal(prod[0]), right));
		}
		if (!nonTerminals.contains(startNonTerminal)){
			throw new UndeclaredSymbolException(startNonTerminal, "start symbol");
		}
		return new Grammar(terms, nonTerms, new NonTerminal(startNonTerminal), prods);
	}

	private Symbol resolve(String name, String context){
		boolean isTerminal = terminals.contains(name);
		boolean isNonTerminal = nonTerminals.contains(name);
		if (isTerminal && isNonTerminal){
			throw new GLRException(String.format("Ambiguity while building the grammar: '%s' is the name of a " +
					"terminal and therefore can't be used as a non terminal name", name));
		}
		if (isTerminal){
			return new Terminal(name);
		}
		if (isNonTerminal){
			return new NonTerminal(name);
		}
		throw new UndeclaredSymbolException(name, "production " + context);
	}
}
