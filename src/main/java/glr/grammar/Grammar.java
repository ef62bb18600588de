package glr.grammar;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import glr.GLRException;

import static glr.util.Utils.join;

/**
 * Grammar consisting of terminals, non terminals and productions. Immutable after construction,
 * the nullable, first and follow sets are calculated once in the constructor.
 *
 * Use the GrammarBuilder to build a grammar instance properly. Cyclic and left recursive grammars
 * and epsilon productions are allowed.
 *
 * @see GrammarBuilder GrammarBuilder
 */
public class Grammar implements Serializable {

	private final Set<Terminal> terminals;

	private final Set<NonTerminal> nonTerminals;

	private final List<Production> productions;

	private final NonTerminal start;

	private final Map<NonTerminal, List<Production>> productionsPerNonTerminal;

	private final FirstFollowSets sets;

	/**
	 * Create a new Grammar object
	 *
	 * @param terminals declared terminals
	 * @param nonTerminals declared non terminals
	 * @param start start non terminal
	 * @param productions productions, the id of each has to be its index
	 * @throws UndeclaredSymbolException if a production uses a symbol that isn't declared
	 * @throws GLRException if the start non terminal has no production
	 */
	public Grammar(Set<Terminal> terminals, Set<NonTerminal> nonTerminals, NonTerminal start,
	               List<Production> productions) {
		this.terminals = Collections.unmodifiableSet(new LinkedHashSet<>(terminals));
		this.nonTerminals = Collections.unmodifiableSet(new LinkedHashSet<>(nonTerminals));
		this.productions = Collections.unmodifiableList(new ArrayList<>(productions));
		this.start = start;
		checkDeclarations();
		Map<NonTerminal, List<Production>> perNonTerminal = new HashMap<>();
		for (NonTerminal nonTerminal : this.nonTerminals){
			perNonTerminal.put(nonTerminal, new ArrayList<>());
		}
		for (Production production : this.productions){
			perNonTerminal.get(production.left).add(production);
		}
		for (NonTerminal nonTerminal : this.nonTerminals){
			perNonTerminal.put(nonTerminal, Collections.unmodifiableList(perNonTerminal.get(nonTerminal)));
		}
		this.productionsPerNonTerminal = Collections.unmodifiableMap(perNonTerminal);
		if (productionsFor(start).isEmpty()){
			throw new GLRException(String.format("Start non terminal %s has no production", start));
		}
		this.sets = new FirstFollowSets(this.nonTerminals, this.productions, start);
	}

	private void checkDeclarations(){
		if (start == null || !nonTerminals.contains(start)){
			throw new UndeclaredSymbolException(start == null ? "null" : start.name, "start symbol");
		}
		if (terminals.contains(Terminal.END_MARKER)){
			throw new GLRException("The end marker can't be used as a terminal of a grammar");
		}
		Set<String> terminalNames = new HashSet<>();
		for (Terminal terminal : terminals){
			terminalNames.add(terminal.name);
		}
		for (NonTerminal nonTerminal : nonTerminals){
			if (terminalNames.contains(nonTerminal.name)){
				throw new GLRException(String.format("Ambiguity while building the grammar: '%s' is the name of a " +
						"terminal and therefore can't be used as a non terminal name", nonTerminal.name));
			}
		}
		for (int i = 0; i < productions.size(); i++){
			Production production = productions.get(i);
			if (production.id != i){
				throw new GLRException(String.format("Production %s has id %d but is at index %d", production,
						production.id, i));
			}
			if (!nonTerminals.contains(production.left)){
				throw new UndeclaredSymbolException(production.left.name, "production " + production);
			}
			for (Symbol symbol : production.right){
				if (!(symbol.isTerminal() ? terminals.contains(symbol) : nonTerminals.contains(symbol))){
					throw new UndeclaredSymbolException(symbol.name, "production " + production);
				}
			}
		}
	}

	/**
	 * Returns a new grammar with a new start non terminal S' and the single production S' → S
	 * (assuming S is the current start non terminal). The new production is appended, so the ids of
	 * all other productions stay the same.
	 *
	 * @return new grammar
	 */
	public Grammar augment(){
		Set<String> names = new HashSet<>();
		for (NonTerminal nonTerminal : nonTerminals) {
			names.add(nonTerminal.name);
		}
		for (Terminal terminal : terminals){
			names.add(terminal.name);
		}
		String startName = this.start.name + "'";
		while (names.contains(startName)) {
			startName += "'";
		}
		NonTerminal newStart = new NonTerminal(startName);
		Set<NonTerminal> newNonTerminals = new LinkedHashSet<>(nonTerminals);
		newNonTerminals.add(newStart);
		List<Production> newProductions = new ArrayList<>(productions);
		List<Symbol> right = new ArrayList<>();
		right.add(start);
		newProductions.add(new Production(productions.size(), newStart, right));
		return new Grammar(terminals, newNonTerminals, newStart, newProductions);
	}

	/**
	 * Ordered productions with the passed non terminal on their left side
	 */
	public List<Production> productionsFor(NonTerminal nonTerminal) {
		List<Production> prods = productionsPerNonTerminal.get(nonTerminal);
		if (prods == null){
			throw new UndeclaredSymbolException(nonTerminal.name, "query");
		}
		return prods;
	}

	public boolean isTerminal(Symbol symbol){
		return symbol.isTerminal() && (terminals.contains(symbol) || symbol.equals(Terminal.END_MARKER));
	}

	public boolean isNullable(Symbol symbol){
		return sets.isNullable(symbol);
	}

	public Set<NonTerminal> nullableNonTerminals(){
		return sets.nullable();
	}

	public Set<Terminal> first(Symbol symbol){
		return sets.first(symbol);
	}

	public Set<Terminal> firstOfSequence(List<Symbol> symbols){
		return sets.first(symbols);
	}

	public Set<Terminal> follow(NonTerminal nonTerminal){
		return sets.follow(nonTerminal);
	}

	public FirstFollowSets getSets() {
		return sets;
	}

	public List<Production> getProductions(){
		return productions;
	}

	public Production getProductionForId(int id){
		return productions.get(id);
	}

	public NonTerminal getStart(){
		return start;
	}

	public Set<Terminal> getTerminals() {
		return terminals;
	}

	public Set<NonTerminal> getNonTerminals() {
		return nonTerminals;
	}

	public Terminal getTerminal(String name){
		Terminal terminal = new Terminal(name);
		if (!terminals.contains(terminal)){
			throw new UndeclaredSymbolException(name, "terminal lookup");
		}
		return terminal;
	}

	public NonTerminal getNonTerminal(String name){
		NonTerminal nonTerminal = new NonTerminal(name);
		if (!nonTerminals.contains(nonTerminal)){
			throw new UndeclaredSymbolException(name, "non terminal lookup");
		}
		return nonTerminal;
	}

	/**
	 * Converts the passed names into terminals of this grammar.
	 */
	public List<Terminal> terminals(String... names){
		List<Terminal> ret = new ArrayList<>(names.length);
		for (String name : names){
			ret.add(getTerminal(name));
		}
		return ret;
	}

	@Override
	public String toString() {
		return join(productions, "\n");
	}
}
