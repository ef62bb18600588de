package glr.grammar;

import java.io.Serializable;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Nullable non terminals, first(1) and follow(1) sets of a grammar.
 *
 * All sets are calculated by fix point iterations over the productions: each pass adds to the sets,
 * the iteration stops after the first pass that didn't change anything. The sets only grow and are bounded
 * by the finite set of terminals, therefore cyclic grammars are no problem.
 */
public class FirstFollowSets implements Serializable {

	private final Set<NonTerminal> nullable;
	private final Map<NonTerminal, Set<Terminal>> first;
	private final Map<NonTerminal, Set<Terminal>> follow;

	public FirstFollowSets(Collection<NonTerminal> nonTerminals, List<Production> productions, NonTerminal start) {
		this.nullable = Collections.unmodifiableSet(calculateNullable(productions));
		this.first = freeze(calculateFirst(nonTerminals, productions));
		this.follow = freeze(calculateFollow(nonTerminals, productions, start));
	}

	/**
	 * Calculate the non terminals that can derive the empty word.
	 */
	private static Set<NonTerminal> calculateNullable(List<Production> productions){
		Set<NonTerminal> epsSet = new LinkedHashSet<>();
		boolean somethingChanged;
		do {
			somethingChanged = false;
			for (Production prod : productions) {
				if (epsSet.contains(prod.left)){
					continue;
				}
				boolean allNullable = true;
				for (Symbol sym : prod.right){
					if (sym.isTerminal() || !epsSet.contains(sym)){
						allNullable = false;
						break;
					}
				}
				if (allNullable){
					somethingChanged = epsSet.add(prod.left) || somethingChanged;
				}
			}
		} while (somethingChanged);
		return epsSet;
	}

	private Map<NonTerminal, Set<Terminal>> calculateFirst(Collection<NonTerminal> nonTerminals,
	                                                      List<Production> productions){
		Map<NonTerminal, Set<Terminal>> first = new HashMap<>();
		for (NonTerminal nonTerminal : nonTerminals){
			first.put(nonTerminal, new LinkedHashSet<>());
		}
		boolean firstChanged;
		do {
			firstChanged = false;
			for (Production production : productions){
				Set<Terminal> leftSet = first.get(production.left);
				for (Symbol symbol : production.right){
					if (symbol.isTerminal()){
						firstChanged = leftSet.add((Terminal)symbol) || firstChanged;
						break;
					}
					firstChanged = leftSet.addAll(first.get(symbol)) || firstChanged;
					if (!nullable.contains(symbol)){
						break;
					}
				}
			}
		} while (firstChanged);
		return first;
	}

	/**
	 * Calculate the follow 1 set for all non terminals
	 *
	 * First put $ (the end of input marker) in Follow(S) (S is the start symbol)
	 * If there is a production A → aBb, (where a can be a whole string) then everything in FIRST(b) is placed in FOLLOW(B).
	 * If there is a production A → aB, then everything in FOLLOW(A) is in FOLLOW(B)
	 * If there is a production A → aBb, where b is nullable, then everything in FOLLOW(A) is in FOLLOW(B)
	 */
	private Map<NonTerminal, Set<Terminal>> calculateFollow(Collection<NonTerminal> nonTerminals,
	                                                       List<Production> productions, NonTerminal start){
		Map<NonTerminal, Set<Terminal>> follow = new HashMap<>();
		for (NonTerminal nonTerminal : nonTerminals){
			follow.put(nonTerminal, new LinkedHashSet<>());
		}
		follow.get(start).add(Terminal.END_MARKER);
		boolean followChanged;
		do {
			followChanged = false;
			for (Production production : productions){
				Set<Terminal> lastFollow = new HashSet<>(follow.get(production.left));
				for (int i = production.right.size() - 1; i >= 0; i--){
					Symbol symbol = production.right.get(i);
					if (symbol.isNonTerminal()){
						NonTerminal rightPart = (NonTerminal)symbol;
						followChanged = follow.get(rightPart).addAll(lastFollow) || followChanged;
						if (!nullable.contains(rightPart)){
							lastFollow.clear();
						}
						lastFollow.addAll(first.get(rightPart));
					} else {
						lastFollow.clear();
						lastFollow.add((Terminal)symbol);
					}
				}
			}
		} while (followChanged);
		return follow;
	}

	private static Map<NonTerminal, Set<Terminal>> freeze(Map<NonTerminal, Set<Terminal>> sets){
		Map<NonTerminal, Set<Terminal>> ret = new HashMap<>();
		for (Map.Entry<NonTerminal, Set<Terminal>> entry : sets.entrySet()){
			ret.put(entry.getKey(), Collections.unmodifiableSet(entry.getValue()));
		}
		return Collections.unmodifiableMap(ret);
	}

	public Set<NonTerminal> nullable(){
		return nullable;
	}

	public boolean isNullable(Symbol symbol){
		return symbol.isNonTerminal() && nullable.contains(symbol);
	}

	public boolean isNullable(List<Symbol> symbols){
		for (Symbol symbol : symbols){
			if (!isNullable(symbol)){
				return false;
			}
		}
		return true;
	}

	/**
	 * First set of a single symbol, a terminal is its own first set.
	 */
	public Set<Terminal> first(Symbol symbol){
		if (symbol.isTerminal()){
			return Collections.singleton((Terminal)symbol);
		}
		return first.getOrDefault(symbol, Collections.emptySet());
	}

	/**
	 * First set of a sequence of symbols, empty for the empty sequence.
	 */
	public Set<Terminal> first(List<Symbol> symbols){
		Set<Terminal> set = new LinkedHashSet<>();
		for (Symbol symbol : symbols){
			set.addAll(first(symbol));
			if (!isNullable(symbol)){
				break;
			}
		}
		return set;
	}

	public Set<Terminal> follow(NonTerminal nonTerminal){
		return follow.getOrDefault(nonTerminal, Collections.emptySet());
	}

	public Map<NonTerminal, Set<Terminal>> followSets(){
		return follow;
	}
}
