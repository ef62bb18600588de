package glr.parser.lr;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import glr.grammar.Grammar;
import glr.grammar.NonTerminal;
import glr.grammar.Production;
import glr.grammar.Symbol;

/**
 * A state of the LR(0) automaton: a closed set of items together with its outgoing transitions.
 *
 * Two states are the same if their closed item sets are equal.
 */
public class State implements Serializable, Comparable<State> {

	public final int id;

	private final List<Item> items;

	private final Set<Item> itemSet;

	private final List<Item> kernelItems;

	private final Map<Symbol, Integer> adjacentStates = new LinkedHashMap<>();

	State(int id, Set<Item> closedItems, Collection<Item> kernelItems) {
		this.id = id;
		this.itemSet = Collections.unmodifiableSet(closedItems);
		this.items = Collections.unmodifiableList(new ArrayList<>(closedItems));
		this.kernelItems = Collections.unmodifiableList(new ArrayList<>(kernelItems));
	}

	/**
	 * Closure of a set of items: for every item in front of a non terminal B all items B → • γ are
	 * added, till nothing changes. Completed items (including epsilon items) don't add anything.
	 *
	 * @return closed item set, kernel items first
	 */
	public static Set<Item> closure(Grammar grammar, Collection<Item> kernel){
		LinkedHashSet<Item> result = new LinkedHashSet<>(kernel);
		List<Item> worklist = new ArrayList<>(kernel);
		Set<NonTerminal> expanded = new LinkedHashSet<>();
		for (int i = 0; i < worklist.size(); i++){
			Item item = worklist.get(i);
			if (item.inFrontOfNonTerminal()){
				NonTerminal n = (NonTerminal)item.nextSymbol();
				if (expanded.add(n)){
					for (Production prod : grammar.productionsFor(n)){
						Item newItem = new Item(prod);
						if (result.add(newItem)){
							worklist.add(newItem);
						}
					}
				}
			}
		}
		return result;
	}

	/**
	 * Kernel items of the goto state for every symbol that appears after a dot, grouped by symbol
	 * in order of appearance.
	 */
	Map<Symbol, List<Item>> shift(){
		Map<Symbol, List<Item>> kernels = new LinkedHashMap<>();
		for (Item item : items){
			if (item.canAdvance()){
				kernels.computeIfAbsent(item.nextSymbol(), s -> new ArrayList<>()).add(item.advance());
			}
		}
		return kernels;
	}

	void addTransition(Symbol symbol, int state){
		adjacentStates.put(symbol, state);
	}

	/**
	 * @return id of the state reached via the passed symbol or null if there is no such transition
	 */
	public Integer goTo(Symbol symbol){
		return adjacentStates.get(symbol);
	}

	public Map<Symbol, Integer> getAdjacentStates() {
		return Collections.unmodifiableMap(adjacentStates);
	}

	public List<Item> getItems() {
		return items;
	}

	public Set<Item> getItemSet() {
		return itemSet;
	}

	public List<Item> getKernelItems() {
		return kernelItems;
	}

	/**
	 * Items with the dot at the end, the reduce candidates
	 */
	public List<Item> getCompletedItems(){
		List<Item> ret = new ArrayList<>();
		for (Item item : items){
			if (item.atEnd()){
				ret.add(item);
			}
		}
		return ret;
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		List<Item> tempItems = new ArrayList<>(items);
		Collections.sort(tempItems);
		for (int j = 0; j < tempItems.size(); j++) {
			if (j != 0){
				builder.append("\n");
			}
			builder.append("- ").append(tempItems.get(j));
		}
		return "State " + id + "\n" + builder;
	}

	@Override
	public int compareTo(State o) {
		return Integer.compare(id, o.id);
	}
}
