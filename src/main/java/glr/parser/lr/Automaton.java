package glr.parser.lr;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import glr.grammar.Grammar;
import glr.grammar.Production;
import glr.grammar.Symbol;
import glr.util.Utils;

/**
 * The canonical LR(0) automaton of a grammar: the states are closed item sets, the transitions
 * are the goto function. It's deterministic, but partial.
 *
 * Immutable after construction.
 */
public class Automaton implements Serializable {

	private static final Logger LOG = Logger.getLogger("Automaton");

	private final Grammar grammar;
	private final Grammar augmentedGrammar;
	private final List<State> states;

	private Automaton(Grammar grammar, Grammar augmentedGrammar, List<State> states) {
		this.grammar = grammar;
		this.augmentedGrammar = augmentedGrammar;
		this.states = Collections.unmodifiableList(states);
	}

	/**
	 * Builds the automaton for the augmented version of the passed grammar. The start state (id 0)
	 * is the closure of S' → • S, the other states are created by a worklist iteration and
	 * numbered in order of discovery.
	 */
	public static Automaton createFromGrammar(Grammar grammar){
		Grammar augmented = grammar.augment();
		Production startProduction = augmented.productionsFor(augmented.getStart()).get(0);
		List<State> states = new ArrayList<>();
		Map<Set<Item>, State> stateForItems = new HashMap<>();
		List<Item> startKernel = Utils.makeArrayList(new Item(startProduction));
		State startState = new State(0, State.closure(augmented, startKernel), startKernel);
		states.add(startState);
		stateForItems.put(startState.getItemSet(), startState);
		for (int i = 0; i < states.size(); i++){
			State currentState = states.get(i);
			for (Map.Entry<Symbol, List<Item>> entry : currentState.shift().entrySet()){
				Set<Item> closed = State.closure(augmented, entry.getValue());
				State target = stateForItems.get(closed);
				if (target == null){
					target = new State(states.size(), closed, entry.getValue());
					states.add(target);
					stateForItems.put(closed, target);
				}
				currentState.addTransition(entry.getKey(), target.id);
			}
		}
		Automaton automaton = new Automaton(grammar, augmented, states);
		if (LOG.isLoggable(Level.FINE)){
			LOG.fine(String.format("LR(0) automaton with %d states and %d transitions", automaton.stateCount(),
					automaton.transitionCount()));
		}
		return automaton;
	}

	public State getState(int id){
		return states.get(id);
	}

	public State getStartState(){
		return states.get(0);
	}

	public List<State> getStates() {
		return states;
	}

	public int stateCount(){
		return states.size();
	}

	public int transitionCount(){
		int count = 0;
		for (State state : states){
			count += state.getAdjacentStates().size();
		}
		return count;
	}

	/**
	 * @return id of the next state or null if there is no transition
	 */
	public Integer goTo(int state, Symbol symbol){
		return states.get(state).goTo(symbol);
	}

	/**
	 * The grammar the automaton was created for
	 */
	public Grammar getGrammar() {
		return grammar;
	}

	/**
	 * The grammar with the additional start production, the automaton items refer to its productions
	 */
	public Grammar getAugmentedGrammar() {
		return augmentedGrammar;
	}

	/**
	 * Creates the SLR(1) parser table, its cells may contain several actions.
	 */
	public ParserTable toParserTable(){
		return ParserTable.create(this);
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (State state : states){
			if (state.id != 0){
				builder.append("\n–––––––\n");
			}
			builder.append(state);
			for (Map.Entry<Symbol, Integer> entry : state.getAdjacentStates().entrySet()){
				builder.append("\n  ").append(entry.getKey()).append(" ⇒ ").append(entry.getValue());
			}
		}
		return builder.toString();
	}
}
