package glr.parser.lr;

import java.io.Serializable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

import glr.grammar.Grammar;
import glr.grammar.NonTerminal;
import glr.grammar.Production;
import glr.grammar.Symbol;
import glr.grammar.Terminal;

/**
 * SLR(1) parser table whose action cells are sets of actions. Shift-reduce and reduce-reduce
 * conflicts are kept, the GLR parser explores all actions of a cell.
 */
public class ParserTable implements Serializable {

	private static final Logger LOG = Logger.getLogger("ParserTable");

	private final Automaton automaton;

	/**
	 * Mapping of terminal to actions for each state.
	 */
	private final List<Map<Terminal, Set<Action>>> actionTable;

	/**
	 * Mapping of non terminal to next state (for each state).
	 */
	private final List<Map<NonTerminal, Integer>> gotoTable;

	private ParserTable(Automaton automaton, List<Map<Terminal, Set<Action>>> actionTable,
	                    List<Map<NonTerminal, Integer>> gotoTable) {
		this.automaton = automaton;
		this.actionTable = actionTable;
		this.gotoTable = gotoTable;
	}

	public enum Kind {
		SHIFT, REDUCE, ACCEPT
	}

	public static abstract class Action implements Serializable {

		public abstract Kind kind();
	}

	public static class Shift extends Action {

		public final int state;

		public Shift(int state) {
			this.state = state;
		}

		@Override
		public Kind kind() {
			return Kind.SHIFT;
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof Shift && ((Shift)obj).state == state;
		}

		@Override
		public int hashCode() {
			return state;
		}

		@Override
		public String toString() {
			return "sh" + state;
		}
	}

	public static class Reduce extends Action {

		public final Production production;

		public Reduce(Production production) {
			this.production = production;
		}

		@Override
		public Kind kind() {
			return Kind.REDUCE;
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof Reduce && ((Reduce)obj).production.equals(production);
		}

		@Override
		public int hashCode() {
			return production.hashCode() + 1;
		}

		@Override
		public String toString() {
			return "re" + production.id;
		}
	}

	public static class Accept extends Action {

		public static final Accept INSTANCE = new Accept();

		private Accept() {
		}

		@Override
		public Kind kind() {
			return Kind.ACCEPT;
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof Accept;
		}

		@Override
		public int hashCode() {
			return -1;
		}

		@Override
		public String toString() {
			return "acc";
		}

		private Object readResolve() {
			return INSTANCE;
		}
	}

	/**
	 * A table cell with more than one action
	 */
	public static class Conflict {

		public final int state;
		public final Terminal terminal;
		public final Set<Action> actions;

		Conflict(int state, Terminal terminal, Set<Action> actions) {
			this.state = state;
			this.terminal = terminal;
			this.actions = actions;
		}

		public boolean isShiftReduce(){
			return actions.stream().anyMatch(a -> a.kind() == Kind.SHIFT) &&
					actions.stream().anyMatch(a -> a.kind() == Kind.REDUCE);
		}

		@Override
		public String toString() {
			return String.format("state %d at terminal %s: %s", state, terminal, actions);
		}
	}

	/**
	 * Creates the table:
	 * <ul>
	 *     <li>[A → α • a β] in state s with goto(s, a) = t: shift t at (s, a)</li>
	 *     <li>[A → α •] in state s: reduce A → α at (s, t) for every t in Follow(A),
	 *     or accept at (s, $) if A is the augmented start symbol</li>
	 *     <li>goto(s, B) = t for a non terminal B: goto table entry</li>
	 * </ul>
	 * Building the table never fails, an empty cell is a syntax error while parsing.
	 */
	static ParserTable create(Automaton automaton){
		Grammar grammar = automaton.getAugmentedGrammar();
		List<Map<Terminal, Set<Action>>> actionTable = new ArrayList<>();
		List<Map<NonTerminal, Integer>> gotoTable = new ArrayList<>();
		for (State state : automaton.getStates()){
			Map<Terminal, Set<Action>> row = new LinkedHashMap<>();
			Map<NonTerminal, Integer> gotoRow = new LinkedHashMap<>();
			for (Map.Entry<Symbol, Integer> entry : state.getAdjacentStates().entrySet()){
				if (entry.getKey().isTerminal()){
					insert(row, (Terminal)entry.getKey(), new Shift(entry.getValue()));
				} else {
					gotoRow.put((NonTerminal)entry.getKey(), entry.getValue());
				}
			}
			for (Item item : state.getCompletedItems()){
				NonTerminal left = item.left();
				if (left.equals(grammar.getStart())){
					insert(row, Terminal.END_MARKER, Accept.INSTANCE);
				} else {
					for (Terminal terminal : grammar.follow(left)){
						insert(row, terminal, new Reduce(item.production));
					}
				}
			}
			actionTable.add(freezeRow(row));
			gotoTable.add(Collections.unmodifiableMap(gotoRow));
		}
		ParserTable table = new ParserTable(automaton, Collections.unmodifiableList(actionTable),
				Collections.unmodifiableList(gotoTable));
		if (LOG.isLoggable(Level.FINE)){
			for (Conflict conflict : table.conflicts()){
				LOG.fine("Conflict in " + conflict);
			}
		}
		return table;
	}

	private static void insert(Map<Terminal, Set<Action>> row, Terminal terminal, Action action){
		row.computeIfAbsent(terminal, t -> new LinkedHashSet<>()).add(action);
	}

	private static Map<Terminal, Set<Action>> freezeRow(Map<Terminal, Set<Action>> row){
		Map<Terminal, Set<Action>> ret = new LinkedHashMap<>();
		for (Map.Entry<Terminal, Set<Action>> entry : row.entrySet()){
			ret.put(entry.getKey(), Collections.unmodifiableSet(entry.getValue()));
		}
		return Collections.unmodifiableMap(ret);
	}

	/**
	 * @return actions for the state and the lookahead, an empty set signals a syntax error
	 */
	public Set<Action> actions(int state, Terminal terminal){
		return actionTable.get(state).getOrDefault(terminal, Collections.emptySet());
	}

	/**
	 * @return next state after a reduction to the non terminal or null if there is none
	 */
	public Integer goTo(int state, NonTerminal nonTerminal){
		return gotoTable.get(state).get(nonTerminal);
	}

	public Map<Terminal, Set<Action>> actionRow(int state){
		return actionTable.get(state);
	}

	public Map<NonTerminal, Integer> gotoRow(int state){
		return gotoTable.get(state);
	}

	/**
	 * Terminals with a non empty cell in the passed state, used for error messages
	 */
	public Set<Terminal> expectedTerminals(int state){
		return actionTable.get(state).keySet();
	}

	public int stateCount(){
		return actionTable.size();
	}

	public Automaton getAutomaton() {
		return automaton;
	}

	/**
	 * The augmented grammar the table belongs to
	 */
	public Grammar getGrammar(){
		return automaton.getAugmentedGrammar();
	}

	public List<Conflict> conflicts(){
		List<Conflict> conflicts = new ArrayList<>();
		for (int state = 0; state < actionTable.size(); state++){
			for (Map.Entry<Terminal, Set<Action>> entry : actionTable.get(state).entrySet()){
				if (entry.getValue().size() > 1){
					conflicts.add(new Conflict(state, entry.getKey(), entry.getValue()));
				}
			}
		}
		return conflicts;
	}

	public boolean isDeterministic(){
		return conflicts().isEmpty();
	}

	/**
	 * Are both tables equal up to a renumbering of their states and productions? The states are matched
	 * starting with the start states by following the shift and goto entries.
	 */
	public boolean equivalent(ParserTable other){
		if (stateCount() != other.stateCount()){
			return false;
		}
		Map<Integer, Integer> mapping = new HashMap<>();
		Deque<Integer> queue = new ArrayDeque<>();
		mapping.put(0, 0);
		queue.add(0);
		while (!queue.isEmpty()){
			int s = queue.poll();
			int t = mapping.get(s);
			if (!nonShiftActions(actionRow(s)).equals(nonShiftActions(other.actionRow(t)))){
				return false;
			}
			Map<Symbol, Integer> successors = successors(s);
			Map<Symbol, Integer> otherSuccessors = other.successors(t);
			if (!successors.keySet().equals(otherSuccessors.keySet())){
				return false;
			}
			for (Map.Entry<Symbol, Integer> entry : successors.entrySet()){
				int ss = entry.getValue();
				int tt = otherSuccessors.get(entry.getKey());
				if (mapping.containsKey(ss)){
					if (mapping.get(ss) != tt){
						return false;
					}
				} else if (mapping.containsValue(tt)){
					return false;
				} else {
					mapping.put(ss, tt);
					queue.add(ss);
				}
			}
		}
		return true;
	}

	private Map<Symbol, Integer> successors(int state){
		Map<Symbol, Integer> ret = new HashMap<>(gotoRow(state));
		for (Map.Entry<Terminal, Set<Action>> entry : actionRow(state).entrySet()){
			for (Action action : entry.getValue()){
				if (action.kind() == Kind.SHIFT){
					ret.put(entry.getKey(), ((Shift)action).state);
				}
			}
		}
		return ret;
	}

	/**
	 * Reduce and accept actions per terminal, reductions are identified by their production without its id
	 */
	private static Map<Terminal, Set<String>> nonShiftActions(Map<Terminal, Set<Action>> row){
		Map<Terminal, Set<String>> ret = new HashMap<>();
		for (Map.Entry<Terminal, Set<Action>> entry : row.entrySet()){
			for (Action action : entry.getValue()){
				if (action.kind() != Kind.SHIFT){
					String description = action.kind() == Kind.REDUCE ? ((Reduce)action).production.toString() : action.toString();
					ret.computeIfAbsent(entry.getKey(), t -> new HashSet<>()).add(description);
				}
			}
		}
		return ret;
	}

	/**
	 * Table with one row per state and one column per terminal (including $) and non terminal,
	 * the columns are evenly spaced.
	 */
	@Override
	public String toString() {
		Grammar grammar = getGrammar();
		List<Symbol> symbols = new ArrayList<>(new TreeSet<>(grammar.getTerminals()));
		symbols.add(Terminal.END_MARKER);
		for (NonTerminal nonTerminal : new TreeSet<>(grammar.getNonTerminals())){
			if (!nonTerminal.equals(grammar.getStart())){
				symbols.add(nonTerminal);
			}
		}
		List<List<String>> rows = new ArrayList<>();
		List<String> header = new ArrayList<>();
		header.add("");
		for (Symbol symbol : symbols){
			header.add(symbol.toString());
		}
		rows.add(header);
		for (int state = 0; state < stateCount(); state++){
			List<String> row = new ArrayList<>();
			row.add(String.valueOf(state));
			for (Symbol symbol : symbols){
				if (symbol.isTerminal()){
					List<String> cell = new ArrayList<>();
					for (Action action : actions(state, (Terminal)symbol)){
						cell.add(action.toString());
					}
					row.add(String.join(",", cell));
				} else {
					Integer next = goTo(state, (NonTerminal)symbol);
					row.add(next == null ? "" : next.toString());
				}
			}
			rows.add(row);
		}
		int[] widths = new int[header.size()];
		for (List<String> row : rows){
			for (int i = 0; i < row.size(); i++){
				widths[i] = Math.max(widths[i], row.get(i).length() + 1);
			}
		}
		StringBuilder builder = new StringBuilder();
		for (List<String> row : rows){
			if (builder.length() > 0){
				builder.append("\n");
			}
			StringBuilder line = new StringBuilder();
			for (int i = 0; i < row.size(); i++){
				line.append(String.format("%-" + Math.max(widths[i], 6) + "s", row.get(i)));
			}
			builder.append(line.toString().replaceAll("\\s+$", ""));
		}
		return builder.toString();
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof ParserTable)){
			return false;
		}
		ParserTable other = (ParserTable)obj;
		return actionTable.equals(other.actionTable) && gotoTable.equals(other.gotoTable);
	}

	@Override
	public int hashCode() {
		return Objects.hash(actionTable, gotoTable);
	}
}
