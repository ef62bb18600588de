package glr.parser.glr;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

import glr.Config;
import glr.GLRException;
import glr.grammar.NonTerminal;
import glr.grammar.Production;
import glr.grammar.Terminal;
import glr.parser.forest.Derivation;
import glr.parser.forest.Forest;
import glr.parser.forest.SymbolNode;
import glr.parser.forest.TerminalNode;
import glr.parser.glr.GraphStructuredStack.Edge;
import glr.parser.glr.GraphStructuredStack.Path;
import glr.parser.glr.GraphStructuredStack.StackNode;
import glr.parser.lr.ParserTable;

/**
 * Generalized LR parser (Tomita's algorithm with Farshi's correction) that works for every context free
 * grammar, including grammars with epsilon productions, cycles and ambiguities.
 *
 * All stacks are kept in a {@link GraphStructuredStack}, the results in a shared packed parse
 * {@link Forest}. On every input position all reductions are applied till nothing changes, then all
 * stacks shift the next terminal. A stack without an action simply dies.
 *
 * A parser instance is used for a single parse, the table can be shared between parsers.
 * The input can either be passed at once ({@link #parse(List)}) or terminal by terminal
 * ({@link #feed(Terminal)}, followed by {@link #finish()}).
 */
public class GLRParser {

	private static final Logger LOG = Logger.getLogger("GLRParser");

	private static class ReduceTask {
		final StackNode node;
		final Production production;
		/**
		 * Only paths through this edge are considered if it isn't null
		 */
		final Edge requiredEdge;

		ReduceTask(StackNode node, Production production, Edge requiredEdge) {
			this.node = node;
			this.production = production;
			this.requiredEdge = requiredEdge;
		}
	}

	private final ParserTable table;

	private final NonTerminal start;

	private final GraphStructuredStack stack = new GraphStructuredStack();

	private final Forest forest = new Forest();

	private final boolean logSteps = Config.logSteps();

	/**
	 * Number of consumed terminals
	 */
	private int position = 0;

	private Status status = Status.RUNNING;

	private SymbolNode root;

	public GLRParser(ParserTable table){
		this.table = table;
		this.start = table.getAutomaton().getGrammar().getStart();
		stack.createNode(0, 0);
	}

	/**
	 * Parses the input with a new parser
	 *
	 * @return root of the forest, it spans the whole input
	 * @throws NoParseException if the input isn't a sentence of the grammar
	 */
	public static SymbolNode parse(ParserTable table, List<Terminal> input){
		return new GLRParser(table).parse(input);
	}

	/**
	 * Is the input a sentence of the grammar?
	 */
	public static boolean accepts(ParserTable table, List<Terminal> input){
		try {
			parse(table, input);
			return true;
		} catch (NoParseException ex){
			return false;
		}
	}

	public SymbolNode parse(List<Terminal> input){
		return parse(input.iterator());
	}

	public SymbolNode parse(Iterator<Terminal> input){
		if (position != 0 || status != Status.RUNNING){
			throw new IllegalStateException("The parser has already been used");
		}
		while (input.hasNext()){
			feed(input.next());
		}
		return finish();
	}

	/**
	 * Consumes the next terminal of the input
	 *
	 * @throws NoParseException if no stack can shift the terminal
	 */
	public void feed(Terminal terminal){
		checkRunning();
		if (terminal.isEndMarker()){
			throw new GLRException("The end marker can't be fed, call finish() instead");
		}
		log(() -> String.format("Position %d, lookahead %s, states %s", position, terminal, activeStates()));
		reduceAll(terminal);
		shift(terminal);
		position++;
	}

	/**
	 * Processes the end of the input
	 *
	 * @return root of the forest, it spans the whole input
	 * @throws NoParseException if no stack accepts
	 */
	public SymbolNode finish(){
		checkRunning();
		log(() -> String.format("Position %d, end of input, states %s", position, activeStates()));
		reduceAll(Terminal.END_MARKER);
		boolean accepted = false;
		for (StackNode node : stack.nodesAt(position)){
			if (table.actions(node.state, Terminal.END_MARKER).contains(ParserTable.Accept.INSTANCE)){
				log(() -> "Accept in " + node);
				accepted = true;
			}
		}
		if (!accepted){
			status = Status.REJECTED;
			throw new NoParseException(position, null, expectedTerminals());
		}
		root = forest.getSymbolNode(start, 0, position);
		if (root == null){
			throw new Error(String.format("Accepted without a node for %s[0, %d)", start, position));
		}
		status = Status.ACCEPTED;
		if (LOG.isLoggable(Level.FINE)){
			LOG.fine(String.format("Accepted %d terminals, graph structured stack with %d nodes and %d edges, " +
					"forest with %d nodes", position, stack.size(), stack.edgeCount(), forest.size()));
		}
		return root;
	}

	/**
	 * Cancels the parse, the parser can't be used afterwards
	 */
	public void abort(){
		if (status == Status.RUNNING){
			log(() -> "Abort at position " + position);
			status = Status.REJECTED;
		}
	}

	private void checkRunning(){
		if (status != Status.RUNNING){
			throw new IllegalStateException("The parse is already finished: " + status);
		}
	}

	/**
	 * Applies all reductions for the lookahead on the current level till nothing changes.
	 * Every stack node exists only once per level and every edge is added only once, a reduction is only
	 * repeated if a new edge creates new paths, therefore the loop terminates even for cyclic grammars.
	 */
	private void reduceAll(Terminal lookahead){
		Deque<ReduceTask> worklist = new ArrayDeque<>();
		for (StackNode node : new ArrayList<>(stack.nodesAt(position))){
			enqueueReductions(node, lookahead, null, true, worklist);
		}
		while (!worklist.isEmpty()){
			reduce(worklist.poll(), lookahead, worklist);
		}
	}

	/**
	 * @param includeEpsilon epsilon reductions don't use edges, they are only enqueued for new nodes
	 */
	private void enqueueReductions(StackNode node, Terminal lookahead, Edge requiredEdge, boolean includeEpsilon,
	                               Deque<ReduceTask> worklist){
		for (ParserTable.Action action : table.actions(node.state, lookahead)){
			switch (action.kind()){
				case REDUCE:
					Production production = ((ParserTable.Reduce)action).production;
					if (!production.isEpsilonProduction() || includeEpsilon){
						worklist.add(new ReduceTask(node, production, requiredEdge));
					}
					break;
				case SHIFT:
				case ACCEPT:
					break;
			}
		}
	}

	private void reduce(ReduceTask task, Terminal lookahead, Deque<ReduceTask> worklist){
		Production production = task.production;
		List<Path> paths;
		if (production.isEpsilonProduction()){
			paths = Collections.singletonList(new Path(task.node, Collections.emptyList()));
		} else {
			paths = stack.paths(task.node, production.rightSize(), task.requiredEdge);
		}
		for (Path path : paths){
			Integer next = table.goTo(path.ancestor.state, production.left);
			if (next == null){
				throw new Error(String.format("No goto for state %d and %s", path.ancestor.state, production.left));
			}
			SymbolNode symbolNode = forest.symbolNode(production.left, path.ancestor.level, position);
			if (symbolNode.addDerivation(new Derivation(production, path.labels))){
				log(() -> String.format("Reduce %s in %s to %s", production, task.node, symbolNode.spanString()));
			}
			StackNode target = stack.getNode(next, position);
			if (target == null){
				target = stack.createNode(next, position);
				stack.addEdge(target, path.ancestor, symbolNode);
				enqueueReductions(target, lookahead, null, true, worklist);
			} else {
				Edge edge = stack.addEdge(target, path.ancestor, symbolNode);
				if (edge != null){
					for (StackNode node : new ArrayList<>(stack.nodesAt(position))){
						enqueueReductions(node, lookahead, edge, false, worklist);
					}
				}
			}
		}
	}

	/**
	 * Shifts the terminal on every stack that can shift it. Several shift targets for one node are
	 * handled like stacks of their own.
	 */
	private void shift(Terminal terminal){
		TerminalNode leaf = null;
		int nextLevel = position + 1;
		for (StackNode node : new ArrayList<>(stack.nodesAt(position))){
			for (ParserTable.Action action : table.actions(node.state, terminal)){
				if (action.kind() == ParserTable.Kind.SHIFT){
					if (leaf == null){
						leaf = forest.terminalNode(terminal, position);
					}
					int nextState = ((ParserTable.Shift)action).state;
					StackNode target = stack.getNode(nextState, nextLevel);
					if (target == null){
						target = stack.createNode(nextState, nextLevel);
					}
					stack.addEdge(target, node, leaf);
					log(() -> String.format("Shift %s from %s to state %d", terminal, node, nextState));
				}
			}
		}
		if (leaf == null){
			status = Status.REJECTED;
			throw new NoParseException(position, terminal, expectedTerminals());
		}
	}

	/**
	 * Terminals for which at least one stack on the current level has an action
	 */
	public Set<Terminal> expectedTerminals(){
		Set<Terminal> expected = new TreeSet<>();
		for (StackNode node : stack.nodesAt(position)){
			expected.addAll(table.expectedTerminals(node.state));
		}
		return expected;
	}

	/**
	 * Automaton states of the stack nodes on the current level
	 */
	public List<Integer> activeStates(){
		List<Integer> states = new ArrayList<>();
		for (StackNode node : stack.nodesAt(position)){
			states.add(node.state);
		}
		return states;
	}

	private void log(Supplier<String> msgProducer){
		if (logSteps){
			LOG.info(msgProducer.get());
		} else if (LOG.isLoggable(Level.FINER)){
			LOG.finer(msgProducer.get());
		}
	}

	public Status getStatus() {
		return status;
	}

	public int getPosition() {
		return position;
	}

	/**
	 * @throws IllegalStateException if the parse hasn't been accepted
	 */
	public SymbolNode getRoot() {
		if (status != Status.ACCEPTED){
			throw new IllegalStateException("No root available, the parse is " + status);
		}
		return root;
	}

	public Forest getForest() {
		return forest;
	}

	public GraphStructuredStack getStack() {
		return stack;
	}

	public ParserTable getTable() {
		return table;
	}
}
