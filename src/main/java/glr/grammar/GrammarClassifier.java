package glr.grammar;

import java.util.List;
import java.util.Set;

import org.jgrapht.alg.cycle.CycleDetector;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;

/**
 * Structural properties of grammars that break naive parsers: epsilon productions, left recursion
 * and cycles (A ⇒+ A).
 */
public class GrammarClassifier {

	public static boolean hasEpsilonProductions(Grammar grammar){
		for (Production production : grammar.getProductions()){
			if (production.isEpsilonProduction()){
				return true;
			}
		}
		return false;
	}

	/**
	 * Is there a non terminal A with A ⇒+ A α? The derivation might go through nullable prefixes.
	 */
	public static boolean isLeftRecursive(Grammar grammar){
		DefaultDirectedGraph<NonTerminal, DefaultEdge> graph = createGraph(grammar);
		for (Production production : grammar.getProductions()){
			for (Symbol symbol : production.right){
				if (symbol.isTerminal()){
					break;
				}
				graph.addEdge(production.left, (NonTerminal)symbol);
				if (!grammar.isNullable(symbol)){
					break;
				}
			}
		}
		return hasCycle(graph);
	}

	/**
	 * Is there a non terminal A with A ⇒+ A?
	 */
	public static boolean isCyclic(Grammar grammar){
		return hasCycle(unitDerivationGraph(grammar));
	}

	/**
	 * Graph with an edge A → B for every production A → α B β with nullable α and β
	 */
	public static DefaultDirectedGraph<NonTerminal, DefaultEdge> unitDerivationGraph(Grammar grammar){
		DefaultDirectedGraph<NonTerminal, DefaultEdge> graph = createGraph(grammar);
		for (Production production : grammar.getProductions()){
			List<Symbol> right = production.right;
			for (int i = 0; i < right.size(); i++){
				if (right.get(i).isTerminal()){
					continue;
				}
				boolean restNullable = true;
				for (int j = 0; j < right.size() && restNullable; j++){
					restNullable = j == i || grammar.isNullable(right.get(j));
				}
				if (restNullable){
					graph.addEdge(production.left, (NonTerminal)right.get(i));
				}
			}
		}
		return graph;
	}

	/**
	 * Non terminals that are part of a cycle
	 */
	public static Set<NonTerminal> cyclicNonTerminals(Grammar grammar){
		return new CycleDetector<>(unitDerivationGraph(grammar)).findCycles();
	}

	private static DefaultDirectedGraph<NonTerminal, DefaultEdge> createGraph(Grammar grammar){
		DefaultDirectedGraph<NonTerminal, DefaultEdge> graph = new DefaultDirectedGraph<>(DefaultEdge.class);
		for (NonTerminal nonTerminal : grammar.getNonTerminals()){
			graph.addVertex(nonTerminal);
		}
		return graph;
	}

	private static boolean hasCycle(DefaultDirectedGraph<NonTerminal, DefaultEdge> graph){
		for (DefaultEdge edge : graph.edgeSet()){
			if (graph.getEdgeSource(edge).equals(graph.getEdgeTarget(edge))){
				return true;
			}
		}
		return new CycleDetector<>(graph).detectCycles();
	}
}
