package glr.parser.forest;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import glr.Config;
import glr.grammar.NonTerminal;

/**
 * Packed node: a non terminal that derives the input terminals [start, end) together with all found
 * derivations of this span. A node with more than one derivation is an ambiguity point.
 *
 * The derivations of cyclic grammars can refer back to the node itself (e.g. S → S), the tree
 * enumeration cuts these cycles.
 */
public class SymbolNode extends ForestNode {

	public final NonTerminal nonTerminal;

	private final Set<Derivation> derivations = new LinkedHashSet<>();

	SymbolNode(NonTerminal nonTerminal, int start, int end) {
		super(start, end);
		this.nonTerminal = nonTerminal;
	}

	@Override
	public NonTerminal symbol() {
		return nonTerminal;
	}

	/**
	 * @return true if the derivation wasn't already known
	 */
	public boolean addDerivation(Derivation derivation){
		if (!derivation.production.left.equals(nonTerminal)){
			throw new Error(String.format("%s can't be a derivation of %s", derivation.production, spanString()));
		}
		int derivationEnd = derivation.isEpsilon() ? start : derivation.children.get(derivation.children.size() - 1).end;
		int derivationStart = derivation.isEpsilon() ? start : derivation.children.get(0).start;
		if (derivationStart != start || derivationEnd != end){
			throw new Error(String.format("Derivation %s doesn't span %s", derivation, spanString()));
		}
		return derivations.add(derivation);
	}

	public Set<Derivation> getDerivations() {
		return Collections.unmodifiableSet(derivations);
	}

	/**
	 * Has this node more than one derivation? This doesn't imply that there is more than one tree,
	 * the additional derivations might be cyclic.
	 */
	public boolean isPacked(){
		return derivations.size() > 1;
	}

	/**
	 * Enumerates distinct acyclic derivation trees, at most {@link Config#maxTrees()}
	 */
	public List<ParseTree> trees(){
		return trees(Config.maxTrees());
	}

	/**
	 * Enumerates at most limit distinct acyclic derivation trees. A derivation that leads back to a
	 * node that is already part of the current tree branch is skipped.
	 */
	public List<ParseTree> trees(int limit){
		if (limit <= 0){
			throw new IllegalArgumentException("The limit has to be positive, got " + limit);
		}
		return trees(new ArrayList<>(), limit);
	}

	@Override
	List<ParseTree> trees(List<SymbolNode> path, int limit) {
		if (path.contains(this)){
			return Collections.emptyList();
		}
		path.add(this);
		List<ParseTree> result = new ArrayList<>();
		for (Derivation derivation : derivations){
			if (result.size() >= limit){
				break;
			}
			List<List<ParseTree>> childTrees = new ArrayList<>();
			boolean possible = true;
			for (ForestNode child : derivation.children){
				List<ParseTree> trees = child.trees(path, limit);
				if (trees.isEmpty()){
					possible = false;
					break;
				}
				childTrees.add(trees);
			}
			if (possible){
				combine(derivation, childTrees, new ArrayDeque<>(), result, limit);
			}
		}
		path.remove(path.size() - 1);
		return result;
	}

	/**
	 * Adds the cartesian product of the child trees to the result
	 */
	private void combine(Derivation derivation, List<List<ParseTree>> childTrees, Deque<ParseTree> current,
	                     List<ParseTree> result, int limit){
		if (result.size() >= limit){
			return;
		}
		if (current.size() == childTrees.size()){
			result.add(new TreeNode(derivation.production, new ArrayList<>(current), start, end));
			return;
		}
		for (ParseTree tree : childTrees.get(current.size())){
			current.addLast(tree);
			combine(derivation, childTrees, current, result, limit);
			current.removeLast();
		}
	}

	public int countTrees(int limit){
		return trees(limit).size();
	}

	/**
	 * Are there at least two distinct acyclic trees?
	 */
	public boolean isAmbiguous(){
		return countTrees(2) > 1;
	}

	/**
	 * All symbol nodes reachable from this node (including itself), in breadth first order
	 */
	public List<SymbolNode> reachableSymbolNodes(){
		List<SymbolNode> nodes = new ArrayList<>();
		Set<SymbolNode> visited = new LinkedHashSet<>();
		visited.add(this);
		nodes.add(this);
		for (int i = 0; i < nodes.size(); i++){
			for (Derivation derivation : nodes.get(i).derivations){
				for (ForestNode child : derivation.children){
					if (child instanceof SymbolNode && visited.add((SymbolNode)child)){
						nodes.add((SymbolNode)child);
					}
				}
			}
		}
		return nodes;
	}
}
