package glr.parser.glr;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import glr.parser.forest.ForestNode;

/**
 * Graph structured stack: the stacks of all parse threads merged into one graph. The nodes live in
 * an arena and are addressed by their index, there is at most one node per (automaton state, level).
 *
 * An edge leads from a node to its predecessor (the node below it on the stack) and is labelled with
 * the forest node of the symbol that lies between the levels of both nodes.
 */
public class GraphStructuredStack {

	public static class StackNode {

		public final int index;

		public final int state;

		/**
		 * Number of terminals consumed when this node was created
		 */
		public final int level;

		/**
		 * predecessor index → label
		 */
		private final Map<Integer, ForestNode> predecessors = new LinkedHashMap<>();

		private final Set<Integer> successors = new LinkedHashSet<>();

		StackNode(int index, int state, int level) {
			this.index = index;
			this.state = state;
			this.level = level;
		}

		public Map<Integer, ForestNode> getPredecessors() {
			return Collections.unmodifiableMap(predecessors);
		}

		public Set<Integer> getSuccessors() {
			return Collections.unmodifiableSet(successors);
		}

		@Override
		public String toString() {
			return String.format("v%d(state %d, level %d)", index, state, level);
		}
	}

	/**
	 * Edge from a node to its predecessor
	 */
	public static class Edge {

		public final StackNode from;
		public final StackNode to;
		public final ForestNode label;

		Edge(StackNode from, StackNode to, ForestNode label) {
			this.from = from;
			this.to = to;
			this.label = label;
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof Edge && ((Edge)obj).from == from && ((Edge)obj).to == to;
		}

		@Override
		public int hashCode() {
			return from.index * 31 + to.index;
		}

		@Override
		public String toString() {
			return String.format("%s → %s [%s]", from, to, label);
		}
	}

	/**
	 * A path of reduction length through the stack, it starts at the node the reduction is applied to
	 */
	public static class Path {

		/**
		 * The node at the end of the path, the stack top after popping
		 */
		public final StackNode ancestor;

		/**
		 * Edge labels from left to right (i.e. from the ancestor to the start node)
		 */
		public final List<ForestNode> labels;

		Path(StackNode ancestor, List<ForestNode> labels) {
			this.ancestor = ancestor;
			this.labels = labels;
		}

		@Override
		public String toString() {
			return ancestor + " " + labels;
		}
	}

	private final List<StackNode> nodes = new ArrayList<>();

	/**
	 * level → (state → node)
	 */
	private final List<Map<Integer, StackNode>> levels = new ArrayList<>();

	private int edgeCount = 0;

	/**
	 * Creates a new node, there must be no node for the state on the level yet
	 */
	public StackNode createNode(int state, int level){
		while (levels.size() <= level){
			levels.add(new LinkedHashMap<>());
		}
		if (levels.get(level).containsKey(state)){
			throw new Error(String.format("Node for state %d on level %d already exists", state, level));
		}
		StackNode node = new StackNode(nodes.size(), state, level);
		nodes.add(node);
		levels.get(level).put(state, node);
		return node;
	}

	/**
	 * @return the node or null if there is no node for the state on the level
	 */
	public StackNode getNode(int state, int level){
		if (level >= levels.size()){
			return null;
		}
		return levels.get(level).get(state);
	}

	public StackNode getNode(int index){
		return nodes.get(index);
	}

	/**
	 * Adds the edge from → to if it doesn't exist
	 *
	 * @return the new edge or null if the nodes were already connected
	 */
	public Edge addEdge(StackNode from, StackNode to, ForestNode label){
		if (from.predecessors.containsKey(to.index)){
			if (from.predecessors.get(to.index) != label){
				throw new Error(String.format("Edge %s → %s has already the label %s, not %s", from, to,
						from.predecessors.get(to.index), label));
			}
			return null;
		}
		from.predecessors.put(to.index, label);
		to.successors.add(from.index);
		edgeCount++;
		return new Edge(from, to, label);
	}

	/**
	 * Collects all paths of the passed length that start at the passed node
	 *
	 * @param requiredEdge if not null, only paths that contain this edge are collected
	 */
	public List<Path> paths(StackNode start, int length, Edge requiredEdge){
		List<Path> paths = new ArrayList<>();
		collectPaths(start, length, requiredEdge, requiredEdge == null, new ArrayList<>(), paths);
		return paths;
	}

	private void collectPaths(StackNode current, int remaining, Edge requiredEdge, boolean containsRequired,
	                          List<ForestNode> reversedLabels, List<Path> paths){
		if (remaining == 0){
			if (containsRequired){
				List<ForestNode> labels = new ArrayList<>(reversedLabels);
				Collections.reverse(labels);
				paths.add(new Path(current, labels));
			}
			return;
		}
		for (Map.Entry<Integer, ForestNode> entry : current.predecessors.entrySet()){
			StackNode predecessor = nodes.get(entry.getKey());
			boolean isRequired = requiredEdge != null && requiredEdge.from == current && requiredEdge.to == predecessor;
			reversedLabels.add(entry.getValue());
			collectPaths(predecessor, remaining - 1, requiredEdge, containsRequired || isRequired, reversedLabels, paths);
			reversedLabels.remove(reversedLabels.size() - 1);
		}
	}

	public Collection<StackNode> nodesAt(int level){
		if (level >= levels.size()){
			return Collections.emptyList();
		}
		return Collections.unmodifiableCollection(levels.get(level).values());
	}

	public List<StackNode> getNodes() {
		return Collections.unmodifiableList(nodes);
	}

	public int levelCount(){
		return levels.size();
	}

	public int size(){
		return nodes.size();
	}

	public int edgeCount(){
		return edgeCount;
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (StackNode node : nodes){
			if (builder.length() > 0){
				builder.append("\n");
			}
			builder.append(node);
			for (Map.Entry<Integer, ForestNode> entry : node.predecessors.entrySet()){
				builder.append("\n  → v").append(entry.getKey()).append(" [").append(entry.getValue().spanString())
						.append("]");
			}
		}
		return builder.toString();
	}
}
