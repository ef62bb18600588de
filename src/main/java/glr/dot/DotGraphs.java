package glr.dot;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import guru.nidi.graphviz.attribute.Color;
import guru.nidi.graphviz.attribute.Label;
import guru.nidi.graphviz.attribute.Shape;
import guru.nidi.graphviz.attribute.Style;
import guru.nidi.graphviz.model.MutableGraph;
import guru.nidi.graphviz.model.MutableNode;
import guru.nidi.graphviz.model.Serializer;

import glr.Config;
import glr.GLRException;
import glr.grammar.Symbol;
import glr.parser.forest.Derivation;
import glr.parser.forest.ForestNode;
import glr.parser.forest.SymbolNode;
import glr.parser.glr.GraphStructuredStack;
import glr.parser.glr.GraphStructuredStack.StackNode;
import glr.parser.lr.Automaton;
import glr.parser.lr.Item;
import glr.parser.lr.State;

import static guru.nidi.graphviz.attribute.Attributes.attr;
import static guru.nidi.graphviz.model.Factory.mutGraph;
import static guru.nidi.graphviz.model.Factory.mutNode;
import static guru.nidi.graphviz.model.Factory.to;

/**
 * Graphviz graphs of the automaton, the graph structured stack and the parse forest.
 * The parser itself doesn't depend on this class, rendering the DOT files is up to the caller.
 */
public class DotGraphs {

	private static final Logger LOG = Logger.getLogger("DotGraphs");

	public static MutableGraph automatonGraph(String name, Automaton automaton){
		MutableGraph graph = mutGraph(name).setDirected(true);
		graph.graphAttrs().add(attr("rankdir", "LR"));
		Map<Integer, MutableNode> nodes = new HashMap<>();
		for (State state : automaton.getStates()){
			List<String> lines = new ArrayList<>();
			lines.add("State " + state.id);
			for (Item item : state.getItems()){
				lines.add(item.toString());
			}
			MutableNode node = mutNode("s" + state.id).add(Label.lines(lines.toArray(new String[0])), Shape.BOX);
			if (state.id == 0){
				node.add(Color.BLUE);
			}
			nodes.put(state.id, node);
			graph.add(node);
		}
		for (State state : automaton.getStates()){
			for (Map.Entry<Symbol, Integer> entry : state.getAdjacentStates().entrySet()){
				nodes.get(state.id).addLink(to(nodes.get(entry.getValue())).with(Label.of(entry.getKey().toString())));
			}
		}
		return graph;
	}

	/**
	 * The edges point from a node to its predecessors, they are labelled with the span of their forest node
	 */
	public static MutableGraph stackGraph(String name, GraphStructuredStack stack){
		MutableGraph graph = mutGraph(name).setDirected(true);
		graph.graphAttrs().add(attr("rankdir", "RL"));
		List<MutableNode> nodes = new ArrayList<>();
		for (StackNode stackNode : stack.getNodes()){
			MutableNode node = mutNode("v" + stackNode.index)
					.add(Label.lines("state " + stackNode.state, "level " + stackNode.level));
			nodes.add(node);
			graph.add(node);
		}
		for (StackNode stackNode : stack.getNodes()){
			for (Map.Entry<Integer, ForestNode> entry : stackNode.getPredecessors().entrySet()){
				nodes.get(stackNode.index).addLink(to(nodes.get(entry.getKey()))
						.with(Label.of(entry.getValue().spanString())));
			}
		}
		return graph;
	}

	/**
	 * Forest below the root: symbol nodes are ellipses, terminal nodes rectangles. The derivations of a
	 * packed node are drawn as red points between the node and its children.
	 */
	public static MutableGraph forestGraph(String name, SymbolNode root){
		MutableGraph graph = mutGraph(name).setDirected(true);
		Map<ForestNode, MutableNode> nodes = new HashMap<>();
		int derivationCounter = 0;
		for (SymbolNode symbolNode : root.reachableSymbolNodes()){
			MutableNode node = forestNode(symbolNode, nodes, graph);
			for (Derivation derivation : symbolNode.getDerivations()){
				MutableNode parent = node;
				if (symbolNode.isPacked()){
					parent = mutNode("d" + derivationCounter++).add(Shape.POINT, Color.RED);
					graph.add(parent);
					node.addLink(to(parent).with(Style.DASHED));
				}
				if (derivation.isEpsilon()){
					MutableNode epsilon = mutNode("e" + derivationCounter++).add(Label.of("ε"), attr("shape", "plaintext"));
					graph.add(epsilon);
					parent.addLink(epsilon);
				}
				for (ForestNode child : derivation.children){
					parent.addLink(forestNode(child, nodes, graph));
				}
			}
		}
		return graph;
	}

	private static MutableNode forestNode(ForestNode forestNode, Map<ForestNode, MutableNode> nodes, MutableGraph graph){
		if (!nodes.containsKey(forestNode)){
			MutableNode node = mutNode((forestNode.isTerminalNode() ? "t" : "n") + nodes.size())
					.add(Label.of(forestNode.spanString()), forestNode.isTerminalNode() ? Shape.BOX : Shape.ELLIPSE);
			nodes.put(forestNode, node);
			graph.add(node);
		}
		return nodes.get(forestNode);
	}

	public static String toDot(MutableGraph graph){
		return new Serializer().serialize(graph);
	}

	/**
	 * Writes the graph in the DOT format into the configured dot directory
	 *
	 * @return path of the written file
	 */
	public static Path writeDot(MutableGraph graph, String fileName){
		Path dir = Paths.get(Config.getDotDir());
		Path file = dir.resolve(fileName + ".dot");
		try {
			Files.createDirectories(dir);
			Files.write(file, toDot(graph).getBytes(StandardCharsets.UTF_8));
		} catch (IOException e) {
			throw new GLRException("Can't write " + file, e);
		}
		LOG.fine("Wrote " + file);
		return file;
	}
}
