package glr.parser.forest;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

import glr.grammar.NonTerminal;
import glr.grammar.Production;
import glr.grammar.Terminal;

/**
 * Inner tree node: a non terminal expanded with a production
 */
public class TreeNode extends ParseTree {

	private final Production production;

	private final List<ParseTree> children;

	public TreeNode(Production production, List<ParseTree> children, int start, int end) {
		super(start, end);
		this.production = production;
		this.children = Collections.unmodifiableList(children);
	}

	public Production production(){
		return production;
	}

	public List<ParseTree> getChildren() {
		return children;
	}

	@Override
	public NonTerminal symbol() {
		return production.left;
	}

	@Override
	public boolean isLeaf() {
		return false;
	}

	@Override
	void collectLeaves(List<Terminal> leaves) {
		for (ParseTree child : children){
			child.collectLeaves(leaves);
		}
	}

	@Override
	void collectProductions(List<Production> productions) {
		productions.add(production);
		for (ParseTree child : children){
			child.collectProductions(productions);
		}
	}

	@Override
	public int size() {
		int size = 1;
		for (ParseTree child : children){
			size += child.size();
		}
		return size;
	}

	@Override
	public int height() {
		int height = 0;
		for (ParseTree child : children){
			height = Math.max(height, child.height());
		}
		return height + 1;
	}

	@Override
	void toPrettyString(List<String> lines, String indent) {
		lines.add(indent + production.left);
		if (children.isEmpty()){
			lines.add(indent + "  ε");
		}
		for (ParseTree child : children){
			child.toPrettyString(lines, indent + "  ");
		}
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder("(").append(production.left);
		if (children.isEmpty()){
			builder.append(" ε");
		}
		for (ParseTree child : children){
			builder.append(" ").append(child);
		}
		return builder.append(")").toString();
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof TreeNode)){
			return false;
		}
		TreeNode other = (TreeNode)obj;
		return other.start == start && other.end == end && other.production.equals(production)
				&& other.children.equals(children);
	}

	@Override
	public int hashCode() {
		return Objects.hash(production, children, start, end);
	}
}
