package glr.parser.forest;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

import glr.grammar.Production;

/**
 * One alternative of a symbol node: the production used and the forest nodes of its right hand side.
 * The children are contiguous.
 */
public class Derivation {

	public final Production production;

	public final List<ForestNode> children;

	public Derivation(Production production, List<ForestNode> children) {
		if (production.rightSize() != children.size()){
			throw new Error(String.format("%s needs %d children, got %d", production, production.rightSize(),
					children.size()));
		}
		for (int i = 0; i < children.size(); i++){
			if (!children.get(i).symbol().equals(production.right.get(i))){
				throw new Error(String.format("Child %s doesn't match the symbol %s of %s", children.get(i),
						production.right.get(i), production));
			}
			if (i > 0 && children.get(i - 1).end != children.get(i).start){
				throw new Error(String.format("Children %s and %s aren't adjacent", children.get(i - 1), children.get(i)));
			}
		}
		this.production = production;
		this.children = Collections.unmodifiableList(children);
	}

	public boolean isEpsilon(){
		return children.isEmpty();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Derivation && ((Derivation)obj).production.equals(production)
				&& ((Derivation)obj).children.equals(children);
	}

	@Override
	public int hashCode() {
		return Objects.hash(production, children);
	}

	@Override
	public String toString() {
		return production + " " + children;
	}
}
