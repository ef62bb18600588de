package glr.parser.lr;

import java.io.Serializable;
import java.util.Objects;

import glr.grammar.NonTerminal;
import glr.grammar.Production;
import glr.grammar.Symbol;
import glr.grammar.Terminal;

/**
 * An LR(0) item: a production with a dot that marks how much of its right hand side has been matched.
 */
public class Item implements Serializable, Comparable<Item> {

	public final Production production;

	/**
	 * The dot is before the $position.th right hand side symbol
	 */
	public final int position;

	public Item(Production production, int position) {
		if (position < 0 || position > production.rightSize()){
			throw new IllegalArgumentException(String.format("Dot position %d not within bounds of %s", position,
					production));
		}
		this.production = Objects.requireNonNull(production);
		this.position = position;
	}

	public Item(Production production){
		this(production, 0);
	}

	public NonTerminal left(){
		return production.left;
	}

	public boolean canAdvance(){
		return position < production.rightSize();
	}

	public Item advance(){
		if (!canAdvance()){
			throw new Error("Can't advance " + this);
		}
		return new Item(production, position + 1);
	}

	/**
	 * @return symbol after the dot or null if the dot is at the end
	 */
	public Symbol nextSymbol(){
		if (canAdvance()){
			return production.right.get(position);
		}
		return null;
	}

	public boolean inFrontOfTerminal(){
		return canAdvance() && nextSymbol().isTerminal();
	}

	public boolean inFrontOfTerminal(Terminal terminal){
		return inFrontOfTerminal() && terminal.equals(nextSymbol());
	}

	public boolean inFrontOfNonTerminal(){
		return canAdvance() && nextSymbol().isNonTerminal();
	}

	/**
	 * Is the whole right hand side matched? Completed epsilon items are at the end from the beginning.
	 */
	public boolean atEnd(){
		return !canAdvance();
	}

	public String formatRightSide() {
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < position; i++) {
			builder.append(production.right.get(i)).append(" ");
		}
		builder.append("•");
		for (int i = position; i < production.rightSize(); i++) {
			builder.append(" ").append(production.right.get(i));
		}
		return builder.toString();
	}

	@Override
	public String toString() {
		return production.left + " → " + formatRightSide();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Item && ((Item)obj).position == position && ((Item)obj).production.equals(production);
	}

	@Override
	public int hashCode() {
		return production.hashCode() * 31 + position;
	}

	@Override
	public int compareTo(Item o) {
		if (position == 0 && o.position != 0){
			return 1;
		}
		if (position != 0 && o.position == 0){
			return -1;
		}
		if (o.production.id != production.id){
			return Integer.compare(production.id, o.production.id);
		}
		return Integer.compare(position, o.position);
	}
}
