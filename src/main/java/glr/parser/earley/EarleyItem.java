package glr.parser.earley;

import java.util.Objects;

import glr.grammar.Production;
import glr.parser.lr.Item;

/**
 * An LR(0) item together with the input position at which the recognition of its production started
 */
public class EarleyItem {

	public final Item item;

	public final int origin;

	public EarleyItem(Item item, int origin){
		this.item = item;
		this.origin = origin;
	}

	public EarleyItem(Production production, int origin){
		this(new Item(production), origin);
	}

	public EarleyItem advance(){
		return new EarleyItem(item.advance(), origin);
	}

	@Override
	public String toString() {
		return "[" + item + ", " + origin + "]";
	}

	@Override
	public boolean equals(Object obj) {
		if (obj instanceof EarleyItem){
			EarleyItem other = (EarleyItem)obj;
			return other.origin == origin && item.equals(other.item);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash(item, origin);
	}
}
