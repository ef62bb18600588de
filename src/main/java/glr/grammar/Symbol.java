package glr.grammar;

import java.io.Serializable;
import java.util.Objects;

/**
 * Base class for terminal symbols and non terminal symbols.
 *
 * Symbols are equal if they are of the same class and have the same name, therefore a terminal
 * never equals a non terminal with the same name.
 */
public abstract class Symbol implements Serializable, Comparable<Symbol> {

	/**
	 * Name of the symbol
	 */
	public final String name;

	protected Symbol(String name) {
		this.name = Objects.requireNonNull(name);
	}

	public abstract boolean isTerminal();

	public boolean isNonTerminal(){
		return !isTerminal();
	}

	/**
	 * Position of this kind of symbol in the symbol order: non terminals, terminals, end marker
	 */
	protected abstract int sortNum();

	@Override
	public int hashCode() {
		return name.hashCode() * 31 + sortNum();
	}

	@Override
	public boolean equals(Object obj) {
		return obj != null && obj.getClass() == getClass() && ((Symbol)obj).name.equals(name);
	}

	@Override
	public int compareTo(Symbol o) {
		if (sortNum() != o.sortNum()){
			return Integer.compare(sortNum(), o.sortNum());
		}
		return name.compareTo(o.name);
	}

	@Override
	public String toString() {
		return name;
	}
}
