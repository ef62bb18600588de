package glr;

import java.util.ArrayList;
import java.util.List;

import glr.grammar.Grammar;
import glr.grammar.GrammarBuilder;
import glr.grammar.Terminal;

/**
 * Grammars used throughout the tests
 */
public class Grammars {

	/**
	 * S → a S a | a, odd number of a's
	 */
	public static Grammar aSa(){
		return new GrammarBuilder()
				.terminals("a")
				.add("S", "a", "S", "a")
				.add("S", "a")
				.toGrammar("S");
	}

	/**
	 * The classic (unambiguous, SLR(1)) expression grammar
	 */
	public static Grammar expression(){
		return new GrammarBuilder()
				.terminals("+", "*", "(", ")", "id")
				.add("E", "E", "+", "T")
				.add("E", "T")
				.add("T", "T", "*", "F")
				.add("T", "F")
				.add("F", "(", "E", ")")
				.add("F", "id")
				.toGrammar("E");
	}

	/**
	 * E → E + E | E * E | id, the number of trees is a catalan number
	 */
	public static Grammar ambiguousExpression(){
		return new GrammarBuilder()
				.terminals("+", "*", "id")
				.add("E", "E", "+", "E")
				.add("E", "E", "*", "E")
				.add("E", "id")
				.toGrammar("E");
	}

	/**
	 * Every sentence a^n has exactly two trees
	 */
	public static Grammar boundedAmbiguity(){
		return new GrammarBuilder()
				.terminals("a")
				.add("S", "X")
				.add("S", "Y")
				.add("X", "a", "X")
				.add("X", "a")
				.add("Y", "a", "Y")
				.add("Y", "a")
				.toGrammar("S");
	}

	/**
	 * The sentence x b^i x has i + 1 trees
	 */
	public static Grammar unboundedAmbiguity(){
		return new GrammarBuilder()
				.terminals("x", "b")
				.add("S", "M", "N")
				.add("M", "A", "M", "b")
				.add("M", "x")
				.add("N", "b", "N", "A")
				.add("N", "x")
				.epsilon("A")
				.toGrammar("S");
	}

	/**
	 * S → S | a
	 */
	public static Grammar unitCycle(){
		return new GrammarBuilder()
				.terminals("a")
				.add("S", "S")
				.add("S", "a")
				.toGrammar("S");
	}

	/**
	 * S → S S | a | ε, cyclic and infinitely ambiguous
	 */
	public static Grammar cyclicEpsilon(){
		return new GrammarBuilder()
				.terminals("a")
				.add("S", "S", "S")
				.add("S", "a")
				.epsilon("S")
				.toGrammar("S");
	}

	/**
	 * S → A S b | c, A → ε: hidden left recursion
	 */
	public static Grammar hiddenLeftRecursion(){
		return new GrammarBuilder()
				.terminals("b", "c")
				.add("S", "A", "S", "b")
				.add("S", "c")
				.epsilon("A")
				.toGrammar("S");
	}

	/**
	 * S → A B C with optional a, b and c
	 */
	public static Grammar optionals(){
		return new GrammarBuilder()
				.terminals("a", "b", "c")
				.add("S", "A", "B", "C")
				.add("A", "a")
				.epsilon("A")
				.add("B", "b")
				.epsilon("B")
				.add("C", "c")
				.epsilon("C")
				.toGrammar("S");
	}

	/**
	 * Balanced parentheses, S → ( S ) S | ε
	 */
	public static Grammar parentheses(){
		return new GrammarBuilder()
				.terminals("(", ")")
				.add("S", "(", "S", ")", "S")
				.epsilon("S")
				.toGrammar("S");
	}

	/**
	 * Dangling else: ambiguous and not SLR(1)
	 */
	public static Grammar danglingElse(){
		return new GrammarBuilder()
				.terminals("if", "then", "else", "c", "s")
				.add("S", "if", "c", "then", "S")
				.add("S", "if", "c", "then", "S", "else", "S")
				.add("S", "s")
				.toGrammar("S");
	}

	public static List<Grammar> all(){
		List<Grammar> grammars = new ArrayList<>();
		grammars.add(aSa());
		grammars.add(expression());
		grammars.add(ambiguousExpression());
		grammars.add(boundedAmbiguity());
		grammars.add(unboundedAmbiguity());
		grammars.add(unitCycle());
		grammars.add(cyclicEpsilon());
		grammars.add(hiddenLeftRecursion());
		grammars.add(optionals());
		grammars.add(parentheses());
		grammars.add(danglingElse());
		return grammars;
	}

	/**
	 * Splits the input at white spaces into terminals of the grammar
	 */
	public static List<Terminal> words(Grammar grammar, String input){
		String trimmed = input.trim();
		if (trimmed.isEmpty()){
			return new ArrayList<>();
		}
		return grammar.terminals(trimmed.split("\\s+"));
	}

	/**
	 * Every character of the input is a terminal of the grammar
	 */
	public static List<Terminal> chars(Grammar grammar, String input){
		List<Terminal> terminals = new ArrayList<>();
		for (char c : input.toCharArray()){
			terminals.add(grammar.getTerminal(String.valueOf(c)));
		}
		return terminals;
	}

	/**
	 * All words over the terminals of the grammar up to the passed length
	 */
	public static List<List<Terminal>> allWords(Grammar grammar, int maxLength){
		List<List<Terminal>> words = new ArrayList<>();
		List<List<Terminal>> current = new ArrayList<>();
		current.add(new ArrayList<>());
		words.add(new ArrayList<>());
		for (int length = 1; length <= maxLength; length++){
			List<List<Terminal>> next = new ArrayList<>();
			for (List<Terminal> word : current){
				for (Terminal terminal : grammar.getTerminals()){
					List<Terminal> newWord = new ArrayList<>(word);
					newWord.add(terminal);
					next.add(newWord);
				}
			}
			words.addAll(next);
			current = next;
		}
		return words;
	}
}
