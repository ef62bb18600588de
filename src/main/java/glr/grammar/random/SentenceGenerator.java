package glr.grammar.random;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import glr.GLRException;
import glr.grammar.Grammar;
import glr.grammar.NonTerminal;
import glr.grammar.Production;
import glr.grammar.Symbol;
import glr.grammar.Terminal;

/**
 * A generator of random sentences that are valid for a given grammar.
 *
 * Every production only gets chosen if a complete derivation is possible within the remaining depth,
 * therefore the generation terminates for every grammar, even for cyclic ones.
 */
public class SentenceGenerator {

	private final Grammar grammar;
	private final Random rand;
	private final double factor;

	/**
	 * Minimal height of a derivation tree for the non terminal, unproductive non terminals are missing
	 */
	private final Map<NonTerminal, Integer> minHeights = new HashMap<>();
	private final Map<Production, Double> productionLengths = new HashMap<>();

	public SentenceGenerator(Grammar grammar, long seed) {
		this(grammar, new Random(seed), 0.8);
	}

	/**
	 * @param factor weight factor in (0, 1], the probability of a production is proportional to
	 *               factor^(2 · right hand side size), smaller factors favor shorter sentences
	 */
	public SentenceGenerator(Grammar grammar, Random rand, double factor) {
		if (factor <= 0 || factor > 1){
			throw new IllegalArgumentException("The factor has to be in (0, 1], got " + factor);
		}
		this.grammar = grammar;
		this.rand = rand;
		this.factor = factor;
		for (Production production : grammar.getProductions()) {
			productionLengths.put(production, production.rightSize() * 2.0);
		}
		calculateMinHeights();
	}

	private void calculateMinHeights(){
		boolean somethingChanged = true;
		while (somethingChanged){
			somethingChanged = false;
			for (Production production : grammar.getProductions()){
				Integer height = height(production);
				if (height != null && (!minHeights.containsKey(production.left) || minHeights.get(production.left) > height)){
					minHeights.put(production.left, height);
					somethingChanged = true;
				}
			}
		}
	}

	/**
	 * @return minimal height of a derivation tree that starts with the production or null if there is none (yet)
	 */
	private Integer height(Production production){
		int max = 0;
		for (Symbol symbol : production.right){
			if (symbol.isNonTerminal()){
				Integer height = minHeights.get((NonTerminal)symbol);
				if (height == null){
					return null;
				}
				max = Math.max(max, height);
			}
		}
		return max + 1;
	}

	/**
	 * Minimal height of a derivation tree for the non terminal
	 *
	 * @return -1 if the non terminal derives no terminal string
	 */
	public int minimalHeight(NonTerminal nonTerminal){
		return minHeights.getOrDefault(nonTerminal, -1);
	}

	/**
	 * Generates a sentence whose derivation tree has at most the passed height
	 *
	 * @throws GLRException if the language is empty or has no sentence of the height
	 */
	public List<Terminal> generate(int maxHeight){
		NonTerminal start = grammar.getStart();
		if (!minHeights.containsKey(start)){
			throw new GLRException("The language of the grammar is empty");
		}
		if (minHeights.get(start) > maxHeight){
			throw new GLRException(String.format("No sentence with a derivation tree of height %d, minimum is %d",
					maxHeight, minHeights.get(start)));
		}
		List<Terminal> sentence = new ArrayList<>();
		generate(start, maxHeight, sentence);
		return sentence;
	}

	public List<List<Terminal>> generate(int count, int maxHeight){
		List<List<Terminal>> sentences = new ArrayList<>();
		for (int i = 0; i < count; i++){
			sentences.add(generate(maxHeight));
		}
		return sentences;
	}

	private void generate(NonTerminal nonTerminal, int remainingHeight, List<Terminal> sentence){
		List<Production> usable = new ArrayList<>();
		for (Production production : grammar.productionsFor(nonTerminal)){
			Integer height = height(production);
			if (height != null && height <= remainingHeight){
				usable.add(production);
			}
		}
		if (usable.isEmpty()){
			throw new Error(String.format("No production of %s fits in height %d", nonTerminal, remainingHeight));
		}
		Production production = weightedProduction(usable);
		for (Symbol symbol : production.right) {
			if (symbol.isNonTerminal()) {
				generate((NonTerminal)symbol, remainingHeight - 1, sentence);
			} else {
				sentence.add((Terminal)symbol);
			}
		}
	}

	private Production weightedProduction(List<Production> avProds){
		double sum = 0;
		for (Production avProd : avProds) {
			sum += Math.pow(factor, productionLengths.get(avProd));
		}
		double randomNum = rand.nextDouble() * sum;
		Production ret = avProds.get(avProds.size() - 1);
		sum = 0;
		for (Production avProd : avProds) {
			sum += Math.pow(factor, productionLengths.get(avProd));
			if (randomNum <= sum){
				ret = avProd;
				break;
			}
		}
		return ret;
	}

	public Map<NonTerminal, Integer> getMinHeights() {
		return Collections.unmodifiableMap(minHeights);
	}
}
