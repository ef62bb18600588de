package glr.parser.earley;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

import glr.grammar.Grammar;
import glr.grammar.NonTerminal;
import glr.grammar.Production;
import glr.grammar.Terminal;
import glr.parser.lr.Item;

/**
 * Earley recognizer, independent of the LR machinery. It handles epsilon productions by advancing
 * over nullable non terminals during the prediction (Aycock and Horspool).
 */
public class EarleyRecognizer {

	private static final Logger LOG = Logger.getLogger("EarleyRecognizer");

	private final Grammar grammar;

	private final Production startProduction;

	private final List<EarleySet> sets = new ArrayList<>();

	public EarleyRecognizer(Grammar grammar){
		this.grammar = grammar.augment();
		this.startProduction = this.grammar.productionsFor(this.grammar.getStart()).get(0);
	}

	/**
	 * Is the input a sentence of the grammar? Can be called several times.
	 */
	public boolean recognizes(List<Terminal> input){
		sets.clear();
		sets.add(new EarleySet(0));
		sets.get(0).add(new EarleyItem(startProduction, 0));
		for (int i = 0; i <= input.size(); i++){
			EarleySet current = sets.get(i);
			for (int index = 0; index < current.size(); index++){
				EarleyItem item = current.get(index);
				if (item.item.inFrontOfNonTerminal()){
					prediction(i, item);
				} else if (item.item.atEnd()){
					completion(i, item);
				}
			}
			if (i < input.size()){
				sets.add(new EarleySet(i + 1));
				scanning(i, input.get(i));
				if (sets.get(i + 1).size() == 0){
					int failedPosition = i;
					logStep(() -> String.format("Nothing scanned at position %d", failedPosition));
					return false;
				}
			}
		}
		return sets.get(input.size()).contains(new EarleyItem(new Item(startProduction, 1), 0));
	}

	private void prediction(int i, EarleyItem item){
		NonTerminal n = (NonTerminal)item.item.nextSymbol();
		for (Production prod : grammar.productionsFor(n)){
			addToSet(i, new EarleyItem(prod, i), "prediction", item);
		}
		if (grammar.isNullable(n)){
			addToSet(i, item.advance(), "nullable", item);
		}
	}

	private void completion(int i, EarleyItem item){
		NonTerminal left = item.item.left();
		EarleySet originSet = sets.get(item.origin);
		for (int index = 0; index < originSet.size(); index++){
			EarleyItem waiting = originSet.get(index);
			if (waiting.item.inFrontOfNonTerminal() && waiting.item.nextSymbol().equals(left)){
				addToSet(i, waiting.advance(), "completion", item);
			}
		}
	}

	private void scanning(int i, Terminal terminal){
		for (EarleyItem item : sets.get(i).getItems()){
			if (item.item.inFrontOfTerminal(terminal)){
				addToSet(i + 1, item.advance(), "scanning", item);
			}
		}
	}

	private void addToSet(int i, EarleyItem newItem, String method, EarleyItem source){
		if (sets.get(i).add(newItem)){
			logStep(() -> String.format("%10s %30s to S_%d %s", method + ":", source, i, newItem));
		}
	}

	private void logStep(Supplier<String> msgProducer){
		if (LOG.isLoggable(Level.FINEST)){
			LOG.finest(msgProducer.get());
		}
	}

	/**
	 * Item sets of the last call to {@link #recognizes(List)}
	 */
	public List<EarleySet> getSets() {
		return sets;
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (EarleySet set : sets){
			if (builder.length() > 0){
				builder.append("\n");
			}
			builder.append("Earley Set ").append(set.position).append("\n").append(set);
		}
		return builder.toString();
	}
}
