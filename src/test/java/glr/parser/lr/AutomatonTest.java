package glr.parser.lr;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import glr.Grammars;
import glr.grammar.Grammar;
import glr.grammar.Symbol;

import static org.junit.jupiter.api.Assertions.*;

public class AutomatonTest {

	@Test
	public void testExpressionGrammar(){
		Automaton automaton = Automaton.createFromGrammar(Grammars.expression());
		assertEquals(12, automaton.stateCount());
		assertEquals(22, automaton.transitionCount());
		State start = automaton.getStartState();
		assertEquals(1, start.getKernelItems().size());
		assertEquals("E' → • E", start.getKernelItems().get(0).toString());
		assertEquals(7, start.getItems().size());
	}

	@Test
	public void testStartState(){
		Automaton automaton = Automaton.createFromGrammar(Grammars.aSa());
		assertEquals(5, automaton.stateCount());
		assertEquals(5, automaton.transitionCount());
		Grammar augmented = automaton.getAugmentedGrammar();
		Integer afterStart = automaton.goTo(0, augmented.getNonTerminal("S"));
		assertNotNull(afterStart);
		assertEquals(1, automaton.getState(afterStart).getCompletedItems().size());
		assertEquals(augmented.getStart(), automaton.getState(afterStart).getCompletedItems().get(0).left());
	}

	@Test
	public void testGotoIsPartialAndDeterministic(){
		Automaton automaton = Automaton.createFromGrammar(Grammars.aSa());
		Symbol a = automaton.getGrammar().getTerminal("a");
		int afterA = automaton.goTo(0, a);
		assertEquals(afterA, (int)automaton.goTo(afterA, a));
		Integer afterS = automaton.goTo(0, automaton.getGrammar().getStart());
		assertNull(automaton.goTo(afterS, a));
	}

	@Test
	public void testEpsilonItemsAreReduceCandidates(){
		Automaton automaton = Automaton.createFromGrammar(Grammars.cyclicEpsilon());
		List<Item> completed = automaton.getStartState().getCompletedItems();
		assertEquals(1, completed.size());
		assertTrue(completed.get(0).production.isEpsilonProduction());
	}

	@Test
	public void testStatesAreDeduplicated(){
		Automaton automaton = Automaton.createFromGrammar(Grammars.hiddenLeftRecursion());
		Symbol a = automaton.getGrammar().getNonTerminal("A");
		int afterA = automaton.goTo(0, a);
		assertEquals(afterA, (int)automaton.goTo(afterA, a));
		for (State state : automaton.getStates()){
			for (State other : automaton.getStates()){
				if (state != other){
					assertNotEquals(state.getItemSet(), other.getItemSet());
				}
			}
		}
	}

	@ParameterizedTest
	@MethodSource("glr.Grammars#all")
	public void testIdempotence(Grammar grammar){
		Automaton first = Automaton.createFromGrammar(grammar);
		Automaton second = Automaton.createFromGrammar(grammar);
		assertEquals(first.stateCount(), second.stateCount());
		assertEquals(first.transitionCount(), second.transitionCount());
		for (int i = 0; i < first.stateCount(); i++){
			assertEquals(first.getState(i).getItemSet(), second.getState(i).getItemSet());
			assertEquals(first.getState(i).getAdjacentStates(), second.getState(i).getAdjacentStates());
		}
		assertEquals(first.toParserTable(), second.toParserTable());
	}
}
