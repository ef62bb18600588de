package glr.grammar;

import java.util.ArrayList;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import glr.GLRException;
import glr.Grammars;

import static org.junit.jupiter.api.Assertions.*;

public class GrammarTest {

	@Test
	public void testBuilder(){
		Grammar grammar = Grammars.aSa();
		assertEquals(new NonTerminal("S"), grammar.getStart());
		assertEquals(2, grammar.getProductions().size());
		assertEquals("S → a S a", grammar.getProductionForId(0).toString());
		assertEquals(grammar.getProductions(), grammar.productionsFor(grammar.getStart()));
		assertTrue(grammar.isTerminal(new Terminal("a")));
		assertFalse(grammar.isTerminal(new NonTerminal("S")));
	}

	@Test
	public void testEpsilonProduction(){
		Grammar grammar = Grammars.optionals();
		Production production = grammar.productionsFor(grammar.getNonTerminal("A")).get(1);
		assertTrue(production.isEpsilonProduction());
		assertEquals("A → ε", production.toString());
	}

	@Test
	public void testTerminalsAndNonTerminalsAreDisjoint(){
		assertNotEquals(new Terminal("a"), new NonTerminal("a"));
		assertNotEquals(new Terminal("$"), Terminal.END_MARKER);
		assertTrue(Terminal.END_MARKER.isEndMarker());
		assertFalse(new Terminal("$").isEndMarker());
	}

	@Test
	public void testUndeclaredSymbolInBody(){
		UndeclaredSymbolException ex = assertThrows(UndeclaredSymbolException.class, () -> new GrammarBuilder()
				.terminals("a")
				.add("S", "a", "B")
				.toGrammar("S"));
		assertEquals("B", ex.symbolName);
	}

	@Test
	public void testUndeclaredStart(){
		assertThrows(UndeclaredSymbolException.class, () -> new GrammarBuilder()
				.terminals("a")
				.add("S", "a")
				.toGrammar("T"));
	}

	@Test
	public void testUndeclaredHead(){
		NonTerminal s = new NonTerminal("S");
		Production production = new Production(0, new NonTerminal("T"), new ArrayList<>());
		assertThrows(UndeclaredSymbolException.class, () -> new Grammar(Collections.emptySet(),
				Collections.singleton(s), s, Collections.singletonList(production)));
	}

	@Test
	public void testStartWithoutProduction(){
		GLRException ex = assertThrows(GLRException.class, () -> new GrammarBuilder()
				.terminals("a")
				.nonTerminals("T")
				.add("S", "a")
				.toGrammar("T"));
		assertEquals(GLRException.class, ex.getClass());
	}

	@Test
	public void testNameDeclaredTwice(){
		GLRException ex = assertThrows(GLRException.class, () -> new GrammarBuilder()
				.terminals("a")
				.nonTerminals("a")
				.add("S", "b")
				.terminals("b")
				.toGrammar("S"));
		assertEquals(GLRException.class, ex.getClass());
	}

	@Test
	public void testAugment(){
		Grammar grammar = Grammars.expression();
		Grammar augmented = grammar.augment();
		NonTerminal start = augmented.getStart();
		assertEquals("E'", start.name);
		assertEquals(grammar.getProductions().size() + 1, augmented.getProductions().size());
		assertEquals(grammar.getProductions(), augmented.getProductions().subList(0, grammar.getProductions().size()));
		assertEquals(1, augmented.productionsFor(start).size());
		assertEquals("E' → E", augmented.productionsFor(start).get(0).toString());
		assertTrue(augmented.follow(start).contains(Terminal.END_MARKER));
	}

	@Test
	public void testAugmentAvoidsUsedNames(){
		Grammar grammar = new GrammarBuilder()
				.terminals("a")
				.add("S", "S'")
				.add("S'", "a")
				.toGrammar("S");
		assertEquals("S''", grammar.augment().getStart().name);
	}

	@Test
	public void testTerminalLookup(){
		Grammar grammar = Grammars.expression();
		assertEquals(3, grammar.terminals("id", "+", "id").size());
		assertThrows(UndeclaredSymbolException.class, () -> grammar.getTerminal("E"));
		assertThrows(UndeclaredSymbolException.class, () -> grammar.getNonTerminal("id"));
	}
}
