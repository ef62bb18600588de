package glr.parser.lr;

import org.junit.jupiter.api.Test;

import glr.Grammars;
import glr.grammar.Grammar;
import glr.grammar.Production;

import static org.junit.jupiter.api.Assertions.*;

public class ItemTest {

	private final Grammar grammar = Grammars.aSa();
	private final Production aSa = grammar.getProductionForId(0);

	@Test
	public void testAdvance(){
		Item item = new Item(aSa);
		assertEquals(grammar.getTerminal("a"), item.nextSymbol());
		assertTrue(item.inFrontOfTerminal());
		Item second = item.advance();
		assertEquals(1, second.position);
		assertTrue(second.inFrontOfNonTerminal());
		assertEquals("S → a • S a", second.toString());
		Item last = second.advance().advance();
		assertTrue(last.atEnd());
		assertNull(last.nextSymbol());
		assertThrows(Error.class, last::advance);
	}

	@Test
	public void testEpsilonItemIsCompleted(){
		Grammar optionals = Grammars.optionals();
		Item item = new Item(optionals.productionsFor(optionals.getNonTerminal("A")).get(1));
		assertTrue(item.atEnd());
		assertFalse(item.canAdvance());
		assertEquals("A → •", item.toString());
	}

	@Test
	public void testBounds(){
		assertThrows(IllegalArgumentException.class, () -> new Item(aSa, 4));
		assertThrows(IllegalArgumentException.class, () -> new Item(aSa, -1));
	}

	@Test
	public void testStructuralEquality(){
		assertEquals(new Item(aSa, 2), new Item(aSa).advance().advance());
		assertEquals(new Item(aSa, 2).hashCode(), new Item(aSa, 1).advance().hashCode());
		assertNotEquals(new Item(aSa, 1), new Item(grammar.getProductionForId(1), 1));
	}
}
