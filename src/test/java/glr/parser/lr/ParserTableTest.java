package glr.parser.lr;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import glr.Grammars;
import glr.grammar.Grammar;
import glr.grammar.GrammarBuilder;
import glr.grammar.NonTerminal;
import glr.grammar.Terminal;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTableTest {

	static ParserTable table(Grammar grammar){
		return Automaton.createFromGrammar(grammar).toParserTable();
	}

	@Nested
	class Construction {

		@Test
		public void testExpressionGrammarIsDeterministic(){
			ParserTable table = table(Grammars.expression());
			assertTrue(table.isDeterministic());
			assertEquals(12, table.stateCount());
		}

		@Test
		public void testAcceptOnlyOnEndMarker(){
			ParserTable table = table(Grammars.expression());
			Grammar grammar = table.getGrammar();
			int afterE = table.goTo(0, grammar.getNonTerminal("E"));
			Set<ParserTable.Action> actions = table.actions(afterE, Terminal.END_MARKER);
			assertEquals(1, actions.size());
			assertEquals(ParserTable.Kind.ACCEPT, actions.iterator().next().kind());
			assertEquals(ParserTable.Kind.SHIFT, table.actions(afterE, grammar.getTerminal("+")).iterator().next().kind());
			assertTrue(table.actions(afterE, grammar.getTerminal("id")).isEmpty());
		}

		@Test
		public void testReduceOnFollowSet(){
			ParserTable table = table(Grammars.expression());
			Grammar grammar = table.getGrammar();
			int afterId = table.getAutomaton().goTo(0, grammar.getTerminal("id"));
			ParserTable.Reduce reduce = new ParserTable.Reduce(grammar.getProductionForId(5));
			for (Terminal terminal : grammar.follow(grammar.getNonTerminal("F"))){
				assertEquals(Set.of(reduce), table.actions(afterId, terminal));
			}
			assertEquals(4, table.actionRow(afterId).size());
			assertTrue(table.gotoRow(afterId).isEmpty());
		}

		@Test
		public void testEpsilonReductions(){
			ParserTable table = table(Grammars.cyclicEpsilon());
			Grammar grammar = table.getGrammar();
			ParserTable.Reduce epsilon = new ParserTable.Reduce(grammar.getProductionForId(2));
			assertTrue(table.actions(0, grammar.getTerminal("a")).contains(epsilon));
			assertTrue(table.actions(0, Terminal.END_MARKER).contains(epsilon));
		}

		@Test
		public void testMissingGoto(){
			ParserTable table = table(Grammars.aSa());
			assertNull(table.goTo(0, new NonTerminal("X")));
		}
	}

	@Nested
	class Conflicts {

		@Test
		public void testShiftReduceConflict(){
			ParserTable table = table(Grammars.aSa());
			List<ParserTable.Conflict> conflicts = table.conflicts();
			assertEquals(1, conflicts.size());
			ParserTable.Conflict conflict = conflicts.get(0);
			assertEquals("a", conflict.terminal.name);
			assertTrue(conflict.isShiftReduce());
			assertEquals(2, conflict.actions.size());
		}

		@Test
		public void testDanglingElse(){
			ParserTable table = table(Grammars.danglingElse());
			assertFalse(table.isDeterministic());
			assertTrue(table.conflicts().stream().allMatch(c -> c.terminal.name.equals("else") && c.isShiftReduce()));
		}

		@Test
		public void testReduceReduceConflict(){
			ParserTable table = table(Grammars.boundedAmbiguity());
			assertTrue(table.conflicts().stream().anyMatch(c -> !c.isShiftReduce()
					&& c.actions.stream().allMatch(a -> a.kind() == ParserTable.Kind.REDUCE)));
		}

		@Test
		public void testConflictsArePreserved(){
			ParserTable table = table(Grammars.ambiguousExpression());
			for (ParserTable.Conflict conflict : table.conflicts()){
				assertEquals(conflict.actions, table.actions(conflict.state, conflict.terminal));
			}
			assertEquals(4, table.conflicts().size());
		}
	}

	@Nested
	class Equivalence {

		@Test
		public void testReorderedProductions(){
			Grammar reordered = new GrammarBuilder()
					.terminals("+", "*", "(", ")", "id")
					.add("F", "id")
					.add("F", "(", "E", ")")
					.add("T", "F")
					.add("T", "T", "*", "F")
					.add("E", "T")
					.add("E", "E", "+", "T")
					.toGrammar("E");
			ParserTable table = table(Grammars.expression());
			ParserTable other = table(reordered);
			assertTrue(table.equivalent(other));
			assertTrue(other.equivalent(table));
		}

		@Test
		public void testDifferentGrammars(){
			assertFalse(table(Grammars.aSa()).equivalent(table(Grammars.boundedAmbiguity())));
			assertFalse(table(Grammars.expression()).equivalent(table(Grammars.ambiguousExpression())));
		}

		@Test
		public void testSelf(){
			ParserTable table = table(Grammars.unboundedAmbiguity());
			assertTrue(table.equivalent(table));
			assertTrue(table.equivalent(table(Grammars.unboundedAmbiguity())));
		}
	}

	@Test
	public void testToString(){
		ParserTable table = table(Grammars.aSa());
		String[] lines = table.toString().split("\n");
		assertEquals(table.stateCount() + 1, lines.length);
		assertTrue(lines[0].contains("a"));
		assertTrue(lines[0].contains("$"));
		assertTrue(table.toString().contains("acc"));
		assertTrue(table.toString().contains("sh2,re1") || table.toString().contains("re1,sh2"));
	}

	@Test
	public void testSerialization() throws Exception {
		ParserTable table = table(Grammars.unboundedAmbiguity());
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		try (ObjectOutputStream out = new ObjectOutputStream(bytes)){
			out.writeObject(table);
		}
		try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(bytes.toByteArray()))){
			ParserTable copy = (ParserTable)in.readObject();
			assertEquals(table, copy);
			assertEquals(table.getAutomaton().stateCount(), copy.getAutomaton().stateCount());
			assertTrue(copy.actions(copy.goTo(0, copy.getGrammar().getNonTerminal("S")), Terminal.END_MARKER)
					.contains(ParserTable.Accept.INSTANCE));
		}
	}
}
