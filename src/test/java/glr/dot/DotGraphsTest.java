package glr.dot;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import glr.Grammars;
import glr.grammar.Grammar;
import glr.parser.glr.GLRParser;
import glr.parser.lr.Automaton;

import static org.junit.jupiter.api.Assertions.*;

public class DotGraphsTest {

	static int edgeCount(String dot){
		return dot.split("->", -1).length - 1;
	}

	@Test
	public void testAutomatonGraph(){
		Automaton automaton = Automaton.createFromGrammar(Grammars.expression());
		String dot = DotGraphs.toDot(DotGraphs.automatonGraph("expression", automaton));
		assertTrue(dot.startsWith("digraph"));
		assertTrue(dot.contains("\"s11\""));
		assertEquals(automaton.transitionCount(), edgeCount(dot));
	}

	@Test
	public void testStackGraph(){
		Grammar grammar = Grammars.ambiguousExpression();
		GLRParser parser = new GLRParser(Automaton.createFromGrammar(grammar).toParserTable());
		parser.parse(Grammars.words(grammar, "id + id + id"));
		String dot = DotGraphs.toDot(DotGraphs.stackGraph("stack", parser.getStack()));
		assertEquals(parser.getStack().edgeCount(), edgeCount(dot));
		assertTrue(dot.contains("E[0, 5)"));
	}

	@Test
	public void testForestGraph(){
		Grammar grammar = Grammars.ambiguousExpression();
		GLRParser parser = new GLRParser(Automaton.createFromGrammar(grammar).toParserTable());
		parser.parse(Grammars.words(grammar, "id + id + id"));
		String dot = DotGraphs.toDot(DotGraphs.forestGraph("forest", parser.getRoot()));
		assertTrue(dot.contains("E[0, 5)"));
		assertTrue(dot.contains("\"d0\""));
		assertTrue(dot.contains("\"d1\""));
	}

	@Test
	public void testWriteDot(@TempDir Path dir) throws Exception {
		String old = System.getProperty("glr.dotDir");
		System.setProperty("glr.dotDir", dir.toString());
		try {
			Automaton automaton = Automaton.createFromGrammar(Grammars.aSa());
			Path file = DotGraphs.writeDot(DotGraphs.automatonGraph("aSa", automaton), "aSa");
			assertEquals(dir.resolve("aSa.dot"), file);
			assertTrue(new String(Files.readAllBytes(file), StandardCharsets.UTF_8).startsWith("digraph"));
		} finally {
			if (old == null){
				System.clearProperty("glr.dotDir");
			} else {
				System.setProperty("glr.dotDir", old);
			}
		}
	}
}
