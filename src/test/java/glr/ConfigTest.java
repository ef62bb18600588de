package glr;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigTest {

	@Test
	public void testDefaults(){
		assertFalse(Config.logSteps());
		assertEquals(1000, Config.maxTrees());
		assertEquals("tmp", Config.getDotDir());
	}

	@Test
	public void testSystemPropertyOverride(){
		System.setProperty("glr.maxTrees", "12");
		try {
			assertEquals(12, Config.maxTrees());
			System.setProperty("glr.maxTrees", "many");
			assertThrows(GLRException.class, Config::maxTrees);
		} finally {
			System.clearProperty("glr.maxTrees");
		}
	}

	@Test
	public void testUnknownKey(){
		assertThrows(GLRException.class, () -> Config.get("unknown"));
	}
}
