package glr;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Global settings, read once from {@value #configFile} (lines of the form {@code key = value})
 * and overridable per key by the system property {@code glr.<key>}.
 */
public class Config {

	public static final String configFile = "glr.ini";

	private static final Logger LOG = Logger.getLogger("Config");

	private static final Map<String, String> config = new HashMap<String, String>(){{
		put("logSteps", "no");
		put("maxTrees", "1000");
		put("dotDir", "tmp");
	}};

	/** Log every action of the GLR parser? */
	public static boolean logSteps(){
		return get("logSteps").equals("yes");
	}

	/** Maximum number of trees enumerated from a parse forest if the caller passes no limit */
	public static int maxTrees(){
		try {
			return Integer.parseInt(get("maxTrees"));
		} catch (NumberFormatException ex){
			throw new GLRException("maxTrees has to be an integer, got \"" + get("maxTrees") + "\"", ex);
		}
	}

	public static String getDotDir(){
		return get("dotDir");
	}

	public static String get(String key){
		if (!config.containsKey(key)){
			throw new GLRException("Unknown config key \"" + key + "\"");
		}
		return System.getProperty("glr." + key, config.get(key));
	}

	private static void loadConfig(){
		File file = new File(configFile);
		if (!file.exists()){
			return;
		}
		try (BufferedReader reader = new BufferedReader(new FileReader(file))) {
			String line;
			while ((line = reader.readLine()) != null){
				if (line.contains(" = ")){
					String[] parts = line.split(" = ", 2);
					if (config.containsKey(parts[0].trim())){
						config.put(parts[0].trim(), parts[1].trim());
					} else {
						LOG.warning("Unknown config key \"" + parts[0] + "\"");
					}
				}
			}
		} catch (IOException e) {
			LOG.log(Level.WARNING, "Can't read " + configFile, e);
		}
	}

	static {
		loadConfig();
	}
}
