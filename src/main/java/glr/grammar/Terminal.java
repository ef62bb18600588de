package glr.grammar;

/**
 * A terminal symbol
 */
public class Terminal extends Symbol {

	/**
	 * Marks the end of the input, it isn't equal to any other terminal.
	 */
	public static final Terminal END_MARKER = new EndMarker();

	public Terminal(String name) {
		super(name);
	}

	@Override
	public boolean isTerminal() {
		return true;
	}

	public boolean isEndMarker(){
		return false;
	}

	@Override
	protected int sortNum() {
		return 1;
	}

	private static class EndMarker extends Terminal {

		EndMarker() {
			super("$");
		}

		@Override
		public boolean isEndMarker() {
			return true;
		}

		@Override
		protected int sortNum() {
			return 3;
		}

		private Object readResolve() {
			return END_MARKER;
		}
	}
}
