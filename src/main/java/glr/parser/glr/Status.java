package glr.parser.glr;

public enum Status {
	/**
	 * At least one stack is alive and the end of the input isn't processed yet
	 */
	RUNNING,
	ACCEPTED,
	/**
	 * All stacks died or the parse was aborted
	 */
	REJECTED
}
