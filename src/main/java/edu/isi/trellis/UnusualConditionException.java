package edu.isi.trellis;
/** for errors where an automaton operation could not finish, such as a
    determinization that keeps producing new subsets */

public class UnusualConditionException extends Exception {
	/**          Constructs a new exception with null as its detail message. */
	public UnusualConditionException() { super(); }
	/**      Constructs a new exception with the specified detail message. */
	public UnusualConditionException(String message) { super(message); }
	/**      Constructs a new exception with the specified detail message and cause.    */
	public UnusualConditionException(String message, Throwable cause) { super(message, cause); }
}
