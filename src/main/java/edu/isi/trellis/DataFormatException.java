package edu.isi.trellis;
/** for errors in the data format of automaton files */

public class DataFormatException extends Exception {
	/**          Constructs a new exception with null as its detail message. */
	public DataFormatException() { super(); }
	/**      Constructs a new exception with the specified detail message. */
	public DataFormatException(String message) { super(message); }
	/**      Constructs a new exception with the specified detail message and cause.    */
	public DataFormatException(String message, Throwable cause) { super(message, cause); }
	/**      Constructs a new exception for a bad line of a named file. */
	public DataFormatException(String file, int lineNumber, String message) {
		super(file+":"+lineNumber+": "+message);
	}
}
