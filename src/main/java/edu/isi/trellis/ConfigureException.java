package edu.isi.trellis;
/** for errors in the configuration of a predictor or the command line, like
    unknown predictor types, illegal combinations, etc. */
public class ConfigureException extends Exception {
	/**          Constructs a new exception with null as its detail message. */
	public ConfigureException() { super(); }
	/**      Constructs a new exception with the specified detail message. */
	public ConfigureException(String message) { super(message); }
	/**      Constructs a new exception with the specified detail message and cause.    */
	public ConfigureException(String message, Throwable cause) { super(message, cause); }
}
