package dev.notebook.server.session;

/**
 * Raised when an operation is not allowed in the session's current state.
 */
public class SessionStateException extends IllegalStateException {

	private static final long serialVersionUID = 1L;

	public SessionStateException(String message) {
		super(message);
	}

}
