package dev.notebook.server.session;

/**
 * Asks the hosting server to stop. Implementations must return promptly and perform the actual
 * stop on another thread, since they are called while a request is still being served.
 */
@FunctionalInterface
public interface ShutdownHandle {

	void requestShutdown();

}
