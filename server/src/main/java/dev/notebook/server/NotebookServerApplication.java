package dev.notebook.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the JDBC notebook JSON-RPC server.
 */
@SpringBootApplication
public class NotebookServerApplication {

	private static final Logger logger = LoggerFactory.getLogger(NotebookServerApplication.class);

	/**
	 * Bootstrap the Spring Boot application. The short {@code -p} and {@code -c} flags are accepted
	 * alongside regular Spring Boot arguments.
	 * @param args application arguments passed from the command line
	 */
	public static void main(String[] args) {
		String[] springArgs;
		try {
			springArgs = LegacyArguments.translate(args);
		}
		catch (IllegalArgumentException e) {
			logger.error("{}", e.getMessage());
			System.err.println(LegacyArguments.USAGE);
			System.exit(1);
			return;
		}
		SpringApplication.run(NotebookServerApplication.class, springArgs);
	}

}
