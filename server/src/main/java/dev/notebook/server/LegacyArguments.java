package dev.notebook.server;

import java.util.ArrayList;
import java.util.List;

/**
 * Translates the short command-line flags into Spring Boot properties:
 * {@code -p PORT} becomes {@code --server.port=PORT} and {@code -c URL} becomes
 * {@code --notebook.jdbc.url=URL}. Any other argument is passed through unchanged.
 */
final class LegacyArguments {

	static final String USAGE = "notebook-server [-p PORT] [-c JDBC_URL] [--spring.property=value ...]";

	private LegacyArguments() {
	}

	/**
	 * @param args raw command-line arguments
	 * @return arguments understood by Spring Boot
	 * @throws IllegalArgumentException when a flag is repeated, lacks its value or the port is out of range
	 */
	static String[] translate(String[] args) {
		List<String> translated = new ArrayList<>();
		boolean portSeen = false;
		boolean urlSeen = false;
		for (int i = 0; i < args.length; i++) {
			String arg = args[i];
			switch (arg) {
				case "-p" -> {
					if (portSeen) {
						throw new IllegalArgumentException("-p given more than once");
					}
					portSeen = true;
					translated.add("--server.port=" + parsePort(valueOf(args, ++i, arg)));
				}
				case "-c" -> {
					if (urlSeen) {
						throw new IllegalArgumentException("-c given more than once");
					}
					urlSeen = true;
					translated.add("--notebook.jdbc.url=" + valueOf(args, ++i, arg));
				}
				default -> translated.add(arg);
			}
		}
		return translated.toArray(new String[0]);
	}

	private static String valueOf(String[] args, int index, String flag) {
		if (index >= args.length) {
			throw new IllegalArgumentException(flag + " requires a value");
		}
		return args[index];
	}

	private static int parsePort(String value) {
		int port;
		try {
			port = Integer.parseInt(value);
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid port: " + value, e);
		}
		if (port <= 0 || port > 65535) {
			throw new IllegalArgumentException("Port out of range: " + port);
		}
		return port;
	}

}
