package dev.notebook.server.config;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.DriverManager;
import java.sql.SQLException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;

import dev.notebook.jsonrpc.JsonRpcDispatcher;
import dev.notebook.jsonrpc.MethodRegistry;
import dev.notebook.jsonrpc.RpcMethod;
import dev.notebook.server.rpc.NotebookMethods;
import dev.notebook.server.session.NotebookSession;
import dev.notebook.server.session.ShutdownHandle;

/**
 * Spring configuration that opens the database connection, wraps it in the session and builds
 * the JSON-RPC dispatcher over the session's methods.
 */
@Configuration
@EnableConfigurationProperties(NotebookProperties.class)
public class NotebookServerConfig {

	private static final Logger logger = LoggerFactory.getLogger(NotebookServerConfig.class);

	/**
	 * Open the connection described by {@link NotebookProperties} and hand it to a new session.
	 * @param properties connection settings
	 * @param shutdownHandle handle invoked when a client calls {@code quit}
	 * @return the session owning the connection
	 * @throws SQLException when the connection cannot be opened
	 */
	@Bean(destroyMethod = "close")
	public NotebookSession notebookSession(NotebookProperties properties, ShutdownHandle shutdownHandle)
			throws SQLException {
		Connection connection = DriverManager.getConnection(properties.requireUrl(), properties.getUsername(),
				properties.getPassword());
		try {
			connection.setAutoCommit(properties.isAutoCommit());
			DatabaseMetaData metaData = connection.getMetaData();
			logger.info("Connected to {} {} (auto-commit: {})", metaData.getDatabaseProductName(),
					metaData.getDatabaseProductVersion(), properties.isAutoCommit());
		}
		catch (SQLException e) {
			try {
				connection.close();
			}
			catch (SQLException closeFailure) {
				e.addSuppressed(closeFailure);
			}
			throw e;
		}
		return new NotebookSession(connection, shutdownHandle);
	}

	/**
	 * Build the dispatcher answering every registered notebook method.
	 * @param methods method definitions bound to the session
	 * @param objectMapper mapper used to read requests and write responses
	 * @return dispatcher for request bodies
	 */
	@Bean
	public JsonRpcDispatcher jsonRpcDispatcher(NotebookMethods methods, ObjectMapper objectMapper) {
		MethodRegistry registry = methods.registry();
		logger.info("JSON-RPC dispatcher ready with methods {}",
				registry.methods().stream().map(RpcMethod::name).toList());
		return new JsonRpcDispatcher(registry, objectMapper);
	}

}
