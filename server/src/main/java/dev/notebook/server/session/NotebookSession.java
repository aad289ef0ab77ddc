package dev.notebook.server.session;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.notebook.server.catalog.CatalogReader;
import dev.notebook.server.model.ColumnDescriptor;
import dev.notebook.server.model.ColumnEntry;
import dev.notebook.server.model.TableEntry;
import dev.notebook.server.query.PagingContext;

/**
 * The state held for the single database connection the server exposes: the connection itself and
 * at most one active query. Every transition is checked against the current {@link State}; an
 * operation that is not allowed fails with {@link SessionStateException} and leaves the session
 * unchanged.
 * <p>
 * All public operations are mutually exclusive.
 */
public class NotebookSession implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(NotebookSession.class);

	/**
	 * Lifecycle of a session.
	 */
	public enum State {
		/** No query is open. */
		IDLE,
		/** One query is open and can be paged. */
		ACTIVE_QUERY,
		/** The connection was released; nothing further is accepted. */
		CLOSED
	}

	private final Connection connection;

	private final CatalogReader catalogReader;

	private final ShutdownHandle shutdownHandle;

	private PagingContext activeQuery;

	private boolean closed;

	/**
	 * Create a session that takes ownership of the given connection.
	 * @param connection open JDBC connection, closed by {@link #quit()} or {@link #close()}
	 * @param shutdownHandle invoked once by {@link #quit()} after the connection is closed
	 */
	public NotebookSession(Connection connection, ShutdownHandle shutdownHandle) {
		this.connection = Objects.requireNonNull(connection, "connection");
		this.shutdownHandle = Objects.requireNonNull(shutdownHandle, "shutdownHandle");
		this.catalogReader = new CatalogReader(connection);
	}

	/**
	 * @return the current lifecycle state
	 */
	public synchronized State state() {
		if (this.closed) {
			return State.CLOSED;
		}
		return this.activeQuery == null ? State.IDLE : State.ACTIVE_QUERY;
	}

	/**
	 * List the tables visible through the connection.
	 * @return table entries in driver order
	 * @throws SQLException when the driver fails
	 */
	public synchronized List<TableEntry> tables() throws SQLException {
		ensureNotClosed();
		return this.catalogReader.tablesOfKind(CatalogReader.TABLE_KIND);
	}

	/**
	 * List the views visible through the connection.
	 * @return view entries in driver order
	 * @throws SQLException when the driver fails
	 */
	public synchronized List<TableEntry> views() throws SQLException {
		ensureNotClosed();
		return this.catalogReader.tablesOfKind(CatalogReader.VIEW_KIND);
	}

	/**
	 * List columns of the matching tables; empty catalog or schema means any.
	 * @param catalog catalog filter
	 * @param schema schema filter
	 * @param table table name, {@code null} for all tables
	 * @return column entries in driver order
	 * @throws SQLException when the driver fails
	 */
	public synchronized List<ColumnEntry> columns(String catalog, String schema, String table)
			throws SQLException {
		ensureNotClosed();
		return this.catalogReader.columns(catalog, schema, table);
	}

	/**
	 * Execute SQL and make its result the active query.
	 * @param sql statement text, passed to the driver unmodified
	 * @return {@code true}
	 * @throws SQLException when the driver rejects the statement; no query becomes active
	 */
	public synchronized boolean execute(String sql) throws SQLException {
		ensureNotClosed();
		if (this.activeQuery != null) {
			throw new SessionStateException("Cannot execute while a query is active");
		}
		Statement statement = this.connection.createStatement();
		this.activeQuery = PagingContext.open(statement, sql);
		logger.info("Query started");
		logger.debug("Executed: {}", sql);
		return true;
	}

	/**
	 * @return column descriptors of the active query
	 */
	public synchronized List<ColumnDescriptor> metadata() {
		return requireActiveQuery().metadata();
	}

	/**
	 * @return update count of the active query
	 */
	public synchronized int count() {
		return requireActiveQuery().count();
	}

	/**
	 * Fetch the next rows of the active query.
	 * @param maxRows page size, at least 1
	 * @return up to {@code maxRows} rows, empty once the result is exhausted
	 * @throws SQLException when the driver fails while fetching
	 */
	public synchronized List<Map<String, String>> page(int maxRows) throws SQLException {
		PagingContext query = requireActiveQuery();
		if (maxRows <= 0) {
			throw new IllegalArgumentException("Page size must be a positive integer");
		}
		return query.page(maxRows);
	}

	/**
	 * Release the active query and return to the idle state.
	 * @return {@code true}
	 * @throws SQLException when the driver fails to release the cursor; the session is idle anyway
	 */
	public synchronized boolean finish() throws SQLException {
		PagingContext query = requireActiveQuery();
		this.activeQuery = null;
		query.finish();
		logger.info("Query finished");
		return true;
	}

	/**
	 * Close the connection and ask the server to stop. Only allowed while idle.
	 * @return {@code true}
	 * @throws SQLException when the driver fails to close the connection; shutdown is still requested
	 */
	public synchronized boolean quit() throws SQLException {
		ensureNotClosed();
		if (this.activeQuery != null) {
			throw new SessionStateException("Cannot quit while a query is active");
		}
		this.closed = true;
		logger.info("Quit requested, closing connection");
		try {
			this.connection.close();
		}
		finally {
			this.shutdownHandle.requestShutdown();
		}
		return true;
	}

	/**
	 * Release any active query and the connection without requesting a shutdown. Used when the
	 * hosting application stops for reasons other than {@link #quit()}.
	 */
	@Override
	public synchronized void close() {
		if (this.closed) {
			return;
		}
		this.closed = true;
		if (this.activeQuery != null) {
			try {
				this.activeQuery.finish();
			}
			catch (SQLException e) {
				logger.warn("Failed to release active query on close", e);
			}
			this.activeQuery = null;
		}
		try {
			this.connection.close();
		}
		catch (SQLException e) {
			logger.warn("Failed to close connection", e);
		}
		logger.info("Session closed");
	}

	private PagingContext requireActiveQuery() {
		ensureNotClosed();
		if (this.activeQuery == null) {
			throw new SessionStateException("No active query");
		}
		return this.activeQuery;
	}

	private void ensureNotClosed() {
		if (this.closed) {
			throw new SessionStateException("Session is closed");
		}
	}

}
