package dev.notebook.server.query;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.notebook.server.model.ColumnDescriptor;

/**
 * Owns one executed statement and hands out its rows a page at a time. Column descriptors and
 * the update count are read once, when the statement is executed, and never refreshed.
 * <p>
 * Row values are the driver's string rendering of each column, or {@code null} for SQL NULL.
 * <p>
 * Instances are not thread-safe; the owning session serializes access.
 */
public final class PagingContext implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(PagingContext.class);

	private final Statement statement;

	private final ResultSet resultSet;

	private final List<ColumnDescriptor> columns;

	private final int updateCount;

	private boolean exhausted;

	private boolean open = true;

	private PagingContext(Statement statement, ResultSet resultSet, List<ColumnDescriptor> columns,
			int updateCount) {
		this.statement = statement;
		this.resultSet = resultSet;
		this.columns = List.copyOf(columns);
		this.updateCount = updateCount;
		this.exhausted = resultSet == null;
	}

	/**
	 * Execute the SQL on the given statement and wrap the outcome. If execution or metadata
	 * capture fails, the statement is closed before the driver error is rethrown.
	 * @param statement freshly created statement, owned by the context from here on
	 * @param sql SQL text passed to the driver unmodified
	 * @return an open paging context
	 * @throws SQLException when the driver rejects the statement
	 */
	public static PagingContext open(Statement statement, String sql) throws SQLException {
		try {
			boolean hasResultSet = statement.execute(sql);
			ResultSet resultSet = hasResultSet ? statement.getResultSet() : null;
			List<ColumnDescriptor> columns = resultSet == null ? List.of() : describe(resultSet.getMetaData());
			int updateCount = statement.getUpdateCount();
			logger.debug("Opened paging context with {} columns, update count {}", columns.size(), updateCount);
			return new PagingContext(statement, resultSet, columns, updateCount);
		}
		catch (SQLException e) {
			try {
				statement.close();
			}
			catch (SQLException closeFailure) {
				e.addSuppressed(closeFailure);
			}
			throw e;
		}
	}

	/**
	 * @return the column descriptors captured at execution time
	 */
	public List<ColumnDescriptor> metadata() {
		ensureOpen();
		return this.columns;
	}

	/**
	 * @return rows affected by the statement, or {@code -1} when it produced a result set
	 */
	public int count() {
		ensureOpen();
		return this.updateCount;
	}

	/**
	 * Read up to {@code maxRows} further rows. Each row maps column names, in descriptor order, to
	 * the driver's textual rendering of the value ({@code null} for SQL NULL). An empty page means
	 * the result set is exhausted.
	 * @param maxRows upper bound on the number of rows returned, at least 1
	 * @return the next rows, possibly fewer than requested
	 * @throws SQLException when the driver fails while fetching
	 */
	public List<Map<String, String>> page(int maxRows) throws SQLException {
		ensureOpen();
		if (maxRows <= 0) {
			throw new IllegalArgumentException("Page size must be a positive integer");
		}
		List<Map<String, String>> page = new ArrayList<>();
		while (page.size() < maxRows && !this.exhausted) {
			if (!this.resultSet.next()) {
				this.exhausted = true;
				break;
			}
			Map<String, String> row = new LinkedHashMap<>();
			for (int i = 0; i < this.columns.size(); i++) {
				row.put(this.columns.get(i).name(), this.resultSet.getString(i + 1));
			}
			page.add(row);
		}
		return page;
	}

	/**
	 * Release the result set and statement. Must be called exactly once.
	 * @throws SQLException when the driver fails to release the statement
	 */
	public void finish() throws SQLException {
		ensureOpen();
		this.open = false;
		try {
			if (this.resultSet != null) {
				this.resultSet.close();
			}
		}
		finally {
			this.statement.close();
		}
	}

	/**
	 * Finish the context if it is still open.
	 */
	@Override
	public void close() throws SQLException {
		if (this.open) {
			finish();
		}
	}

	public boolean isOpen() {
		return this.open;
	}

	private void ensureOpen() {
		if (!this.open) {
			throw new IllegalStateException("Paging context is already finished");
		}
	}

	private static List<ColumnDescriptor> describe(ResultSetMetaData metaData) throws SQLException {
		List<ColumnDescriptor> columns = new ArrayList<>(metaData.getColumnCount());
		for (int i = 1; i <= metaData.getColumnCount(); i++) {
			columns.add(new ColumnDescriptor(metaData.getColumnLabel(i), metaData.getColumnTypeName(i)));
		}
		return columns;
	}

}
