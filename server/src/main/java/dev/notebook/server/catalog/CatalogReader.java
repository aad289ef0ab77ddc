package dev.notebook.server.catalog;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.notebook.server.model.ColumnEntry;
import dev.notebook.server.model.TableEntry;

/**
 * Reads table, view and column listings from the driver's {@link DatabaseMetaData}. Every call
 * opens and closes its own catalog result set, so it never disturbs a query in progress on the
 * same connection.
 */
public class CatalogReader {

	private static final Logger logger = LoggerFactory.getLogger(CatalogReader.class);

	/**
	 * Table type reported by drivers for ordinary tables.
	 */
	public static final String TABLE_KIND = "table";

	/**
	 * Table type reported by drivers for views.
	 */
	public static final String VIEW_KIND = "view";

	private final Connection connection;

	/**
	 * Create a reader over the given connection. The connection stays owned by the caller.
	 * @param connection open JDBC connection
	 */
	public CatalogReader(Connection connection) {
		this.connection = connection;
	}

	/**
	 * List every catalog object whose table type equals the given kind, ignoring case.
	 * @param kind table type to keep, for example {@link #TABLE_KIND} or {@link #VIEW_KIND}
	 * @return matching entries in driver order
	 * @throws SQLException when the driver fails to produce the listing
	 */
	public List<TableEntry> tablesOfKind(String kind) throws SQLException {
		DatabaseMetaData metaData = this.connection.getMetaData();
		List<TableEntry> tables = new ArrayList<>();
		try (ResultSet rows = metaData.getTables(null, null, "%", null)) {
			while (rows.next()) {
				String tableType = rows.getString("TABLE_TYPE");
				if (tableType != null && tableType.equalsIgnoreCase(kind)) {
					tables.add(new TableEntry(rows.getString("TABLE_CAT"), rows.getString("TABLE_SCHEM"),
							rows.getString("TABLE_NAME")));
				}
			}
		}
		logger.debug("Catalog listed {} objects of kind {}", tables.size(), kind);
		return tables;
	}

	/**
	 * List the columns of the matching tables. Empty or {@code null} catalog and schema values do
	 * not filter; the table name is handed to the driver unmodified.
	 * @param catalog catalog filter, empty for any
	 * @param schema schema filter, empty for any
	 * @param table table name pattern, {@code null} for all tables
	 * @return one entry per column in driver order
	 * @throws SQLException when the driver fails to produce the listing
	 */
	public List<ColumnEntry> columns(String catalog, String schema, String table) throws SQLException {
		DatabaseMetaData metaData = this.connection.getMetaData();
		List<ColumnEntry> columns = new ArrayList<>();
		try (ResultSet rows = metaData.getColumns(unspecifiedIfEmpty(catalog), unspecifiedIfEmpty(schema), table,
				null)) {
			while (rows.next()) {
				columns.add(new ColumnEntry(rows.getString("TABLE_CAT"), rows.getString("TABLE_SCHEM"),
						rows.getString("TABLE_NAME"), rows.getString("COLUMN_NAME"), rows.getString("TYPE_NAME")));
			}
		}
		logger.debug("Catalog listed {} columns for {}.{}.{}", columns.size(), catalog, schema, table);
		return columns;
	}

	private static String unspecifiedIfEmpty(String value) {
		return value == null || value.isEmpty() ? null : value;
	}

}
