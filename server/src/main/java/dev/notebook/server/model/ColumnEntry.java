package dev.notebook.server.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A column of a table as reported by the driver's catalog.
 * @param catalog catalog name, empty when the driver reports none
 * @param schema schema name, empty when the driver reports none
 * @param table owning table name
 * @param column column name
 * @param datatype driver type name of the column
 */
public record ColumnEntry(String catalog, String schema, String table, String column, String datatype) {

	public ColumnEntry {
		catalog = catalog == null ? "" : catalog;
		schema = schema == null ? "" : schema;
	}

	/**
	 * Render this entry as a structured map suitable for RPC responses.
	 * @return structured representation of the column
	 */
	public Map<String, Object> toStructured() {
		Map<String, Object> structured = new LinkedHashMap<>();
		structured.put("catalog", catalog);
		structured.put("schema", schema);
		structured.put("table", table);
		structured.put("column", column);
		structured.put("datatype", datatype);
		return structured;
	}

}
