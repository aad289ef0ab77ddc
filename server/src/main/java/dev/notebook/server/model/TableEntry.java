package dev.notebook.server.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A table or view reported by the driver's catalog.
 * @param catalog catalog name, empty when the driver reports none
 * @param schema schema name, empty when the driver reports none
 * @param table table or view name as reported
 */
public record TableEntry(String catalog, String schema, String table) {

	public TableEntry {
		catalog = catalog == null ? "" : catalog;
		schema = schema == null ? "" : schema;
	}

	/**
	 * Render this entry as a structured map suitable for RPC responses.
	 * @return structured representation of the table
	 */
	public Map<String, Object> toStructured() {
		Map<String, Object> structured = new LinkedHashMap<>();
		structured.put("catalog", catalog);
		structured.put("schema", schema);
		structured.put("table", table);
		return structured;
	}

}
