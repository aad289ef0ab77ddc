package dev.notebook.server.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Name and driver type name of one result column, captured when a query is executed.
 * @param name column label reported by the driver
 * @param typeName driver-specific type name of the column
 */
public record ColumnDescriptor(String name, String typeName) {

	/**
	 * Render this descriptor as a structured map suitable for RPC responses.
	 * @return map with {@code column} and {@code datatype} entries
	 */
	public Map<String, Object> toStructured() {
		Map<String, Object> structured = new LinkedHashMap<>();
		structured.put("column", name);
		structured.put("datatype", typeName);
		return structured;
	}

}
