package dev.notebook.server.rpc;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

import dev.notebook.jsonrpc.MethodRegistry;
import dev.notebook.jsonrpc.ParamSpec;
import dev.notebook.jsonrpc.RpcMethod;
import dev.notebook.server.model.ColumnDescriptor;
import dev.notebook.server.model.ColumnEntry;
import dev.notebook.server.model.TableEntry;
import dev.notebook.server.session.NotebookSession;

/**
 * JSON-RPC method definitions exposing the {@link NotebookSession} operations: catalog listings,
 * query execution and paging, and server shutdown.
 */
@Component
@RequiredArgsConstructor
public class NotebookMethods {

	private static final Logger logger = LoggerFactory.getLogger(NotebookMethods.class);

	private final NotebookSession session;

	/**
	 * Assemble the registry of every method the server answers.
	 * @return registry keyed by method name
	 */
	public MethodRegistry registry() {
		return MethodRegistry.builder()
			.register(tablesMethod())
			.register(viewsMethod())
			.register(columnsMethod())
			.register(executeMethod())
			.register(metadataMethod())
			.register(countMethod())
			.register(pageMethod())
			.register(finishMethod())
			.register(quitMethod())
			.build();
	}

	/**
	 * Provide the {@code tables} method.
	 * @return method listing all tables
	 */
	public RpcMethod tablesMethod() {
		return RpcMethod.builder("tables")
			.description("List every table as {catalog, schema, table}.")
			.handler(arguments -> structured(this.session.tables(), TableEntry::toStructured));
	}

	/**
	 * Provide the {@code views} method.
	 * @return method listing all views
	 */
	public RpcMethod viewsMethod() {
		return RpcMethod.builder("views")
			.description("List every view as {catalog, schema, table}.")
			.handler(arguments -> structured(this.session.views(), TableEntry::toStructured));
	}

	/**
	 * Provide the {@code columns} method. Empty catalog and schema arguments match any.
	 * @return method listing the columns of a table
	 */
	public RpcMethod columnsMethod() {
		return RpcMethod.builder("columns")
			.description("List the columns of a table as {catalog, schema, table, column, datatype}.")
			.param(ParamSpec.nullableString("catalog"))
			.param(ParamSpec.nullableString("schema"))
			.param(ParamSpec.nullableString("table"))
			.handler(arguments -> {
				String catalog = (String) arguments.get(0);
				String schema = (String) arguments.get(1);
				String table = (String) arguments.get(2);
				logger.debug("Handling columns request for {}.{}.{}", catalog, schema, table);
				return structured(this.session.columns(catalog, schema, table), ColumnEntry::toStructured);
			});
	}

	/**
	 * Provide the {@code execute} method.
	 * @return method starting a query
	 */
	public RpcMethod executeMethod() {
		return RpcMethod.builder("execute")
			.description("Execute SQL and make it the active query.")
			.param(ParamSpec.string("sql"))
			.handler(arguments -> this.session.execute((String) arguments.get(0)));
	}

	/**
	 * Provide the {@code metadata} method.
	 * @return method describing the active query's columns
	 */
	public RpcMethod metadataMethod() {
		return RpcMethod.builder("metadata")
			.description("Describe the active query's columns as {column, datatype}.")
			.handler(arguments -> structured(this.session.metadata(), ColumnDescriptor::toStructured));
	}

	/**
	 * Provide the {@code count} method.
	 * @return method reporting the active query's update count
	 */
	public RpcMethod countMethod() {
		return RpcMethod.builder("count")
			.description("Report the number of rows affected by the active query.")
			.handler(arguments -> this.session.count());
	}

	/**
	 * Provide the {@code page} method.
	 * @return method fetching the next rows of the active query
	 */
	public RpcMethod pageMethod() {
		return RpcMethod.builder("page")
			.description("Fetch up to max further rows of the active query.")
			.param(ParamSpec.integer("max"))
			.handler(arguments -> this.session.page((Integer) arguments.get(0)));
	}

	/**
	 * Provide the {@code finish} method.
	 * @return method closing the active query
	 */
	public RpcMethod finishMethod() {
		return RpcMethod.builder("finish")
			.description("Close the active query.")
			.handler(arguments -> this.session.finish());
	}

	/**
	 * Provide the {@code quit} method.
	 * @return method closing the connection and stopping the server
	 */
	public RpcMethod quitMethod() {
		return RpcMethod.builder("quit")
			.description("Close the connection and stop the server.")
			.handler(arguments -> this.session.quit());
	}

	private static <T> List<Map<String, Object>> structured(List<T> entries,
			Function<T, Map<String, Object>> mapper) {
		return entries.stream().map(mapper).collect(Collectors.toList());
	}

}
