package dev.notebook.server.rpc;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import dev.notebook.jsonrpc.JsonRpcDispatcher;
import dev.notebook.jsonrpc.RpcMethod;
import dev.notebook.server.session.NotebookSession;

class NotebookMethodsTest {

	private final ObjectMapper mapper = new ObjectMapper();

	private final AtomicInteger shutdownRequests = new AtomicInteger();

	private NotebookSession session;

	private NotebookMethods methods;

	private JsonRpcDispatcher dispatcher;

	@BeforeEach
	void setUp() throws SQLException {
		Connection connection = DriverManager.getConnection("jdbc:hsqldb:mem:methods-" + UUID.randomUUID(), "SA",
				"");
		try (Statement statement = connection.createStatement()) {
			statement.execute("CREATE TABLE items (id INTEGER, label VARCHAR(20))");
			statement.execute("INSERT INTO items VALUES (1, 'one'), (2, 'two')");
			statement.execute("CREATE VIEW item_ids AS SELECT id FROM items");
		}
		this.session = new NotebookSession(connection, this.shutdownRequests::incrementAndGet);
		this.methods = new NotebookMethods(this.session);
		this.dispatcher = new JsonRpcDispatcher(this.methods.registry(), this.mapper);
	}

	@AfterEach
	void tearDown() {
		this.session.close();
	}

	@Test
	void registersEveryNotebookMethod() {
		assertThat(this.methods.registry().methods()).extracting(RpcMethod::name)
			.containsExactlyInAnyOrder("tables", "views", "columns", "execute", "metadata", "count", "page",
					"finish", "quit");
	}

	@Test
	void runsQueryLifecycleOverRpc() throws Exception {
		assertThat(call("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"execute\",\"params\":[\"SELECT id, label FROM items ORDER BY id\"]}")
			.path("result")
			.asBoolean()).isTrue();

		JsonNode metadata = call("{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"metadata\"}").path("result");
		assertThat(metadata).hasSize(2);
		assertThat(metadata.get(0).path("column").asText()).isEqualTo("ID");
		assertThat(metadata.get(0).path("datatype").asText()).isEqualTo("INTEGER");

		JsonNode page = call("{\"jsonrpc\":\"2.0\",\"id\":3,\"method\":\"page\",\"params\":{\"max\":1}}").path("result");
		assertThat(page).hasSize(1);
		assertThat(page.get(0).path("LABEL").asText()).isEqualTo("one");

		assertThat(call("{\"jsonrpc\":\"2.0\",\"id\":4,\"method\":\"page\",\"params\":[10]}").path("result")).hasSize(1);
		assertThat(call("{\"jsonrpc\":\"2.0\",\"id\":5,\"method\":\"page\",\"params\":[10]}").path("result")).isEmpty();
		assertThat(call("{\"jsonrpc\":\"2.0\",\"id\":6,\"method\":\"count\"}").path("result").asInt()).isEqualTo(-1);
		assertThat(call("{\"jsonrpc\":\"2.0\",\"id\":7,\"method\":\"finish\"}").path("result").asBoolean()).isTrue();
	}

	@Test
	void listsCatalogObjects() throws Exception {
		JsonNode tables = call("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tables\"}").path("result");
		JsonNode views = call("{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"views\",\"params\":[]}").path("result");
		JsonNode columns = call(
				"{\"jsonrpc\":\"2.0\",\"id\":3,\"method\":\"columns\",\"params\":[\"\",\"\",\"ITEMS\"]}")
			.path("result");

		assertThat(tables.findValuesAsText("table")).contains("ITEMS").doesNotContain("ITEM_IDS");
		assertThat(views.findValuesAsText("table")).contains("ITEM_IDS");
		assertThat(columns.findValuesAsText("column")).containsExactly("ID", "LABEL");
		assertThat(columns.get(0).path("schema").asText()).isEqualTo("PUBLIC");
	}

	@Test
	void sqlNullIsSentAsJsonNull() throws Exception {
		call("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"execute\",\"params\":[\"INSERT INTO items VALUES (3, NULL)\"]}");
		assertThat(call("{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"count\"}").path("result").asInt()).isEqualTo(1);
		call("{\"jsonrpc\":\"2.0\",\"id\":3,\"method\":\"finish\"}");
		call("{\"jsonrpc\":\"2.0\",\"id\":4,\"method\":\"execute\",\"params\":[\"SELECT id, label FROM items WHERE id = 3\"]}");

		JsonNode row = call("{\"jsonrpc\":\"2.0\",\"id\":5,\"method\":\"page\",\"params\":[1]}").path("result").get(0);

		assertThat(row.path("ID").asText()).isEqualTo("3");
		assertThat(row.has("LABEL")).isTrue();
		assertThat(row.get("LABEL").isNull()).isTrue();
	}

	@Test
	void stateViolationsSurfaceAsInternalErrors() throws Exception {
		JsonNode response = call("{\"jsonrpc\":\"2.0\",\"id\":9,\"method\":\"count\"}");

		assertThat(response.path("id").asInt()).isEqualTo(9);
		assertThat(response.path("error").path("code").asInt()).isEqualTo(-32603);
		assertThat(response.path("error").path("message").asText()).isEqualTo("Internal error");
		assertThat(response.path("error").path("data").path("message").asText()).isEqualTo("No active query");
		assertThat(response.path("error").path("data").path("stacktrace").asText()).contains("SessionStateException");
	}

	@Test
	void wrongPageArgumentTypeIsInvalidParams() throws Exception {
		call("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"execute\",\"params\":[\"SELECT id FROM items\"]}");

		JsonNode response = call("{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"page\",\"params\":[\"10\"]}");

		assertThat(response.path("error").path("code").asInt()).isEqualTo(-32602);
		assertThat(this.session.state()).isEqualTo(NotebookSession.State.ACTIVE_QUERY);
	}

	@Test
	void batchKeepsFailuresOfRequestsAndDropsNotifications() throws Exception {
		JsonNode response = call(
				"[{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"count\"},{\"jsonrpc\":\"2.0\",\"id\":null,\"method\":\"bogus\"}]");

		assertThat(response.isArray()).isTrue();
		assertThat(response).hasSize(1);
		assertThat(response.get(0).path("id").asInt()).isEqualTo(1);
		assertThat(response.get(0).path("error").path("data").path("message").asText()).isEqualTo("No active query");
	}

	@Test
	void quitOverRpcRequestsShutdown() throws Exception {
		JsonNode response = call("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"quit\"}");

		assertThat(response.path("result").asBoolean()).isTrue();
		assertThat(this.shutdownRequests).hasValue(1);
		assertThat(this.session.state()).isEqualTo(NotebookSession.State.CLOSED);
	}

	private JsonNode call(String body) throws Exception {
		Optional<String> response = this.dispatcher.handle("test", body.getBytes(StandardCharsets.UTF_8));
		assertThat(response).isPresent();
		return this.mapper.readTree(response.get());
	}

}
