package dev.notebook.server.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import dev.notebook.server.session.NotebookSession;
import dev.notebook.server.session.ShutdownHandle;

@SpringBootTest(properties = { "notebook.jdbc.url=jdbc:hsqldb:mem:web-handler", "notebook.jdbc.username=SA" })
@AutoConfigureMockMvc
class JsonRpcHandlerTest {

	@Autowired
	private MockMvc mockMvc;

	@Autowired
	private NotebookSession session;

	@MockBean
	private ShutdownHandle shutdownHandle;

	@Test
	void answersJsonRpcCallWithCorsHeaders() throws Exception {
		this.mockMvc
			.perform(post("/").contentType(MediaType.APPLICATION_JSON)
				.content("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tables\"}"))
			.andExpect(status().isOk())
			.andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
			.andExpect(header().string("Access-Control-Allow-Origin", "*"))
			.andExpect(jsonPath("$.jsonrpc").value("2.0"))
			.andExpect(jsonPath("$.id").value(1))
			.andExpect(jsonPath("$.result").isArray());
	}

	@Test
	void acceptsJsonWithCharsetParameter() throws Exception {
		this.mockMvc
			.perform(post("/").contentType("application/json; charset=utf-8")
				.content("{\"jsonrpc\":\"2.0\",\"id\":\"x\",\"method\":\"views\"}"))
			.andExpect(status().isOk())
			.andExpect(jsonPath("$.id").value("x"));
	}

	@Test
	void notificationGetsEmptyOk() throws Exception {
		MvcResult result = this.mockMvc
			.perform(post("/").contentType(MediaType.APPLICATION_JSON)
				.content("{\"jsonrpc\":\"2.0\",\"method\":\"count\"}"))
			.andExpect(status().isOk())
			.andReturn();

		assertThat(result.getResponse().getContentAsString()).isEmpty();
	}

	@Test
	void malformedBodyGetsParseError() throws Exception {
		this.mockMvc.perform(post("/").contentType(MediaType.APPLICATION_JSON).content("{\"jsonrpc\":"))
			.andExpect(status().isOk())
			.andExpect(jsonPath("$.error.code").value(-32700))
			.andExpect(jsonPath("$.id").value(nullValue()));
	}

	@Test
	void refusesOtherPaths() throws Exception {
		this.mockMvc.perform(post("/rpc").contentType(MediaType.APPLICATION_JSON).content("{}"))
			.andExpect(status().isNotFound())
			.andExpect(content().string(JsonRpcHandler.WRONG_PATH_MESSAGE));
		this.mockMvc.perform(get("/anything"))
			.andExpect(status().isNotFound())
			.andExpect(content().string(JsonRpcHandler.WRONG_PATH_MESSAGE));
	}

	@Test
	void refusesNonJsonContentType() throws Exception {
		this.mockMvc.perform(post("/").contentType(MediaType.TEXT_PLAIN).content("{}"))
			.andExpect(status().isBadRequest())
			.andExpect(content().string(JsonRpcHandler.WRONG_CONTENT_TYPE_MESSAGE));
		this.mockMvc.perform(post("/").content("{}"))
			.andExpect(status().isBadRequest());
	}

	@Test
	void refusesOtherMethodsOnRoot() throws Exception {
		this.mockMvc.perform(put("/").contentType(MediaType.APPLICATION_JSON).content("{}"))
			.andExpect(status().isMethodNotAllowed());
	}

	@Test
	void answersPreflight() throws Exception {
		this.mockMvc.perform(options("/"))
			.andExpect(status().isOk())
			.andExpect(header().string("Access-Control-Allow-Origin", "*"))
			.andExpect(header().string("Access-Control-Allow-Methods", "POST, OPTIONS"))
			.andExpect(header().string("Access-Control-Allow-Headers", "Content-Type"))
			.andExpect(header().string("Access-Control-Max-Age", "86400"));
		verify(this.shutdownHandle, never()).requestShutdown();
	}

	@Test
	@DirtiesContext
	void quitClosesSessionAndRequestsShutdown() throws Exception {
		this.mockMvc
			.perform(post("/").contentType(MediaType.APPLICATION_JSON)
				.content("{\"jsonrpc\":\"2.0\",\"id\":5,\"method\":\"quit\"}"))
			.andExpect(status().isOk())
			.andExpect(jsonPath("$.result").value(true));

		verify(this.shutdownHandle).requestShutdown();
		assertThat(this.session.state()).isEqualTo(NotebookSession.State.CLOSED);
	}

}
