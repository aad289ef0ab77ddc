package dev.notebook.server.web;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

import lombok.RequiredArgsConstructor;

import dev.notebook.jsonrpc.JsonRpcDispatcher;

/**
 * HTTP front-end for the JSON-RPC dispatcher. Requests that are not a JSON {@code POST} to
 * {@code /} are refused with a plain-text status response and never reach the dispatcher.
 */
@Component
@RequiredArgsConstructor
public class JsonRpcHandler {

	private static final Logger logger = LoggerFactory.getLogger(JsonRpcHandler.class);

	static final String WRONG_PATH_MESSAGE = "Request Must Have Path Of /";

	static final String WRONG_CONTENT_TYPE_MESSAGE = "Content-Type Must Be application/json";

	private final JsonRpcDispatcher dispatcher;

	/**
	 * Dispatch a JSON-RPC body. Responds with an empty 200 when every call was a notification.
	 * @param request incoming HTTP request
	 * @return the JSON-RPC response, or a 400 when the content type is not JSON
	 * @throws IOException when the request body cannot be read
	 */
	public ServerResponse post(ServerRequest request) throws IOException {
		if (!isJson(request)) {
			logger.info("Invalid request Content-Type: {}", request.headers().asHttpHeaders().getFirst(HttpHeaders.CONTENT_TYPE));
			return plainText(HttpStatus.BAD_REQUEST, WRONG_CONTENT_TYPE_MESSAGE);
		}
		byte[] body = StreamUtils.copyToByteArray(request.servletRequest().getInputStream());
		String remote = request.remoteAddress().map(String::valueOf).orElse("unknown");
		Optional<String> response = this.dispatcher.handle(remote, body);
		if (response.isEmpty()) {
			return ServerResponse.ok().build();
		}
		return ServerResponse.ok()
			.contentType(MediaType.APPLICATION_JSON)
			.body(response.get().getBytes(StandardCharsets.UTF_8));
	}

	/**
	 * Answer a CORS preflight request; the CORS headers themselves are added by
	 * {@link CorsHeadersFilter}.
	 * @param request incoming HTTP request
	 * @return empty 200 response
	 */
	public ServerResponse preflight(ServerRequest request) {
		logger.debug("Processing CORS OPTIONS request");
		return ServerResponse.ok().build();
	}

	/**
	 * Refuse methods other than {@code POST} and {@code OPTIONS} on {@code /}.
	 * @param request incoming HTTP request
	 * @return 405 response
	 */
	public ServerResponse methodNotAllowed(ServerRequest request) {
		logger.info("Unsupported method {} on /", request.method());
		return plainText(HttpStatus.METHOD_NOT_ALLOWED, "Method Must Be POST Or OPTIONS");
	}

	/**
	 * Refuse any path other than {@code /}.
	 * @param request incoming HTTP request
	 * @return 404 response
	 */
	public ServerResponse notFound(ServerRequest request) {
		logger.info("Invalid request path: {}", request.path());
		return plainText(HttpStatus.NOT_FOUND, WRONG_PATH_MESSAGE);
	}

	/**
	 * Report a failure of the front-end itself as a plain 500.
	 * @param failure the error raised while handling the request
	 * @param request incoming HTTP request
	 * @return 500 response
	 */
	public ServerResponse failed(Throwable failure, ServerRequest request) {
		logger.error("Failed to handle {} {}", request.method(), request.path(), failure);
		return plainText(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error");
	}

	private static boolean isJson(ServerRequest request) {
		try {
			return request.headers()
				.contentType()
				.map(MediaType.APPLICATION_JSON::equalsTypeAndSubtype)
				.orElse(false);
		}
		catch (InvalidMediaTypeException e) {
			logger.debug("Unparseable Content-Type header", e);
			return false;
		}
	}

	private static ServerResponse plainText(HttpStatus status, String message) {
		return ServerResponse.status(status).contentType(MediaType.TEXT_PLAIN).body(message);
	}

}
