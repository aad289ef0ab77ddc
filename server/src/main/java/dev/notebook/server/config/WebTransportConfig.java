package dev.notebook.server.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.function.RequestPredicates;
import org.springframework.web.servlet.function.RouterFunction;
import org.springframework.web.servlet.function.RouterFunctions;
import org.springframework.web.servlet.function.ServerResponse;

import dev.notebook.server.web.JsonRpcHandler;

/**
 * Routes HTTP traffic to the JSON-RPC front-end. Only {@code /} is served; every other path is
 * answered with a 404 by the same router.
 */
@Configuration
public class WebTransportConfig {

	@Bean
	public RouterFunction<ServerResponse> jsonRpcRouter(JsonRpcHandler handler) {
		return RouterFunctions.route()
			.POST("/", handler::post)
			.OPTIONS("/", handler::preflight)
			.route(RequestPredicates.path("/"), handler::methodNotAllowed)
			.route(RequestPredicates.all(), handler::notFound)
			.onError(Exception.class, handler::failed)
			.build();
	}

}
