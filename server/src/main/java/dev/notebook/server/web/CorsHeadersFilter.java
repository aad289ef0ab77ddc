package dev.notebook.server.web;

import java.io.IOException;
import java.util.Map;

import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Adds the fixed CORS headers to every response, so browsers on any origin can call the server.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorsHeadersFilter extends OncePerRequestFilter {

	static final Map<String, String> CORS_HEADERS = Map.of(
			"Access-Control-Allow-Origin", "*",
			"Access-Control-Allow-Methods", "POST, OPTIONS",
			"Access-Control-Allow-Headers", "Content-Type",
			"Access-Control-Max-Age", "86400");

	@Override
	protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
			throws ServletException, IOException {
		CORS_HEADERS.forEach(response::setHeader);
		chain.doFilter(request, response);
	}

}
