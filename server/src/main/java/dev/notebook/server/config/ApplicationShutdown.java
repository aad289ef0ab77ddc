package dev.notebook.server.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

import dev.notebook.server.session.ShutdownHandle;

/**
 * Stops the application from a dedicated thread, so that the request asking for the shutdown can
 * complete while the web server drains.
 */
@Component
@RequiredArgsConstructor
public class ApplicationShutdown implements ShutdownHandle {

	private static final Logger logger = LoggerFactory.getLogger(ApplicationShutdown.class);

	static final String THREAD_NAME = "notebook-shutdown";

	private final ConfigurableApplicationContext context;

	@Override
	public void requestShutdown() {
		Thread stopper = new Thread(() -> {
			logger.info("Stopping notebook server");
			int exitCode = SpringApplication.exit(this.context);
			logger.info("Notebook server stopped with exit code {}", exitCode);
		}, THREAD_NAME);
		stopper.setDaemon(false);
		stopper.start();
	}

}
