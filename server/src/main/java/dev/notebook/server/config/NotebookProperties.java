package dev.notebook.server.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

/**
 * Connection settings for the single database connection the server exposes.
 */
@ConfigurationProperties(prefix = "notebook.jdbc")
public class NotebookProperties {

	/**
	 * JDBC URL of the database to expose. Required.
	 */
	private String url;

	/**
	 * Optional user name passed to the driver.
	 */
	private String username;

	/**
	 * Optional password passed to the driver.
	 */
	private String password;

	/**
	 * Whether statements commit as they complete.
	 */
	private boolean autoCommit = true;

	public String getUrl() {
		return url;
	}

	public void setUrl(String url) {
		this.url = url;
	}

	public String getUsername() {
		return username;
	}

	public void setUsername(String username) {
		this.username = username;
	}

	public String getPassword() {
		return password;
	}

	public void setPassword(String password) {
		this.password = password;
	}

	public boolean isAutoCommit() {
		return autoCommit;
	}

	public void setAutoCommit(boolean autoCommit) {
		this.autoCommit = autoCommit;
	}

	/**
	 * Retrieve the configured URL, failing when none was supplied.
	 * @return the JDBC URL
	 * @throws IllegalStateException when {@code notebook.jdbc.url} is not set
	 */
	public String requireUrl() {
		if (!StringUtils.hasText(this.url)) {
			throw new IllegalStateException(
					"No JDBC URL configured; set notebook.jdbc.url or pass -c <jdbc-url> on the command line");
		}
		return this.url;
	}

}
