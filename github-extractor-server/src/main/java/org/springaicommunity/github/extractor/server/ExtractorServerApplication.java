package org.springaicommunity.github.extractor.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * GitHub Extractor Server
 *
 * HTTP front end for submitting extraction jobs and polling their progress. Jobs run in
 * the background; finished CSV files are served from {@code /api/download}.
 *
 * Usage: java -jar github-extractor-server.jar [--server.port=8000]
 *
 * Environment Variables: GITHUB_TOKEN - used when a submission carries no token
 */
@SpringBootApplication
public class ExtractorServerApplication {

	public static void main(String[] args) {
		SpringApplication.run(ExtractorServerApplication.class, args);
	}

}
