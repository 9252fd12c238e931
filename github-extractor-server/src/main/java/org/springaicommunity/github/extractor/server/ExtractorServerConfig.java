package org.springaicommunity.github.extractor.server;

import org.springaicommunity.github.extractor.ExtractorProperties;
import org.springaicommunity.github.extractor.GitHubExtractorBuilder;
import org.springaicommunity.github.extractor.JobRegistry;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the core {@link JobRegistry} from {@code extractor.*} properties.
 */
@Configuration
public class ExtractorServerConfig {

	@Bean
	@ConfigurationProperties(prefix = "extractor")
	public ExtractorProperties extractorProperties() {
		return new ExtractorProperties();
	}

	@Bean(destroyMethod = "close")
	public JobRegistry jobRegistry(ExtractorProperties extractorProperties) {
		return GitHubExtractorBuilder.create().properties(extractorProperties).buildJobRegistry();
	}

}
