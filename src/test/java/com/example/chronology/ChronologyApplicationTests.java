package com.example.chronology;

import com.example.chronology.application.port.SecondaryExtractor;
import com.example.chronology.application.service.ChronologyService;
import com.example.chronology.domain.model.RuleSet;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration smoke tests for verifying the Spring context boots with the documented beans.
 */
@SpringBootTest
class ChronologyApplicationTests {

	@Autowired
	private ApplicationContext context;

	/**
	 * Ensures the application context loads without throwing exceptions.
	 */
	@Test
	void contextLoads() {
		assertThat(context.getBean(ChronologyService.class)).isNotNull();
		assertThat(context.getBean(RuleSet.class).eventPatterns()).isNotEmpty();
	}

	/**
	 * The secondary extractor only exists when explicitly enabled.
	 */
	@Test
	void secondaryExtractorIsOffByDefault() {
		assertThat(context.getBeanNamesForType(SecondaryExtractor.class)).isEmpty();
	}

}
