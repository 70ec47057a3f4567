package com.example.chronology;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Application entry point for the case chronology extractor.
 * This class lives in the API/bootstrap layer and should only be used to wire the
 * application context and hand over control to Spring.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ChronologyApplication {

	/**
	 * Boots the Spring container. With {@code chronology.batch.input} set, the batch runner processes that
	 * path at startup; the HTTP endpoints under the interfaces layer are available either way.
	 *
	 * @param args optional command line arguments passed by the JVM
	 */
	public static void main(String[] args) {
		SpringApplication.run(ChronologyApplication.class, args);
	}

}
