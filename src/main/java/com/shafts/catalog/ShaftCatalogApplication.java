package com.shafts.catalog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * The main entry point for the Shaft Catalog application.
 *
 * <p>This Spring Boot application normalizes golf shaft data published by many manufacturers
 * into one canonical schema and exposes RESTful endpoints for:
 * <ul>
 *   <li>ingesting raw manufacturer records,</li>
 *   <li>filtered search, lookup and statistics,</li>
 *   <li>side-by-side comparison of 2 to 4 shafts,</li>
 *   <li>CSV and JSON export.</li>
 * </ul>
 * </p>
 *
 * <p>Usage:
 * <pre>{@code
 *   // From the command line:
 *   mvn spring-boot:run
 *
 *   // Or run the JAR:
 *   java -jar target/shaft-catalog-0.1.0.jar
 * }</pre>
 *
 * <p>Once started, the application will listen on the configured port (default
 * 8080) and serve requests under <code>/api/</code>.</p>
 */
@SpringBootApplication
public class ShaftCatalogApplication {

    /**
     * Bootstrap method to launch the Spring Boot application.
     *
     * @param args command-line arguments (ignored)
     */
    public static void main(final String[] args) {
        SpringApplication.run(ShaftCatalogApplication.class, args);
    }
}
