package com.products.lookup;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * The main entry point for the Product Lookup application.
 *
 * <p>This Spring Boot application exposes RESTful endpoints for:
 * <ul>
 *   <li>barcode lookups across the food, beauty and general product catalogs,
 *       with language fallback,</li>
 *   <li>price history, latest price and statistics from the pricing service,</li>
 *   <li>authenticated price submission.</li>
 * </ul>
 * It wires together the catalog clients, the pricing session manager and
 * Spring MVC controllers.</p>
 *
 * <p>Usage:
 * <pre>{@code
 *   // From the command line:
 *   mvn spring-boot:run
 *
 *   // Or run the JAR:
 *   java -jar target/product-lookup-0.1.0-SNAPSHOT.jar
 * }</pre>
 *
 * <p>Once started, the application listens on the configured port (default
 * 8080) and serves requests under <code>/api/</code>.</p>
 */
@SpringBootApplication
public class ProductLookupApplication {

    /**
     * Bootstrap method to launch the Spring Boot application.
     *
     * @param args command-line arguments (ignored)
     */
    public static void main(final String[] args) {
        SpringApplication.run(ProductLookupApplication.class, args);
    }
}
