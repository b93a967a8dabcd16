/**
 * Main application class for the guild lookup service
 *
 * Features:
 * - Serves guild profiles from the Postgres cache and refreshes them from Battle.net
 * - The lookup endpoint is public; no authentication layer is configured
 * - Entry point for Spring Boot application
 */

package net.guildlookup;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GuildLookupApplication {

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        SpringApplication.run(GuildLookupApplication.class, args);
    }
}
