package co.fanki.depgraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Dependency Graph Server Application.
 *
 * <p>Builds file dependency graphs of local repositories, finds import
 * cycles and answers neighborhood and between queries over HTTP. With
 * {@code watch.enabled=true} it also keeps the graph of one repository
 * up to date as the working tree changes.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
@EnableScheduling
public class DependencyGraphServerApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(DependencyGraphServerApplication.class, args);
    }

}
