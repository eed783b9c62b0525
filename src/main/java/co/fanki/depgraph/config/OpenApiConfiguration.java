package co.fanki.depgraph.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI metadata for the Dependency Graph Server.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class OpenApiConfiguration {

    @Value("${server.port:8080}")
    private int serverPort;

    /**
     * Describes the API.
     *
     * @return the OpenAPI model
     */
    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Dependency Graph Server API")
                        .description("""
                                Builds file level dependency graphs of local repositories.

                                ## Endpoints
                                - `POST /api/graph` - full graph, optionally narrowed to a
                                  neighborhood (targetFile, level) or to the files between
                                  betweenFiles
                                - `POST /api/graph/cycles` - import cycles only
                                - `GET /api/graph/languages` - languages whose imports resolve
                                - `GET /api/graph/latest` - graph last rebuilt by the watcher

                                ## Sources
                                Files come from explicit paths, a commit, the uncommitted
                                changes or the whole working tree.
                                """)
                        .version("0.0.1")
                        .contact(new Contact()
                                .name("Fanki")
                                .email("emiliano@fanki.co")
                                .url("https://fanki.co")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")));
    }

}
