package co.fanki.depgraph.config;

import co.fanki.depgraph.graph.application.SourceFileCollector;
import co.fanki.depgraph.graph.domain.ConventionTestFileClassifier;
import co.fanki.depgraph.graph.domain.GraphBuilder;
import co.fanki.depgraph.graph.domain.ImportResolverRegistry;
import co.fanki.depgraph.graph.domain.TestFileClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the graph engine.
 *
 * <p>The domain classes carry no Spring annotations; they are created
 * here once and shared, since none of them keeps state between
 * calls.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class GraphEngineConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            GraphEngineConfiguration.class);

    /**
     * Creates the registry with the built-in import resolvers.
     *
     * @return the registry
     */
    @Bean
    public ImportResolverRegistry importResolverRegistry() {
        final ImportResolverRegistry registry =
                ImportResolverRegistry.defaults();
        LOG.info("Import resolvers registered for {}",
                registry.supportedExtensions());
        return registry;
    }

    @Bean
    public GraphBuilder graphBuilder(final ImportResolverRegistry registry) {
        return new GraphBuilder(registry);
    }

    @Bean
    public TestFileClassifier testFileClassifier(
            final ImportResolverRegistry registry) {
        return new ConventionTestFileClassifier(registry);
    }

    @Bean
    public SourceFileCollector sourceFileCollector() {
        return new SourceFileCollector();
    }

}
