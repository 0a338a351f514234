package io.cgmes.eqflat;

import io.cgmes.eqflat.config.loader.FlattenConfigLoader;
import io.cgmes.eqflat.config.model.FlattenConfig;
import io.cgmes.eqflat.parse.UnparseableDocumentException;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point. Takes the path of a properties file as its only argument, or reads
 * it from the {@value FlattenConfigLoader#SYS_PROP} system property.
 */
public final class EqFlattenerCli {
    private static final Logger LOG = LoggerFactory.getLogger(EqFlattenerCli.class);

    private EqFlattenerCli() {}

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        if (args.length > 1) {
            LOG.error("Usage: EqFlattenerCli [config.properties]");
            return 64;
        }
        try {
            FlattenConfig config =
                    args.length == 1
                            ? FlattenConfigLoader.load(args[0])
                            : FlattenConfigLoader.load();
            FlattenResult result = new EqFlattener(config).run();
            LOG.info(
                    "Done: {} objects, {} classes",
                    result.objectCount(),
                    result.enriched().size());
            return 0;
        } catch (UnparseableDocumentException e) {
            LOG.error("Input is not readable RDF/XML: {}", e.getMessage(), e);
            return 2;
        } catch (IOException | IllegalArgumentException e) {
            LOG.error("Run failed: {}", e.getMessage(), e);
            return 1;
        }
    }
}
