package in.worldsync.infrastructure.worlds;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * GraphQL documents bundled on the classpath under {@code queries/<name>.graphql}.
 */
public final class GraphqlDocuments {

    private static final String PREFIX = "queries/";
    private static final String SUFFIX = ".graphql";

    private final Map<String, String> cache = new ConcurrentHashMap<>();

    /**
     * @throws IllegalArgumentException if no document with that name is bundled
     */
    public String load(String name) {
        return cache.computeIfAbsent(name, GraphqlDocuments::read);
    }

    private static String read(String name) {
        String path = PREFIX + name + SUFFIX;
        try (InputStream in = GraphqlDocuments.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalArgumentException("Query document not found: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read query document " + path, e);
        }
    }
}
