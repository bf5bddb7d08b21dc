package work.cinit.trace.support;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import work.cinit.trace.catalog.CatalogLoader;
import work.cinit.trace.catalog.FactCatalog;

/**
 * Catalog fixtures. Every call returns a fresh catalog, since evaluation writes variable defaults.
 */
public final class Catalogs {
    public static final Path FIXTURES = Path.of("src", "test", "resources", "fixtures").toAbsolutePath();

    private Catalogs() {}

    /** The {@code data.c} / {@code alloc.c} catalog from {@code fixtures/catalog.yaml}. */
    public static FactCatalog standard() {
        return CatalogLoader.load(FIXTURES.resolve("catalog.yaml"));
    }

    public static FactCatalog yaml(String document) {
        try {
            return CatalogLoader.parse(new ByteArrayInputStream(document.getBytes(StandardCharsets.UTF_8)), false);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }
}
