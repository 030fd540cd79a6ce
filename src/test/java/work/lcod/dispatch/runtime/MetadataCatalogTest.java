package work.lcod.dispatch.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.dispatch.alias.AliasPattern;

class MetadataCatalogTest {
    @Test
    void snapshotsAreUnaffectedByLaterRegistrations() {
        var catalog = new MetadataCatalog();
        catalog.register(command("alpha"));
        var before = catalog.snapshot();
        catalog.register(command("beta"));

        assertEquals(1, before.size());
        assertEquals(2, catalog.snapshot().size());
        assertThrows(UnsupportedOperationException.class, () -> before.add(command("gamma")));
    }

    @Test
    void resolvesAllMatchesInRegistrationOrder() {
        var catalog = new MetadataCatalog();
        catalog.register(CommandDefinition.command("one").alias("run").handler((c, a) -> 1).build());
        catalog.register(CommandDefinition.command("other").handler((c, a) -> 0).build());
        catalog.register(CommandDefinition.command("two").alias(AliasPattern.regex("r\\w+")).handler((c, a) -> 2).build());

        var matches = catalog.resolve("RUN fast");
        assertEquals(List.of("one", "two"), List.of(matches.get(0).metadata().name(), matches.get(1).metadata().name()));
        assertEquals("one", catalog.resolveFirst("run").orElseThrow().metadata().name());
        assertEquals("fast", matches.get(0).arguments("RUN fast"));
    }

    @Test
    void unmatchedInputResolvesToNothing() {
        var catalog = new MetadataCatalog();
        catalog.register(command("alpha"));
        assertTrue(catalog.resolve("beta").isEmpty());
        assertTrue(catalog.resolve(null).isEmpty());
    }

    private static CommandMetadata command(String name) {
        return CommandDefinition.command(name).handler((c, a) -> name).build();
    }
}
