package com.alertrelay.pipeline.followers;

import com.alertrelay.pipeline.store.CollectionPaths;
import com.alertrelay.pipeline.store.InMemoryDocumentStore;
import com.alertrelay.pipeline.support.Fixtures;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;

class StoredGroupPreferenceFilterTest {
    private final InMemoryDocumentStore store =
            new InMemoryDocumentStore(Clock.fixed(Instant.parse("2026-02-01T00:00:00Z"), ZoneOffset.UTC));
    private final StoredGroupPreferenceFilter filter = new StoredGroupPreferenceFilter(store);

    @Test
    void missingPreferenceMeansNotOptedIn() {
        Fixtures.groupPreference(store, "A", "grp-1", true);
        Fixtures.groupPreference(store, "B", "grp-2", true);
        store.set(CollectionPaths.followedOrganizations("C"), Fixtures.ORG_ID, Map.of("followedAt", 1L), false);

        Set<String> enabled = filter.filter(Fixtures.ORG_ID, Set.of("A", "B", "C", "D"), "grp-1");

        assertEquals(Set.of("A"), enabled);
    }

    @Test
    void preferencesAreScopedToTheOrganization() {
        store.set(CollectionPaths.followedOrganizations("A"), "other-org",
                Map.of("groupPreferences", Map.of("grp-1", true)), false);

        assertEquals(Set.of(), filter.filter(Fixtures.ORG_ID, Set.of("A"), "grp-1"));
    }
}
