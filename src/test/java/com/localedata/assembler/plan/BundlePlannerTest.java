package com.localedata.assembler.plan;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.localedata.assembler.exception.RepositoryReadException;
import com.localedata.assembler.locale.LocaleDecomposer;
import com.localedata.assembler.model.CategoryToken;
import com.localedata.assembler.model.LocaleTag;
import com.localedata.assembler.model.PartKey;
import com.localedata.assembler.repository.LocaleDataRepository;
import com.localedata.assembler.resolve.CategoryResolver;
import com.localedata.assembler.support.RepositoryFixture;

/**
 * Unit tests for BundlePlanner.
 */
class BundlePlannerTest {

    @TempDir
    Path tempDir;

    private RepositoryFixture fixture;
    private final List<String> lookups = new ArrayList<>();

    @BeforeEach
    void setUp() {
        fixture = new RepositoryFixture(tempDir);
    }

    private BundlePlanner planner() {
        CategoryResolver counting = new CategoryResolver(new LocaleDataRepository(fixture.getDataDir())) {
            @Override
            public Optional<PlanEntry> resolve(PartKey part, CategoryToken token) {
                lookups.add(part + ":" + token);
                return super.resolve(part, token);
            }
        };
        return new BundlePlanner(new LocaleDecomposer(), counting);
    }

    private static List<LocaleTag> locales(String... ids) {
        return java.util.Arrays.stream(ids).map(LocaleTag::parse).toList();
    }

    @Test
    void testPartsWithoutDocumentsAreNotPlanned() {
        fixture.withNumberFormats();

        BundlePlan plan = planner().plan(List.of(CategoryToken.of("numberformats")), locales("en-US", "fr-FR"));

        assertThat(plan.getPartNames()).containsExactly("root", "fr");
        assertThat(plan.getEntries(PartKey.ROOT)).extracting(PlanEntry::getKey).containsExactly("numberformats");
        assertThat(plan.getEntries(PartKey.of("fr")).get(0).getPayload().toJson()).contains("\" \"");
        assertThat(plan.getEntries(PartKey.of("en"))).isEmpty();
        assertThat(plan.getEntryCount()).isEqualTo(2);
    }

    @Test
    void testSharedPartIsResolvedAndStoredOnce() {
        fixture.withDateFormats();

        BundlePlan plan = planner().plan(List.of(CategoryToken.of("dateformats")), locales("en-US", "en-GB"));

        assertThat(plan.getEntries(PartKey.of("en"))).hasSize(1);
        assertThat(lookups).containsOnlyOnce("en:dateformats", "root:dateformats");
        assertThat(plan.getPartNames()).containsExactly("root", "en", "en-US");
    }

    @Test
    void testEveryLayerOfTheHierarchyIsPlanned() {
        fixture.withDateFormats();

        BundlePlan plan = planner().plan(List.of(CategoryToken.of("dateformats")), locales("en-US"));

        assertThat(plan.getParts()).containsExactly(PartKey.ROOT, PartKey.of("en"), PartKey.of("en-US"));
    }

    @Test
    void testSpecialCategoriesAreMergedIntoRoot() {
        fixture.withNumberFormats().withZones();

        BundlePlan plan = planner().plan(
                List.of(CategoryToken.of("numberformats"), CategoryToken.of("zoneinfo")), locales("fr-FR"));

        assertThat(plan.getEntries(PartKey.ROOT)).extracting(PlanEntry::getKey)
                .startsWith("numberformats", "zonetab")
                .contains("zoneinfo/Europe/Paris", "zoneinfo/UTC");
        assertThat(lookups).noneMatch(l -> l.endsWith(":zoneinfo"));
    }

    @Test
    void testUnreadableZoneDirectoryDoesNotAbortThePlan() {
        fixture.withNumberFormats().withZones();
        LocaleDataRepository unlistable = new LocaleDataRepository(fixture.getDataDir()) {
            @Override
            public List<String> listDocuments(String directory) {
                throw new RepositoryReadException(getDataDir().resolve(directory),
                        new IOException("Permission denied"));
            }
        };
        BundlePlanner planner = new BundlePlanner(new LocaleDecomposer(), new CategoryResolver(unlistable));
        List<CategoryToken> tokens = List.of(CategoryToken.of("numberformats"), CategoryToken.of("zoneinfo"));

        assertThatCode(() -> planner.plan(tokens, locales("en-US"))).doesNotThrowAnyException();

        BundlePlan plan = planner.plan(tokens, locales("en-US"));
        assertThat(plan.getEntries(PartKey.ROOT)).extracting(PlanEntry::getKey)
                .contains("numberformats", "zonetab", "zoneinfo/America/New_York", "zoneinfo/America/Los_Angeles")
                .doesNotContain("zoneinfo/UTC", "zoneinfo/Etc/GMT-5");
    }

    @Test
    void testEmptyRequestSetProducesEmptyPlan() {
        fixture.withNumberFormats();

        BundlePlan plan = planner().plan(List.of(), locales("en-US"));

        assertThat(plan.isEmpty()).isTrue();
        assertThat(plan.getPartNames()).isEmpty();
    }

    @Test
    void testAddIfAbsentKeepsFirstEntry() throws Exception {
        BundlePlan plan = new BundlePlan();
        PlanEntry first = PlanEntry.builder()
                .key("numberformats")
                .category(CategoryToken.of("numberformats"))
                .target("ilib.data.numberformats")
                .payload(com.localedata.assembler.model.DataDocument.parse("{\"a\":1}"))
                .build();

        assertThat(plan.addIfAbsent(PartKey.ROOT, first)).isTrue();
        assertThat(plan.addIfAbsent(PartKey.ROOT, first.toBuilder().target("other").build())).isFalse();
        assertThat(plan.getEntries(PartKey.ROOT)).containsExactly(first);
    }
}
