package com.localedata.assembler.resolve;

import static org.assertj.core.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.localedata.assembler.model.CategoryToken;
import com.localedata.assembler.model.LocaleTag;
import com.localedata.assembler.model.PartKey;
import com.localedata.assembler.plan.EntryKind;
import com.localedata.assembler.plan.PlanEntry;
import com.localedata.assembler.plan.ResolvedEntry;
import com.localedata.assembler.repository.LocaleDataRepository;
import com.localedata.assembler.support.RepositoryFixture;

/**
 * Unit tests for CategoryResolver and the special category resolvers.
 */
class CategoryResolverTest {

    @TempDir
    Path tempDir;

    private RepositoryFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new RepositoryFixture(tempDir);
    }

    private CategoryResolver resolver() {
        return new CategoryResolver(new LocaleDataRepository(fixture.getDataDir()));
    }

    private static List<LocaleTag> locales(String... ids) {
        return java.util.Arrays.stream(ids).map(LocaleTag::parse).toList();
    }

    private static List<String> keys(List<ResolvedEntry> entries) {
        return entries.stream().map(r -> r.getEntry().getKey()).toList();
    }

    @Test
    void testOrdinaryCategoryHitsEveryPartHoldingTheDocument() {
        fixture.withDateFormats();
        CategoryResolver resolver = resolver();
        CategoryToken token = CategoryToken.of("dateformats");

        assertThat(resolver.resolve(PartKey.ROOT, token)).isPresent();
        assertThat(resolver.resolve(PartKey.of("en"), token)).isPresent();
        assertThat(resolver.resolve(PartKey.of("und-US"), token)).isEmpty();

        Optional<PlanEntry> specific = resolver.resolve(PartKey.of("en-US"), token);
        assertThat(specific).isPresent();
        assertThat(specific.get().getTarget()).isEqualTo("ilib.data.dateformats_en_US");
        assertThat(specific.get().getKind()).isEqualTo(EntryKind.ASSIGN);
        assertThat(specific.get().getPayload().toJson()).contains("M/d/yyyy");
    }

    @Test
    void testRootTargetHasNoPartSuffix() {
        fixture.withNumberFormats();

        PlanEntry entry = resolver().resolve(PartKey.ROOT, CategoryToken.of("numberformats")).orElseThrow();

        assertThat(entry.getTarget()).isEqualTo("ilib.data.numberformats");
    }

    @Test
    void testMissingDocumentIsNotAnError() {
        fixture.withNumberFormats();

        assertThat(resolver().resolve(PartKey.of("de"), CategoryToken.of("numberformats"))).isEmpty();
        assertThat(resolver().resolve(PartKey.ROOT, CategoryToken.of("sysres"))).isEmpty();
    }

    @Test
    void testUnreadableDocumentIsSkipped() {
        fixture.withNumberFormats().document("de/numberformats", "{broken");

        assertThat(resolver().resolve(PartKey.of("de"), CategoryToken.of("numberformats"))).isEmpty();
        assertThat(resolver().resolve(PartKey.of("fr"), CategoryToken.of("numberformats"))).isPresent();
    }

    @Test
    void testCategoryOutsideTheDataDirectoryIsAMiss() throws Exception {
        fixture.withNumberFormats();
        Files.writeString(tempDir.resolve("secret.json"), "{\"token\":\"x\"}");
        LocaleDataRepository repository = new LocaleDataRepository(fixture.getDataDir());

        assertThat(resolver().resolve(PartKey.ROOT, CategoryToken.of("../../secret"))).isEmpty();
        assertThat(repository.find("../../secret")).isEmpty();
        assertThat(repository.listDocuments("../..")).isEmpty();
        assertThat(repository.find("en/../numberformats")).isPresent();
    }

    @Test
    void testSpecialTokenIsNotResolvedPerPart() {
        fixture.withZones();

        assertThatThrownBy(() -> resolver().resolve(PartKey.ROOT, CategoryToken.of("zoneinfo")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testCharsetsGoToRoot() {
        fixture.withCharsets();

        List<ResolvedEntry> resolved = resolver().resolveSpecial(
                List.of(CategoryToken.of("charset")), locales("en-US", "ja-JP"));

        assertThat(resolved).allMatch(r -> r.getPart().isRoot());
        assertThat(keys(resolved)).containsExactly(
                "charsetaliases",
                "charset/ISO-8859-1",
                "charset/UTF-8",
                "charset/Shift_JIS",
                "charset/EUC-JP");
        assertThat(resolved.get(1).getEntry().getTarget()).isEqualTo("ilib.data.charset_ISO_8859_1");
    }

    @Test
    void testCharmapsAreBucketedByLanguageAndSkipOptionalCharsets() {
        fixture.withCharsets();

        List<ResolvedEntry> resolved = resolver().resolveSpecial(
                List.of(CategoryToken.of("charmaps")), locales("en-US", "ja-JP"));

        List<ResolvedEntry> charmaps = resolved.stream()
                .filter(r -> r.getEntry().getKey().startsWith("charmaps/"))
                .toList();

        assertThat(charmaps).extracting(r -> r.getPart().getValue() + ":" + r.getEntry().getKey())
                .containsExactly(
                        "en:charmaps/ISO-8859-1",
                        "ja:charmaps/Shift_JIS",
                        "ja:charmaps/EUC-JP");
        assertThat(keys(resolved)).doesNotContain("charmaps/UTF-8");
        assertThat(charmaps.get(1).getEntry().getTarget()).isEqualTo("ilib.data.charmaps_Shift_JIS");
    }

    @Test
    void testGlobalCharmapsGoToRoot() {
        fixture.withCharsets().document("charset/UTF-8", "{\"name\":\"UTF-8\"}");

        List<ResolvedEntry> resolved = resolver().resolveSpecial(
                List.of(CategoryToken.of("charmaps")), locales("de-DE"));

        assertThat(resolved).extracting(r -> r.getPart().getValue() + ":" + r.getEntry().getKey())
                .containsExactly(
                        "root:charsetaliases",
                        "root:charset/UTF-8",
                        "root:charmaps/UTF-8");
    }

    @Test
    void testZoneInfoIncludesRegionZonesAndEveryGenericZone() {
        fixture.withZones();

        List<ResolvedEntry> resolved = resolver().resolveSpecial(
                List.of(CategoryToken.of("zoneinfo")), locales("en-US"));

        assertThat(resolved).allMatch(r -> r.getPart().isRoot());
        assertThat(keys(resolved)).containsExactly(
                "zonetab",
                "zoneinfo/America/New_York",
                "zoneinfo/America/Los_Angeles",
                "zoneinfo/UTC",
                "zoneinfo/Etc/GMT+3",
                "zoneinfo/Etc/GMT-5");
        assertThat(keys(resolved)).doesNotContain("zoneinfo/Europe/Paris");
        assertThat(resolved).extracting(r -> r.getEntry().getTarget())
                .contains("ilib.data.zoneinfo.zonetab",
                        "ilib.data.zoneinfo[\"Etc/GMTp3\"]",
                        "ilib.data.zoneinfo[\"Etc/GMTm5\"]");
    }

    @Test
    void testZoneInfoWithoutRegionsStillIncludesGenericZones() {
        fixture.withZones();

        List<ResolvedEntry> resolved = resolver().resolveSpecial(
                List.of(CategoryToken.of("zoneinfo")), locales("fr"));

        assertThat(keys(resolved)).containsExactly(
                "zonetab", "zoneinfo/UTC", "zoneinfo/Etc/GMT+3", "zoneinfo/Etc/GMT-5");
    }

    @Test
    void testNormalizationAllResolvesOnlyTheAggregate() {
        fixture.withNormalization();

        List<ResolvedEntry> resolved = resolver().resolveSpecial(
                List.of(CategoryToken.of("nfc/all"), CategoryToken.of("nfc")), locales("en-US", "ru-RU"));

        assertThat(keys(resolved)).containsExactly("nfc/all");
        assertThat(resolved.get(0).getEntry().getKind()).isEqualTo(EntryKind.EXTEND);
        assertThat(resolved.get(0).getEntry().getTarget()).isEqualTo("ilib.data.norm.nfc");
    }

    @Test
    void testUnqualifiedNormalizationUsesLikelyScripts() {
        fixture.withNormalization();

        List<ResolvedEntry> resolved = resolver().resolveSpecial(
                List.of(CategoryToken.of("nfc")), locales("en-US", "ru-RU", "fr-FR"));

        assertThat(keys(resolved)).containsExactly("nfc/Latn", "nfc/Cyrl");
    }

    @Test
    void testLikelyScriptsTableInRepositoryWins() {
        fixture.withNormalization().document("likelylocales", "{\"en\":\"en-Cyrl-US\"}");

        List<ResolvedEntry> resolved = resolver().resolveSpecial(
                List.of(CategoryToken.of("nfc")), locales("en-US"));

        assertThat(keys(resolved)).containsExactly("nfc/Cyrl");
    }

    @Test
    void testScriptQualifiedNormalization() {
        fixture.withNormalization();

        List<ResolvedEntry> resolved = resolver().resolveSpecial(
                List.of(CategoryToken.of("nfkd/Latn")), locales("ja-JP"));

        assertThat(keys(resolved)).containsExactly("nfkd/Latn");
    }
}
