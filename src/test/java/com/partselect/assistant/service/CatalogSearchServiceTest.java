package com.partselect.assistant.service;

import com.partselect.assistant.model.CatalogEntry;
import com.partselect.assistant.model.CompatibilityResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CatalogSearchServiceTest {

    private CatalogSearchService service;

    @BeforeEach
    void setUp() {
        service = new CatalogSearchService(CatalogFixtures.sampleCatalog());
    }

    @Test
    void exactPartNumberBypassesScoring() {
        List<CatalogEntry> hits = service.search("PS11752778");

        assertThat(hits).extracting(CatalogEntry::getPartNumber).containsExactly("PS11752778");
    }

    @Test
    void exactPartNumberMatchIsCaseInsensitive() {
        assertThat(service.search("do you have ps11752778 in stock"))
                .extracting(CatalogEntry::getPartNumber)
                .containsExactly("PS11752778");
    }

    @Test
    void explicitPartWinsOverQueryText() {
        assertThat(service.search("dishwasher rack", "PS11703268", null))
                .extracting(CatalogEntry::getName)
                .containsExactly("Drain Pump");
    }

    @Test
    void blankQueryReturnsNothing() {
        assertThat(service.search("  ")).isEmpty();
        assertThat(service.search(null)).isEmpty();
    }

    @Test
    void scoredResultsKeepCatalogOrderOnTies() {
        List<CatalogEntry> hits = service.search("dishwasher rack");

        assertThat(hits).extracting(CatalogEntry::getName)
                .containsExactly("Lower Dishrack Wheel", "Upper Dishrack", "Drain Pump", "Micro Filter");
    }

    @Test
    void addingBrandNeverLowersTheBrandedEntry() {
        List<CatalogEntry> withoutBrand = service.search("dishwasher rack");
        List<CatalogEntry> withBrand = service.search("bosch dishwasher rack");

        int rankBefore = indexOf(withoutBrand, "PS9990001");
        int rankAfter = indexOf(withBrand, "PS9990001");
        assertThat(rankAfter).isLessThanOrEqualTo(rankBefore);
        assertThat(rankAfter).isZero();
    }

    @Test
    void brandMustBeAWholeWord() {
        // "fridge" contains "ge" but names no brand
        assertThat(CatalogVocabulary.findBrand("my fridge rack")).isNull();
        assertThat(CatalogVocabulary.findBrand("GE fridge")).isEqualTo("ge");
    }

    @Test
    void noMatchYieldsSyntheticEntryWithSearchUrl() {
        List<CatalogEntry> hits = service.search("xyzzy quux");

        assertThat(hits).hasSize(1);
        CatalogEntry entry = hits.get(0);
        assertThat(entry.isNoMatch()).isTrue();
        assertThat(entry.getPartNumber()).isEqualTo(CatalogEntry.NO_MATCH_PART_NUMBER);
        assertThat(entry.getOfficialURL()).isEqualTo("https://www.partselect.com/Search.aspx?SearchTerm=xyzzy+quux");
    }

    @Test
    void findPartsFiltersOnEveryHint() {
        List<CatalogEntry> hits = service.findParts("dishwasher", "whirlpool", "rack", "show me whirlpool racks");

        assertThat(hits).extracting(CatalogEntry::getPartNumber).containsExactly("PS3406971");
    }

    @Test
    void findPartsFallsBackToUnfilteredHits() {
        List<CatalogEntry> hits = service.findParts("refrigerator", null, "rack", "rack");

        assertThat(hits).isNotEmpty();
        assertThat(hits).containsExactlyElementsOf(service.search("rack refrigerator rack"));
    }

    @Test
    void installGuidePromptsForMissingPart() {
        assertThat(service.installGuide("")).isEqualTo("Please provide a part number (e.g., 'How to install WP2188656').");
        assertThat(service.installGuide(null)).startsWith("Please provide a part number");
    }

    @Test
    void installGuideReturnsStoredGuideVerbatim() {
        assertThat(service.installGuide("ps12348183"))
                .isEqualTo("Stored guide for PS12348183:\n1) Twist out the old filter\n2) Seat the new one");
    }

    @Test
    void installGuideUsesRackStepsForRackParts() {
        String guide = service.installGuide("PS3406971");

        assertThat(guide).startsWith("General guide for PS3406971:\n1) ");
        assertThat(guide).contains("Remove rack", "2) ", "3) ");
        assertThat(guide).endsWith("Full instructions: https://www.partselect.com/Installation/PS3406971.htm");
    }

    @Test
    void installGuideUsesGenericStepsForUnknownParts() {
        assertThat(service.installGuide("PS0000001"))
                .startsWith("General guide for PS0000001:\n1) Disconnect power/water");
    }

    @Test
    void compatibilityIsCaseInsensitive() {
        CompatibilityResult lower = service.isCompatible("ps11752778", "wrs325sdhz08");
        CompatibilityResult upper = service.isCompatible("PS11752778", "WRS325SDHZ08");

        assertThat(lower).isEqualTo(upper);
        assertThat(upper.compatible()).isTrue();
        assertThat(upper.message()).isEqualTo("PS11752778 fits model WRS325SDHZ08.");
    }

    @Test
    void unlistedModelIsInformationalWithLookupUrl() {
        CompatibilityResult result = service.isCompatible("PS11752778", "ABC100");

        assertThat(result.compatible()).isFalse();
        assertThat(result.message())
                .contains("not confirmed locally", "Whirlpool")
                .contains("https://www.partselect.com/ModelSearch.aspx?SearchTerm=ABC100+PS11752778");
    }

    @Test
    void unknownPartAndMissingArgumentsAreNotErrors() {
        assertThat(service.isCompatible("PS0000001", "ABC100").message()).startsWith("I couldn't find PS0000001 locally.");
        assertThat(service.isCompatible("PS11752778", " ").message())
                .isEqualTo("Please provide both a part number and a full model number.");
    }

    @Test
    void scopeKeywordsCoverPartNumbersAndNames() {
        assertThat(service.scopeKeywords()).contains("ps11752778", "refrigerator door shelf bin", "drain pump");
    }

    @Test
    void findByPartNumberChecksManufacturerNumbers() {
        assertThat(service.findByPartNumber("00754866").getPartNumber()).isEqualTo("PS12348183");
        assertThat(service.findByPartNumber("dishrack wheel")).isNotNull();
        assertThat(service.findByPartNumber("nothing-like-this")).isNull();
    }

    @Test
    void shortBrandDoesNotMatchInsideLongerBrand() {
        CatalogEntry whirlpool = CatalogFixtures.entry("PS1000000", "Upper Rack", "Whirlpool", "dishwasher", "rack", List.of());
        CatalogEntry generic = CatalogFixtures.entry("PS1000001", "Upper Rack", "Generic", "dishwasher", "rack", List.of());
        CatalogEntry ge = CatalogFixtures.entry("PS1000002", "Upper Rack", "GE", "dishwasher", "rack", List.of());
        CatalogSearchService racks = new CatalogSearchService(List.of(whirlpool, generic, ge));

        assertThat(racks.findParts("dishwasher", "ge", "rack", "show me ge racks"))
                .extracting(CatalogEntry::getPartNumber)
                .containsExactly("PS1000002");
        assertThat(racks.score(generic, "ge", "dishwasher", "rack", Set.of("rack")))
                .isEqualTo(racks.score(whirlpool, "ge", "dishwasher", "rack", Set.of("rack")));
        assertThat(CatalogSearchService.sameBrand(generic, "ge")).isFalse();
        assertThat(CatalogSearchService.sameBrand(ge, "GE")).isTrue();
    }

    @Test
    void entryListsAreReadOnlyAndNullFree() {
        List<String> models = new ArrayList<>(Arrays.asList("WDT780SAEM1", null));
        CatalogEntry entry = CatalogFixtures.entry("PS1000003", "Upper Rack", "Bosch", "dishwasher", "rack", models);

        assertThat(entry.getModels()).containsExactly("WDT780SAEM1");
        assertThatThrownBy(() -> entry.getModels().add("OTHER"))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(entry.getModels()).containsExactly("WDT780SAEM1");
    }

    @Test
    void featuredReturnsLeadingEntries() {
        assertThat(service.featured()).hasSize(5);
        assertThat(service.size()).isEqualTo(5);
    }

    private static int indexOf(List<CatalogEntry> hits, String partNumber) {
        for (int i = 0; i < hits.size(); i++) {
            if (partNumber.equals(hits.get(i).getPartNumber())) {
                return i;
            }
        }
        return Integer.MAX_VALUE;
    }
}
