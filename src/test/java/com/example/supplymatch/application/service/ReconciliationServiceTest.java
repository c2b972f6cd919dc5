package com.example.supplymatch.application.service;

import com.example.supplymatch.application.exception.UseCaseValidationException;
import com.example.supplymatch.domain.catalog.CatalogExclusionBuilder;
import com.example.supplymatch.domain.catalog.CatalogSnapshot;
import com.example.supplymatch.domain.catalog.ExclusionRules;
import com.example.supplymatch.domain.exception.CatalogItemNotFoundException;
import com.example.supplymatch.domain.exception.InvalidMatchTargetException;
import com.example.supplymatch.domain.exception.MalformedDocumentException;
import com.example.supplymatch.domain.mapping.LearnedMappingStore;
import com.example.supplymatch.domain.matching.MatchingEngine;
import com.example.supplymatch.domain.matching.SupplierMatcher;
import com.example.supplymatch.domain.matching.TypoCorrections;
import com.example.supplymatch.domain.model.CatalogItem;
import com.example.supplymatch.domain.model.CatalogItemType;
import com.example.supplymatch.domain.model.DocumentFormat;
import com.example.supplymatch.domain.model.DocumentReconciliation;
import com.example.supplymatch.domain.model.LearnedMapping;
import com.example.supplymatch.domain.model.LineItem;
import com.example.supplymatch.domain.model.LineMatch;
import com.example.supplymatch.domain.model.MatchCandidate;
import com.example.supplymatch.domain.model.MatchSource;
import com.example.supplymatch.domain.model.MeasureUnit;
import com.example.supplymatch.domain.model.ParsedDocument;
import com.example.supplymatch.domain.model.Supplier;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.web.multipart.MultipartFile;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Unit tests covering line matching and mapping confirmation, with the real matching engine and
 * mocked ports.
 */
class ReconciliationServiceTest {

    private static final CatalogSnapshot SNAPSHOT = CatalogSnapshot.of(
            List.of(
                    new CatalogItem("kitchen", "Кухня", "", CatalogItemType.GROUP, ""),
                    new CatalogItem("soup", "Суп дня", "", CatalogItemType.ITEM, "kitchen"),
                    new CatalogItem("dairy", "Молочка", "", CatalogItemType.GROUP, ""),
                    new CatalogItem("milk", "Молоко", "00375", CatalogItemType.ITEM, "dairy"),
                    new CatalogItem("kefir", "Кефир", "00400", CatalogItemType.ITEM, "dairy")),
            List.of(new Supplier("s1", "ООО Ромашка")),
            new CatalogExclusionBuilder(ExclusionRules.defaults()),
            Instant.parse("2024-03-01T10:00:00Z"));

    private DocumentParsingService documentParsingService;
    private CatalogSnapshotService catalogSnapshotService;
    private LearnedMappingStore mappingStore;
    private ReconciliationService service;

    @BeforeEach
    void setUp() {
        documentParsingService = mock(DocumentParsingService.class);
        catalogSnapshotService = mock(CatalogSnapshotService.class);
        mappingStore = mock(LearnedMappingStore.class);
        given(catalogSnapshotService.current()).willReturn(SNAPSHOT);
        service = new ReconciliationService(documentParsingService, catalogSnapshotService,
                new MatchingEngine(TypoCorrections.defaults()), new SupplierMatcher(), mappingStore,
                new MatchingSettings(MatchingEngine.DEFAULT_LIMIT, MatchingEngine.DEFAULT_MIN_SCORE));
    }

    @Test
    void learnedMappingWinsWhileItsItemIsSearchable() {
        given(mappingStore.get("Молоко ультрапаст.")).willReturn(Optional.of(
                new LearnedMapping("Молоко ультрапаст.", "milk", "Молоко", "00375")));

        Map<Integer, LineMatch> matches = service.reconcile(List.of(line("Молоко ультрапаст.")), SNAPSHOT);

        LineMatch match = matches.get(1);
        assertThat(match.source()).isEqualTo(MatchSource.LEARNED);
        assertThat(match.candidate().id()).isEqualTo("milk");
        assertThat(match.candidate().score()).isEqualTo(100);
        verify(mappingStore, never()).remove(any());
    }

    @Test
    void staleMappingIsRemovedAndTheLineIsSearched() {
        given(mappingStore.get("Кефир")).willReturn(Optional.of(
                new LearnedMapping("Кефир", "soup", "Суп дня", "")));

        LineMatch match = service.reconcile(List.of(line("Кефир")), SNAPSHOT).get(1);

        verify(mappingStore).remove("Кефир");
        assertThat(match.source()).isEqualTo(MatchSource.SEARCH);
        assertThat(match.match()).map(MatchCandidate::id).contains("kefir");
    }

    @Test
    void linesAreKeyedFromOneInDocumentOrder() {
        Map<Integer, LineMatch> matches = service.reconcile(
                List.of(line("Молоко"), line("Шуруповёрт"), line("Кефир")), SNAPSHOT);

        assertThat(matches).containsOnlyKeys(1, 2, 3);
        assertThat(matches.values()).extracting(LineMatch::lineIndex).containsExactly(1, 2, 3);
        assertThat(matches.get(1).candidate().id()).isEqualTo("milk");
        assertThat(matches.get(2).source()).isEqualTo(MatchSource.NONE);
        assertThat(matches.get(2).candidate()).isNull();
        assertThat(matches.get(3).candidate().id()).isEqualTo("kefir");
    }

    @Test
    void processDocumentMatchesLinesAndSupplier() {
        ParsedDocument document = new ParsedDocument("invoice.pdf", DocumentFormat.PDF,
                List.of(line("Молоко"), line("00400")), "Ромашка");
        given(documentParsingService.parseDocument(any(MultipartFile.class))).willReturn(document);

        DocumentReconciliation result = service.processDocument(upload());

        assertThat(result.document()).isSameAs(document);
        assertThat(result.lines()).extracting(line -> line.candidate().id()).containsExactly("milk", "kefir");
        assertThat(result.matchedSupplier()).isEqualTo(new Supplier("s1", "ООО Ромашка"));
    }

    @Test
    void documentWithoutLineItemsIsMalformed() {
        given(documentParsingService.parseDocument(any(MultipartFile.class)))
                .willReturn(new ParsedDocument("scan.pdf", DocumentFormat.PDF, List.of(), null));

        assertThrows(MalformedDocumentException.class, () -> service.processDocument(upload()));
    }

    @Test
    void confirmStoresMappingUnderNormalizedText() {
        LearnedMapping mapping = service.confirmMapping("  Молоко   3,2% ", "milk");

        assertThat(mapping).isEqualTo(new LearnedMapping("Молоко 3,2%", "milk", "Молоко", "00375"));
        verify(mappingStore).save(Map.of("Молоко 3,2%", mapping));
    }

    @Test
    void confirmRejectsGroupsExcludedAndUnknownItems() {
        InvalidMatchTargetException group = assertThrows(InvalidMatchTargetException.class,
                () -> service.confirmMapping("Молоко", "dairy"));
        assertThat(group.getCatalogItemId()).isEqualTo("dairy");

        assertThrows(InvalidMatchTargetException.class, () -> service.confirmMapping("Суп", "soup"));
        assertThrows(CatalogItemNotFoundException.class, () -> service.confirmMapping("Молоко", "missing"));
        assertThrows(UseCaseValidationException.class, () -> service.confirmMapping("  ", "milk"));
        assertThrows(UseCaseValidationException.class, () -> service.confirmMapping("Молоко", " "));
        verify(mappingStore, never()).save(anyMap());
    }

    @Test
    void confirmWithCatalogItemChecksTheCurrentSnapshot() {
        CatalogItem kefir = SNAPSHOT.findItem("kefir").orElseThrow();

        LearnedMapping mapping = service.confirmMapping("Кефир 1%", kefir);

        assertThat(mapping.id()).isEqualTo("kefir");
        verify(mappingStore).save(Map.of("Кефир 1%", mapping));
        assertThrows(InvalidMatchTargetException.class,
                () -> service.confirmMapping("Молочка", SNAPSHOT.findItem("dairy").orElseThrow()));
        assertThrows(UseCaseValidationException.class, () -> service.confirmMapping("Кефир", (CatalogItem) null));
    }

    @Test
    void batchConfirmationSavesNothingWhenOneEntryIsInvalid() {
        Map<String, String> selections = new LinkedHashMap<>();
        selections.put("Молоко", "milk");
        selections.put("Суп", "soup");

        assertThrows(InvalidMatchTargetException.class, () -> service.confirmMappings(selections, SNAPSHOT));
        verify(mappingStore, never()).save(anyMap());
    }

    @Test
    void searchUsesConfiguredDefaults() {
        assertThat(service.searchCatalog("кефир", null, null))
                .extracting(MatchCandidate::id)
                .containsExactly("kefir");
        assertThat(service.searchCatalog("кефир", 10, 101)).isEmpty();
    }

    @Test
    void findAndRemoveDelegateToTheStore() {
        LearnedMapping stored = new LearnedMapping("Молоко", "milk", "Молоко", "00375");
        given(mappingStore.get("Молоко")).willReturn(Optional.of(stored));

        assertThat(service.findMapping(" Молоко ")).contains(stored);
        service.removeMapping("Молоко");
        verify(mappingStore).remove("Молоко");
    }

    private static LineItem line(String name) {
        return new LineItem(name, MeasureUnit.PIECE, BigDecimal.ONE, new BigDecimal("10.00"), "");
    }

    private static MockMultipartFile upload() {
        return new MockMultipartFile("file", "invoice.pdf", "application/pdf", new byte[]{1});
    }
}
