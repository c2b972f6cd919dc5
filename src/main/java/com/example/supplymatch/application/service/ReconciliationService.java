package com.example.supplymatch.application.service;

import com.example.supplymatch.application.exception.UseCaseValidationException;
import com.example.supplymatch.domain.catalog.CatalogSnapshot;
import com.example.supplymatch.domain.exception.CatalogItemNotFoundException;
import com.example.supplymatch.domain.exception.InvalidMatchTargetException;
import com.example.supplymatch.domain.exception.MalformedDocumentException;
import com.example.supplymatch.domain.mapping.LearnedMappingStore;
import com.example.supplymatch.domain.mapping.MappingKeys;
import com.example.supplymatch.domain.matching.MatchingEngine;
import com.example.supplymatch.domain.matching.SupplierMatcher;
import com.example.supplymatch.domain.model.CatalogItem;
import com.example.supplymatch.domain.model.DocumentReconciliation;
import com.example.supplymatch.domain.model.LearnedMapping;
import com.example.supplymatch.domain.model.LineItem;
import com.example.supplymatch.domain.model.LineMatch;
import com.example.supplymatch.domain.model.MatchCandidate;
import com.example.supplymatch.domain.model.MatchSource;
import com.example.supplymatch.domain.model.ParsedDocument;
import com.example.supplymatch.domain.model.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Proposes catalog items for invoice lines and records the matches a person confirms.
 * <p>
 * Each line is looked up in the {@link LearnedMappingStore} first. A stored mapping is used only
 * while its catalog item is still searchable in the current snapshot; otherwise it is removed and
 * the line goes through the {@link MatchingEngine}, whose top candidate becomes the proposal.
 */
@Service
public class ReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);

    private final DocumentParsingService documentParsingService;
    private final CatalogSnapshotService catalogSnapshotService;
    private final MatchingEngine matchingEngine;
    private final SupplierMatcher supplierMatcher;
    private final LearnedMappingStore mappingStore;
    private final MatchingSettings settings;

    public ReconciliationService(DocumentParsingService documentParsingService,
                                 CatalogSnapshotService catalogSnapshotService,
                                 MatchingEngine matchingEngine,
                                 SupplierMatcher supplierMatcher,
                                 LearnedMappingStore mappingStore,
                                 MatchingSettings settings) {
        this.documentParsingService = documentParsingService;
        this.catalogSnapshotService = catalogSnapshotService;
        this.matchingEngine = matchingEngine;
        this.supplierMatcher = supplierMatcher;
        this.mappingStore = mappingStore;
        this.settings = settings;
    }

    /**
     * Parses an uploaded invoice, proposes a catalog item for every line and matches the supplier.
     *
     * @param file uploaded PDF or spreadsheet
     * @return the document with one {@link LineMatch} per line item
     * @throws MalformedDocumentException when no line items could be extracted
     */
    public DocumentReconciliation processDocument(MultipartFile file) {
        ParsedDocument document = documentParsingService.parseDocument(file);
        if (document.isEmpty()) {
            throw new MalformedDocumentException(document.fileName());
        }
        CatalogSnapshot snapshot = catalogSnapshotService.current();
        List<LineMatch> lines = new ArrayList<>(reconcile(document.lineItems(), snapshot).values());
        Supplier supplier = supplierMatcher.match(document.supplierName(), snapshot.suppliers()).orElse(null);
        log.info("Reconciled {}: {} of {} line(s) matched, supplier {}", document.fileName(),
                lines.stream().filter(line -> line.candidate() != null).count(), lines.size(),
                supplier != null ? supplier.name() : "unmatched");
        return new DocumentReconciliation(document, lines, supplier);
    }

    /**
     * Proposes a catalog item for every line.
     *
     * @param lineItems extracted invoice lines
     * @param snapshot  catalog to match against
     * @return proposals keyed by 1-based line index, in line order
     */
    public Map<Integer, LineMatch> reconcile(List<LineItem> lineItems, CatalogSnapshot snapshot) {
        Map<Integer, LineMatch> matches = new LinkedHashMap<>();
        if (lineItems == null) {
            return matches;
        }
        int index = 1;
        for (LineItem item : lineItems) {
            matches.put(index, matchLine(index, item, snapshot));
            index++;
        }
        return matches;
    }

    private LineMatch matchLine(int index, LineItem item, CatalogSnapshot snapshot) {
        String lineText = item.name() == null ? "" : item.name().strip();
        Optional<LearnedMapping> saved = mappingStore.get(lineText);
        if (saved.isPresent()) {
            LearnedMapping mapping = saved.get();
            if (snapshot.isSearchable(mapping.id())) {
                return new LineMatch(index, item, mapping.toCandidate(), MatchSource.LEARNED);
            }
            log.warn("Removing stale mapping '{}' -> {}: item is no longer in the searchable catalog", lineText, mapping.id());
            mappingStore.remove(lineText);
        }
        List<MatchCandidate> candidates = matchingEngine.search(lineText, snapshot.searchableItems(),
                settings.limit(), settings.minScore());
        if (candidates.isEmpty()) {
            return new LineMatch(index, item, null, MatchSource.NONE);
        }
        return new LineMatch(index, item, candidates.get(0), MatchSource.SEARCH);
    }

    /**
     * Searches the current catalog, for manual corrections.
     *
     * @param query    search text or article code
     * @param limit    maximum candidates, the configured default when {@code null}
     * @param minScore lowest accepted score, the configured default when {@code null}
     * @return ranked candidates
     */
    public List<MatchCandidate> searchCatalog(String query, Integer limit, Integer minScore) {
        CatalogSnapshot snapshot = catalogSnapshotService.current();
        return matchingEngine.search(query, snapshot.searchableItems(),
                limit != null ? limit : settings.limit(),
                minScore != null ? minScore : settings.minScore());
    }

    public Optional<Supplier> matchSupplier(String supplierName) {
        return supplierMatcher.match(supplierName, catalogSnapshotService.current().suppliers());
    }

    /**
     * Records that {@code lineText} should map to {@code item} from now on.
     *
     * @throws UseCaseValidationException  when the line text is blank or no item is given
     * @throws InvalidMatchTargetException when the item is a category or an excluded entry
     */
    public LearnedMapping confirmMapping(String lineText, CatalogItem item) {
        String key = requireKey(lineText);
        if (item == null) {
            throw new UseCaseValidationException("A catalog item is required to confirm a mapping.");
        }
        requireValidTarget(item, catalogSnapshotService.current());
        LearnedMapping mapping = toMapping(key, item);
        mappingStore.save(Map.of(key, mapping));
        log.info("Confirmed mapping '{}' -> {} ({})", key, item.id(), item.name());
        return mapping;
    }

    /**
     * Resolves the id in the current catalog and confirms the mapping.
     *
     * @throws CatalogItemNotFoundException when the id is unknown
     */
    public LearnedMapping confirmMapping(String lineText, String catalogItemId) {
        return confirmMappings(Map.of(requireKey(lineText), requireId(catalogItemId)),
                catalogSnapshotService.current()).get(0);
    }

    /**
     * Validates every entry and then saves all of them at once; nothing is stored when any entry
     * is invalid.
     *
     * @param selections line text to chosen catalog item id
     * @param snapshot   catalog the ids refer to
     * @return stored mappings, in input order
     */
    public List<LearnedMapping> confirmMappings(Map<String, String> selections, CatalogSnapshot snapshot) {
        if (selections == null || selections.isEmpty()) {
            throw new UseCaseValidationException("At least one mapping is required.");
        }
        Map<String, LearnedMapping> mappings = new LinkedHashMap<>();
        for (Map.Entry<String, String> selection : selections.entrySet()) {
            String key = requireKey(selection.getKey());
            String id = requireId(selection.getValue());
            CatalogItem item = snapshot.findItem(id)
                    .orElseThrow(() -> new CatalogItemNotFoundException(id));
            requireValidTarget(item, snapshot);
            mappings.put(key, toMapping(key, item));
        }
        mappingStore.save(mappings);
        log.info("Confirmed {} mapping(s)", mappings.size());
        return List.copyOf(mappings.values());
    }

    public Optional<LearnedMapping> findMapping(String lineText) {
        return mappingStore.get(requireKey(lineText));
    }

    public void removeMapping(String lineText) {
        mappingStore.remove(requireKey(lineText));
    }

    private static void requireValidTarget(CatalogItem item, CatalogSnapshot snapshot) {
        if (item.isGroup()) {
            throw InvalidMatchTargetException.group(item.id(), item.name());
        }
        if (snapshot.isExcluded(item.id())) {
            throw InvalidMatchTargetException.excluded(item.id(), item.name());
        }
    }

    private static String requireKey(String lineText) {
        String key = MappingKeys.normalize(lineText);
        if (key.isEmpty()) {
            throw new UseCaseValidationException("Line text must not be blank.");
        }
        return key;
    }

    private static String requireId(String catalogItemId) {
        if (catalogItemId == null || catalogItemId.isBlank()) {
            throw new UseCaseValidationException("Catalog item id must not be blank.");
        }
        return catalogItemId.strip();
    }

    private static LearnedMapping toMapping(String key, CatalogItem item) {
        return new LearnedMapping(key, item.id(), item.name(), item.code());
    }
}
