package com.example.supplymatch.infrastructure.catalog;

import com.example.supplymatch.application.port.CatalogContents;
import com.example.supplymatch.application.port.CatalogProvider;
import com.example.supplymatch.domain.model.CatalogItem;
import com.example.supplymatch.domain.model.CatalogItemType;
import com.example.supplymatch.domain.model.Supplier;
import com.example.supplymatch.infrastructure.exception.CatalogUnavailableException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link CatalogProvider} backed by a JSON export of the catalog system:
 * <pre>
 * {"products": [{"id", "parentId", "name", "productType", "num", "code"}],
 *  "suppliers": [{"id", "name"}]}
 * </pre>
 * The file is read again on every fetch, so replacing it and refreshing the snapshot picks up a
 * new export. {@link #fetchAll()} reads it once for both lists.
 */
public class JsonFileCatalogProvider implements CatalogProvider {

    private static final Logger log = LoggerFactory.getLogger(JsonFileCatalogProvider.class);

    private final Path catalogFile;
    private final ObjectMapper objectMapper;

    public JsonFileCatalogProvider(Path catalogFile, ObjectMapper objectMapper) {
        this.catalogFile = catalogFile;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<CatalogItem> fetchCatalog() {
        return toItems(readExport());
    }

    @Override
    public List<Supplier> fetchSuppliers() {
        return toSuppliers(readExport());
    }

    @Override
    public CatalogContents fetchAll() {
        CatalogExport export = readExport();
        return new CatalogContents(toItems(export), toSuppliers(export));
    }

    private List<CatalogItem> toItems(CatalogExport export) {
        List<CatalogItem> items = new ArrayList<>();
        if (export.products() == null) {
            return items;
        }
        int skipped = 0;
        for (CatalogExport.ProductEntry entry : export.products()) {
            if (entry == null || entry.id() == null || entry.id().isBlank()) {
                skipped++;
                continue;
            }
            String code = entry.num() != null && !entry.num().isBlank() ? entry.num() : entry.code();
            items.add(new CatalogItem(entry.id().strip(), entry.name() == null ? "" : entry.name().strip(), code,
                    CatalogItemType.fromRaw(entry.productType()), entry.parentId()));
        }
        if (skipped > 0) {
            log.warn("Ignored {} catalog entries without an id in {}", skipped, catalogFile);
        }
        return items;
    }

    private List<Supplier> toSuppliers(CatalogExport export) {
        if (export.suppliers() == null) {
            return List.of();
        }
        return export.suppliers().stream()
                .filter(entry -> entry != null && entry.id() != null && !entry.id().isBlank())
                .map(entry -> new Supplier(entry.id().strip(), entry.name() == null ? "" : entry.name().strip()))
                .toList();
    }

    private CatalogExport readExport() {
        if (catalogFile == null || !Files.isRegularFile(catalogFile)) {
            throw new CatalogUnavailableException("Catalog export not found: " + catalogFile);
        }
        try {
            return objectMapper.readValue(catalogFile.toFile(), CatalogExport.class);
        } catch (IOException e) {
            throw new CatalogUnavailableException("Unable to read the catalog export " + catalogFile, e);
        }
    }
}
