package com.example.supplymatch.infrastructure.config;

import com.example.supplymatch.application.port.CatalogProvider;
import com.example.supplymatch.application.service.MatchingSettings;
import com.example.supplymatch.domain.catalog.CatalogExclusionBuilder;
import com.example.supplymatch.domain.catalog.ExclusionRules;
import com.example.supplymatch.domain.mapping.LearnedMappingStore;
import com.example.supplymatch.domain.matching.MatchingEngine;
import com.example.supplymatch.domain.matching.SupplierMatcher;
import com.example.supplymatch.domain.matching.TypoCorrections;
import com.example.supplymatch.domain.parsing.ExtractionProfile;
import com.example.supplymatch.infrastructure.catalog.JsonFileCatalogProvider;
import com.example.supplymatch.infrastructure.mapping.JsonFileLearnedMappingStore;
import com.example.supplymatch.infrastructure.pdf.PdfInvoiceAdapter;
import com.example.supplymatch.infrastructure.spreadsheet.SpreadsheetInvoiceAdapter;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;

import java.nio.file.Path;
import java.time.Clock;
import java.util.HashSet;

/**
 * Wires the pure domain components and the file-based adapters from {@link SupplyMatchProperties}.
 */
@Configuration
@EnableConfigurationProperties(SupplyMatchProperties.class)
public class SupplyMatchConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SupplyMatchConfiguration.class);

    private final SupplyMatchProperties properties;

    public SupplyMatchConfiguration(SupplyMatchProperties properties) {
        this.properties = properties;
    }

    @Bean
    @Order(1)
    public PdfInvoiceAdapter pdfInvoiceAdapter() {
        return new PdfInvoiceAdapter(ExtractionProfile.invoicePdf()
                .withHeaderLookahead(properties.getExtraction().getHeaderLookahead()));
    }

    @Bean
    @Order(2)
    public SpreadsheetInvoiceAdapter spreadsheetInvoiceAdapter() {
        return new SpreadsheetInvoiceAdapter(ExtractionProfile.invoiceSpreadsheet()
                .withHeaderLookahead(properties.getExtraction().getHeaderLookahead()));
    }

    @Bean
    public CatalogProvider catalogProvider(ObjectMapper objectMapper) {
        return new JsonFileCatalogProvider(Path.of(properties.getCatalog().getFile()), objectMapper);
    }

    @Bean
    public LearnedMappingStore learnedMappingStore(ObjectMapper objectMapper) {
        return new JsonFileLearnedMappingStore(Path.of(properties.getMappings().getFile()), objectMapper);
    }

    @Bean
    public CatalogExclusionBuilder catalogExclusionBuilder() {
        SupplyMatchProperties.Catalog catalog = properties.getCatalog();
        ExclusionRules defaults = ExclusionRules.defaults();
        ExclusionRules rules = new ExclusionRules(
                catalog.getExcludedNames().isEmpty() ? defaults.exactNames() : new HashSet<>(catalog.getExcludedNames()),
                catalog.getExcludedFragments().isEmpty()
                        ? defaults.fragmentRules()
                        : ExclusionRules.parseFragmentRules(catalog.getExcludedFragments()));
        log.info("Catalog exclusions: {} name(s), {} fragment rule(s)", rules.exactNames().size(), rules.fragmentRules().size());
        return new CatalogExclusionBuilder(rules);
    }

    @Bean
    public MatchingEngine matchingEngine() {
        TypoCorrections corrections = TypoCorrections.defaults()
                .withAdditional(TypoCorrections.parseEntries(properties.getMatching().getTypoCorrections()));
        log.info("Typo corrections version {} with {} entries", corrections.version(), corrections.entries().size());
        return new MatchingEngine(corrections);
    }

    @Bean
    public SupplierMatcher supplierMatcher() {
        return new SupplierMatcher();
    }

    @Bean
    public MatchingSettings matchingSettings() {
        return new MatchingSettings(properties.getMatching().getLimit(), properties.getMatching().getMinScore());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
