package com.example.supplymatch.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "supply-match")
public class SupplyMatchProperties {

    private final Catalog catalog = new Catalog();
    private final Mappings mappings = new Mappings();
    private final Matching matching = new Matching();
    private final Extraction extraction = new Extraction();

    public Catalog getCatalog() {
        return catalog;
    }

    public Mappings getMappings() {
        return mappings;
    }

    public Matching getMatching() {
        return matching;
    }

    public Extraction getExtraction() {
        return extraction;
    }

    public static class Catalog {

        /**
         * Path of the JSON catalog export with products and suppliers.
         */
        private String file = "data/catalog.json";

        /**
         * Category names whose subtree is hidden from matching. Replaces the built-in list when set.
         */
        private List<String> excludedNames = new ArrayList<>();

        /**
         * Fragment rules such as {@code gonzo gaming+нетка}; a category is excluded when its name
         * contains every fragment of a rule. Replaces the built-in rules when set.
         */
        private List<String> excludedFragments = new ArrayList<>();

        public String getFile() {
            return file;
        }

        public void setFile(String file) {
            this.file = file;
        }

        public List<String> getExcludedNames() {
            return excludedNames;
        }

        public void setExcludedNames(List<String> excludedNames) {
            this.excludedNames = excludedNames;
        }

        public List<String> getExcludedFragments() {
            return excludedFragments;
        }

        public void setExcludedFragments(List<String> excludedFragments) {
            this.excludedFragments = excludedFragments;
        }
    }

    public static class Mappings {

        /**
         * JSON file holding confirmed line-to-product mappings.
         */
        private String file = "data/product-mappings.json";

        public String getFile() {
            return file;
        }

        public void setFile(String file) {
            this.file = file;
        }
    }

    public static class Matching {

        /**
         * Maximum number of candidates a search returns.
         */
        private int limit = 10;

        /**
         * Lowest score a candidate may have.
         */
        private int minScore = 38;

        /**
         * Extra misspelling corrections applied on top of the built-in table, each written as
         * {@code typo=correction}, for example {@code авакадо=авокадо}.
         */
        private List<String> typoCorrections = new ArrayList<>();

        public int getLimit() {
            return limit;
        }

        public void setLimit(int limit) {
            this.limit = limit;
        }

        public int getMinScore() {
            return minScore;
        }

        public void setMinScore(int minScore) {
            this.minScore = minScore;
        }

        public List<String> getTypoCorrections() {
            return typoCorrections;
        }

        public void setTypoCorrections(List<String> typoCorrections) {
            this.typoCorrections = typoCorrections;
        }
    }

    public static class Extraction {

        /**
         * Number of rows at the top of a table searched for the header.
         */
        private int headerLookahead = 30;

        public int getHeaderLookahead() {
            return headerLookahead;
        }

        public void setHeaderLookahead(int headerLookahead) {
            this.headerLookahead = headerLookahead;
        }
    }
}
