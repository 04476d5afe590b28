package com.ai.codescope.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Strongly-typed configuration for the repository index and the query engine.
 *
 * Expected configuration shape (application.properties):
 *
 * codescope.root=/path/to/repo
 * codescope.skip-dirs=.git,node_modules,target
 * codescope.max-file-bytes=524288
 * codescope.request-timeout=10s
 * codescope.scan.workers=8
 * codescope.grep.match-all-terms=true
 * codescope.tokens.bytes-per-token=4
 * codescope.stub.max-bytes=2048
 * codescope.context.default-budget=50000
 */
@Component
@ConfigurationProperties(prefix = "codescope")
public class CodescopeProperties {

    /**
     * Repository root that is indexed at startup.
     */
    private String root = ".";

    /**
     * Directory names never descended into while indexing.
     */
    private List<String> skipDirs = new ArrayList<>(List.of(
            ".git", "node_modules", "__pycache__", "target", "dist", "build", ".next", "vendor", ".idea"));

    /**
     * Files larger than this are left out of the index.
     */
    private long maxFileBytes = 512 * 1024;

    /**
     * Deadline applied to every fan-out scan (grep, find).
     */
    private Duration requestTimeout = Duration.ofSeconds(10);

    private Scan scan = new Scan();
    private Grep grep = new Grep();
    private Search search = new Search();
    private Tokens tokens = new Tokens();
    private Stub stub = new Stub();
    private Context context = new Context();

    public String getRoot() {
        return root;
    }

    public void setRoot(String root) {
        this.root = root;
    }

    public List<String> getSkipDirs() {
        return skipDirs;
    }

    public void setSkipDirs(List<String> skipDirs) {
        this.skipDirs = skipDirs;
    }

    public long getMaxFileBytes() {
        return maxFileBytes;
    }

    public void setMaxFileBytes(long maxFileBytes) {
        this.maxFileBytes = maxFileBytes;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public Scan getScan() {
        return scan;
    }

    public void setScan(Scan scan) {
        this.scan = scan;
    }

    public Grep getGrep() {
        return grep;
    }

    public void setGrep(Grep grep) {
        this.grep = grep;
    }

    public Search getSearch() {
        return search;
    }

    public void setSearch(Search search) {
        this.search = search;
    }

    public Tokens getTokens() {
        return tokens;
    }

    public void setTokens(Tokens tokens) {
        this.tokens = tokens;
    }

    public Stub getStub() {
        return stub;
    }

    public void setStub(Stub stub) {
        this.stub = stub;
    }

    public Context getContext() {
        return context;
    }

    public void setContext(Context context) {
        this.context = context;
    }

    /**
     * Worker pool used to scan file contents in parallel.
     */
    public static class Scan {
        private int workers = Math.max(2, Runtime.getRuntime().availableProcessors());
        /** Files handed to the pool per round; grep stops between rounds once its limit is reached. */
        private int batchSize = 256;

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = workers;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    public static class Grep {
        private int defaultLimit = 100;
        private int maxLimit = 500;
        private int defaultMaxPerFile = 5;
        private int snippetMaxChars = 240;
        /** true: a line must contain every term; false: any term is enough. */
        private boolean matchAllTerms = true;

        public int getDefaultLimit() {
            return defaultLimit;
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = defaultLimit;
        }

        public int getMaxLimit() {
            return maxLimit;
        }

        public void setMaxLimit(int maxLimit) {
            this.maxLimit = maxLimit;
        }

        public int getDefaultMaxPerFile() {
            return defaultMaxPerFile;
        }

        public void setDefaultMaxPerFile(int defaultMaxPerFile) {
            this.defaultMaxPerFile = defaultMaxPerFile;
        }

        public int getSnippetMaxChars() {
            return snippetMaxChars;
        }

        public void setSnippetMaxChars(int snippetMaxChars) {
            this.snippetMaxChars = snippetMaxChars;
        }

        public boolean isMatchAllTerms() {
            return matchAllTerms;
        }

        public void setMatchAllTerms(boolean matchAllTerms) {
            this.matchAllTerms = matchAllTerms;
        }
    }

    public static class Search {
        private int defaultFileLimit = 80;
        private int defaultModuleLimit = 8;
        private int defaultFindLimit = 50;
        private int maxFindLimit = 200;

        public int getDefaultFileLimit() {
            return defaultFileLimit;
        }

        public void setDefaultFileLimit(int defaultFileLimit) {
            this.defaultFileLimit = defaultFileLimit;
        }

        public int getDefaultModuleLimit() {
            return defaultModuleLimit;
        }

        public void setDefaultModuleLimit(int defaultModuleLimit) {
            this.defaultModuleLimit = defaultModuleLimit;
        }

        public int getDefaultFindLimit() {
            return defaultFindLimit;
        }

        public void setDefaultFindLimit(int defaultFindLimit) {
            this.defaultFindLimit = defaultFindLimit;
        }

        public int getMaxFindLimit() {
            return maxFindLimit;
        }

        public void setMaxFindLimit(int maxFindLimit) {
            this.maxFindLimit = maxFindLimit;
        }
    }

    public static class Tokens {
        /** Average UTF-8 bytes per token used by the token estimate. */
        private int bytesPerToken = 4;

        public int getBytesPerToken() {
            return bytesPerToken;
        }

        public void setBytesPerToken(int bytesPerToken) {
            this.bytesPerToken = bytesPerToken;
        }
    }

    public static class Stub {
        private int maxBytes = 2048;

        public int getMaxBytes() {
            return maxBytes;
        }

        public void setMaxBytes(int maxBytes) {
            this.maxBytes = maxBytes;
        }
    }

    public static class Context {
        private long defaultBudget = 50_000;

        public long getDefaultBudget() {
            return defaultBudget;
        }

        public void setDefaultBudget(long defaultBudget) {
            this.defaultBudget = defaultBudget;
        }
    }
}
