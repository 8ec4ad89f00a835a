package com.dcgraph.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private IndexConfig index = new IndexConfig();
    private QueryConfig query = new QueryConfig();
    private ExtractionConfig extraction = new ExtractionConfig();

    public static AppConfig load(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        AppConfig loaded = mapper.readValue(config.toFile(), AppConfig.class);
        return loaded == null ? new AppConfig() : loaded;
    }

    public IndexConfig getIndex() {
        return index;
    }

    public void setIndex(IndexConfig index) {
        this.index = index == null ? new IndexConfig() : index;
    }

    public QueryConfig getQuery() {
        return query;
    }

    public void setQuery(QueryConfig query) {
        this.query = query == null ? new QueryConfig() : query;
    }

    public ExtractionConfig getExtraction() {
        return extraction;
    }

    public void setExtraction(ExtractionConfig extraction) {
        this.extraction = extraction == null ? new ExtractionConfig() : extraction;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IndexConfig {
        private String path;

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public Path resolvePath() {
            if (path == null || path.isBlank()) {
                return Path.of(System.getProperty("user.home"), ".dcgraph", "call-index.bin");
            }
            return Path.of(path);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class QueryConfig {
        private int maxDepth = 5;

        public int getMaxDepth() {
            return maxDepth;
        }

        public void setMaxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ExtractionConfig {
        private String extension = "tcl";
        private int workerThreads = 0;
        private List<String> excludedCommands = new ArrayList<>();
        private boolean skipVariableCommands = true;
        private List<String> scriptCommands;

        public String getExtension() {
            return extension;
        }

        public void setExtension(String extension) {
            this.extension = extension;
        }

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }

        public List<String> getExcludedCommands() {
            return excludedCommands;
        }

        public void setExcludedCommands(List<String> excludedCommands) {
            this.excludedCommands = excludedCommands == null ? new ArrayList<>() : excludedCommands;
        }

        public boolean isSkipVariableCommands() {
            return skipVariableCommands;
        }

        public void setSkipVariableCommands(boolean skipVariableCommands) {
            this.skipVariableCommands = skipVariableCommands;
        }

        public List<String> getScriptCommands() {
            return scriptCommands;
        }

        public void setScriptCommands(List<String> scriptCommands) {
            this.scriptCommands = scriptCommands;
        }
    }
}
