package com.charter.core.config;

import com.charter.core.refs.PatternReferenceMatcher;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "charter")
public class CharterProperties {

    private String projectRoot = ".";
    private String govRoot = "gov";
    private String docsOutput = "docs";
    private String changelogFile = "CHANGELOG.md";
    private String defaultOwner = "";
    private References references = new References();
    private Ids ids = new Ids();
    private SourceScan sourceScan = new SourceScan();

    public String getProjectRoot() { return projectRoot; }
    public void setProjectRoot(String projectRoot) { this.projectRoot = projectRoot; }
    public String getGovRoot() { return govRoot; }
    public void setGovRoot(String govRoot) { this.govRoot = govRoot; }
    public String getDocsOutput() { return docsOutput; }
    public void setDocsOutput(String docsOutput) { this.docsOutput = docsOutput; }
    public String getChangelogFile() { return changelogFile; }
    public void setChangelogFile(String changelogFile) { this.changelogFile = changelogFile; }
    public String getDefaultOwner() { return defaultOwner; }
    public void setDefaultOwner(String defaultOwner) { this.defaultOwner = defaultOwner; }
    public References getReferences() { return references; }
    public void setReferences(References references) { this.references = references; }
    public Ids getIds() { return ids; }
    public void setIds(Ids ids) { this.ids = ids; }
    public SourceScan getSourceScan() { return sourceScan; }
    public void setSourceScan(SourceScan sourceScan) { this.sourceScan = sourceScan; }

    public static class References {
        /** Regex whose first capture group is the mentioned artifact id. */
        private String pattern = PatternReferenceMatcher.DEFAULT_PATTERN;

        public String getPattern() { return pattern; }
        public void setPattern(String pattern) { this.pattern = pattern; }
    }

    public static class Ids {
        /** {@code sequential} or {@code dated}. */
        private String strategy = "sequential";

        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }
    }

    public static class SourceScan {
        private boolean enabled = false;
        private List<String> roots = new ArrayList<>(List.of("src"));
        private List<String> extensions = new ArrayList<>(List.of("java", "kt", "py", "rs", "go", "ts", "js", "md"));
        private List<String> excludeDirs = new ArrayList<>(List.of("target", "build", "node_modules"));

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public List<String> getRoots() { return roots; }
        public void setRoots(List<String> roots) { this.roots = roots; }
        public List<String> getExtensions() { return extensions; }
        public void setExtensions(List<String> extensions) { this.extensions = extensions; }
        public List<String> getExcludeDirs() { return excludeDirs; }
        public void setExcludeDirs(List<String> excludeDirs) { this.excludeDirs = excludeDirs; }
    }
}
