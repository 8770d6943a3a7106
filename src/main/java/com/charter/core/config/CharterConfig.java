package com.charter.core.config;

import com.charter.core.ids.DatedIdStrategy;
import com.charter.core.ids.IdStrategy;
import com.charter.core.ids.SequentialIdStrategy;
import com.charter.core.refs.PatternReferenceMatcher;
import com.charter.core.refs.ReferenceMatcher;
import com.charter.core.refs.SourceScanOptions;
import com.charter.core.refs.SourceScanner;
import com.charter.core.store.ArtifactStore;
import com.charter.core.store.WorkspacePaths;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.HashSet;
import java.util.Locale;

/**
 * Wires the core services from {@link CharterProperties}. Relative locations are
 * resolved against {@code charter.project-root}.
 */
@Configuration
public class CharterConfig {

    private static final Logger log = LoggerFactory.getLogger(CharterConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public WorkspacePaths workspacePaths(CharterProperties properties) {
        Path root = Path.of(properties.getProjectRoot()).toAbsolutePath().normalize();
        return new WorkspacePaths(root,
                root.resolve(properties.getGovRoot()),
                root.resolve(properties.getDocsOutput()),
                root.resolve(properties.getChangelogFile()));
    }

    @Bean
    public ArtifactStore artifactStore(WorkspacePaths paths) {
        log.debug("Governance store at {}", paths.govRoot());
        return new ArtifactStore(paths.govRoot());
    }

    @Bean
    public ReferenceMatcher referenceMatcher(CharterProperties properties) {
        return new PatternReferenceMatcher(properties.getReferences().getPattern());
    }

    @Bean
    public SourceScanner sourceScanner(CharterProperties properties, WorkspacePaths paths) {
        CharterProperties.SourceScan scan = properties.getSourceScan();
        return new SourceScanner(new SourceScanOptions(scan.isEnabled(), paths.projectRoot(), scan.getRoots(),
                new HashSet<>(scan.getExtensions()), new HashSet<>(scan.getExcludeDirs())));
    }

    @Bean
    public IdStrategy idStrategy(CharterProperties properties, Clock clock) {
        String strategy = properties.getIds().getStrategy().strip().toLowerCase(Locale.ROOT);
        return switch (strategy) {
            case "sequential" -> new SequentialIdStrategy();
            case "dated" -> new DatedIdStrategy(clock);
            default -> throw new IllegalStateException(
                    "Unknown charter.ids.strategy '" + strategy + "' (expected sequential or dated)");
        };
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
