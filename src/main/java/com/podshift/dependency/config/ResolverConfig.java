package com.podshift.dependency.config;

import com.podshift.dependency.model.ExtractorCategory;
import com.podshift.dependency.model.ResolverSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Default resolver settings, read from application.yml (podshift.resolver.*).
 * A request may override them per run.
 */
@Configuration
@Slf4j
public class ResolverConfig {

    @Value("${podshift.resolver.minutes-per-container:5.0}")
    private double minutesPerContainer;

    @Value("${podshift.resolver.complexity-multiplier:1.5}")
    private double complexityMultiplier;

    @Value("${podshift.resolver.max-explored-paths:100000}")
    private long maxExploredPaths;

    @Value("${podshift.resolver.enabled-extractors:COMPOSE,LINKS,NETWORK,VOLUME,ENVIRONMENT}")
    private String enabledExtractors;

    @Value("${podshift.resolver.ignored-networks:bridge,host,none}")
    private String ignoredNetworks;

    @Bean
    public ResolverSettings resolverSettings() {
        ResolverSettings settings = ResolverSettings.builder()
                .minutesPerContainer(minutesPerContainer)
                .complexityMultiplier(complexityMultiplier)
                .maxExploredPaths(maxExploredPaths)
                .enabledExtractors(parseCategories(enabledExtractors))
                .ignoredNetworks(parseList(ignoredNetworks))
                .build();
        log.info("[Resolver Config] minutesPerContainer={} complexityMultiplier={} maxExploredPaths={} extractors={}",
                settings.getMinutesPerContainer(), settings.getComplexityMultiplier(),
                settings.getMaxExploredPaths(), settings.getEnabledExtractors());
        return settings;
    }

    static Set<ExtractorCategory> parseCategories(String value) {
        Set<ExtractorCategory> categories = EnumSet.noneOf(ExtractorCategory.class);
        for (String name : parseList(value)) {
            categories.add(ExtractorCategory.valueOf(name.toUpperCase(Locale.ROOT)));
        }
        return categories;
    }

    static Set<String> parseList(String value) {
        if (value == null || value.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(TreeSet::new));
    }
}
