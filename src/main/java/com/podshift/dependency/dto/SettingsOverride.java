package com.podshift.dependency.dto;

import com.podshift.dependency.model.ExtractorCategory;
import com.podshift.dependency.model.ResolverSettings;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumSet;
import java.util.Set;

/**
 * Per-request overrides of the configured resolver settings. Unset fields keep the defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SettingsOverride {

    @Positive
    private Double minutesPerContainer;

    @DecimalMin("1.0")
    private Double complexityMultiplier;

    @Min(1)
    private Long maxExploredPaths;

    private Set<ExtractorCategory> enabledExtractors;

    private Set<String> ignoredNetworks;

    public ResolverSettings applyTo(ResolverSettings defaults) {
        ResolverSettings.ResolverSettingsBuilder builder = defaults.toBuilder();
        if (minutesPerContainer != null) {
            builder.minutesPerContainer(minutesPerContainer);
        }
        if (complexityMultiplier != null) {
            builder.complexityMultiplier(complexityMultiplier);
        }
        if (maxExploredPaths != null) {
            builder.maxExploredPaths(maxExploredPaths);
        }
        if (enabledExtractors != null) {
            builder.enabledExtractors(enabledExtractors.isEmpty()
                    ? EnumSet.noneOf(ExtractorCategory.class)
                    : EnumSet.copyOf(enabledExtractors));
        }
        if (ignoredNetworks != null) {
            builder.ignoredNetworks(Set.copyOf(ignoredNetworks));
        }
        return builder.build();
    }
}
