package com.podshift.dependency.dto;

import com.podshift.dependency.model.snapshot.Snapshot;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MigrationPlanRequest {

    @NotNull
    private Snapshot snapshot;

    @Valid
    private SettingsOverride settings;      // Optional
}
