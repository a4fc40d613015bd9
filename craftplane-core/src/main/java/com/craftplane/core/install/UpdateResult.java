package com.craftplane.core.install;

import com.craftplane.api.model.InstallationStatus;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.List;

@Getter
@Builder
@ToString
public class UpdateResult {

    private final String installationId;
    private final String oldVersion;
    private final String newVersion;
    private final InstallationStatus status;
    private final boolean requiresRestart;

    @Singular
    private final List<String> breakingChanges;
}
