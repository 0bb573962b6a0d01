package com.mlops_lifecycle.dto.registry;

import java.nio.file.Path;

/**
 * A registry version whose artifact has been fetched to a local temp file.
 */
public record RegistryArtifact(
        RegistryModelVersion version,
        Path localFile
) {}
