package com.camsentinel.core.recording;

import java.nio.file.Path;
import java.util.Objects;

/**
 * The output files reserved for one recording session.
 */
public final class ArtifactPaths {

    private final String artifactName;
    private final Path snapshotPath;
    private final Path clipPath;

    public ArtifactPaths(String artifactName, Path snapshotPath, Path clipPath) {
        this.artifactName = Objects.requireNonNull(artifactName, "artifactName must not be null");
        this.snapshotPath = Objects.requireNonNull(snapshotPath, "snapshotPath must not be null");
        this.clipPath = Objects.requireNonNull(clipPath, "clipPath must not be null");
    }

    /** @return sortable, per-device unique base name */
    public String getArtifactName() {
        return artifactName;
    }

    public Path getSnapshotPath() {
        return snapshotPath;
    }

    public Path getClipPath() {
        return clipPath;
    }

    @Override
    public String toString() {
        return "ArtifactPaths{snapshot=" + snapshotPath + ", clip=" + clipPath + '}';
    }
}
