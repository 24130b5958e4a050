package org.janelia.flatfield.correction;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.janelia.flatfield.image.Releasable;

/**
 * Tracks the artifacts created during one correction run.
 *
 * The registry is owned by the run: closing it hands every live artifact to the
 * {@link ResourceCleaner}, which releases them unless the run asked to retain them.
 * It is not thread safe.
 */
public class ArtifactRegistry implements AutoCloseable {

    private final ResourceCleaner resourceCleaner;
    private final Map<ArtifactId<?>, Releasable> liveArtifacts = new LinkedHashMap<>();
    private final Set<ArtifactId<?>> releasedArtifacts = new HashSet<>();
    private boolean retainOnClose;

    public ArtifactRegistry() {
        this(new ResourceCleaner());
    }

    public ArtifactRegistry(ResourceCleaner resourceCleaner) {
        this.resourceCleaner = resourceCleaner;
        this.retainOnClose = false;
    }

    public <A extends Releasable> ArtifactId<A> register(String label, A artifact) {
        if (artifact == null) {
            throw new IllegalArgumentException("Cannot register a null artifact for " + label);
        }
        if (artifact.isReleased()) {
            throw new IllegalArgumentException("Cannot register artifact " + label + " because it has already been released");
        }
        ArtifactId<A> artifactId = new ArtifactId<>(label);
        liveArtifacts.put(artifactId, artifact);
        return artifactId;
    }

    @SuppressWarnings("unchecked")
    public <A extends Releasable> Optional<A> find(ArtifactId<A> artifactId) {
        return Optional.ofNullable((A) liveArtifacts.get(artifactId));
    }

    public <A extends Releasable> A get(ArtifactId<A> artifactId) {
        return find(artifactId).orElseThrow(() -> new IllegalStateException(
                releasedArtifacts.contains(artifactId)
                        ? "Artifact " + artifactId + " has already been released"
                        : "Artifact " + artifactId + " is not registered"));
    }

    public boolean isLive(ArtifactId<?> artifactId) {
        return liveArtifacts.containsKey(artifactId);
    }

    public boolean isReleased(ArtifactId<?> artifactId) {
        return releasedArtifacts.contains(artifactId);
    }

    /**
     * Release one artifact. The artifact is no longer tracked afterwards, even if its release fails.
     *
     * @return false if the artifact was not live, i.e. it was never registered or it was already released.
     */
    public boolean release(ArtifactId<?> artifactId) {
        Releasable artifact = liveArtifacts.remove(artifactId);
        if (artifact == null) {
            return false;
        }
        releasedArtifacts.add(artifactId);
        artifact.release();
        return true;
    }

    public List<ArtifactId<?>> getLiveArtifactIds() {
        return new ArrayList<>(liveArtifacts.keySet());
    }

    public int countLiveArtifacts() {
        return liveArtifacts.size();
    }

    /**
     * Keep the live artifacts reachable after the registry is closed.
     */
    public void retainOnClose() {
        this.retainOnClose = true;
    }

    public boolean isRetainedOnClose() {
        return retainOnClose;
    }

    ResourceCleaner getResourceCleaner() {
        return resourceCleaner;
    }

    @Override
    public void close() {
        resourceCleaner.cleanup(this, retainOnClose);
    }
}
