package org.janelia.flatfield.correction;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Releases the intermediate artifacts of a correction run.
 */
public class ResourceCleaner {

    private static final Logger LOG = LoggerFactory.getLogger(ResourceCleaner.class);

    /**
     * @param registry          run registry
     * @param keepIntermediates if set nothing gets released
     * @return the number of artifacts released by this call
     */
    public int cleanup(ArtifactRegistry registry, boolean keepIntermediates) {
        if (keepIntermediates) {
            LOG.debug("Keep {} intermediate artifacts", registry.countLiveArtifacts());
            return 0;
        }
        return releaseAll(registry);
    }

    /**
     * Release every live artifact of the registry. Artifacts that were already released are skipped,
     * so calling this repeatedly is safe. A failure to release one artifact does not stop the others
     * from being released.
     *
     * @throws ArtifactReleaseException if any artifact failed to release
     */
    public int releaseAll(ArtifactRegistry registry) {
        List<RuntimeException> failures = new ArrayList<>();
        int released = 0;
        for (ArtifactId<?> artifactId : registry.getLiveArtifactIds()) {
            try {
                if (registry.release(artifactId)) {
                    released++;
                }
            } catch (RuntimeException e) {
                LOG.warn("Failed to release artifact {}", artifactId, e);
                failures.add(e);
            }
        }
        if (!failures.isEmpty()) {
            ArtifactReleaseException releaseException = new ArtifactReleaseException(
                    failures.size() + " artifacts could not be released");
            failures.forEach(releaseException::addSuppressed);
            throw releaseException;
        }
        if (released > 0) {
            LOG.debug("Released {} intermediate artifacts", released);
        }
        return released;
    }
}
