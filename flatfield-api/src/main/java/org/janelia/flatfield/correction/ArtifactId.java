package org.janelia.flatfield.correction;

import java.util.concurrent.atomic.AtomicLong;

import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.janelia.flatfield.image.Releasable;

/**
 * Opaque handle of an artifact registered with an {@link ArtifactRegistry}.
 *
 * @param <A> artifact type
 */
public final class ArtifactId<A extends Releasable> {

    private static final AtomicLong ID_SEQUENCE = new AtomicLong(0);

    private final long id;
    private final String label;

    ArtifactId(String label) {
        this.id = ID_SEQUENCE.incrementAndGet();
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;

        if (o == null || getClass() != o.getClass()) return false;

        ArtifactId<?> that = (ArtifactId<?>) o;

        return new EqualsBuilder().append(id, that.id).isEquals();
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder(17, 37).append(id).toHashCode();
    }

    @Override
    public String toString() {
        return label + "#" + id;
    }
}
