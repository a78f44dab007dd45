package io.clusterprovisioner.queue;

import io.clusterprovisioner.models.ClusterDocument;

/**
 * In-place change applied to a freshly read document. May run more than once
 * when the conditional write conflicts, so it must not depend on earlier runs.
 */
@FunctionalInterface
public interface DocumentMutator {
    void mutate(ClusterDocument document);
}
