package io.clusterprovisioner.backend;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Identifies the build of this process; stamped into documents as {@code provisionedBy}.
 */
@Getter
@AllArgsConstructor
public class BuildInfo {

    private final String commit;
}
