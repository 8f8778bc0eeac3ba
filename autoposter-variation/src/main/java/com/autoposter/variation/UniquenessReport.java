package com.autoposter.variation;

import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * Advisory result of a post-hoc digest comparison. Whether a collision blocks posting is
 * decided by the caller.
 */
@Value
public class UniquenessReport {
    int totalFiles;
    int uniqueHashes;
    List<HashCollision> collisions;
    List<Path> missingFiles;

    public boolean isAllUnique() {
        return collisions.isEmpty();
    }
}
