package com.armada.core.capability;

/**
 * Content of one path at backup time.
 *
 * @param existed false when the path did not exist, in which case restore deletes it
 */
public record FileSnapshot(String path, boolean existed, String content) {
}
