package com.armada.core.model;

import java.io.Serializable;

/**
 * A proposed change to one file.
 *
 * @param path            workspace-relative path
 * @param type            CREATE, MODIFY or DELETE
 * @param originalContent content the change was made against (nullable for CREATE)
 * @param modifiedContent new content (nullable for DELETE)
 */
public record FileChange(
    String path,
    ChangeType type,
    String originalContent,
    String modifiedContent
) implements Serializable {

    public static FileChange create(String path, String content) {
        return new FileChange(path, ChangeType.CREATE, null, content);
    }

    public static FileChange modify(String path, String original, String modified) {
        return new FileChange(path, ChangeType.MODIFY, original, modified);
    }

    public static FileChange delete(String path, String original) {
        return new FileChange(path, ChangeType.DELETE, original, null);
    }

    public FileChange withModifiedContent(String content) {
        return new FileChange(path, type == ChangeType.DELETE ? ChangeType.MODIFY : type, originalContent, content);
    }
}
