package com.armada.core.pool;

/**
 * A piece of context rendered into the prompt as {@code <type path="...">content</type>}.
 */
public record ContextItem(String type, String path, String content) {

    public static ContextItem file(String path, String content) {
        return new ContextItem("file", path, content);
    }
}
