package com.armada.core.engine;

import com.armada.core.model.FileChange;
import com.armada.core.workspace.WorkspaceFiles;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts file changes from an agent answer. A fenced block counts as a file when its
 * opening line names a path, optionally after a language tag and a comment marker:
 * <pre>
 * ```java // src/main/java/App.java
 * ```ts src/a.ts
 * ```src/a.ts
 * </pre>
 * A path already in the workspace becomes a MODIFY, anything else a CREATE. The last
 * block wins when a path repeats.
 */
public class ResponseChangeParser {

    private static final Pattern BLOCK = Pattern.compile("```([^\\n`]*)\\n([\\s\\S]*?)```");
    private static final Pattern HEADER = Pattern.compile("^(?:([\\w+-]+)\\s+)?(?://|#|--)?\\s*(\\S+)$");

    private final WorkspaceFiles files;

    public ResponseChangeParser(WorkspaceFiles files) {
        this.files = files;
    }

    public List<FileChange> parse(String response) {
        if (response == null || response.isEmpty()) {
            return List.of();
        }
        Map<String, String> contents = new LinkedHashMap<>();
        Matcher block = BLOCK.matcher(response);
        while (block.find()) {
            String path = pathFrom(block.group(1).trim());
            if (path != null) {
                contents.put(path, stripTrailingNewline(block.group(2)));
            }
        }
        List<FileChange> changes = new ArrayList<>();
        contents.forEach((path, content) -> changes.add(files.exists(path)
                ? FileChange.modify(path, null, content)
                : FileChange.create(path, content)));
        return changes;
    }

    static String pathFrom(String header) {
        if (header.isEmpty()) {
            return null;
        }
        Matcher matcher = HEADER.matcher(header);
        if (!matcher.matches()) {
            return null;
        }
        String candidate = matcher.group(2);
        if (candidate.startsWith("//") || candidate.startsWith("#")) {
            return null;
        }
        // a bare language tag ("java", "diff") is not a path
        if (!candidate.contains("/") && !candidate.contains(".")) {
            return null;
        }
        return candidate.startsWith("./") ? candidate.substring(2) : candidate;
    }

    private static String stripTrailingNewline(String content) {
        return content.endsWith("\n") ? content.substring(0, content.length() - 1) : content;
    }
}
