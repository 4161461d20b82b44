package com.armada.core.merge;

import com.armada.core.concurrent.CancellationToken;
import com.armada.core.model.FileChange;
import com.armada.core.model.HierarchyTier;
import com.armada.core.pool.AgentPool;
import com.armada.core.pool.AgentRequest;
import com.armada.core.pool.AgentResponse;
import com.armada.core.pool.ContextItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Asks an agent from the pool to merge both versions and takes the first fenced block of
 * the answer as the merged file.
 */
public class PoolMergeAssistant implements MergeAssistant {

    private static final Logger log = LoggerFactory.getLogger(PoolMergeAssistant.class);

    static final int MAX_TOKENS = 8192;
    static final double TEMPERATURE = 0.1;

    private static final Pattern FENCED_BLOCK = Pattern.compile("```[\\w+-]*\\n?([\\s\\S]*?)```");

    private static final String SYSTEM_PROMPT = """
            You resolve merge conflicts between two workers that changed the same file.
            Preserve both sets of changes where possible. When they are complementary, combine them.
            When they truly contradict, keep the more complete and correct version.
            Keep the file's existing style.
            Respond with only the merged file content in a single fenced code block.""";

    private final AgentPool pool;

    public PoolMergeAssistant(AgentPool pool) {
        this.pool = pool;
    }

    @Override
    public Optional<String> resolve(MergeConflict conflict, MergeOutcome automatic, CancellationToken token) {
        AgentRequest request = new AgentRequest(null, buildPrompt(conflict, automatic), SYSTEM_PROMPT,
                List.of(ContextItem.file(conflict.path(), conflict.baseContent())),
                HierarchyTier.OVERLORD, null, "conflict-" + conflict.id(), MAX_TOKENS, TEMPERATURE, null);
        AgentResponse response = pool.execute(request, token);
        Optional<String> merged = extractFencedBlock(response.content());
        if (merged.isEmpty()) {
            log.warn("Merge answer for {} carried no fenced block", conflict.path());
        }
        return merged;
    }

    static String buildPrompt(MergeConflict conflict, MergeOutcome automatic) {
        String regions = conflict.regions().stream()
                .map(r -> "- " + r.describe())
                .collect(Collectors.joining("\n"));
        return "Resolve the merge conflict in " + conflict.path() + ".\n\n"
                + "Conflicting regions:\n" + regions + "\n\n"
                + "Base version:\n```\n" + conflict.baseContent() + "\n```\n\n"
                + "Version from " + conflict.branch1Id() + " (ours):\n```\n" + content(conflict.ours()) + "\n```\n\n"
                + "Version from " + conflict.branch2Id() + " (theirs):\n```\n" + content(conflict.theirs()) + "\n```\n\n"
                + "Automatic merge attempt (" + automatic.conflictCount() + " conflicting hunk(s)):\n```\n"
                + automatic.content() + "\n```";
    }

    static Optional<String> extractFencedBlock(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = FENCED_BLOCK.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String block = matcher.group(1).strip();
        return block.isEmpty() ? Optional.empty() : Optional.of(block);
    }

    private static String content(FileChange change) {
        return change.modifiedContent() != null ? change.modifiedContent() : "";
    }
}
