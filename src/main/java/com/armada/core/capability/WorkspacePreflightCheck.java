package com.armada.core.capability;

import com.armada.core.model.ChangeType;
import com.armada.core.model.FileChange;
import com.armada.core.workspace.WorkspaceFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Preflight checks against the current workspace: file state, duplicate paths and bracket
 * balance of code files. Risk is scored from change types, sensitive file names and findings.
 */
public class WorkspacePreflightCheck implements PreflightCapability {

    private static final Logger log = LoggerFactory.getLogger(WorkspacePreflightCheck.class);

    private static final Map<ChangeType, Integer> RISK_WEIGHTS = Map.of(
            ChangeType.DELETE, 5,
            ChangeType.CREATE, 2,
            ChangeType.MODIFY, 3);

    private static final List<Pattern> HIGH_RISK = List.of(
            Pattern.compile("(^|/)pom\\.xml$"),
            Pattern.compile("(^|/)package\\.json$"),
            Pattern.compile("\\.config\\.(js|ts|json)$"),
            Pattern.compile("(^|/)(index|main|app)\\.(ts|js)$"),
            Pattern.compile("(^|/)application\\.(yml|yaml|properties)$"));

    private static final List<Pattern> CRITICAL = List.of(
            Pattern.compile("\\.env"),
            Pattern.compile("(^|/)Dockerfile$"),
            Pattern.compile("(^|/)\\.github/"));

    private static final Set<String> BRACKETED = Set.of("java", "ts", "tsx", "js", "jsx", "kt", "go", "rs", "c", "cpp", "cs", "json");

    private final WorkspaceFiles files;

    public WorkspacePreflightCheck(WorkspaceFiles files) {
        this.files = files;
    }

    @Override
    public PreflightReport check(List<FileChange> changes) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        Set<String> seen = new HashSet<>();
        for (FileChange change : changes) {
            if (!seen.add(change.path())) {
                errors.add("Conflicting changes to same file: " + change.path());
            }
            boolean exists = files.exists(change.path());
            if (change.type() == ChangeType.CREATE && exists) {
                warnings.add("File already exists and will be overwritten: " + change.path());
            }
            if (change.type() != ChangeType.CREATE && !exists) {
                errors.add("File does not exist: " + change.path());
            }
            if (change.modifiedContent() != null && BRACKETED.contains(extension(change.path()))) {
                String problem = unbalancedBracket(change.modifiedContent());
                if (problem != null) {
                    errors.add("Syntax error in " + change.path() + ": " + problem);
                }
            }
        }

        RiskLevel risk = riskLevel(score(changes, errors.size(), warnings.size()), changes.size());
        if (!errors.isEmpty()) {
            log.warn("Preflight found {} blocking issue(s): {}", errors.size(), errors);
        }
        return new PreflightReport(errors.isEmpty(), errors, warnings, risk);
    }

    @Override
    public ImpactAnalysis analyze(List<FileChange> changes) {
        int raw = score(changes, 0, 0);
        RiskLevel level = riskLevel(raw, changes.size());
        int normalized = Math.min(100, changes.isEmpty() ? 0 : raw * 10 / changes.size());
        List<String> paths = changes.stream().map(FileChange::path).distinct().toList();
        long deletes = changes.stream().filter(c -> c.type() == ChangeType.DELETE).count();
        String summary = paths.size() + " file(s) affected, " + deletes + " deletion(s), risk " + level;
        return new ImpactAnalysis(paths, normalized, level, summary);
    }

    private static int score(List<FileChange> changes, int errors, int warnings) {
        int score = 0;
        for (FileChange change : changes) {
            score += RISK_WEIGHTS.getOrDefault(change.type(), 1);
            if (HIGH_RISK.stream().anyMatch(p -> p.matcher(change.path()).find())) {
                score += 3;
            }
            if (CRITICAL.stream().anyMatch(p -> p.matcher(change.path()).find())) {
                score += 5;
            }
        }
        return score + errors * 10 + warnings * 3;
    }

    private static RiskLevel riskLevel(int score, int changeCount) {
        double normalized = (double) score / Math.max(changeCount, 1);
        if (normalized >= 10) {
            return RiskLevel.CRITICAL;
        }
        if (normalized >= 7) {
            return RiskLevel.HIGH;
        }
        if (normalized >= 4) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }

    /**
     * Bracket balance ignoring string literals and comments; returns the first problem or null.
     */
    static String unbalancedBracket(String content) {
        Deque<Character> stack = new ArrayDeque<>();
        int line = 1;
        char quote = 0;
        boolean lineComment = false;
        boolean blockComment = false;
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            char next = i + 1 < content.length() ? content.charAt(i + 1) : 0;
            if (c == '\n') {
                line++;
                lineComment = false;
                continue;
            }
            if (lineComment) {
                continue;
            }
            if (blockComment) {
                if (c == '*' && next == '/') {
                    blockComment = false;
                    i++;
                }
                continue;
            }
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '/' && next == '/') {
                lineComment = true;
            } else if (c == '/' && next == '*') {
                blockComment = true;
                i++;
            } else if (c == '"' || c == '\'' || c == '`') {
                quote = c;
            } else if (c == '(' || c == '[' || c == '{') {
                stack.push(c);
            } else if (c == ')' || c == ']' || c == '}') {
                char open = c == ')' ? '(' : c == ']' ? '[' : '{';
                if (stack.isEmpty() || stack.pop() != open) {
                    return "unexpected '" + c + "' at line " + line;
                }
            }
        }
        return stack.isEmpty() ? null : "unclosed '" + stack.peek() + "'";
    }

    private static String extension(String path) {
        int dot = path.lastIndexOf('.');
        return dot < 0 ? "" : path.substring(dot + 1).toLowerCase();
    }
}
