package com.armada.core.merge;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lightweight declaration scanner. Finds the import block, classes, interfaces, functions,
 * type definitions and constants of brace-delimited languages by line patterns, and ends each
 * region at its matching closing brace. Other files are split into fixed-size line chunks.
 */
public class RegionAnalyzer {

    static final int CHUNK_SIZE = 50;

    private static final Set<String> SCRIPT_EXTENSIONS = Set.of("ts", "tsx", "js", "jsx", "mjs", "cjs");
    private static final Set<String> JVM_EXTENSIONS = Set.of("java", "kt", "groovy", "scala");

    private static final Pattern SCRIPT_IMPORT = Pattern.compile("^\\s*(import\\s|export\\s+\\*\\s+from|const\\s+\\w+\\s*=\\s*require\\()");
    private static final Pattern JVM_IMPORT = Pattern.compile("^\\s*(import|package)\\s");

    private static final List<DeclarationPattern> SCRIPT_PATTERNS = List.of(
            new DeclarationPattern(Pattern.compile("^(?:export\\s+)?(?:default\\s+)?(?:async\\s+)?function\\s*\\*?\\s*(\\w+)"), RegionType.FUNCTION),
            new DeclarationPattern(Pattern.compile("^(?:export\\s+)?(?:default\\s+)?(?:abstract\\s+)?class\\s+(\\w+)"), RegionType.CLASS),
            new DeclarationPattern(Pattern.compile("^(?:export\\s+)?interface\\s+(\\w+)"), RegionType.INTERFACE),
            new DeclarationPattern(Pattern.compile("^(?:export\\s+)?(?:type|enum)\\s+(\\w+)"), RegionType.TYPE_DEFINITION),
            new DeclarationPattern(Pattern.compile("^(?:export\\s+)?(?:const|let|var)\\s+(\\w+)"), RegionType.CONSTANT));

    private static final String JVM_MODIFIERS = "(?:(?:public|protected|private|static|final|abstract|sealed|non-sealed|data|open|internal|override|synchronized|default)\\s+)*";

    private static final List<DeclarationPattern> JVM_PATTERNS = List.of(
            new DeclarationPattern(Pattern.compile("^\\s*" + JVM_MODIFIERS + "(?:class|record|object)\\s+(\\w+)"), RegionType.CLASS),
            new DeclarationPattern(Pattern.compile("^\\s*" + JVM_MODIFIERS + "(?:interface|@interface)\\s+(\\w+)"), RegionType.INTERFACE),
            new DeclarationPattern(Pattern.compile("^\\s*" + JVM_MODIFIERS + "enum\\s+(?:class\\s+)?(\\w+)"), RegionType.TYPE_DEFINITION),
            new DeclarationPattern(Pattern.compile("^\\s*" + JVM_MODIFIERS + "fun\\s+(?:<[^>]*>\\s*)?(\\w+)\\s*\\("), RegionType.FUNCTION),
            new DeclarationPattern(Pattern.compile("^\\s*(?:(?:public|protected|private|static|final|abstract|synchronized|default)\\s+)+(?:<[^>]*>\\s*)?[\\w.<>\\[\\],?\\s]+?\\s+(\\w+)\\s*\\([^;]*$"), RegionType.FUNCTION),
            new DeclarationPattern(Pattern.compile("^\\s*(?:(?:public|protected|private)\\s+)?static\\s+final\\s+[\\w.<>\\[\\],?\\s]+?\\s+([A-Z][A-Z0-9_]*)\\s*="), RegionType.CONSTANT));

    /**
     * Regions sorted by start line.
     */
    public List<CodeRegion> analyze(String path, String content) {
        String text = content != null ? content : "";
        String[] lines = ThreeWayMerger.lines(text);
        String extension = extension(path);
        if (SCRIPT_EXTENSIONS.contains(extension)) {
            return scan(path, lines, SCRIPT_IMPORT, SCRIPT_PATTERNS);
        }
        if (JVM_EXTENSIONS.contains(extension)) {
            return scan(path, lines, JVM_IMPORT, JVM_PATTERNS);
        }
        return chunks(path, lines);
    }

    private List<CodeRegion> scan(String path, String[] lines, Pattern importPattern, List<DeclarationPattern> patterns) {
        List<CodeRegion> regions = new ArrayList<>();
        int importStart = -1;
        int importEnd = -1;
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (importPattern.matcher(line).find()) {
                if (importStart < 0) {
                    importStart = i + 1;
                }
                importEnd = i + 1;
                continue;
            }
            for (DeclarationPattern declaration : patterns) {
                Matcher matcher = declaration.pattern.matcher(line);
                if (matcher.find()) {
                    regions.add(new CodeRegion(path, declaration.type, matcher.group(1), i + 1, findEndLine(lines, i)));
                    break;
                }
            }
        }
        if (importStart > 0) {
            regions.add(new CodeRegion(path, RegionType.IMPORTS, "imports", importStart, importEnd));
        }
        regions.sort(Comparator.comparingInt(CodeRegion::startLine));
        return dedupeNames(regions);
    }

    private List<CodeRegion> chunks(String path, String[] lines) {
        List<CodeRegion> regions = new ArrayList<>();
        for (int i = 0; i < lines.length; i += CHUNK_SIZE) {
            int start = i + 1;
            int end = Math.min(i + CHUNK_SIZE, lines.length);
            regions.add(new CodeRegion(path, RegionType.OTHER, "lines_" + start + "_" + end, start, end));
        }
        return regions;
    }

    /**
     * Line (1-based) of the brace closing the block opened at or after {@code startIndex};
     * the declaration line itself when no brace opens.
     */
    static int findEndLine(String[] lines, int startIndex) {
        int depth = 0;
        boolean opened = false;
        for (int i = startIndex; i < lines.length; i++) {
            for (char c : lines[i].toCharArray()) {
                if (c == '{') {
                    depth++;
                    opened = true;
                } else if (c == '}') {
                    depth--;
                    if (opened && depth == 0) {
                        return i + 1;
                    }
                }
            }
            if (!opened && lines[i].trim().endsWith(";")) {
                return i + 1;
            }
        }
        return startIndex + 1;
    }

    /**
     * Overloads share a name; suffix repeats so region keys stay unique per file.
     */
    private static List<CodeRegion> dedupeNames(List<CodeRegion> regions) {
        List<CodeRegion> result = new ArrayList<>(regions.size());
        Map<String, Integer> seen = new HashMap<>();
        for (CodeRegion region : regions) {
            int count = seen.merge(region.key(), 1, Integer::sum);
            result.add(count == 1 ? region
                    : new CodeRegion(region.path(), region.type(), region.name() + "#" + count,
                    region.startLine(), region.endLine()));
        }
        return result;
    }

    private static String extension(String path) {
        int slash = path.lastIndexOf('/');
        int dot = path.lastIndexOf('.');
        return dot <= slash ? "" : path.substring(dot + 1).toLowerCase();
    }

    private record DeclarationPattern(Pattern pattern, RegionType type) {
    }
}
