package com.armada.core.merge;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Line-level three-way merge (diff3 style).
 * <p>
 * Both sides are aligned to the base with a longest-common-subsequence match. Base lines
 * matched on both sides are stable anchors; between anchors a hunk taken by only one side
 * wins, identical hunks collapse, a hunk that strictly extends the other side's lines wins,
 * and any other pair of differing hunks conflicts. When the inputs are too
 * large for the LCS table the merge falls back to index-aligned comparison.
 */
public class ThreeWayMerger {

    static final String OURS_MARKER = "<<<<<<< ours";
    static final String SEPARATOR = "=======";
    static final String THEIRS_MARKER = ">>>>>>> theirs";

    private static final long MAX_LCS_CELLS = 4_000_000L;

    public MergeOutcome merge(String base, String ours, String theirs) {
        String b = base != null ? base : "";
        String o = ours != null ? ours : "";
        String t = theirs != null ? theirs : "";

        if (o.equals(t)) {
            return new MergeOutcome(true, o, 0);
        }
        if (o.equals(b)) {
            return new MergeOutcome(true, t, 0);
        }
        if (t.equals(b)) {
            return new MergeOutcome(true, o, 0);
        }

        String[] baseLines = lines(b);
        String[] oursLines = lines(o);
        String[] theirsLines = lines(t);
        if (tooLarge(baseLines, oursLines) || tooLarge(baseLines, theirsLines)) {
            return indexAligned(baseLines, oursLines, theirsLines);
        }

        int[] oursMatch = match(baseLines, oursLines);
        int[] theirsMatch = match(baseLines, theirsLines);

        List<String> result = new ArrayList<>();
        int conflicts = 0;
        int pb = 0;
        int po = 0;
        int pt = 0;
        while (true) {
            int anchor = -1;
            for (int i = pb; i < baseLines.length; i++) {
                if (oursMatch[i] >= po && theirsMatch[i] >= pt) {
                    anchor = i;
                    break;
                }
            }
            int eb = anchor >= 0 ? anchor : baseLines.length;
            int eo = anchor >= 0 ? oursMatch[anchor] : oursLines.length;
            int et = anchor >= 0 ? theirsMatch[anchor] : theirsLines.length;

            List<String> baseHunk = slice(baseLines, pb, eb);
            List<String> oursHunk = slice(oursLines, po, eo);
            List<String> theirsHunk = slice(theirsLines, pt, et);
            if (oursHunk.equals(theirsHunk) || theirsHunk.equals(baseHunk)) {
                result.addAll(oursHunk);
            } else if (oursHunk.equals(baseHunk)) {
                result.addAll(theirsHunk);
            } else if (supersedes(oursHunk, theirsHunk, baseHunk)) {
                result.addAll(oursHunk);
            } else if (supersedes(theirsHunk, oursHunk, baseHunk)) {
                result.addAll(theirsHunk);
            } else {
                conflicts++;
                result.add(OURS_MARKER);
                result.addAll(oursHunk);
                result.add(SEPARATOR);
                result.addAll(theirsHunk);
                result.add(THEIRS_MARKER);
            }

            if (anchor < 0) {
                break;
            }
            result.add(baseLines[anchor]);
            pb = anchor + 1;
            po = eo + 1;
            pt = et + 1;
        }
        return new MergeOutcome(conflicts == 0, String.join("\n", result), conflicts);
    }

    /**
     * True when {@code wider} is a strict line-level superset of {@code narrower} within one
     * hunk: it keeps every line of {@code narrower} in order, adds at least one more, and
     * reintroduces no base line that {@code narrower} removed.
     */
    static boolean supersedes(List<String> wider, List<String> narrower, List<String> base) {
        if (wider.size() <= narrower.size() || !isSubsequence(narrower, wider)) {
            return false;
        }
        for (String line : base) {
            if (!narrower.contains(line) && wider.contains(line)) {
                return false;
            }
        }
        return true;
    }

    private static boolean isSubsequence(List<String> needle, List<String> haystack) {
        int i = 0;
        for (String line : haystack) {
            if (i < needle.size() && needle.get(i).equals(line)) {
                i++;
            }
        }
        return i == needle.size();
    }

    /**
     * Base-coordinate ranges that {@code side} replaced, inserted into or deleted.
     */
    public List<LineRange> changedRanges(String base, String side) {
        String[] baseLines = lines(base != null ? base : "");
        String[] sideLines = lines(side != null ? side : "");
        List<LineRange> ranges = new ArrayList<>();
        if (tooLarge(baseLines, sideLines)) {
            int common = Math.min(baseLines.length, sideLines.length);
            for (int i = 0; i < common; i++) {
                if (!baseLines[i].equals(sideLines[i])) {
                    ranges.add(new LineRange(i, i + 1));
                }
            }
            if (baseLines.length != sideLines.length) {
                ranges.add(new LineRange(common, baseLines.length));
            }
            return ranges;
        }
        int[] matched = match(baseLines, sideLines);
        int pb = 0;
        int ps = 0;
        for (int i = 0; i <= baseLines.length; i++) {
            boolean isAnchor = i == baseLines.length || matched[i] >= 0;
            if (!isAnchor) {
                continue;
            }
            int es = i == baseLines.length ? sideLines.length : matched[i];
            if (pb != i || ps != es) {
                ranges.add(new LineRange(pb, i));
            }
            pb = i + 1;
            ps = es + 1;
        }
        return ranges;
    }

    /**
     * Renders both sides whole between conflict markers.
     */
    public String markConflict(String ours, String theirs) {
        return OURS_MARKER + "\n" + (ours != null ? ours : "") + "\n" + SEPARATOR + "\n"
                + (theirs != null ? theirs : "") + "\n" + THEIRS_MARKER;
    }

    private MergeOutcome indexAligned(String[] base, String[] ours, String[] theirs) {
        List<String> result = new ArrayList<>();
        int conflicts = 0;
        int max = Math.max(base.length, Math.max(ours.length, theirs.length));
        for (int i = 0; i < max; i++) {
            String b = i < base.length ? base[i] : null;
            String o = i < ours.length ? ours[i] : null;
            String t = i < theirs.length ? theirs[i] : null;
            if (Objects.equals(o, t) || Objects.equals(t, b)) {
                if (o != null) {
                    result.add(o);
                }
            } else if (Objects.equals(o, b)) {
                if (t != null) {
                    result.add(t);
                }
            } else {
                conflicts++;
                result.add(OURS_MARKER);
                if (o != null) {
                    result.add(o);
                }
                result.add(SEPARATOR);
                if (t != null) {
                    result.add(t);
                }
                result.add(THEIRS_MARKER);
            }
        }
        return new MergeOutcome(conflicts == 0, String.join("\n", result), conflicts);
    }

    /**
     * For each base line, the index of the side line it is matched to by an LCS, or -1.
     */
    private static int[] match(String[] base, String[] side) {
        int n = base.length;
        int m = side.length;
        int[][] lcs = new int[n + 1][m + 1];
        for (int i = n - 1; i >= 0; i--) {
            for (int j = m - 1; j >= 0; j--) {
                lcs[i][j] = base[i].equals(side[j])
                        ? lcs[i + 1][j + 1] + 1
                        : Math.max(lcs[i + 1][j], lcs[i][j + 1]);
            }
        }
        int[] matched = new int[n];
        Arrays.fill(matched, -1);
        int i = 0;
        int j = 0;
        while (i < n && j < m) {
            if (base[i].equals(side[j])) {
                matched[i] = j;
                i++;
                j++;
            } else if (lcs[i + 1][j] >= lcs[i][j + 1]) {
                i++;
            } else {
                j++;
            }
        }
        return matched;
    }

    private static boolean tooLarge(String[] a, String[] b) {
        return (long) (a.length + 1) * (b.length + 1) > MAX_LCS_CELLS;
    }

    private static List<String> slice(String[] lines, int from, int to) {
        return from >= to ? List.of() : Arrays.asList(lines).subList(from, to);
    }

    static String[] lines(String text) {
        return text.isEmpty() ? new String[0] : text.split("\n", -1);
    }
}
