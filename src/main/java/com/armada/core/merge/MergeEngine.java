package com.armada.core.merge;

import com.armada.core.branch.VirtualBranch;
import com.armada.core.branch.VirtualBranchManager;
import com.armada.core.concurrent.CancellationToken;
import com.armada.core.error.ArmadaException;
import com.armada.core.error.ErrorKind;
import com.armada.core.events.ArmadaEvent;
import com.armada.core.events.EventPublisher;
import com.armada.core.metrics.ArmadaMetrics;
import com.armada.core.model.ChangeType;
import com.armada.core.model.FileChange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Detects region-level conflicts between active branches and resolves them through the
 * cascade AUTO, AI_ASSISTED, MANUAL.
 */
public class MergeEngine {

    private static final Logger log = LoggerFactory.getLogger(MergeEngine.class);

    private final VirtualBranchManager branches;
    private final RegionAnalyzer analyzer;
    private final ThreeWayMerger merger;
    private final MergeAssistant assistant;
    private final EventPublisher events;
    private final ArmadaMetrics metrics;
    private final Clock clock;

    private final Map<String, MergeConflict> activeConflicts = new LinkedHashMap<>();

    public MergeEngine(VirtualBranchManager branches, RegionAnalyzer analyzer, ThreeWayMerger merger,
                       MergeAssistant assistant, EventPublisher events, ArmadaMetrics metrics) {
        this(branches, analyzer, merger, assistant, events, metrics, Clock.systemUTC());
    }

    public MergeEngine(VirtualBranchManager branches, RegionAnalyzer analyzer, ThreeWayMerger merger,
                       MergeAssistant assistant, EventPublisher events, ArmadaMetrics metrics, Clock clock) {
        this.branches = branches;
        this.analyzer = analyzer;
        this.merger = merger;
        this.assistant = assistant != null ? assistant : MergeAssistant.NONE;
        this.events = events;
        this.metrics = metrics;
        this.clock = clock;
    }

    public List<MergeConflict> detectConflicts() {
        return detect(branches.getActiveBranches());
    }

    /**
     * Conflicts among the given branches only; ids that are unknown or no longer active
     * are ignored.
     */
    public List<MergeConflict> detectConflicts(Collection<String> branchIds) {
        Set<String> wanted = new HashSet<>(branchIds);
        List<VirtualBranch> candidates = branches.getActiveBranches().stream()
                .filter(b -> wanted.contains(b.id()))
                .toList();
        return detect(candidates);
    }

    private List<MergeConflict> detect(List<VirtualBranch> candidates) {
        List<VirtualBranch> sorted = new ArrayList<>(candidates);
        sorted.sort(Comparator.comparing(VirtualBranch::id));

        List<MergeConflict> found = new ArrayList<>();
        for (int i = 0; i < sorted.size(); i++) {
            for (int j = i + 1; j < sorted.size(); j++) {
                VirtualBranch first = sorted.get(i);
                VirtualBranch second = sorted.get(j);
                for (FileChange ours : first.changes()) {
                    second.changeFor(ours.path())
                            .flatMap(theirs -> compare(first, second, ours, theirs))
                            .ifPresent(found::add);
                }
            }
        }

        List<MergeConflict> fresh = new ArrayList<>();
        synchronized (this) {
            for (MergeConflict conflict : found) {
                if (activeConflicts.putIfAbsent(conflict.id(), conflict) == null) {
                    fresh.add(conflict);
                } else {
                    activeConflicts.put(conflict.id(), conflict);
                }
            }
        }
        for (MergeConflict conflict : fresh) {
            log.info("Conflict {} on {} between {} and {} ({} region(s))", conflict.id(), conflict.path(),
                    conflict.branch1Id(), conflict.branch2Id(), conflict.regions().size());
            events.publish(ArmadaEvent.of("conflict.detected", null, conflict.id(), Map.of(
                    "path", conflict.path(),
                    "branch1", conflict.branch1Id(),
                    "branch2", conflict.branch2Id(),
                    "regions", conflict.regions().stream().map(CodeRegion::key).toList())));
        }
        return found;
    }

    private Optional<MergeConflict> compare(VirtualBranch first, VirtualBranch second, FileChange ours, FileChange theirs) {
        String path = ours.path();
        String base = baseContent(ours, theirs);
        String oursContent = contentOf(ours);
        String theirsContent = contentOf(theirs);

        if (ours.type() == ChangeType.DELETE && theirs.type() == ChangeType.DELETE) {
            return Optional.empty();
        }
        if (oursContent.equals(theirsContent) && ours.type() == theirs.type()) {
            return Optional.empty();
        }

        List<CodeRegion> regions;
        if (ours.type() == ChangeType.DELETE || theirs.type() == ChangeType.DELETE) {
            int lineCount = Math.max(1, ThreeWayMerger.lines(base).length);
            regions = List.of(new CodeRegion(path, RegionType.OTHER, "file", 1, lineCount));
        } else {
            regions = overlappingRegions(path, base, oursContent, theirsContent);
        }
        if (regions.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new MergeConflict(conflictId(first.id(), second.id(), path), path, base,
                first.id(), second.id(), ours, theirs, regions, clock.instant()));
    }

    private List<CodeRegion> overlappingRegions(String path, String base, String ours, String theirs) {
        List<CodeRegion> oursRegions = analyzer.analyze(path, ours);
        Map<String, String> baseText = ownText(ThreeWayMerger.lines(base), analyzer.analyze(path, base));
        Map<String, String> oursText = ownText(ThreeWayMerger.lines(ours), oursRegions);
        Map<String, String> theirsText = ownText(ThreeWayMerger.lines(theirs), analyzer.analyze(path, theirs));

        List<CodeRegion> conflicting = new ArrayList<>();
        for (CodeRegion region : oursRegions) {
            String key = region.key();
            boolean changedByUs = !oursText.get(key).equals(baseText.get(key));
            boolean changedByThem = !Objects.equals(theirsText.get(key), baseText.get(key));
            if (changedByUs && changedByThem && !oursText.get(key).equals(theirsText.get(key))) {
                conflicting.add(region);
            }
        }
        if (!conflicting.isEmpty()) {
            return conflicting;
        }

        for (LineRange mine : merger.changedRanges(base, ours)) {
            for (LineRange other : merger.changedRanges(base, theirs)) {
                if (mine.overlaps(other)) {
                    int start = Math.min(mine.start(), other.start()) + 1;
                    int end = Math.max(start, Math.max(mine.end(), other.end()));
                    conflicting.add(new CodeRegion(path, RegionType.OTHER, "lines_" + start + "_" + end, start, end));
                }
            }
        }
        return conflicting;
    }

    /**
     * Own text of each region by key. Lines of nested regions are left out of their
     * container, so a class whose methods alone changed keeps its text.
     */
    private static Map<String, String> ownText(String[] lines, List<CodeRegion> regions) {
        Map<String, String> text = new LinkedHashMap<>();
        for (CodeRegion region : regions) {
            StringBuilder own = new StringBuilder();
            for (int line = region.startLine(); line <= region.endLine() && line <= lines.length; line++) {
                if (!coveredByNested(region, regions, line)) {
                    own.append(lines[line - 1]).append('\n');
                }
            }
            text.put(region.key(), own.toString());
        }
        return text;
    }

    private static boolean coveredByNested(CodeRegion container, List<CodeRegion> regions, int line) {
        for (CodeRegion other : regions) {
            if (other == container) {
                continue;
            }
            boolean nested = other.startLine() >= container.startLine() && other.endLine() <= container.endLine()
                    && (other.startLine() > container.startLine() || other.endLine() < container.endLine());
            if (nested && line >= other.startLine() && line <= other.endLine()) {
                return true;
            }
        }
        return false;
    }

    private String baseContent(FileChange ours, FileChange theirs) {
        if (ours.originalContent() != null) {
            return ours.originalContent();
        }
        if (theirs.originalContent() != null) {
            return theirs.originalContent();
        }
        if (ours.type() == ChangeType.CREATE && theirs.type() == ChangeType.CREATE) {
            return "";
        }
        String snapshot = branches.snapshotFile(ours.path());
        return snapshot != null ? snapshot : "";
    }

    private static String contentOf(FileChange change) {
        return change.modifiedContent() != null ? change.modifiedContent() : "";
    }

    static String conflictId(String branchA, String branchB, String path) {
        String low = branchA.compareTo(branchB) <= 0 ? branchA : branchB;
        String high = low.equals(branchA) ? branchB : branchA;
        byte[] key = (low + "|" + high + "|" + path).getBytes(StandardCharsets.UTF_8);
        return "conflict-" + UUID.nameUUIDFromBytes(key);
    }

    public MergeResolution resolveConflict(MergeConflict conflict) {
        return resolveConflict(conflict, CancellationToken.none());
    }

    /**
     * Runs the cascade: a clean line-level merge, then the assistant, then a MANUAL
     * resolution carrying both versions untouched.
     */
    public MergeResolution resolveConflict(MergeConflict conflict, CancellationToken token) {
        MergeOutcome automatic = automaticMerge(conflict);
        if (automatic.clean()) {
            return resolved(conflict, MergeStrategy.AUTO, automatic.content());
        }
        Optional<String> assisted = assist(conflict, automatic, token);
        if (assisted.isPresent()) {
            return resolved(conflict, MergeStrategy.AI_ASSISTED, assisted.get());
        }
        return manual(conflict);
    }

    /**
     * Tries one strategy only. A failed AUTO or AI_ASSISTED attempt yields a MANUAL
     * resolution.
     */
    public MergeResolution resolveConflict(MergeConflict conflict, MergeStrategy strategy) {
        return switch (strategy) {
            case AUTO -> {
                MergeOutcome automatic = automaticMerge(conflict);
                yield automatic.clean() ? resolved(conflict, MergeStrategy.AUTO, automatic.content()) : manual(conflict);
            }
            case AI_ASSISTED -> assist(conflict, automaticMerge(conflict), CancellationToken.none())
                    .map(content -> resolved(conflict, MergeStrategy.AI_ASSISTED, content))
                    .orElseGet(() -> manual(conflict));
            case MANUAL -> manual(conflict);
        };
    }

    private MergeOutcome automaticMerge(MergeConflict conflict) {
        if (conflict.ours().type() == ChangeType.DELETE || conflict.theirs().type() == ChangeType.DELETE) {
            return new MergeOutcome(false, merger.markConflict(contentOf(conflict.ours()), contentOf(conflict.theirs())), 1);
        }
        return merger.merge(conflict.baseContent(), contentOf(conflict.ours()), contentOf(conflict.theirs()));
    }

    private Optional<String> assist(MergeConflict conflict, MergeOutcome automatic, CancellationToken token) {
        try {
            return assistant.resolve(conflict, automatic, token);
        } catch (ArmadaException e) {
            if (e.is(ErrorKind.CANCELLED)) {
                throw e;
            }
            log.warn("Assisted merge of {} failed ({}), falling back to manual", conflict.path(), e.code());
            return Optional.empty();
        }
    }

    private MergeResolution resolved(MergeConflict conflict, MergeStrategy strategy, String content) {
        metrics.recordMergeConflict(strategy.code());
        log.info("Conflict {} on {} resolved with {}", conflict.id(), conflict.path(), strategy.code());
        return new MergeResolution(conflict.id(), conflict.path(), strategy, content,
                contentOf(conflict.ours()), contentOf(conflict.theirs()), null);
    }

    private MergeResolution manual(MergeConflict conflict) {
        metrics.recordMergeConflict(MergeStrategy.MANUAL.code());
        log.warn("Conflict {} on {} needs manual resolution", conflict.id(), conflict.path());
        String ours = contentOf(conflict.ours());
        String theirs = contentOf(conflict.theirs());
        return new MergeResolution(conflict.id(), conflict.path(), MergeStrategy.MANUAL, null,
                ours, theirs, merger.markConflict(ours, theirs));
    }

    /**
     * Records the resolved content into the first branch, drops the path from the second
     * and closes the conflict.
     *
     * @throws ArmadaException NOT_FOUND for an unknown or closed conflict, INVALID_STATE
     *                         for a resolution without content
     */
    public void applyResolution(MergeResolution resolution) {
        MergeConflict conflict;
        synchronized (this) {
            conflict = activeConflicts.get(resolution.conflictId());
            if (conflict == null) {
                throw ArmadaException.notFound("Conflict", resolution.conflictId());
            }
            if (!resolution.isResolved()) {
                throw new ArmadaException(ErrorKind.INVALID_STATE,
                        "Conflict " + conflict.id() + " on " + conflict.path() + " has no chosen content");
            }
            activeConflicts.remove(conflict.id());
        }

        String base = conflict.ours().type() == ChangeType.CREATE && conflict.theirs().type() == ChangeType.CREATE
                ? null : conflict.baseContent();
        FileChange merged = base == null
                ? FileChange.create(conflict.path(), resolution.resolvedContent())
                : FileChange.modify(conflict.path(), base, resolution.resolvedContent());
        branches.recordChange(conflict.branch1Id(), merged);
        branches.discardChange(conflict.branch2Id(), conflict.path());

        log.info("Applied {} resolution for {}", resolution.strategy().code(), conflict.path());
        events.publish(ArmadaEvent.of("conflict.resolved", null, conflict.id(), Map.of(
                "path", conflict.path(),
                "strategy", resolution.strategy().code())));
    }

    public synchronized List<MergeConflict> getActiveConflicts() {
        return List.copyOf(activeConflicts.values());
    }

    /**
     * Forgets every open conflict, or only those involving one of the given branches.
     */
    public synchronized int clearConflicts() {
        int cleared = activeConflicts.size();
        activeConflicts.clear();
        return cleared;
    }

    public synchronized int clearConflicts(Collection<String> branchIds) {
        int before = activeConflicts.size();
        activeConflicts.values().removeIf(c -> branchIds.stream().anyMatch(c::involves));
        return before - activeConflicts.size();
    }
}
