package io.dropwatch.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Point-in-time read of one build: the build row, its ordered waves and every drop.
 *
 * <p>Wave gating: the active wave is the first wave that still holds a blocking drop that is not
 * complete. Drops of later waves never start before it clears.
 */
public record BuildSnapshot(BuildView build, Map<String, List<String>> waves, List<DropView> drops) {
    public BuildSnapshot {
        LinkedHashMap<String, List<String>> copy = new LinkedHashMap<>();
        if (waves != null) {
            waves.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        }
        waves = Collections.unmodifiableMap(copy);
        drops = drops == null ? List.of() : List.copyOf(drops);
    }

    public String slug() {
        return build.slug();
    }

    public Optional<DropView> drop(String dropId) {
        return drops.stream().filter(d -> d.dropId().equals(dropId)).findFirst();
    }

    public List<DropView> dropsWithStatus(DropStatus status) {
        return drops.stream().filter(d -> d.status() == status).toList();
    }

    public Optional<String> activeWave() {
        Map<String, DropView> byId = byId();
        for (Map.Entry<String, List<String>> wave : waves.entrySet()) {
            for (String dropId : wave.getValue()) {
                DropView d = byId.get(dropId);
                if (d != null && d.blocking() && d.status() != DropStatus.COMPLETE) {
                    return Optional.of(wave.getKey());
                }
            }
        }
        return Optional.empty();
    }

    public List<DropView> waveDrops(String wave) {
        Map<String, DropView> byId = byId();
        List<DropView> out = new ArrayList<>();
        for (String dropId : waves.getOrDefault(wave, List.of())) {
            DropView d = byId.get(dropId);
            if (d != null) {
                out.add(d);
            }
        }
        return out;
    }

    /**
     * Pending drops whose wave is open, whose dependencies are complete and whose stream
     * predecessor is complete.
     */
    public List<DropView> readyDrops() {
        Optional<String> active = activeWave();
        if (active.isEmpty()) {
            return List.of();
        }
        Set<String> complete = drops.stream()
                .filter(d -> d.status() == DropStatus.COMPLETE)
                .map(DropView::dropId)
                .collect(Collectors.toSet());
        List<String> openWaves = new ArrayList<>();
        for (String wave : waves.keySet()) {
            openWaves.add(wave);
            if (wave.equals(active.get())) {
                break;
            }
        }
        List<DropView> ready = new ArrayList<>();
        for (String wave : openWaves) {
            for (DropView d : waveDrops(wave)) {
                if (d.status() != DropStatus.PENDING) {
                    continue;
                }
                if (!complete.containsAll(d.dependsOn())) {
                    continue;
                }
                Optional<DropView> predecessor = streamPredecessor(d);
                if (predecessor.isPresent() && predecessor.get().status() != DropStatus.COMPLETE) {
                    continue;
                }
                ready.add(d);
            }
        }
        return ready;
    }

    public boolean allBlockingComplete() {
        return drops.stream()
                .filter(DropView::blocking)
                .allMatch(d -> d.status() == DropStatus.COMPLETE);
    }

    public Optional<DropView> streamPredecessor(DropView drop) {
        if (drop.stream() <= 0) {
            return Optional.empty();
        }
        return drops.stream()
                .filter(d -> d.stream() == drop.stream() && d.order() < drop.order())
                .max(Comparator.comparingInt(DropView::order));
    }

    private Map<String, DropView> byId() {
        Map<String, DropView> out = new LinkedHashMap<>();
        for (DropView d : drops) {
            out.put(d.dropId(), d);
        }
        return out;
    }
}
