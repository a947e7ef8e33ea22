package com.stagetracker.core;

import com.google.common.collect.ImmutableSet;
import com.stagetracker.model.Stage;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory index of which items are in which stage.
 * <p>
 * Each stage has its own set guarded by its own read/write lock, so
 * operations on different stages never contend. Membership is only
 * changed by {@link MoveProcessor} (through {@link #add} and
 * {@link #remove}) and once at startup through {@link #seed}.
 */
@Slf4j
public class StageIndex {
    private final Map<Stage, StageSet> stages = new EnumMap<>(Stage.class);

    public StageIndex() {
        for (Stage stage : Stage.values()) {
            stages.put(stage, new StageSet());
        }
    }

    /**
     * Populate a stage with items found on disk. IDs already present in
     * another stage are skipped so an item is never in two stages.
     *
     * @return number of IDs actually added
     */
    public int seed(Stage stage, Collection<Long> ids) {
        int added = 0;
        for (Long id : ids) {
            Stage owner = findStage(id);
            if (owner != null && owner != stage) {
                log.warn("Item {} already seeded into {}, ignoring copy in {}", id, owner, stage);
                continue;
            }
            if (add(stage, id)) {
                added++;
            }
        }
        log.info("Seeded {} items into stage {}", added, stage);
        return added;
    }

    public boolean contains(Stage stage, long id) {
        StageSet set = stages.get(stage);
        set.lock.readLock().lock();
        try {
            return set.ids.contains(id);
        } finally {
            set.lock.readLock().unlock();
        }
    }

    /**
     * Return some current member of the stage, or empty if the stage has none.
     * No fairness: whichever ID the set iterates first.
     */
    public OptionalLong pickAny(Stage stage) {
        StageSet set = stages.get(stage);
        set.lock.readLock().lock();
        try {
            Iterator<Long> it = set.ids.iterator();
            if (!it.hasNext()) {
                return OptionalLong.empty();
            }
            long id = it.next();
            log.debug("Picked item {} from stage {}", id, stage);
            return OptionalLong.of(id);
        } finally {
            set.lock.readLock().unlock();
        }
    }

    /**
     * Copy of the stage's current members
     */
    public ImmutableSet<Long> snapshot(Stage stage) {
        StageSet set = stages.get(stage);
        set.lock.readLock().lock();
        try {
            return ImmutableSet.copyOf(set.ids);
        } finally {
            set.lock.readLock().unlock();
        }
    }

    public int size(Stage stage) {
        StageSet set = stages.get(stage);
        set.lock.readLock().lock();
        try {
            return set.ids.size();
        } finally {
            set.lock.readLock().unlock();
        }
    }

    /**
     * @return true if the ID was not already a member
     */
    boolean add(Stage stage, long id) {
        StageSet set = stages.get(stage);
        set.lock.writeLock().lock();
        try {
            return set.ids.add(id);
        } finally {
            set.lock.writeLock().unlock();
        }
    }

    /**
     * @return true if the ID was a member and has been removed
     */
    boolean remove(Stage stage, long id) {
        StageSet set = stages.get(stage);
        set.lock.writeLock().lock();
        try {
            return set.ids.remove(id);
        } finally {
            set.lock.writeLock().unlock();
        }
    }

    private Stage findStage(long id) {
        for (Stage stage : Stage.values()) {
            if (contains(stage, id)) {
                return stage;
            }
        }
        return null;
    }

    /**
     * Members of one stage and the lock guarding them
     */
    private static class StageSet {
        private final Set<Long> ids = new HashSet<>();
        private final ReadWriteLock lock = new ReentrantReadWriteLock();
    }
}
