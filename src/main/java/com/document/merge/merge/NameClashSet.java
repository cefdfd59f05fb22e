package com.document.merge.merge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Run-scoped record of every name clash seen by extend calls.
 *
 * <p>Strict clashes decide whether the run must abort; graceful clashes only
 * feed the warning summary. One instance belongs to one orchestration run and
 * is reset at its start.</p>
 */
public class NameClashSet {
    private static final Logger log = LoggerFactory.getLogger(NameClashSet.class);

    private final List<NameClash> strictClashes = new CopyOnWriteArrayList<>();
    private final List<NameClash> gracefulClashes = new CopyOnWriteArrayList<>();

    public void record(NameClash clash) {
        if (clash.mode() == MergeMode.STRICT) {
            strictClashes.add(clash);
        } else {
            gracefulClashes.add(clash);
        }
    }

    public boolean anyStrictClash() {
        if (!strictClashes.isEmpty()) {
            log.warn("Elements clashed: {}", strictClashes.stream().map(NameClash::describe).toList());
        }
        return !strictClashes.isEmpty();
    }

    public boolean anyGracefulClash() {
        return !gracefulClashes.isEmpty();
    }

    public List<NameClash> getStrictClashes() {
        return Collections.unmodifiableList(new ArrayList<>(strictClashes));
    }

    public List<NameClash> getGracefulClashes() {
        return Collections.unmodifiableList(new ArrayList<>(gracefulClashes));
    }

    public int size() {
        return strictClashes.size() + gracefulClashes.size();
    }

    public void reset() {
        strictClashes.clear();
        gracefulClashes.clear();
    }
}
