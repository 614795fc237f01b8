package com.configkit.ini.history;

import java.util.ArrayDeque;
import java.util.Deque;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.configkit.ini.model.Document;

import lombok.Getter;

/**
 * Bounded undo stack of deep document snapshots. Undo restores the tracked document in place,
 * so references held by callers stay valid. The oldest snapshot is discarded once the limit is reached.
 */
public class DocumentHistory {
    private static final Logger log = LoggerFactory.getLogger(DocumentHistory.class);

    public static final int DEFAULT_MAX_SNAPSHOTS = 10;

    @Getter
    private final Document current;
    private final int maxSnapshots;
    private final Deque<Document> snapshots = new ArrayDeque<>();

    public DocumentHistory(Document document) {
        this(document, DEFAULT_MAX_SNAPSHOTS);
    }

    public DocumentHistory(Document document, int maxSnapshots) {
        if (document == null) {
            throw new IllegalArgumentException("Document cannot be null");
        }
        if (maxSnapshots < 1) {
            throw new IllegalArgumentException("Max snapshots must be at least 1");
        }
        this.current = document;
        this.maxSnapshots = maxSnapshots;
    }

    public void takeSnapshot() {
        snapshots.addFirst(current.copy());
        while (snapshots.size() > maxSnapshots) {
            snapshots.removeLast();
        }
        log.debug("Snapshot taken ({} stored)", snapshots.size());
    }

    /**
     * Restores the most recent snapshot.
     *
     * @return false when there is nothing to undo
     */
    public boolean undo() {
        Document snapshot = snapshots.pollFirst();
        if (snapshot == null) {
            return false;
        }
        current.restoreFrom(snapshot);
        return true;
    }

    public boolean canUndo() {
        return !snapshots.isEmpty();
    }

    public int getSnapshotCount() {
        return snapshots.size();
    }

    public void clear() {
        snapshots.clear();
    }
}
