package com.keystone.core.episodic;

import com.keystone.core.model.EpisodeRecord;
import com.keystone.core.persistence.Journal;

import java.time.Instant;
import java.util.List;

/**
 * Append-only history of how tasks ended. The promotion pipeline mines it for
 * recurring adverse patterns.
 */
public class EpisodicHistory {

    private final Journal<EpisodeRecord> journal;

    public EpisodicHistory(Journal<EpisodeRecord> journal) {
        this.journal = journal;
    }

    public EpisodeRecord record(EpisodeRecord episode) {
        return journal.append(episode.taskId(), episode);
    }

    public List<EpisodeRecord> all() {
        return journal.readAll();
    }

    public List<EpisodeRecord> forTask(String taskId) {
        return journal.read(taskId);
    }

    public List<EpisodeRecord> since(Instant from) {
        return journal.readAll().stream()
                .filter(e -> !e.recordedAt().isBefore(from))
                .toList();
    }
}
