package com.airwave.resolution.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * An individual play event reported by a station.
 * Holds the raw artist/title strings as logged and, once resolved, the linked work.
 */
public class BroadcastLog {
    private final Long id;
    private final Long stationId;
    private final Instant playedAt;
    private final String rawArtist;
    private final String rawTitle;
    private final Long workId;
    private final String matchReason;

    private BroadcastLog(Builder builder) {
        this.id = builder.id;
        this.stationId = builder.stationId;
        this.playedAt = builder.playedAt != null ? builder.playedAt : Instant.now();
        this.rawArtist = builder.rawArtist;
        this.rawTitle = builder.rawTitle;
        this.workId = builder.workId;
        this.matchReason = builder.matchReason;
    }

    public Long getId() {
        return id;
    }

    public Long getStationId() {
        return stationId;
    }

    public Instant getPlayedAt() {
        return playedAt;
    }

    public String getRawArtist() {
        return rawArtist;
    }

    public String getRawTitle() {
        return rawTitle;
    }

    public Long getWorkId() {
        return workId;
    }

    public String getMatchReason() {
        return matchReason;
    }

    public boolean isLinked() {
        return workId != null;
    }

    /**
     * Returns a copy of this log linked to the given work.
     */
    public BroadcastLog linkedTo(Long workId, String matchReason) {
        return builder(this).workId(workId).matchReason(matchReason).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BroadcastLog that = (BroadcastLog) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "BroadcastLog{" +
                "id=" + id +
                ", rawArtist='" + rawArtist + '\'' +
                ", rawTitle='" + rawTitle + '\'' +
                ", workId=" + workId +
                ", matchReason='" + matchReason + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(BroadcastLog log) {
        return new Builder()
                .id(log.id)
                .stationId(log.stationId)
                .playedAt(log.playedAt)
                .rawArtist(log.rawArtist)
                .rawTitle(log.rawTitle)
                .workId(log.workId)
                .matchReason(log.matchReason);
    }

    public static class Builder {
        private Long id;
        private Long stationId;
        private Instant playedAt;
        private String rawArtist;
        private String rawTitle;
        private Long workId;
        private String matchReason;

        public Builder id(Long id) {
            this.id = id;
            return this;
        }

        public Builder stationId(Long stationId) {
            this.stationId = stationId;
            return this;
        }

        public Builder playedAt(Instant playedAt) {
            this.playedAt = playedAt;
            return this;
        }

        public Builder rawArtist(String rawArtist) {
            this.rawArtist = rawArtist;
            return this;
        }

        public Builder rawTitle(String rawTitle) {
            this.rawTitle = rawTitle;
            return this;
        }

        public Builder workId(Long workId) {
            this.workId = workId;
            return this;
        }

        public Builder matchReason(String matchReason) {
            this.matchReason = matchReason;
            return this;
        }

        public BroadcastLog build() {
            return new BroadcastLog(this);
        }
    }
}
