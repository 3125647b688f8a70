package com.airwave.resolution.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Canonical musical composition. The unit of identity that broadcast logs link to.
 * A Work is credited to a primary artist and zero or more co-artists.
 */
public class Work {
    private final Long id;
    private final String title;
    private final String primaryArtist;
    private final List<String> coArtists;
    private final Instant createdAt;

    private Work(Builder builder) {
        this.id = builder.id;
        this.title = builder.title;
        this.primaryArtist = builder.primaryArtist;
        this.coArtists = List.copyOf(builder.coArtists);
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
    }

    public Long getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getPrimaryArtist() {
        return primaryArtist;
    }

    public List<String> getCoArtists() {
        return coArtists;
    }

    /**
     * Every artist name associated with this work, primary artist first.
     */
    public List<String> allArtists() {
        if (coArtists.isEmpty()) {
            return List.of(primaryArtist);
        }
        List<String> all = new ArrayList<>(coArtists.size() + 1);
        all.add(primaryArtist);
        all.addAll(coArtists);
        return Collections.unmodifiableList(all);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Work work = (Work) o;
        return Objects.equals(id, work.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Work{" +
                "id=" + id +
                ", title='" + title + '\'' +
                ", primaryArtist='" + primaryArtist + '\'' +
                ", coArtists=" + coArtists +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Work work) {
        return new Builder()
                .id(work.id)
                .title(work.title)
                .primaryArtist(work.primaryArtist)
                .coArtists(work.coArtists)
                .createdAt(work.createdAt);
    }

    public static class Builder {
        private Long id;
        private String title;
        private String primaryArtist;
        private List<String> coArtists = List.of();
        private Instant createdAt;

        public Builder id(Long id) {
            this.id = id;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder primaryArtist(String primaryArtist) {
            this.primaryArtist = primaryArtist;
            return this;
        }

        public Builder coArtists(List<String> coArtists) {
            this.coArtists = coArtists != null ? coArtists : List.of();
            return this;
        }

        public Builder coArtists(String... coArtists) {
            this.coArtists = List.of(coArtists);
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Work build() {
            Objects.requireNonNull(title, "title is required");
            Objects.requireNonNull(primaryArtist, "primaryArtist is required");
            return new Work(this);
        }
    }
}
