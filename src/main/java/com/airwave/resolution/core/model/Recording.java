package com.airwave.resolution.core.model;

import java.util.Objects;

/**
 * A concrete recorded instance of a {@link Work}.
 * A recording without an audio file is a placeholder, created so that
 * broadcast logs can be linked before the audio exists in the library.
 */
public class Recording {
    private final Long id;
    private final Long workId;
    private final String title;
    private final String versionType;
    private final boolean verified;
    private final boolean hasAudioFile;

    private Recording(Builder builder) {
        this.id = builder.id;
        this.workId = builder.workId;
        this.title = builder.title;
        this.versionType = builder.versionType != null ? builder.versionType : "Original";
        this.verified = builder.verified;
        this.hasAudioFile = builder.hasAudioFile;
    }

    public Long getId() {
        return id;
    }

    public Long getWorkId() {
        return workId;
    }

    public String getTitle() {
        return title;
    }

    public String getVersionType() {
        return versionType;
    }

    public boolean isVerified() {
        return verified;
    }

    public boolean hasAudioFile() {
        return hasAudioFile;
    }

    public boolean isPlaceholder() {
        return !hasAudioFile;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Recording recording = (Recording) o;
        return Objects.equals(id, recording.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Recording{" +
                "id=" + id +
                ", workId=" + workId +
                ", title='" + title + '\'' +
                ", versionType='" + versionType + '\'' +
                ", hasAudioFile=" + hasAudioFile +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Recording recording) {
        return new Builder()
                .id(recording.id)
                .workId(recording.workId)
                .title(recording.title)
                .versionType(recording.versionType)
                .verified(recording.verified)
                .hasAudioFile(recording.hasAudioFile);
    }

    public static class Builder {
        private Long id;
        private Long workId;
        private String title;
        private String versionType;
        private boolean verified;
        private boolean hasAudioFile = true;

        public Builder id(Long id) {
            this.id = id;
            return this;
        }

        public Builder workId(Long workId) {
            this.workId = workId;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder versionType(String versionType) {
            this.versionType = versionType;
            return this;
        }

        public Builder verified(boolean verified) {
            this.verified = verified;
            return this;
        }

        public Builder hasAudioFile(boolean hasAudioFile) {
            this.hasAudioFile = hasAudioFile;
            return this;
        }

        public Recording build() {
            Objects.requireNonNull(workId, "workId is required");
            Objects.requireNonNull(title, "title is required");
            return new Recording(this);
        }
    }
}
