package com.fotogeo.core.model;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, normalized view of one photo's metadata. One instance per source file per run.
 * <p>
 * {@code customName} and {@code description} keep the tag text as read, so an empty string and an
 * absent tag stay distinguishable; renderers treat both as "no value".
 */
public final class ImageRecord {
    private final String filename;
    private final Path source;
    private final String customName;
    private final String description;
    private final Double latitude;
    private final Double longitude;
    private final LocalDateTime captureTimestamp;
    private final Orientation orientation;
    private final ProjectedCoordinate projected;

    private ImageRecord(Builder builder) {
        this.filename = requireNonBlank(builder.filename, "filename");
        this.source = builder.source;
        this.customName = builder.customName;
        this.description = builder.description;
        if ((builder.latitude == null) != (builder.longitude == null)) {
            throw new IllegalArgumentException("latitude and longitude must be both present or both absent: " + filename);
        }
        if (builder.projected != null && builder.latitude == null) {
            throw new IllegalArgumentException("projected coordinate requires latitude/longitude: " + filename);
        }
        this.latitude = builder.latitude;
        this.longitude = builder.longitude;
        this.captureTimestamp = builder.captureTimestamp;
        this.orientation = builder.orientation == null ? Orientation.IDENTITY : builder.orientation;
        this.projected = builder.projected;
    }

    public static Builder builder(String filename) {
        return new Builder(filename);
    }

    public String filename() {
        return filename;
    }

    /**
     * Location of the photo on disk; empty for records built without a backing file.
     */
    public Optional<Path> source() {
        return Optional.ofNullable(source);
    }

    public Optional<String> customName() {
        return Optional.ofNullable(customName);
    }

    public Optional<String> description() {
        return Optional.ofNullable(description);
    }

    public Optional<Double> latitude() {
        return Optional.ofNullable(latitude);
    }

    public Optional<Double> longitude() {
        return Optional.ofNullable(longitude);
    }

    public boolean hasCoordinates() {
        return latitude != null;
    }

    public Optional<LocalDateTime> captureTimestamp() {
        return Optional.ofNullable(captureTimestamp);
    }

    public Orientation orientation() {
        return orientation;
    }

    public Optional<ProjectedCoordinate> projected() {
        return Optional.ofNullable(projected);
    }

    /**
     * A record can be placed on a map only when its projection succeeded.
     */
    public boolean isPlaceable() {
        return projected != null;
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " cannot be blank");
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ImageRecord that)) return false;
        return filename.equals(that.filename)
            && Objects.equals(source, that.source)
            && Objects.equals(customName, that.customName)
            && Objects.equals(description, that.description)
            && Objects.equals(latitude, that.latitude)
            && Objects.equals(longitude, that.longitude)
            && Objects.equals(captureTimestamp, that.captureTimestamp)
            && orientation == that.orientation
            && Objects.equals(projected, that.projected);
    }

    @Override
    public int hashCode() {
        return Objects.hash(filename, source, customName, description, latitude, longitude,
            captureTimestamp, orientation, projected);
    }

    @Override
    public String toString() {
        return "ImageRecord{" +
            "filename='" + filename + '\'' +
            ", customName='" + customName + '\'' +
            ", description='" + description + '\'' +
            ", latitude=" + latitude +
            ", longitude=" + longitude +
            ", captureTimestamp=" + captureTimestamp +
            ", orientation=" + orientation +
            ", projected=" + projected +
            '}';
    }

    public static final class Builder {
        private final String filename;
        private Path source;
        private String customName;
        private String description;
        private Double latitude;
        private Double longitude;
        private LocalDateTime captureTimestamp;
        private Orientation orientation;
        private ProjectedCoordinate projected;

        private Builder(String filename) {
            this.filename = filename;
        }

        public Builder source(Path source) {
            this.source = source;
            return this;
        }

        public Builder customName(String customName) {
            this.customName = customName;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder coordinates(double latitude, double longitude) {
            this.latitude = latitude;
            this.longitude = longitude;
            return this;
        }

        public Builder captureTimestamp(LocalDateTime captureTimestamp) {
            this.captureTimestamp = captureTimestamp;
            return this;
        }

        public Builder orientation(Orientation orientation) {
            this.orientation = orientation;
            return this;
        }

        public Builder projected(ProjectedCoordinate projected) {
            this.projected = projected;
            return this;
        }

        public ImageRecord build() {
            return new ImageRecord(this);
        }
    }
}
