package com.zzf.koda.core.change;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A proposed file mutation held in memory. {@code originalContent} is null iff the file did not
 * exist when it was first staged; a delete always carries an empty {@code newContent}.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public final class StagedChange {

    private final String path;
    private final ChangeType changeType;
    private final String originalContent;
    private final String newContent;

    @JsonCreator
    public StagedChange(@JsonProperty("path") String path,
                        @JsonProperty("change_type") ChangeType changeType,
                        @JsonProperty("original_content") String originalContent,
                        @JsonProperty("new_content") String newContent) {
        this.path = Objects.requireNonNull(path, "path");
        this.changeType = Objects.requireNonNull(changeType, "changeType");
        this.originalContent = originalContent;
        this.newContent = changeType == ChangeType.DELETE ? "" : Objects.requireNonNull(newContent, "newContent");
        if (changeType == ChangeType.CREATE && originalContent != null) {
            throw new IllegalArgumentException("create must not carry original content: " + path);
        }
        if (changeType != ChangeType.CREATE && originalContent == null) {
            throw new IllegalArgumentException(changeType.wireName() + " requires original content: " + path);
        }
    }

    @JsonProperty("path")
    public String getPath() {
        return path;
    }

    @JsonProperty("change_type")
    public ChangeType getChangeType() {
        return changeType;
    }

    @JsonProperty("original_content")
    public String getOriginalContent() {
        return originalContent;
    }

    @JsonProperty("new_content")
    public String getNewContent() {
        return newContent;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StagedChange)) {
            return false;
        }
        StagedChange that = (StagedChange) o;
        return path.equals(that.path)
                && changeType == that.changeType
                && Objects.equals(originalContent, that.originalContent)
                && newContent.equals(that.newContent);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, changeType, originalContent, newContent);
    }

    @Override
    public String toString() {
        return changeType.wireName() + " " + path;
    }
}
