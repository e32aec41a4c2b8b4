package com.zzf.toolevents.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import lombok.EqualsAndHashCode;
import lombok.Value;

import java.nio.file.Path;

/**
 * One file's part of a patch: added, deleted or updated in place (optionally moved).
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = FileChange.Add.class, name = "add"),
        @JsonSubTypes.Type(value = FileChange.Delete.class, name = "delete"),
        @JsonSubTypes.Type(value = FileChange.Update.class, name = "update")
})
public abstract class FileChange {

    private FileChange() {
    }

    public static Add add(String content) {
        return new Add(content);
    }

    public static Delete delete(String content) {
        return new Delete(content);
    }

    public static Update update(String unifiedDiff, Path movePath) {
        return new Update(unifiedDiff, movePath);
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Add extends FileChange {
        String content;
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Delete extends FileChange {
        String content;
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Update extends FileChange {
        @JsonProperty("unified_diff")
        String unifiedDiff;
        @JsonProperty("move_path")
        @JsonSerialize(using = ToStringSerializer.class)
        Path movePath;
    }
}
