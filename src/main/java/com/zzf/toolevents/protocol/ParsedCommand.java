package com.zzf.toolevents.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.EqualsAndHashCode;
import lombok.Value;

/**
 * Display-oriented reading of one segment of a command line.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ParsedCommand.Read.class, name = "read"),
        @JsonSubTypes.Type(value = ParsedCommand.ListFiles.class, name = "list_files"),
        @JsonSubTypes.Type(value = ParsedCommand.Search.class, name = "search"),
        @JsonSubTypes.Type(value = ParsedCommand.Unknown.class, name = "unknown")
})
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class ParsedCommand {

    private ParsedCommand() {
    }

    public abstract String getCmd();

    public static Read read(String cmd, String name, String path) {
        return new Read(cmd, name, path);
    }

    public static ListFiles listFiles(String cmd, String path) {
        return new ListFiles(cmd, path);
    }

    public static Search search(String cmd, String query, String path) {
        return new Search(cmd, query, path);
    }

    public static Unknown unknown(String cmd) {
        return new Unknown(cmd);
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Read extends ParsedCommand {
        String cmd;
        String name;
        String path;
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class ListFiles extends ParsedCommand {
        String cmd;
        String path;
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Search extends ParsedCommand {
        String cmd;
        String query;
        String path;
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Unknown extends ParsedCommand {
        String cmd;
    }
}
