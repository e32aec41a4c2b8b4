package com.zzf.toolevents.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.nio.file.Path;
import java.util.List;

@Value
@Builder
@Jacksonized
@EqualsAndHashCode(callSuper = false)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExecCommandBeginEvent extends EventMsg {
    String callId;
    String turnId;
    List<String> command;
    @JsonSerialize(using = ToStringSerializer.class)
    Path cwd;
    List<ParsedCommand> parsedCmd;
    ExecCommandSource source;
    String interactionInput;

    @Override
    public EventType getEventType() {
        return EventType.EXEC_COMMAND_BEGIN;
    }
}
