package com.zzf.toolevents.parse;

import com.zzf.toolevents.protocol.ParsedCommand;

import java.util.List;

/**
 * Turns a raw argv into display tokens. Implementations must be pure and total:
 * any input, including an empty one, yields a non-empty list.
 */
public interface CommandParser {

    List<ParsedCommand> parse(List<String> command);
}
