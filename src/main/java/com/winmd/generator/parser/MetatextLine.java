package com.winmd.generator.parser;

import com.winmd.generator.parser.exception.GrammarException;
import lombok.NonNull;
import lombok.Value;

import java.util.List;

/**
 * One parsed metatext line: the command and its tab separated fields.
 */
@Value
public class MetatextLine {
    @NonNull
    MetatextCommand command;
    @NonNull
    List<String> fields;
    @NonNull
    SourceLocation location;

    public MetatextLine(MetatextCommand command, List<String> fields, SourceLocation location) {
        this.command = command;
        this.fields = List.copyOf(fields);
        this.location = location;
    }

    public String field(int index) {
        return fields.get(index);
    }

    public boolean hasField(int index) {
        return index < fields.size();
    }

    /**
     * Rejects the line if its field count does not match the command's usage.
     */
    public MetatextLine requireFieldCount() {
        if (!command.acceptsFieldCount(fields.size())) {
            throw new GrammarException(location, command.getUsage());
        }
        return this;
    }
}
