package com.winmd.generator.parser;

import lombok.NonNull;
import lombok.Value;

/**
 * File and one-based line number of a metatext line.
 */
@Value
public class SourceLocation {
    @NonNull
    String fileName;
    int lineNumber;

    @Override
    public String toString() {
        return lineNumber > 0 ? fileName + ":" + lineNumber : fileName;
    }
}
