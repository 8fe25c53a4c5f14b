package com.leadtracker.leadtracker.pipeline;

import java.util.List;

/**
 * Abstraction over where delinquency exports are picked up from.
 */
public interface SourceFileProvider {

    /**
     * Names of the available source files, sorted so older exports come first.
     */
    List<String> listSourceNames();

    /**
     * Reads one source file by the name returned from {@link #listSourceNames()}.
     */
    SourceFile fetch(String fileName);
}
