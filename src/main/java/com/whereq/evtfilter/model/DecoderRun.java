package com.whereq.evtfilter.model;

import lombok.Value;

import java.nio.file.Path;

/**
 * Captured outcome of one Log Parser process.
 */
@Value
public class DecoderRun {
    int exitCode;

    String stdout;

    String stderr;

    /**
     * Destination XML the decoder was asked to write
     */
    Path outputFile;

    public boolean succeeded() {
        return exitCode == 0;
    }
}
