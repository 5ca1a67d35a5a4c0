package io.nosqlbench.graphgen.io;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.nosqlbench.graphgen.api.EdgeSink;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * EdgeSink implementation for plain-text edge lists.
 * The first line is a {@code //} comment describing the graph, followed by one
 * {@code "{src} {dst}"} line per edge.
 */
public class EdgeListWriter implements EdgeSink {

    /** Comment marker that starts the header line. */
    public static final String COMMENT_PREFIX = "//";

    // Heavy-tier runs write hundreds of millions of short lines.
    private static final int BUFFER_SIZE = 1 << 20;

    private BufferedWriter writer;
    private Path path;
    private long edgesWritten;
    private boolean closed;

    /**
     * Default constructor; call {@link #open(Path, String)} before writing.
     */
    public EdgeListWriter() {
    }

    /**
     * Creates and opens a writer in one step.
     *
     * @param path   the output file
     * @param header the header description
     * @return an open writer
     */
    public static EdgeListWriter openFor(Path path, String header) {
        EdgeListWriter writer = new EdgeListWriter();
        writer.open(path, header);
        return writer;
    }

    @Override
    public void open(Path path, String header) {
        if (writer != null) {
            throw new IllegalStateException("Writer is already open for " + this.path);
        }
        String headerLine = formatHeader(header);
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            this.writer = new BufferedWriter(
                new OutputStreamWriter(
                    Files.newOutputStream(path, StandardOpenOption.CREATE,
                        StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE),
                    StandardCharsets.UTF_8),
                BUFFER_SIZE);
            this.path = path;
            writer.write(headerLine);
            writer.write('\n');
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to open edge list for writing: " + path, e);
        }
    }

    @Override
    public void writeEdge(int src, int dst) {
        if (writer == null || closed) {
            throw new IllegalStateException("Writer is not open");
        }
        if (src < 0 || dst < 0) {
            throw new IllegalArgumentException("Node ids must be non-negative: (" + src + ", " + dst + ")");
        }
        if (src == dst) {
            throw new IllegalArgumentException("Self-loops are not allowed: (" + src + ", " + dst + ")");
        }
        try {
            writer.write(Integer.toString(src));
            writer.write(' ');
            writer.write(Integer.toString(dst));
            writer.write('\n');
            edgesWritten++;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write edge to " + path, e);
        }
    }

    @Override
    public long edgesWritten() {
        return edgesWritten;
    }

    @Override
    public Path path() {
        return path;
    }

    @Override
    public void flush() {
        if (writer != null && !closed) {
            try {
                writer.flush();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to flush " + path, e);
            }
        }
    }

    @Override
    public void close() {
        if (writer != null && !closed) {
            closed = true;
            try {
                writer.close();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to close " + path, e);
            }
        }
    }

    /**
     * Normalize a description into a single {@code //} comment line.
     *
     * @param header the description, with or without the comment prefix
     * @return the header line without a trailing newline
     */
    static String formatHeader(String header) {
        if (header == null || header.isBlank()) {
            throw new IllegalArgumentException("Header must not be empty");
        }
        if (header.indexOf('\n') >= 0 || header.indexOf('\r') >= 0) {
            throw new IllegalArgumentException("Header must be a single line: " + header);
        }
        return header.startsWith(COMMENT_PREFIX) ? header : COMMENT_PREFIX + " " + header;
    }
}
