package io.diskjockey.sampler.checkpoint;

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

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import io.diskjockey.core.json.DiskJockeyGsonConfig;
import io.diskjockey.sampler.WalkerState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/// Appends the chain history to an NDJSON file, one [ChainRecord] per line.
///
/// ```json
/// {"loop":0,"iteration":1,"walker":0,"position":[1.02,205.3],"lnprob":-1234.5}
/// ```
///
/// Records are buffered and reach the disk on [#flush()], which the run
/// calls at the end of each loop before saving the checkpoint. On resume,
/// [#truncate(Path, long)] drops whatever a crashed loop wrote past the
/// checkpoint.
public final class ChainWriter implements Closeable {

    private static final Logger logger = LogManager.getLogger(ChainWriter.class);

    /// Chain file name inside a run directory.
    public static final String CHAIN_FILE = "chain.ndjson";

    private final BufferedWriter writer;
    private final Object writeLock = new Object();
    private final Gson gson = DiskJockeyGsonConfig.compactGson();

    /// Opens a chain file for appending, creating it if needed.
    public ChainWriter(Path path) throws IOException {
        this.writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
            StandardOpenOption.CREATE,
            StandardOpenOption.APPEND,
            StandardOpenOption.WRITE);
    }

    public void append(ChainRecord record) throws IOException {
        synchronized (writeLock) {
            writer.write(gson.toJson(record));
            writer.newLine();
        }
    }

    /// Appends every walker of one iteration.
    public void appendAll(int loop, long iteration, List<WalkerState> walkers) throws IOException {
        for (int k = 0; k < walkers.size(); k++) {
            WalkerState w = walkers.get(k);
            append(new ChainRecord(loop, iteration, k, w.position(), w.lnProbability()));
        }
    }

    public void flush() throws IOException {
        synchronized (writeLock) {
            writer.flush();
        }
    }

    @Override
    public void close() throws IOException {
        synchronized (writeLock) {
            writer.close();
        }
    }

    /// Reads a chain file. A torn last line is skipped.
    public static List<ChainRecord> read(Path path) throws IOException {
        List<ChainRecord> records = new ArrayList<>();
        if (!Files.exists(path)) {
            return records;
        }
        Gson gson = DiskJockeyGsonConfig.compactGson();
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                ChainRecord record = parse(gson, line);
                if (record == null) {
                    logger.warn("Skipping unreadable chain record at {}:{}", path, lineNumber);
                    continue;
                }
                records.add(record);
            }
        }
        return records;
    }

    /// Rewrites the chain keeping only records up to the given iteration.
    ///
    /// @return the number of lines removed
    public static long truncate(Path path, long iterationsCompleted) throws IOException {
        if (!Files.exists(path)) {
            return 0;
        }
        Gson gson = DiskJockeyGsonConfig.compactGson();
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        long removed = 0;
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             BufferedWriter out = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                ChainRecord record = parse(gson, line);
                if (record != null && record.iteration() <= iterationsCompleted) {
                    out.write(line);
                    out.newLine();
                } else {
                    removed++;
                }
            }
        }
        Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        if (removed > 0) {
            logger.info("Dropped {} chain records written after iteration {}", removed, iterationsCompleted);
        }
        return removed;
    }

    private static ChainRecord parse(Gson gson, String line) {
        if (line.isBlank()) {
            return null;
        }
        try {
            return gson.fromJson(line, ChainRecord.class);
        } catch (JsonParseException e) {
            return null;
        }
    }
}
