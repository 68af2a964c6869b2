package io.indexkit.collections.tools;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.BiPredicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Feeds a text file of newline-delimited integers into an index. Each key is inserted with itself as the value. Blank
 * lines are ignored and lines that do not parse, undecodable bytes included, are logged and skipped.
 */
public final class IntegerFileLoader {
    private static final Logger logger = LoggerFactory.getLogger(IntegerFileLoader.class);

    static final int ProgressInterval = 100;

    private IntegerFileLoader() {
    }

    /**
     * @param insert called as {@code insert(key, key)} for every key; returns false for a key the index refused
     * @throws java.nio.file.NoSuchFileException if {@code file} does not exist
     */
    public static LoadResult load(Path file, BiPredicate<Long, Long> insert) throws IOException {
        int inserted = 0;
        int refused = 0;
        int skipped = 0;
        int lineNumber = 0;
        // bytes that are not UTF-8 come through as U+FFFD and fail to parse like any other bad line
        final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(Files.newInputStream(file), decoder))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                final String trimmed = line.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                final long key;
                try {
                    key = Long.parseLong(trimmed);
                } catch (NumberFormatException e) {
                    logger.warn("{}:{}: skipping invalid entry '{}'", file, lineNumber, trimmed);
                    skipped++;
                    continue;
                }
                if (insert.test(key, key)) {
                    inserted++;
                } else {
                    refused++;
                }
                final int processed = inserted + refused;
                if (processed % ProgressInterval == 0) {
                    logger.info("Processed {} keys so far...", processed);
                }
            }
        }
        final LoadResult result = new LoadResult(inserted, refused, skipped);
        logger.info("Loaded {}: {}", file, result);
        return result;
    }
}
