package com.ivamare.bulkload.pool;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.bulkload.exception.BulkLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Persists retry lists as JSON so that a killed or partly failed run can be
 * resumed by another process.
 *
 * <p>Job types with more than one kind must carry Jackson type information
 * (see {@link com.fasterxml.jackson.annotation.JsonTypeInfo}).
 */
public class RetryLedger {

    private static final Logger log = LoggerFactory.getLogger(RetryLedger.class);

    private final ObjectMapper objectMapper;

    public RetryLedger(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Write a pool's retry items (failed, then cancelled).
     *
     * @param file target file, replaced if it exists
     * @param snapshot final signals of the pool
     * @param jobType declared job type
     * @return number of items written
     */
    public <J extends Job> int write(Path file, SignalsSnapshot<J> snapshot, Class<J> jobType) {
        List<WorkItem<J>> items = snapshot.retryItems();
        write(file, items, jobType);
        return items.size();
    }

    /**
     * Write work items.
     *
     * @param file target file, replaced if it exists
     * @param items items to write
     * @param jobType declared job type
     */
    public <J extends Job> void write(Path file, List<WorkItem<J>> items, Class<J> jobType) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerFor(listOf(jobType))
                .withDefaultPrettyPrinter()
                .writeValue(file.toFile(), items);
            log.info("Wrote {} retry items to {}", items.size(), file);
        } catch (IOException e) {
            throw new BulkLoadException("Failed to write retry ledger " + file, e);
        }
    }

    /**
     * Read work items written by {@link #write}.
     *
     * @param file source file
     * @param jobType declared job type
     * @return items in the order they were written
     */
    public <J extends Job> List<WorkItem<J>> read(Path file, Class<J> jobType) {
        try {
            List<WorkItem<J>> items = objectMapper.readValue(file.toFile(), listOf(jobType));
            log.info("Read {} retry items from {}", items.size(), file);
            return items;
        } catch (IOException e) {
            throw new BulkLoadException("Failed to read retry ledger " + file, e);
        }
    }

    private JavaType listOf(Class<?> jobType) {
        JavaType item = objectMapper.getTypeFactory().constructParametricType(WorkItem.class, jobType);
        return objectMapper.getTypeFactory().constructCollectionType(List.class, item);
    }
}
