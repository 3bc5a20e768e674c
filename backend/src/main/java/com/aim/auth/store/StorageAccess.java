package com.aim.auth.store;

import com.aim.auth.exception.StorageUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;

import java.util.function.Supplier;

/**
 * Storage boundary for the JPA backend.
 *
 * <ul>
 *   <li>Driver timeouts and connection failures become {@link StorageUnavailableException}.</li>
 *   <li>Reads are idempotent and retried with backoff via the storage {@link RetryTemplate}.</li>
 *   <li>Writes run exactly once; a failed write is never replayed.</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StorageAccess {

    private final RetryTemplate storageRetryTemplate;

    public <T> T read(String operation, Supplier<T> query) {
        return storageRetryTemplate.execute(context -> {
            if (context.getRetryCount() > 0) {
                log.warn("Retrying storage read '{}' (attempt {})", operation, context.getRetryCount() + 1);
            }
            return translate(operation, query);
        });
    }

    public <T> T write(String operation, Supplier<T> command) {
        return translate(operation, command);
    }

    private <T> T translate(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (TransientDataAccessException
                 | DataAccessResourceFailureException
                 | CannotCreateTransactionException e) {
            log.error("Storage unavailable during '{}': {}", operation, e.getMessage());
            throw new StorageUnavailableException("Storage unavailable during " + operation, e);
        }
    }
}
