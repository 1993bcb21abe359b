package com.example.voice.service;

import com.example.voice.config.VoiceProperties;
import com.example.voice.service.exception.TransientStoreException;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.util.backoff.BackOffExecution;
import org.springframework.util.backoff.ExponentialBackOff;

/**
 * Retries datastore calls that failed for a reason expected to clear up on its own. Integrity
 * violations and other non-transient errors pass straight through.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TransientFailureRetrier {

    private final VoiceProperties voiceProperties;

    public <T> T execute(String operation, Supplier<T> action) {
        VoiceProperties.Retry retry = voiceProperties.getRetry();
        int maxAttempts = Math.max(retry.getMaxAttempts(), 1);
        BackOffExecution backOff = newBackOff(retry).start();
        int attempt = 1;
        while (true) {
            try {
                return action.get();
            } catch (TransientDataAccessException | RecoverableDataAccessException | DataAccessResourceFailureException ex) {
                long delay = attempt >= maxAttempts ? BackOffExecution.STOP : backOff.nextBackOff();
                if (delay == BackOffExecution.STOP) {
                    log.error("Giving up on {} after {} attempts", operation, attempt, ex);
                    throw new TransientStoreException(operation, ex);
                }
                log.warn("Transient failure during {} (attempt {}/{}), retrying in {} ms: {}",
                        operation, attempt, maxAttempts, delay, ex.getMessage());
                sleep(operation, delay, ex);
                attempt++;
            }
        }
    }

    public void run(String operation, Runnable action) {
        execute(operation, () -> {
            action.run();
            return null;
        });
    }

    private ExponentialBackOff newBackOff(VoiceProperties.Retry retry) {
        long initial = retry.getInitialInterval() == null ? 50L : Math.max(retry.getInitialInterval().toMillis(), 1L);
        ExponentialBackOff backOff = new ExponentialBackOff(initial, Math.max(retry.getMultiplier(), 1.0));
        backOff.setMaxInterval(Math.max(initial, 2_000L));
        return backOff;
    }

    private void sleep(String operation, long delay, RuntimeException cause) {
        try {
            Thread.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new TransientStoreException(operation, cause);
        }
    }
}
