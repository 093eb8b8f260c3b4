package com.historicforts.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;

/**
 * Utility class for common helper methods used by the fetching and scraping services.
 *
 * @author Fort Scraper Team
 * @since 1.0
 */
public class Utils {
    private static final Logger logger = LoggerFactory.getLogger(Utils.class);

    private Utils() {}

    /**
     * Retries an action up to maxRetries times with exponential backoff.
     * @param action Callable action to execute
     * @param maxRetries Maximum number of attempts
     * @param baseDelayMs Delay before the second attempt; doubled for each further attempt
     * @param actionDesc Description for logging
     * @param <T> Return type
     * @return Result of action, or null if all attempts fail
     */
    public static <T> T retryAction(Callable<T> action, int maxRetries, long baseDelayMs, String actionDesc) {
        int attempts = 0;
        while (attempts < maxRetries) {
            try {
                return action.call();
            } catch (Exception e) {
                attempts++;
                logger.warn("Failed {} (attempt {}): {}", actionDesc, attempts, e.getMessage());
                if (attempts < maxRetries && !sleep(baseDelayMs * (1L << (attempts - 1)))) {
                    logger.warn("Interrupted while retrying {}", actionDesc);
                    return null;
                }
            }
        }
        logger.error("Giving up on {} after {} attempts.", actionDesc, maxRetries);
        return null;
    }

    /**
     * Sleeps for the given time, restoring the interrupt flag if interrupted.
     * @return false if the thread was interrupted
     */
    public static boolean sleep(long millis) {
        if (millis <= 0) return true;
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
