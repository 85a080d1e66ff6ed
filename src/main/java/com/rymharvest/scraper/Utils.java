package com.rymharvest.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;

/**
 * Utility class for common helper methods used by the driver.
 *
 * @author RYM Harvest Team
 * @since 1.0
 */
public class Utils {
    private static final Logger logger = LoggerFactory.getLogger(Utils.class);

    /**
     * Sanitizes a filename by replacing each special character and whitespace with an underscore.
     * @param name Input filename
     * @return Sanitized filename
     */
    public static String sanitizeFilename(String name) {
        return name == null ? "" : name.replaceAll("[*?\"<>|/:\\s]", "_");
    }

    /**
     * Runs an action up to maxRetries times with exponential backoff between attempts.
     * Each attempt should build fresh state (for example a new scraper), since failed scrapers cannot be rerun.
     * @param action Callable action to execute
     * @param maxRetries Maximum number of attempts
     * @param baseDelayMs Delay before the second attempt; doubled for every further attempt
     * @param actionDesc Description for logging
     * @param <T> Return type
     * @return Result of action, or null if all attempts fail
     */
    public static <T> T retry(Callable<T> action, int maxRetries, long baseDelayMs, String actionDesc) {
        int attempts = 0;
        while (attempts < maxRetries) {
            try {
                return action.call();
            } catch (Exception e) {
                attempts++;
                logger.warn("Failed {} (attempt {}): {}", actionDesc, attempts, e.getMessage());
                if (attempts >= maxRetries) break;
                try {
                    Thread.sleep(baseDelayMs * (1L << (attempts - 1)));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    logger.warn("Interrupted while retrying {}", actionDesc);
                    return null;
                }
            }
        }
        logger.error("Giving up on {} after {} attempts.", actionDesc, maxRetries);
        return null;
    }
}
