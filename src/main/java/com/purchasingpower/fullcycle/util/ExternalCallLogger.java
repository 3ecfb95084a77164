package com.purchasingpower.fullcycle.util;

import com.purchasingpower.fullcycle.model.CallContext;
import com.purchasingpower.fullcycle.model.ServiceType;
import org.slf4j.Logger;

/**
 * Unified logging for all external calls (LLM providers, GitHub API, git, build tools).
 */
public final class ExternalCallLogger {

    private ExternalCallLogger() {
    }

    public static CallContext startCall(ServiceType service, String operation, Logger logger) {
        return new CallContext(service, operation, logger);
    }

    /**
     * Truncate large strings for logging (to avoid log spam)
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "(null)";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "... [+" + (text.length() - maxLength) + " chars]";
    }
}
