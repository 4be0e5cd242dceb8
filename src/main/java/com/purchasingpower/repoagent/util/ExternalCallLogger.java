package com.purchasingpower.repoagent.util;

import com.purchasingpower.repoagent.model.CallContext;
import com.purchasingpower.repoagent.model.ServiceType;
import org.slf4j.Logger;

/**
 * Unified logging for calls leaving the process (git transport, GitHub API, completion API).
 */
public final class ExternalCallLogger {

    private ExternalCallLogger() {
    }

    public static CallContext startCall(ServiceType service, String operation, Logger logger) {
        return new CallContext(service, operation, logger);
    }

    /**
     * Truncate large strings for logging.
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
