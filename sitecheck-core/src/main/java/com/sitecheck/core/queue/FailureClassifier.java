package com.sitecheck.core.queue;

import com.sitecheck.core.email.EmailDeliveryException;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.util.Set;

/**
 * Splits failures into ones a retry cannot fix and everything else.
 */
@Component
public class FailureClassifier {

    public enum Kind { PERMANENT, TRANSIENT }

    private static final Set<Integer> PERMANENT_STATUSES = Set.of(401, 403, 404);
    private static final int MAX_CAUSE_DEPTH = 16;

    /**
     * Permanent when the audited site answered 401, 403 or 404, when its host does not
     * resolve, or when it refuses connections. Email delivery problems are never permanent.
     */
    public Kind classify(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < MAX_CAUSE_DEPTH) {
            if (current instanceof EmailDeliveryException) {
                return Kind.TRANSIENT;
            }
            if (current instanceof WebClientResponseException
                    && PERMANENT_STATUSES.contains(((WebClientResponseException) current).getStatusCode().value())) {
                return Kind.PERMANENT;
            }
            if (current instanceof UnknownHostException || current instanceof ConnectException) {
                return Kind.PERMANENT;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return Kind.TRANSIENT;
    }

    public boolean isPermanent(Throwable error) {
        return classify(error) == Kind.PERMANENT;
    }
}
