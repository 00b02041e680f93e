package org.worksindex.exceptions;

import java.util.List;

public class RetentionViolationException extends IllegalStateException {

    public RetentionViolationException(int maxStates, List<String> dois) {
        super("DOI state history exceeds " + maxStates + " records for " + dois.size() + " DOI(s): "
                + dois.subList(0, Math.min(10, dois.size())));
    }
}
