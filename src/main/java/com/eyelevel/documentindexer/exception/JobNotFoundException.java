package com.eyelevel.documentindexer.exception;

import java.io.Serial;
import java.util.UUID;

public class JobNotFoundException extends IndexingException {
    @Serial
    private static final long serialVersionUID = 3010562277384013215L;

    public JobNotFoundException(UUID jobId) {
        super("Indexing job not found: " + jobId);
    }
}
