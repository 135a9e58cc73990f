package com.aquiferai.pipeline.api;

import com.aquiferai.pipeline.model.CandidateQuery;
import com.aquiferai.pipeline.model.PipelineRun;
import com.aquiferai.pipeline.model.ValidationOutcome;
import org.springframework.lang.Nullable;

/**
 * Checks, executes and, on failure, repairs candidate queries within the retry ceiling.
 */
public interface ValidationService {

    /**
     * Validates one candidate query.
     *
     * @param candidate the query to validate
     * @param run       the owning run, consulted for cancellation; may be null
     * @return the terminal outcome, {@code retryCount} never exceeding the configured maximum
     */
    ValidationOutcome validate(CandidateQuery candidate, @Nullable PipelineRun run);
}
