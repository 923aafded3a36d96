package com.starwatch.service;

import com.starwatch.model.StarredRepo;
import com.starwatch.model.SummaryResult;

public interface SummaryGeneratorService {

    /**
     * @throws com.starwatch.exception.SummaryGenerationException when the model call fails or its answer
     *                                                            does not parse into a summary
     */
    SummaryResult summarize(StarredRepo repo);
}
