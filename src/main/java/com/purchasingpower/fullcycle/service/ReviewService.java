package com.purchasingpower.fullcycle.service;

import com.purchasingpower.fullcycle.workflow.state.SelfReviewResult;

/**
 * Automated code review of a pull request diff.
 */
public interface ReviewService {

    /**
     * @throws com.purchasingpower.fullcycle.exception.ReviewServiceException when no usable review
     *         could be produced
     */
    SelfReviewResult review(String taskDescription, String diff);
}
