package com.purchasingpower.fullcycle.model;

/**
 * Identity of a pull request on the hosting platform.
 */
public record PullRequestRef(int number, String url) {
}
