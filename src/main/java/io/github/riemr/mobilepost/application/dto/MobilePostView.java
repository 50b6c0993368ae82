package io.github.riemr.mobilepost.application.dto;

/**
 * A record as exposed to clients, in one of the language projections.
 */
public interface MobilePostView {
    Long getId();
}
