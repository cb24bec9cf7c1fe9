package com.participant.matching.zipcode;

/**
 * How a ZIP code was assigned to its county at build time, in the order the rules are tried.
 */
public enum ZipResolution {
    /**
     * Only one county claimed the ZIP.
     */
    SINGLE_COUNTY,

    /**
     * Several counties claimed it and the authoritative range table named one of them.
     */
    AUTHORITATIVE_OVERRIDE,

    /**
     * Denylisted claimants were dropped; the alphabetically first remaining county won.
     */
    DENYLIST_FALLBACK,

    /**
     * Every claimant was denylisted; the alphabetically first claimant won.
     */
    ALPHABETICAL_FALLBACK
}
