package com.questrail.fits.model;

/**
 * Selects which card answers a keyword lookup when a header repeats a keyword.
 * The full ordered card list always retains every occurrence.
 */
public enum DuplicateKeywordPolicy
{
    /** The last occurrence in header order wins. */
    LAST_WINS,

    /** The first occurrence in header order wins. */
    FIRST_WINS
}
