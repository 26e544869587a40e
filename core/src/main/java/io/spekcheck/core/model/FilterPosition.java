package io.spekcheck.core.model;

/**
 * A path position by filter uid, used to save and compare setups without loading any filter.
 *
 * @param filter filter uid
 * @param mode   transmit or reflect
 */
public record FilterPosition(String filter, Mode mode) {}
