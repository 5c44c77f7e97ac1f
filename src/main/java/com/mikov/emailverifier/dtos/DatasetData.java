package com.mikov.emailverifier.dtos;

/**
 * Result of a dataset membership lookup.
 *
 * @param match     true when the key is considered part of the dataset
 * @param matchedOn the candidate that produced the decision, null when nothing matched
 * @param source    which set produced the decision, null when nothing matched
 */
public record DatasetData(boolean match, String matchedOn, Source source) {

    public static DatasetData noMatch() {
        return new DatasetData(false, null, null);
    }

    public enum Source {
        ALLOW,
        DENY,
        DEFAULT
    }
}
