package com.entity.blocking.similarity;

/**
 * Distance between two non-empty strings: 0 for identical strings, larger for less similar ones.
 */
@FunctionalInterface
public interface EditDistance {

    double distance(String s1, String s2);
}
