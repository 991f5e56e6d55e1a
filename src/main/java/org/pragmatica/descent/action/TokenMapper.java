package org.pragmatica.descent.action;

/**
 * Converts a matched terminal into a semantic value.
 */
@FunctionalInterface
public interface TokenMapper<K, R> {
    R map(K kind, String lexeme);
}
