package com.cypher.guard.service;

/**
 * Turns a natural-language question into a Cypher query. The output is treated as untrusted
 * and goes through the full guard pipeline.
 */
@FunctionalInterface
public interface QueryTranslator {

    String translate(String question);
}
