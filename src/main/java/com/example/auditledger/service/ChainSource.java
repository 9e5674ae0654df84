package com.example.auditledger.service;

/**
 * Supplies the ordered record window of a chain scope to the verifier.
 */
@FunctionalInterface
public interface ChainSource {

    /**
     * @param limit the number of most recent records to include
     */
    ChainWindow fetch(String chainScope, int limit);
}
