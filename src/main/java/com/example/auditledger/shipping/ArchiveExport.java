package com.example.auditledger.shipping;

/**
 * Location and SHA-256 (lowercase hex) of an exported archive batch.
 */
public record ArchiveExport(String location, String checksum) {}
