package com.example.auditledger.service;

import com.example.auditledger.models.VerificationFinding;
import java.util.List;

/**
 * Outcome of verifying one or more chain scopes. {@code findings} holds only violations.
 */
public record VerificationReport(
        boolean valid,
        int recordsChecked,
        List<String> chainScopes,
        List<VerificationFinding> findings
) {

    public static VerificationReport of(int recordsChecked,
                                        List<String> chainScopes,
                                        List<VerificationFinding> findings) {
        return new VerificationReport(findings.isEmpty(), recordsChecked,
                List.copyOf(chainScopes), List.copyOf(findings));
    }
}
