package com.property.distress.core.model;

/**
 * A court proceeding touching the property owner: probate, eviction or bankruptcy.
 *
 * @param caseType       court's case-type description
 * @param caseStatus     current status or title of the case
 * @param primaryParty   the party the record was matched on (decedent, defendant, debtor)
 * @param secondaryParty the opposing or benefiting party (beneficiary, plaintiff), may be null
 * @param court          court or division identifier, may be null
 */
public record LegalProceedingDetails(
        String caseType,
        String caseStatus,
        String primaryParty,
        String secondaryParty,
        String court
) implements SignalDetails {
}
