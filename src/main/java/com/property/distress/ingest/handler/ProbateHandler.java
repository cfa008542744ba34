package com.property.distress.ingest.handler;

import com.property.distress.core.model.RecordType;
import com.property.distress.ingest.SourceRow;
import com.property.distress.resolve.ResolutionRequest;

import java.util.List;

/**
 * Probate cases, represented by the decedent. Matched on the decedent's address, then name.
 */
public class ProbateHandler extends CasePartyHandler {

    @Override
    public RecordType recordType() {
        return RecordType.PROBATE;
    }

    @Override
    protected String primaryPartyType() {
        return "Decedent";
    }

    @Override
    protected String secondaryPartyType() {
        return "Beneficiary";
    }

    @Override
    public List<ResolutionRequest> resolutionRequests(SourceRow row) {
        return List.of(
                ResolutionRequest.byAddress(row.text("PartyAddress")),
                ResolutionRequest.byOwnerName(partyName(row)));
    }
}
