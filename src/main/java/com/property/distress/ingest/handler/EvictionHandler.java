package com.property.distress.ingest.handler;

import com.property.distress.core.model.RecordType;
import com.property.distress.ingest.SourceRow;
import com.property.distress.resolve.ResolutionRequest;

import java.util.List;

/**
 * Eviction cases, represented by the defendant (the tenant at the property).
 */
public class EvictionHandler extends CasePartyHandler {

    @Override
    public RecordType recordType() {
        return RecordType.EVICTIONS;
    }

    @Override
    protected String primaryPartyType() {
        return "Defendant";
    }

    @Override
    protected String secondaryPartyType() {
        return "Plaintiff";
    }

    @Override
    public List<ResolutionRequest> resolutionRequests(SourceRow row) {
        return List.of(ResolutionRequest.byAddress(row.text("PartyAddress")));
    }
}
