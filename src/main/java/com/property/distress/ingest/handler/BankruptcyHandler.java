package com.property.distress.ingest.handler;

import com.property.distress.core.model.LegalProceedingDetails;
import com.property.distress.core.model.RecordType;
import com.property.distress.core.model.SignalRecord;
import com.property.distress.ingest.SourceRow;
import com.property.distress.resolve.ResolutionRequest;

import java.util.List;

/**
 * Federal bankruptcy filings. Only the debtor's name is available for matching.
 */
public class BankruptcyHandler implements RecordHandler {

    @Override
    public RecordType recordType() {
        return RecordType.BANKRUPTCY;
    }

    @Override
    public List<ResolutionRequest> resolutionRequests(SourceRow row) {
        return List.of(ResolutionRequest.byOwnerName(row.text("Lead Name")));
    }

    @Override
    public SignalRecord buildRecord(SourceRow row, long propertyId) {
        String caseType = row.text("Case Type");
        LegalProceedingDetails details = new LegalProceedingDetails(
                caseType,
                row.text("Division"),
                row.text("Lead Name"),
                null,
                row.text("Court ID"));
        return SignalRecord.of(propertyId, RecordType.BANKRUPTCY, row.require(identityColumn()), 0,
                caseType, row.date("Date Filed"), details);
    }
}
