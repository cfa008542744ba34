package com.property.distress.ingest.handler;

import com.property.distress.core.model.RecordType;
import com.property.distress.core.model.SignalRecord;
import com.property.distress.core.model.ViolationDetails;
import com.property.distress.ingest.SourceRow;
import com.property.distress.resolve.ResolutionRequest;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

/**
 * Code-enforcement cases, matched on the violation address.
 */
public class ViolationHandler implements RecordHandler {

    @Override
    public RecordType recordType() {
        return RecordType.VIOLATIONS;
    }

    @Override
    public List<ResolutionRequest> resolutionRequests(SourceRow row) {
        return List.of(ResolutionRequest.byAddress(row.text("Address")));
    }

    @Override
    public SignalRecord buildRecord(SourceRow row, long propertyId) {
        String violationType = row.firstText("Violation Type", "Record Type");
        String status = row.text("Status");
        LocalDate opened = row.date("Date");
        LocalDate closed = row.date("Closed Date");
        boolean lien = status != null && status.toLowerCase(Locale.ROOT).contains("lien");

        ViolationDetails details = new ViolationDetails(violationType, status, opened, closed, lien,
                row.amount("Fine Amount"));
        return SignalRecord.of(propertyId, RecordType.VIOLATIONS, row.require(identityColumn()), 0,
                violationType, opened, details);
    }
}
