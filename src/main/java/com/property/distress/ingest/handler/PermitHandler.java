package com.property.distress.ingest.handler;

import com.property.distress.core.model.PermitDetails;
import com.property.distress.core.model.RecordType;
import com.property.distress.core.model.SignalRecord;
import com.property.distress.ingest.SourceRow;
import com.property.distress.resolve.ResolutionRequest;

import java.time.LocalDate;
import java.util.List;

public class PermitHandler implements RecordHandler {

    @Override
    public RecordType recordType() {
        return RecordType.PERMITS;
    }

    @Override
    public List<ResolutionRequest> resolutionRequests(SourceRow row) {
        return List.of(ResolutionRequest.byAddress(row.text("Address")));
    }

    @Override
    public SignalRecord buildRecord(SourceRow row, long propertyId) {
        String permitType = row.text("Record Type");
        LocalDate issued = row.date("Date");
        PermitDetails details = new PermitDetails(permitType, row.text("Status"), issued,
                row.date("Expiration Date"), row.text("Description"));
        return SignalRecord.of(propertyId, RecordType.PERMITS, row.require(identityColumn()), 0,
                permitType, issued, details);
    }
}
