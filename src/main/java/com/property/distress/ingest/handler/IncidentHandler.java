package com.property.distress.ingest.handler;

import com.property.distress.core.model.IncidentDetails;
import com.property.distress.core.model.RecordType;
import com.property.distress.core.model.SignalRecord;
import com.property.distress.ingest.SourceRow;
import com.property.distress.resolve.ResolutionRequest;

import java.util.List;

public class IncidentHandler implements RecordHandler {

    @Override
    public RecordType recordType() {
        return RecordType.INCIDENTS;
    }

    @Override
    public List<ResolutionRequest> resolutionRequests(SourceRow row) {
        return List.of(ResolutionRequest.byAddress(row.text("Address")));
    }

    @Override
    public SignalRecord buildRecord(SourceRow row, long propertyId) {
        String incidentType = row.text("Incident Type");
        IncidentDetails details = new IncidentDetails(incidentType, row.text("Disposition"));
        return SignalRecord.of(propertyId, RecordType.INCIDENTS, row.require(identityColumn()), 0,
                incidentType, row.date("Date"), details);
    }
}
