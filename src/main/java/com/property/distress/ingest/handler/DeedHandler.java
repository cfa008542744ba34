package com.property.distress.ingest.handler;

import com.property.distress.core.model.DeedDetails;
import com.property.distress.core.model.RecordType;
import com.property.distress.core.model.SignalRecord;
import com.property.distress.ingest.SourceRow;
import com.property.distress.resolve.ResolutionRequest;

import java.util.List;

/**
 * Deed transfers. The seller is tried first, then the buyer.
 */
public class DeedHandler implements RecordHandler {

    @Override
    public RecordType recordType() {
        return RecordType.DEEDS;
    }

    @Override
    public List<ResolutionRequest> resolutionRequests(SourceRow row) {
        return List.of(
                ResolutionRequest.byOwnerName(row.text("Grantor")),
                ResolutionRequest.byOwnerName(row.text("Grantee")));
    }

    @Override
    public SignalRecord buildRecord(SourceRow row, long propertyId) {
        String deedType = row.firstText("document_type", "DocType");
        DeedDetails details = new DeedDetails(deedType, row.text("Grantor"), row.text("Grantee"),
                row.amount("SalePrice"));
        return SignalRecord.of(propertyId, RecordType.DEEDS, row.require(identityColumn()), 0,
                deedType, row.date("RecordDate"), details);
    }
}
