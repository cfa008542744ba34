package com.property.distress.ingest.handler;

import com.property.distress.core.model.ForeclosureDetails;
import com.property.distress.core.model.RecordType;
import com.property.distress.core.model.SignalRecord;
import com.property.distress.ingest.SourceRow;
import com.property.distress.resolve.ResolutionRequest;

import java.time.LocalDate;
import java.util.List;

/**
 * Foreclosure auction listings.
 */
public class ForeclosureHandler implements RecordHandler {

    @Override
    public RecordType recordType() {
        return RecordType.FORECLOSURES;
    }

    @Override
    public List<ResolutionRequest> resolutionRequests(SourceRow row) {
        return List.of(
                ResolutionRequest.byParcelId(row.text("Parcel ID")),
                ResolutionRequest.byAddress(row.text("Property Address")));
    }

    @Override
    public SignalRecord buildRecord(SourceRow row, long propertyId) {
        LocalDate auctionDate = row.date("Auction Date");
        LocalDate filed = row.date("Filing Date");
        ForeclosureDetails details = new ForeclosureDetails(row.text("Plaintiff"), row.text("Defendant"),
                row.amount("Judgment Amount"), auctionDate);
        return SignalRecord.of(propertyId, RecordType.FORECLOSURES, row.require(identityColumn()), 0,
                row.text("Case Type"), filed != null ? filed : auctionDate, details);
    }
}
