package com.property.distress.ingest.handler;

import com.property.distress.core.model.RecordType;
import com.property.distress.core.model.SignalRecord;
import com.property.distress.core.model.TaxDelinquencyDetails;
import com.property.distress.ingest.RecordValidationException;
import com.property.distress.ingest.SourceRow;
import com.property.distress.resolve.ResolutionRequest;

import java.util.List;

/**
 * Delinquent tax accounts. The account number is the parcel id, and an account may appear
 * once per tax year.
 */
public class TaxDelinquencyHandler implements RecordHandler {

    static final String TAX_YEAR_COLUMN = "Tax Yr";

    @Override
    public RecordType recordType() {
        return RecordType.TAX;
    }

    @Override
    public int taxYear(SourceRow row) {
        Integer year = row.integer(TAX_YEAR_COLUMN);
        if (year == null) {
            throw new RecordValidationException(row.rowNumber(), TAX_YEAR_COLUMN, "required value is missing");
        }
        if (year < 1900 || year > 2999) {
            throw new RecordValidationException(row.rowNumber(), TAX_YEAR_COLUMN, "implausible tax year " + year);
        }
        return year;
    }

    @Override
    public List<ResolutionRequest> resolutionRequests(SourceRow row) {
        return List.of(ResolutionRequest.byParcelId(row.text(identityColumn())));
    }

    @Override
    public SignalRecord buildRecord(SourceRow row, long propertyId) {
        int taxYear = taxYear(row);
        TaxDelinquencyDetails details = new TaxDelinquencyDetails(
                taxYear,
                row.amount("Amount Due"),
                row.integer("Years Delinquent"),
                row.text("Account Status"),
                row.text("Cert Status"),
                row.text("Deed Status"));
        return SignalRecord.of(propertyId, RecordType.TAX, row.require(identityColumn()), taxYear,
                row.text("Account Status"), null, details);
    }
}
