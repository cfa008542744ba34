package com.property.distress.ingest.handler;

import com.property.distress.core.model.LienDetails;
import com.property.distress.core.model.RecordType;
import com.property.distress.core.model.SignalRecord;
import com.property.distress.ingest.SourceRow;
import com.property.distress.resolve.ResolutionRequest;

import java.util.List;

/**
 * Official-records liens and judgments, matched on the grantor's name.
 * The judgments extract always yields {@link LienDetails.Kind#JUDGMENT}; the liens extract
 * derives the kind from the document type.
 */
public class LienHandler implements RecordHandler {

    private final RecordType recordType;

    public LienHandler(RecordType recordType) {
        if (recordType != RecordType.LIENS && recordType != RecordType.JUDGMENTS) {
            throw new IllegalArgumentException("LienHandler cannot handle " + recordType);
        }
        this.recordType = recordType;
    }

    @Override
    public RecordType recordType() {
        return recordType;
    }

    @Override
    public List<ResolutionRequest> resolutionRequests(SourceRow row) {
        return List.of(ResolutionRequest.byOwnerName(row.text("Grantor")));
    }

    @Override
    public SignalRecord buildRecord(SourceRow row, long propertyId) {
        String documentType = row.firstText("document_type", "DocType");
        LienDetails.Kind kind = recordType == RecordType.JUDGMENTS
                ? LienDetails.Kind.JUDGMENT
                : LienDetails.kindOf(documentType);

        LienDetails details = new LienDetails(kind, documentType, row.text("Grantor"), row.text("Grantee"),
                row.amount("Amount"), row.firstText("BookPage", "Book/Page"));
        return SignalRecord.of(propertyId, recordType, row.require(identityColumn()), 0,
                kind.name(), row.date("RecordDate"), details);
    }
}
