package com.property.distress.ingest.handler;

import com.property.distress.core.model.LegalProceedingDetails;
import com.property.distress.core.model.RecordType;
import com.property.distress.core.model.SignalRecord;
import com.property.distress.ingest.SourceRow;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Base for clerk-of-court extracts that list one row per party of a case.
 * Rows are grouped by case number; the row of the primary party type stands for the case
 * and the first secondary party's name is carried along in {@link #SECONDARY_PARTY_COLUMN}.
 */
public abstract class CasePartyHandler implements RecordHandler {

    static final String SECONDARY_PARTY_COLUMN = "SecondaryParty";
    static final String PARTY_TYPE_COLUMN = "PartyType";
    static final String LAST_OR_COMPANY_COLUMN = "LastName/CompanyName";

    /**
     * Party type (case-insensitive substring) whose row represents the case.
     */
    protected abstract String primaryPartyType();

    /**
     * Party type whose name is recorded as the secondary party.
     */
    protected abstract String secondaryPartyType();

    @Override
    public List<SourceRow> consolidate(List<SourceRow> rows) {
        Map<String, List<SourceRow>> byCase = new LinkedHashMap<>();
        List<SourceRow> consolidated = new ArrayList<>();
        for (SourceRow row : rows) {
            String caseNumber = row.text(identityColumn());
            if (caseNumber == null) {
                // Left for the loader to reject with its line number
                consolidated.add(row);
                continue;
            }
            byCase.computeIfAbsent(caseNumber, k -> new ArrayList<>()).add(row);
        }
        for (List<SourceRow> parties : byCase.values()) {
            SourceRow primary = parties.stream()
                    .filter(row -> isPartyType(row, primaryPartyType()))
                    .findFirst()
                    .orElse(parties.get(0));
            String secondary = parties.stream()
                    .filter(row -> isPartyType(row, secondaryPartyType()))
                    .map(CasePartyHandler::partyName)
                    .filter(Objects::nonNull)
                    .findFirst()
                    .orElse(null);
            consolidated.add(primary.with(SECONDARY_PARTY_COLUMN, secondary));
        }
        return consolidated;
    }

    @Override
    public SignalRecord buildRecord(SourceRow row, long propertyId) {
        String caseType = row.text("CaseTypeDescription");
        LegalProceedingDetails details = new LegalProceedingDetails(
                caseType,
                row.firstText("Title", "CaseStatus"),
                partyName(row),
                row.text(SECONDARY_PARTY_COLUMN),
                row.text("Court"));
        return SignalRecord.of(propertyId, recordType(), row.require(identityColumn()), 0,
                caseType, row.date("FilingDate"), details);
    }

    /**
     * "First Middle Last". Organizations carry their name alone in the last-name column.
     */
    static String partyName(SourceRow row) {
        return row.joinText("FirstName", "MiddleName", LAST_OR_COMPANY_COLUMN);
    }

    private static boolean isPartyType(SourceRow row, String partyType) {
        String value = row.text(PARTY_TYPE_COLUMN);
        return value != null && value.toLowerCase(Locale.ROOT).contains(partyType.toLowerCase(Locale.ROOT));
    }
}
