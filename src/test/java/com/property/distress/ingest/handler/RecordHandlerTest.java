package com.property.distress.ingest.handler;

import com.property.distress.core.model.DeedDetails;
import com.property.distress.core.model.ForeclosureDetails;
import com.property.distress.core.model.LegalProceedingDetails;
import com.property.distress.core.model.LienDetails;
import com.property.distress.core.model.PermitDetails;
import com.property.distress.core.model.RecordType;
import com.property.distress.core.model.SignalRecord;
import com.property.distress.core.model.TaxDelinquencyDetails;
import com.property.distress.core.model.ViolationDetails;
import com.property.distress.ingest.IngestionConfigurationException;
import com.property.distress.ingest.RecordValidationException;
import com.property.distress.ingest.SourceRow;
import com.property.distress.resolve.ResolutionRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RecordHandler Tests")
class RecordHandlerTest {

    private static SourceRow row(long line, String... pairs) {
        Map<String, String> values = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            values.put(pairs[i], pairs[i + 1]);
        }
        return SourceRow.of(line, values);
    }

    @Nested
    @DisplayName("ViolationHandler")
    class Violations {

        private final ViolationHandler handler = new ViolationHandler();

        @Test
        @DisplayName("Should build an open violation with a lien flag from the status")
        void buildsViolation() {
            SourceRow source = row(2, "Record Number", "CE-1", "Address", "1 Main St",
                    "Record Type", "Water Enforcement", "Status", "Lien Recorded", "Date", "5/1/2023",
                    "Fine Amount", "$2,500.00");

            SignalRecord record = handler.buildRecord(source, 9L);
            ViolationDetails details = (ViolationDetails) record.details();

            assertEquals(9L, record.propertyId());
            assertEquals("CE-1", record.externalKey());
            assertEquals("Water Enforcement", details.violationType());
            assertTrue(details.lien());
            assertTrue(details.isOpen());
            assertEquals(new BigDecimal("2500.00"), details.fineAmount());
            assertEquals(LocalDate.of(2023, 5, 1), record.eventDate());
            assertEquals(List.of(ResolutionRequest.byAddress("1 Main St")), handler.resolutionRequests(source));
        }

        @Test
        @DisplayName("A closed date closes the violation")
        void closed() {
            SourceRow source = row(2, "Record Number", "CE-1", "Violation Type", "Zoning",
                    "Status", "Closed", "Closed Date", "2023-06-30");

            ViolationDetails details = (ViolationDetails) handler.buildRecord(source, 1L).details();

            assertFalse(details.isOpen());
            assertFalse(details.lien());
        }
    }

    @Nested
    @DisplayName("LienHandler")
    class Liens {

        @Test
        @DisplayName("Liens extract derives the kind from the document type")
        void lienKind() {
            LienHandler handler = new LienHandler(RecordType.LIENS);
            SourceRow source = row(2, "Instrument", "I-1", "Grantor", "DOE JANE", "DocType", "LIEN",
                    "Book/Page", "123/45");

            SignalRecord record = handler.buildRecord(source, 1L);
            LienDetails details = (LienDetails) record.details();

            assertEquals(LienDetails.Kind.LIEN, details.kind());
            assertEquals("123/45", details.bookPage());
            assertEquals("LIEN", record.recordSubtype());
        }

        @Test
        @DisplayName("Judgments extract always yields judgments")
        void judgmentKind() {
            LienHandler handler = new LienHandler(RecordType.JUDGMENTS);
            SourceRow source = row(2, "Instrument", "I-1", "Grantor", "DOE JANE", "DocType", "LIEN");

            SignalRecord record = handler.buildRecord(source, 1L);

            assertEquals(RecordType.JUDGMENTS, record.recordType());
            assertEquals(LienDetails.Kind.JUDGMENT, ((LienDetails) record.details()).kind());
        }

        @Test
        @DisplayName("Only lien-shaped types are accepted")
        void rejectsOtherTypes() {
            assertThrows(IllegalArgumentException.class, () -> new LienHandler(RecordType.DEEDS));
        }
    }

    @Test
    @DisplayName("DeedHandler tries the grantor before the grantee")
    void deeds() {
        DeedHandler handler = new DeedHandler();
        SourceRow source = row(2, "Instrument", "D-1", "Grantor", "SELLER SAM", "Grantee", "BUYER BOB",
                "SalePrice", "$410,000", "document_type", "WARRANTY DEED", "RecordDate", "3/3/2024");

        List<ResolutionRequest> requests = handler.resolutionRequests(source);
        DeedDetails details = (DeedDetails) handler.buildRecord(source, 1L).details();

        assertEquals("SELLER SAM", requests.get(0).ownerName());
        assertEquals("BUYER BOB", requests.get(1).ownerName());
        assertEquals(new BigDecimal("410000"), details.salePrice());
        assertEquals("WARRANTY DEED", details.deedType());
    }

    @Test
    @DisplayName("ForeclosureHandler falls back to the auction date")
    void foreclosures() {
        ForeclosureHandler handler = new ForeclosureHandler();
        SourceRow source = row(2, "Case Number", "F-1", "Parcel ID", "A-100", "Property Address", "1 Main St",
                "Auction Date", "11/20/2026 11:00:00 AM", "Judgment Amount", "$150,000.00");

        SignalRecord record = handler.buildRecord(source, 1L);

        assertEquals(LocalDate.of(2026, 11, 20), record.eventDate());
        assertEquals(LocalDate.of(2026, 11, 20), ((ForeclosureDetails) record.details()).auctionDate());
        assertEquals("A-100", handler.resolutionRequests(source).get(0).parcelId());
        assertEquals("1 Main St", handler.resolutionRequests(source).get(1).address());
    }

    @Nested
    @DisplayName("TaxDelinquencyHandler")
    class Tax {

        private final TaxDelinquencyHandler handler = new TaxDelinquencyHandler();

        @Test
        @DisplayName("Should scope identity by tax year")
        void taxYear() {
            SourceRow source = row(2, "Account Number", "A-100", "Tax Yr", "2024", "Amount Due", "$3,100.25",
                    "Years Delinquent", "2", "Account Status", "Delinquent");

            SignalRecord record = handler.buildRecord(source, 1L);
            TaxDelinquencyDetails details = (TaxDelinquencyDetails) record.details();

            assertEquals(2024, record.taxYear());
            assertEquals("TAX|A-100|2024", record.identityKey());
            assertEquals(Integer.valueOf(2), details.yearsDelinquent());
            assertEquals("A-100", handler.resolutionRequests(source).get(0).parcelId());
        }

        @Test
        @DisplayName("Missing or implausible years are row failures")
        void badYears() {
            assertThrows(RecordValidationException.class,
                    () -> handler.taxYear(row(2, "Account Number", "A-1")));
            assertThrows(RecordValidationException.class,
                    () -> handler.taxYear(row(2, "Account Number", "A-1", "Tax Yr", "3024")));
        }
    }

    @Test
    @DisplayName("PermitHandler keeps issue and expiration dates")
    void permits() {
        SourceRow source = row(2, "Record Number", "BP-1", "Address", "1 Main St", "Record Type", "Roof",
                "Status", "Issued", "Date", "1/5/2026", "Expiration Date", "7/5/2026");

        PermitDetails details = (PermitDetails) new PermitHandler().buildRecord(source, 1L).details();

        assertEquals(LocalDate.of(2026, 7, 5), details.expirationDate());
        assertEquals("Roof", details.permitType());
    }

    @Test
    @DisplayName("BankruptcyHandler matches on the debtor's name")
    void bankruptcy() {
        BankruptcyHandler handler = new BankruptcyHandler();
        SourceRow source = row(2, "Docket Number", "8:26-bk-01234", "Lead Name", "DOE JANE",
                "Case Type", "Chapter 7", "Division", "Tampa", "Court ID", "flmb", "Date Filed", "2026-03-01");

        SignalRecord record = handler.buildRecord(source, 1L);
        LegalProceedingDetails details = (LegalProceedingDetails) record.details();

        assertEquals("DOE JANE", handler.resolutionRequests(source).get(0).ownerName());
        assertEquals("Chapter 7", record.recordSubtype());
        assertEquals("flmb", details.court());
    }

    @Nested
    @DisplayName("Case-party consolidation")
    class CaseParties {

        @Test
        @DisplayName("Probate cases collapse to the decedent with the beneficiary carried along")
        void probate() {
            ProbateHandler handler = new ProbateHandler();
            List<SourceRow> rows = List.of(
                    row(2, "CaseNumber", "P-1", "PartyType", "Beneficiary", "FirstName", "Ann",
                            "LastName/CompanyName", "Doe"),
                    row(3, "CaseNumber", "P-1", "PartyType", "Decedent", "FirstName", "John",
                            "MiddleName", "Q", "LastName/CompanyName", "Doe", "PartyAddress", "1 Main St",
                            "CaseTypeDescription", "Summary Administration", "Title", "Open",
                            "FilingDate", "2/2/2026"),
                    row(4, "CaseNumber", "P-2", "PartyType", "Petitioner", "LastName/CompanyName", "ACME TRUST CO"),
                    row(5, "CaseNumber", " ", "PartyType", "Decedent"));

            List<SourceRow> consolidated = handler.consolidate(rows);

            assertEquals(3, consolidated.size());
            SourceRow decedent = consolidated.stream().filter(r -> r.rowNumber() == 3).findFirst().orElseThrow();
            SignalRecord record = handler.buildRecord(decedent, 1L);
            LegalProceedingDetails details = (LegalProceedingDetails) record.details();
            assertEquals("John Q Doe", details.primaryParty());
            assertEquals("Ann Doe", details.secondaryParty());
            assertEquals("Open", details.caseStatus());
            assertEquals("Summary Administration", record.recordSubtype());
            assertEquals(LocalDate.of(2026, 2, 2), record.eventDate());

            List<ResolutionRequest> requests = handler.resolutionRequests(decedent);
            assertEquals("1 Main St", requests.get(0).address());
            assertEquals("John Q Doe", requests.get(1).ownerName());

            SourceRow company = consolidated.stream().filter(r -> r.rowNumber() == 4).findFirst().orElseThrow();
            assertEquals("ACME TRUST CO", CasePartyHandler.partyName(company));
        }

        @Test
        @DisplayName("Party names join first, middle and the last-name-or-company column")
        void partyName() {
            assertEquals("John Q Doe", CasePartyHandler.partyName(row(2, "FirstName", "John", "MiddleName", "Q",
                    "LastName/CompanyName", "Doe")));
            assertEquals("Mary Roe", CasePartyHandler.partyName(row(3, "FirstName", "Mary", "MiddleName", " ",
                    "LastName/CompanyName", "Roe")));
            assertNull(CasePartyHandler.partyName(row(4, "PartyType", "Decedent")));
        }

        @Test
        @DisplayName("Eviction cases collapse to the defendant")
        void eviction() {
            EvictionHandler handler = new EvictionHandler();
            List<SourceRow> rows = List.of(
                    row(2, "CaseNumber", "E-1", "PartyType", "Plaintiff", "LastName/CompanyName", "LANDLORD LLC"),
                    row(3, "CaseNumber", "E-1", "PartyType", "Defendant", "FirstName", "Tom",
                            "LastName/CompanyName", "Tenant", "PartyAddress", "5 Elm St",
                            "CaseTypeDescription", "Eviction - Residential", "Title", "Judgment for Possession",
                            "FilingDate", "2026-03-04"));

            List<SourceRow> consolidated = handler.consolidate(rows);

            assertEquals(1, consolidated.size());
            assertEquals(3, consolidated.get(0).rowNumber());
            SignalRecord record = handler.buildRecord(consolidated.get(0), 1L);
            LegalProceedingDetails details = (LegalProceedingDetails) record.details();
            assertEquals("Tom Tenant", details.primaryParty());
            assertEquals("LANDLORD LLC", details.secondaryParty());
            assertEquals("Judgment for Possession", details.caseStatus());
            assertEquals(LocalDate.of(2026, 3, 4), record.eventDate());
            assertEquals(List.of(ResolutionRequest.byAddress("5 Elm St")),
                    handler.resolutionRequests(consolidated.get(0)));
        }
    }

    @Test
    @DisplayName("Default registry covers every record type")
    void registry() {
        RecordHandlerRegistry registry = RecordHandlerRegistry.defaults();

        assertEquals(EnumSet.allOf(RecordType.class), EnumSet.copyOf(registry.supportedTypes()));
        assertEquals(RecordType.INCIDENTS, registry.get(RecordType.INCIDENTS).recordType());
        assertThrows(IngestionConfigurationException.class, () -> new RecordHandlerRegistry().get(RecordType.TAX));
    }
}
