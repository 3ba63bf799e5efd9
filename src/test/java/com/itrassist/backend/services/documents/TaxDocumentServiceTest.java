package com.itrassist.backend.services.documents;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.itrassist.backend.config.ExtractionProperties;
import com.itrassist.backend.config.TaxRulesProperties;
import com.itrassist.backend.config.VisionProperties;
import com.itrassist.backend.entities.FieldNames;
import com.itrassist.backend.entities.TaxDocument;
import com.itrassist.backend.enums.DocumentStatus;
import com.itrassist.backend.enums.DocumentType;
import com.itrassist.backend.enums.ExtractionQuality;
import com.itrassist.backend.enums.FindingType;
import com.itrassist.backend.enums.ItrFormType;
import com.itrassist.backend.exceptions.ConflictException;
import com.itrassist.backend.exceptions.CorrectionRejectedException;
import com.itrassist.backend.exceptions.IngestException;
import com.itrassist.backend.exceptions.ResourceNotFoundException;
import com.itrassist.backend.repositories.InMemoryDocumentContentStore;
import com.itrassist.backend.repositories.InMemoryTaxDocumentRepository;
import com.itrassist.backend.services.aggregate.FilerAggregate;
import com.itrassist.backend.services.aggregate.TaxAggregateCalculator;
import com.itrassist.backend.services.documents.corrections.CorrectionMerger;
import com.itrassist.backend.services.documents.corrections.CorrectionValidator;
import com.itrassist.backend.services.documents.corrections.FieldCorrection;
import com.itrassist.backend.services.documents.corrections.ManualFieldCatalog;
import com.itrassist.backend.services.documents.extraction.ExtractionQualityEvaluator;
import com.itrassist.backend.services.documents.extraction.HeuristicFieldExtractor;
import com.itrassist.backend.services.documents.reconciliation.CrossDocumentReconciler;
import com.itrassist.backend.services.documents.summary.CanonicalExportMapper;
import com.itrassist.backend.services.documents.summary.KeySummaryProjector;
import com.itrassist.backend.services.documents.vision.DisabledVisionExtractionAdapter;
import com.itrassist.backend.services.insights.DeductionAdvisor;
import com.itrassist.backend.services.insights.ItrFormRecommender;
import com.itrassist.backend.services.ocr.PdfTextExtractor;
/**
 * Wires the real collaborators. Outside a Spring context {@code @Async} is inert, so extraction
 * completes before {@code ingest} returns.
 */
class TaxDocumentServiceTest {

    private static final String OWNER = "filer-1";

    private static final String FORM_16 = String.join("\n",
            "FORM 16",
            "Employer: Acme Technologies Pvt Ltd",
            "PAN of Employee: ABCDE1234F",
            "Gross Salary: 10,00,000",
            "Deductions under Chapter VI-A: 1,00,000",
            "Total Taxable Income: 9,00,000",
            "Tax Deducted at Source (TDS): 80,000");

    private static final String SALARY_SLIP = String.join("\n",
            "Monthly pay slip summary",
            "Gross Salary: 10,30,000",
            "Deductions: 12,000");

    private ExtractionProperties extractionProperties;
    private InMemoryTaxDocumentRepository repository;
    private InMemoryDocumentContentStore contentStore;
    private TaxDocumentService service;

    @BeforeEach
    void setUp() {
        TaxRulesProperties rules = TaxRulesProperties.defaults();
        extractionProperties = new ExtractionProperties();
        repository = new InMemoryTaxDocumentRepository();
        contentStore = new InMemoryDocumentContentStore();

        HeuristicFieldExtractor heuristics = new HeuristicFieldExtractor(new ExtractionQualityEvaluator(extractionProperties));
        DocumentExtractionPipeline pipeline = new DocumentExtractionPipeline(new PdfTextExtractor(), heuristics,
                new DisabledVisionExtractionAdapter(), Runnable::run, new VisionProperties());
        DocumentExtractionWorker worker = new DocumentExtractionWorker(repository, contentStore, pipeline);

        KeySummaryProjector projector = new KeySummaryProjector(rules);
        ManualFieldCatalog catalog = new ManualFieldCatalog();

        service = new TaxDocumentService(
                repository,
                contentStore,
                worker,
                extractionProperties,
                projector,
                new CanonicalExportMapper(rules),
                catalog,
                new CorrectionValidator(catalog, rules),
                new CorrectionMerger(),
                new CrossDocumentReconciler(rules),
                new TaxAggregateCalculator(projector, rules),
                new DeductionAdvisor(projector, rules),
                new ItrFormRecommender());
    }

    private TaxDocument upload(String text, String label) {
        return service.ingest(OWNER, text.getBytes(StandardCharsets.UTF_8), "text/plain", label, "upload.txt");
    }

    @Test
    void ingest_extractsInBackgroundAndExposesData() {
        TaxDocument queued = upload(FORM_16, "Form 16");

        assertEquals(DocumentStatus.PROCESSING, queued.getStatus());
        assertEquals(DocumentType.FORM_16, queued.getDeclaredType());

        TaxDocument status = service.getStatus(queued.getId(), OWNER);
        assertEquals(DocumentStatus.EXTRACTED, status.getStatus());

        DocumentData data = service.getData(queued.getId(), OWNER);
        assertEquals(ExtractionQuality.GOOD, data.document().getExtracted().getQuality());
        assertEquals(new BigDecimal("1000000"), data.keySummary().get(KeySummaryProjector.SALARY));
        assertEquals(new BigDecimal("90000"), data.canonicalExport().get("tax_payable"));
        assertTrue(data.missingRequiredFields().isEmpty());
        assertFalse(data.needsReview());
    }

    @Test
    void ingest_rejectsEmptyFile() {
        IngestException ex = assertThrows(IngestException.class,
                () -> service.ingest(OWNER, new byte[0], "text/plain", "Form 16", "a.txt"));

        assertEquals("Uploaded file is empty", ex.getMessage());
    }

    @Test
    void ingest_rejectsUnsupportedType() {
        IngestException ex = assertThrows(IngestException.class,
                () -> service.ingest(OWNER, new byte[] {1}, "application/zip", "Form 16", "a.zip"));

        assertEquals("Unsupported file type: application/zip", ex.getMessage());
    }

    @Test
    void ingest_rejectsOversizedFile() {
        extractionProperties.setMaxUploadBytes(4);

        assertThrows(IngestException.class,
                () -> service.ingest(OWNER, new byte[] {1, 2, 3, 4, 5}, "text/plain", "Form 16", "a.txt"));
        assertTrue(service.list(OWNER).isEmpty());
    }

    @Test
    void ingest_infersMimeAndTypeFromFileName() {
        TaxDocument queued = service.ingest(OWNER, FORM_16.getBytes(StandardCharsets.UTF_8), null, " ", "form16.txt");

        assertEquals("text/plain", queued.getMimeType());
        assertEquals(DocumentType.FORM_16, queued.getDeclaredType());
        assertEquals("Form 16", queued.getDeclaredTypeLabel());
    }

    @Test
    void applyCorrections_fixesLowQualityDocument() {
        TaxDocument slip = upload(SALARY_SLIP, "Salary Slip");
        assertEquals(ExtractionQuality.LOW, service.getData(slip.getId(), OWNER).document().getExtracted().getQuality());

        TaxDocument corrected = service.applyCorrections(slip.getId(), OWNER, List.of(
                FieldCorrection.of(FieldNames.PAN, "ABCDE1234F"),
                FieldCorrection.of(FieldNames.SALARY, "9,50,000")));

        assertEquals(ExtractionQuality.GOOD, corrected.getExtracted().getQuality());
        assertTrue(corrected.getExtracted().getMessages().isEmpty());
        assertEquals(0, new BigDecimal("950000").compareTo(corrected.getExtracted().getSummary().income()));
        assertTrue(corrected.getExtracted().field(FieldNames.SALARY).orElseThrow().isManual());
    }

    @Test
    void applyCorrections_rejectedBatchChangesNothing() {
        TaxDocument form16 = upload(FORM_16, "Form 16");

        assertThrows(CorrectionRejectedException.class, () -> service.applyCorrections(form16.getId(), OWNER, List.of(
                FieldCorrection.of(FieldNames.EMPLOYER, "New Employer"),
                FieldCorrection.of(FieldNames.TDS, "lots"))));

        TaxDocument after = service.getStatus(form16.getId(), OWNER);
        assertEquals("Acme Technologies Pvt Ltd", after.getExtracted().field(FieldNames.EMPLOYER).orElseThrow().value().asText());
    }

    @Test
    void applyCorrections_beforeExtractionIsConflict() {
        TaxDocument pending = new TaxDocument();
        pending.setId(UUID.randomUUID());
        pending.setOwnerId(OWNER);
        pending.setDeclaredType(DocumentType.FORM_16);
        repository.save(pending);

        assertThrows(ConflictException.class, () -> service.applyCorrections(pending.getId(), OWNER,
                List.of(FieldCorrection.of(FieldNames.SALARY, 1))));
    }

    @Test
    void documentsAreScopedToOwner() {
        TaxDocument form16 = upload(FORM_16, "Form 16");

        assertThrows(ResourceNotFoundException.class, () -> service.getStatus(form16.getId(), "someone-else"));
        assertThrows(ResourceNotFoundException.class, () -> service.delete(form16.getId(), "someone-else"));
        assertTrue(service.list("someone-else").isEmpty());
    }

    @Test
    void delete_removesDocumentAndContent() {
        TaxDocument form16 = upload(FORM_16, "Form 16");

        service.delete(form16.getId(), OWNER);

        assertTrue(service.list(OWNER).isEmpty());
        assertTrue(contentStore.fetch(form16.getId()).isEmpty());
        assertThrows(ResourceNotFoundException.class, () -> service.getStatus(form16.getId(), OWNER));
    }

    @Test
    void delete_aggregateMatchesNeverHavingUploaded() {
        upload(FORM_16, "Form 16");
        FilerAggregate form16Only = service.getAggregate(OWNER);

        TaxDocument slip = upload(SALARY_SLIP, "Salary Slip");
        assertEquals(2, service.getAggregate(OWNER).documentsCounted());

        service.delete(slip.getId(), OWNER);

        assertEquals(form16Only, service.getAggregate(OWNER));
        assertTrue(service.getFindings(OWNER).isEmpty());
    }

    @Test
    void ingest_pdfWithoutTextLayerIsExtractedAsUnreadable() throws IOException {
        TaxDocument queued = service.ingest(OWNER, blankPdf(), "application/pdf", "Form 16", "scan.pdf");

        TaxDocument done = service.getStatus(queued.getId(), OWNER);
        assertEquals(DocumentStatus.EXTRACTED, done.getStatus());
        assertEquals(ExtractionQuality.UNREADABLE, done.getExtracted().getQuality());
        assertFalse(done.getExtracted().getMessages().isEmpty());
        assertTrue(done.getExtracted().getFields().isEmpty());

        FilerAggregate aggregate = service.getAggregate(OWNER);
        assertEquals(0, BigDecimal.ZERO.compareTo(aggregate.totalSalary()));
        assertEquals(0, BigDecimal.ZERO.compareTo(aggregate.taxableIncome()));
        assertEquals(0, BigDecimal.ZERO.compareTo(aggregate.totalTDS()));
        assertEquals(0, BigDecimal.ZERO.compareTo(aggregate.estimatedTax()));
    }

    private static byte[] blankPdf() throws IOException {
        try (PDDocument doc = new PDDocument()) {
            doc.addPage(new PDPage());
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            doc.save(out);
            return out.toByteArray();
        }
    }

    @Test
    void filerViews_combineAllDocuments() {
        upload(FORM_16, "Form 16");
        upload(SALARY_SLIP, "Salary Slip");

        List<TaxDocument> documents = service.list(OWNER);
        assertEquals(2, documents.size());
        assertEquals(DocumentType.FORM_16, documents.get(0).getDeclaredType());

        assertEquals(FindingType.SALARY_MISMATCH, service.getFindings(OWNER).get(0).type());

        FilerAggregate aggregate = service.getAggregate(OWNER);
        assertEquals(0, new BigDecimal("2030000").compareTo(aggregate.totalSalary()));
        assertEquals(2, aggregate.documentsCounted());

        DocumentInsights insights = service.getInsights(OWNER);
        assertEquals(ItrFormType.ITR_1, insights.recommendation().form());
        assertEquals(1, insights.findings().size());
    }

    @Test
    void knownOwnerFields_preferForm16() {
        upload(SALARY_SLIP, "Salary Slip");
        upload(FORM_16, "Form 16");

        Set<String> known = service.knownOwnerFields(service.list(OWNER));

        assertTrue(known.contains("pan"));
        assertTrue(known.contains("employer"));
    }
}
