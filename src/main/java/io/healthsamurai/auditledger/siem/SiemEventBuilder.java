package io.healthsamurai.auditledger.siem;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.healthsamurai.auditledger.builder.RecordDocumentMapper;
import io.healthsamurai.auditledger.model.ImmutableAuditRecord;

/**
 * Builds the document sent to the SIEM: the full record plus severity and tags.
 */
public class SiemEventBuilder {

    private static final String SOURCE = "audit-ledger";

    private final SeverityClassifier classifier;

    public SiemEventBuilder(SeverityClassifier classifier) {
        this.classifier = classifier;
    }

    public ObjectNode buildSiemEvent(ImmutableAuditRecord record) {
        ObjectNode document = RecordDocumentMapper.toDocument(record);
        document.put("source", SOURCE);
        document.put("severity", classifier.classify(record).name());
        ArrayNode tags = document.putArray("tags");
        classifier.tags(record).forEach(tags::add);
        return document;
    }
}
