package com.perm.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.perm.dates.IsoDates;
import com.perm.exception.MalformedInputException;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.Map;

/**
 * Factory for creating CaseDateFacts from a JSON case payload.
 * <p>
 * Keys use the camelCase wire names of {@link DateField}; dates are ISO {@code YYYY-MM-DD}
 * strings. Keys the engine does not know (record ids, notes, ...) are ignored. Malformed
 * dates and unknown enum values fail fast.
 */
public class CaseFactsFactory {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Create CaseDateFacts from a JSON object.
     *
     * @param jsonPayload JSON string describing one case
     * @return the parsed snapshot
     * @throws MalformedInputException if the payload is not a JSON object or holds malformed values
     */
    public static CaseDateFacts fromJson(String jsonPayload) {
        if (jsonPayload == null || jsonPayload.isBlank()) {
            throw new MalformedInputException("Empty case payload");
        }
        return fromNode(parseJson(jsonPayload));
    }

    /**
     * Create CaseDateFacts from an already parsed JSON object.
     */
    public static CaseDateFacts fromNode(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new MalformedInputException("Case payload must be a JSON object");
        }
        CaseDateFacts.Builder builder = CaseDateFacts.builder();

        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            applyDateIfKnown(builder, entry.getKey(), entry.getValue());
        }

        builder.employerName(text(node, "employerName"));
        builder.beneficiaryIdentifier(text(node, "beneficiaryIdentifier"));
        builder.positionTitle(text(node, "positionTitle"));
        builder.sundayAdNewspaper(text(node, "sundayAdNewspaper"));
        builder.jobOrderState(text(node, "jobOrderState"));
        builder.eta9089CaseNumber(text(node, "eta9089CaseNumber"));
        builder.professionalOccupation(bool(node, "isProfessionalOccupation"));

        JsonNode applicants = node.get("recruitmentApplicantsCount");
        if (applicants != null && !applicants.isNull()) {
            if (!applicants.isIntegralNumber() || !applicants.canConvertToInt()) {
                throw new MalformedInputException("recruitmentApplicantsCount must be an integer");
            }
            builder.recruitmentApplicantsCount(applicants.asInt());
        }

        String caseStatus = text(node, "caseStatus");
        if (caseStatus != null) {
            builder.caseStatus(CaseStatus.fromWireName(caseStatus));
        }
        String progressStatus = text(node, "progressStatus");
        if (progressStatus != null) {
            builder.progressStatus(ProgressStatus.fromWireName(progressStatus));
        }
        builder.deletedAt(instant(node.get("deletedAt")));

        for (JsonNode method : array(node, "additionalRecruitmentMethods")) {
            builder.additionalRecruitmentMethod(new RecruitmentMethodEntry(
                    RecruitmentMethod.fromWireName(requiredText(method, "method")),
                    IsoDates.parseOptional(text(method, "date")),
                    text(method, "description")));
        }
        for (JsonNode rfi : array(node, "rfiEntries")) {
            builder.rfiEntry(new RfiEntry(
                    requiredText(rfi, "id"),
                    rfi.path("createdAt").asLong(0L),
                    IsoDates.parseOptional(text(rfi, "receivedDate")),
                    IsoDates.parseOptional(text(rfi, "responseDueDate")),
                    IsoDates.parseOptional(text(rfi, "responseSubmittedDate"))));
        }
        for (JsonNode rfe : array(node, "rfeEntries")) {
            builder.rfeEntry(new RfeEntry(
                    requiredText(rfe, "id"),
                    rfe.path("createdAt").asLong(0L),
                    IsoDates.parseOptional(text(rfe, "receivedDate")),
                    IsoDates.parseOptional(text(rfe, "responseDueDate")),
                    IsoDates.parseOptional(text(rfe, "responseSubmittedDate"))));
        }

        return builder.build();
    }

    private static JsonNode parseJson(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedInputException("Invalid JSON payload: " + e.getOriginalMessage(), e);
        }
    }

    private static void applyDateIfKnown(CaseDateFacts.Builder builder, String key, JsonNode value) {
        for (DateField field : DateField.values()) {
            if (!field.isEntryScoped() && field.wireName().equals(key)) {
                builder.date(field, value.isNull() ? null : IsoDates.parseOptional(value.asText()));
                return;
            }
        }
    }

    private static Iterable<JsonNode> array(JsonNode node, String key) {
        JsonNode value = node.get(key);
        if (value == null || value.isNull()) {
            return objectMapper.createArrayNode();
        }
        if (!value.isArray()) {
            throw new MalformedInputException(key + " must be a JSON array");
        }
        return value;
    }

    private static String text(JsonNode node, String key) {
        JsonNode value = node.get(key);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static boolean bool(JsonNode node, String key) {
        JsonNode value = node.get(key);
        if (value == null || value.isNull()) {
            return false;
        }
        if (!value.isBoolean()) {
            throw new MalformedInputException(key + " must be true or false, got " + value);
        }
        return value.booleanValue();
    }

    private static String requiredText(JsonNode node, String key) {
        String value = text(node, key);
        if (value == null || value.isBlank()) {
            throw new MalformedInputException("Missing '" + key + "' in " + node);
        }
        return value;
    }

    private static Instant instant(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return Instant.ofEpochMilli(value.asLong());
        }
        try {
            return Instant.parse(value.asText());
        } catch (DateTimeParseException e) {
            throw new MalformedInputException("Invalid deletedAt timestamp: " + value.asText(), e);
        }
    }
}
