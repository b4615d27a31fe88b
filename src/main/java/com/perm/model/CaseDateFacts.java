package com.perm.model;

import com.perm.dates.IsoDates;
import com.perm.exception.MalformedInputException;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of the dates and flags of one PERM case.
 * <p>
 * Every milestone is optional: a date that has not happened yet is simply absent.
 * Engine operations never modify a snapshot; they return a new one.
 */
public final class CaseDateFacts {

    private final Map<DateField, LocalDate> dates;
    private final String employerName;
    private final String beneficiaryIdentifier;
    private final String positionTitle;
    private final String sundayAdNewspaper;
    private final String jobOrderState;
    private final Integer recruitmentApplicantsCount;
    private final String eta9089CaseNumber;
    private final boolean professionalOccupation;
    private final List<RecruitmentMethodEntry> additionalRecruitmentMethods;
    private final List<RfiEntry> rfiEntries;
    private final List<RfeEntry> rfeEntries;
    private final CaseStatus caseStatus;
    private final ProgressStatus progressStatus;
    private final Instant deletedAt;

    private CaseDateFacts(Builder builder) {
        this.dates = Collections.unmodifiableMap(new EnumMap<>(builder.dates));
        this.employerName = builder.employerName;
        this.beneficiaryIdentifier = builder.beneficiaryIdentifier;
        this.positionTitle = builder.positionTitle;
        this.sundayAdNewspaper = builder.sundayAdNewspaper;
        this.jobOrderState = builder.jobOrderState;
        this.recruitmentApplicantsCount = builder.recruitmentApplicantsCount;
        this.eta9089CaseNumber = builder.eta9089CaseNumber;
        this.professionalOccupation = builder.professionalOccupation;
        this.additionalRecruitmentMethods = List.copyOf(builder.additionalRecruitmentMethods);
        this.rfiEntries = List.copyOf(builder.rfiEntries);
        this.rfeEntries = List.copyOf(builder.rfeEntries);
        this.caseStatus = builder.caseStatus;
        this.progressStatus = builder.progressStatus;
        this.deletedAt = builder.deletedAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Create a builder pre-filled with this snapshot's values.
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.dates.putAll(dates);
        builder.employerName = employerName;
        builder.beneficiaryIdentifier = beneficiaryIdentifier;
        builder.positionTitle = positionTitle;
        builder.sundayAdNewspaper = sundayAdNewspaper;
        builder.jobOrderState = jobOrderState;
        builder.recruitmentApplicantsCount = recruitmentApplicantsCount;
        builder.eta9089CaseNumber = eta9089CaseNumber;
        builder.professionalOccupation = professionalOccupation;
        builder.additionalRecruitmentMethods.addAll(additionalRecruitmentMethods);
        builder.rfiEntries.addAll(rfiEntries);
        builder.rfeEntries.addAll(rfeEntries);
        builder.caseStatus = caseStatus;
        builder.progressStatus = progressStatus;
        builder.deletedAt = deletedAt;
        return builder;
    }

    /**
     * Get a case-scoped date.
     *
     * @param field Case-scoped field
     * @return the date, or null when not set
     * @throws MalformedInputException if the field belongs to an RFI/RFE entry
     */
    public LocalDate date(DateField field) {
        requireCaseScope(field);
        return dates.get(field);
    }

    public boolean has(DateField field) {
        return date(field) != null;
    }

    /**
     * All case-scoped dates that are set.
     */
    public Map<DateField, LocalDate> getDates() {
        return dates;
    }

    public String getEmployerName() {
        return employerName;
    }

    public String getBeneficiaryIdentifier() {
        return beneficiaryIdentifier;
    }

    public String getPositionTitle() {
        return positionTitle;
    }

    public String getSundayAdNewspaper() {
        return sundayAdNewspaper;
    }

    public String getJobOrderState() {
        return jobOrderState;
    }

    public Integer getRecruitmentApplicantsCount() {
        return recruitmentApplicantsCount;
    }

    public String getEta9089CaseNumber() {
        return eta9089CaseNumber;
    }

    public boolean isProfessionalOccupation() {
        return professionalOccupation;
    }

    public List<RecruitmentMethodEntry> getAdditionalRecruitmentMethods() {
        return additionalRecruitmentMethods;
    }

    public List<RfiEntry> getRfiEntries() {
        return rfiEntries;
    }

    public List<RfeEntry> getRfeEntries() {
        return rfeEntries;
    }

    public CaseStatus getCaseStatus() {
        return caseStatus;
    }

    public ProgressStatus getProgressStatus() {
        return progressStatus;
    }

    public Instant getDeletedAt() {
        return deletedAt;
    }

    public boolean isClosed() {
        return caseStatus == CaseStatus.CLOSED;
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    static void requireCaseScope(DateField field) {
        if (field.isEntryScoped()) {
            throw new MalformedInputException("Field " + field.wireName() + " belongs to an RFI/RFE entry");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CaseDateFacts)) return false;
        CaseDateFacts that = (CaseDateFacts) o;
        return professionalOccupation == that.professionalOccupation
                && dates.equals(that.dates)
                && Objects.equals(employerName, that.employerName)
                && Objects.equals(beneficiaryIdentifier, that.beneficiaryIdentifier)
                && Objects.equals(positionTitle, that.positionTitle)
                && Objects.equals(sundayAdNewspaper, that.sundayAdNewspaper)
                && Objects.equals(jobOrderState, that.jobOrderState)
                && Objects.equals(recruitmentApplicantsCount, that.recruitmentApplicantsCount)
                && Objects.equals(eta9089CaseNumber, that.eta9089CaseNumber)
                && additionalRecruitmentMethods.equals(that.additionalRecruitmentMethods)
                && rfiEntries.equals(that.rfiEntries)
                && rfeEntries.equals(that.rfeEntries)
                && caseStatus == that.caseStatus
                && progressStatus == that.progressStatus
                && Objects.equals(deletedAt, that.deletedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dates, employerName, beneficiaryIdentifier, positionTitle, sundayAdNewspaper,
                jobOrderState, recruitmentApplicantsCount, eta9089CaseNumber, professionalOccupation,
                additionalRecruitmentMethods, rfiEntries, rfeEntries, caseStatus, progressStatus, deletedAt);
    }

    @Override
    public String toString() {
        return "CaseDateFacts{" +
                "caseStatus=" + caseStatus.wireName() +
                ", progressStatus=" + progressStatus.wireName() +
                ", professional=" + professionalOccupation +
                ", dates=" + dates +
                ", rfiEntries=" + rfiEntries.size() +
                ", rfeEntries=" + rfeEntries.size() +
                (deletedAt != null ? ", deletedAt=" + deletedAt : "") +
                '}';
    }

    /**
     * Builder for CaseDateFacts.
     */
    public static final class Builder {
        private final Map<DateField, LocalDate> dates = new EnumMap<>(DateField.class);
        private String employerName;
        private String beneficiaryIdentifier;
        private String positionTitle;
        private String sundayAdNewspaper;
        private String jobOrderState;
        private Integer recruitmentApplicantsCount;
        private String eta9089CaseNumber;
        private boolean professionalOccupation;
        private final List<RecruitmentMethodEntry> additionalRecruitmentMethods = new ArrayList<>();
        private final List<RfiEntry> rfiEntries = new ArrayList<>();
        private final List<RfeEntry> rfeEntries = new ArrayList<>();
        private CaseStatus caseStatus = CaseStatus.PWD;
        private ProgressStatus progressStatus = ProgressStatus.WORKING;
        private Instant deletedAt;

        private Builder() {
        }

        /**
         * Set or clear (null value) a case-scoped date.
         */
        public Builder date(DateField field, LocalDate value) {
            requireCaseScope(field);
            if (value == null) {
                dates.remove(field);
            } else {
                dates.put(field, value);
            }
            return this;
        }

        /**
         * Set or clear a case-scoped date from its ISO string form.
         */
        public Builder date(DateField field, String isoValue) {
            return date(field, IsoDates.parseOptional(isoValue));
        }

        public Builder employerName(String employerName) {
            this.employerName = employerName;
            return this;
        }

        public Builder beneficiaryIdentifier(String beneficiaryIdentifier) {
            this.beneficiaryIdentifier = beneficiaryIdentifier;
            return this;
        }

        public Builder positionTitle(String positionTitle) {
            this.positionTitle = positionTitle;
            return this;
        }

        public Builder sundayAdNewspaper(String sundayAdNewspaper) {
            this.sundayAdNewspaper = sundayAdNewspaper;
            return this;
        }

        public Builder jobOrderState(String jobOrderState) {
            this.jobOrderState = jobOrderState;
            return this;
        }

        public Builder recruitmentApplicantsCount(Integer recruitmentApplicantsCount) {
            this.recruitmentApplicantsCount = recruitmentApplicantsCount;
            return this;
        }

        public Builder eta9089CaseNumber(String eta9089CaseNumber) {
            this.eta9089CaseNumber = eta9089CaseNumber;
            return this;
        }

        public Builder professionalOccupation(boolean professionalOccupation) {
            this.professionalOccupation = professionalOccupation;
            return this;
        }

        public Builder additionalRecruitmentMethod(RecruitmentMethodEntry entry) {
            this.additionalRecruitmentMethods.add(Objects.requireNonNull(entry, "entry"));
            return this;
        }

        public Builder additionalRecruitmentMethods(List<RecruitmentMethodEntry> entries) {
            this.additionalRecruitmentMethods.clear();
            this.additionalRecruitmentMethods.addAll(entries);
            return this;
        }

        public Builder rfiEntry(RfiEntry entry) {
            this.rfiEntries.add(Objects.requireNonNull(entry, "entry"));
            return this;
        }

        public Builder rfiEntries(List<RfiEntry> entries) {
            this.rfiEntries.clear();
            this.rfiEntries.addAll(entries);
            return this;
        }

        public Builder rfeEntry(RfeEntry entry) {
            this.rfeEntries.add(Objects.requireNonNull(entry, "entry"));
            return this;
        }

        public Builder rfeEntries(List<RfeEntry> entries) {
            this.rfeEntries.clear();
            this.rfeEntries.addAll(entries);
            return this;
        }

        public Builder caseStatus(CaseStatus caseStatus) {
            this.caseStatus = Objects.requireNonNull(caseStatus, "caseStatus");
            return this;
        }

        public Builder progressStatus(ProgressStatus progressStatus) {
            this.progressStatus = Objects.requireNonNull(progressStatus, "progressStatus");
            return this;
        }

        public Builder deletedAt(Instant deletedAt) {
            this.deletedAt = deletedAt;
            return this;
        }

        public CaseDateFacts build() {
            return new CaseDateFacts(this);
        }
    }
}
