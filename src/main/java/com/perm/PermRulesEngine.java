package com.perm;

import com.perm.cascade.CascadeEngine;
import com.perm.cascade.CascadeRules;
import com.perm.cascade.DefaultCascadeEngine;
import com.perm.config.RulesConfig;
import com.perm.constraint.ConstraintResolver;
import com.perm.constraint.DateConstraint;
import com.perm.constraint.DefaultConstraintResolver;
import com.perm.constraint.FilingWindow;
import com.perm.constraint.FilingWindowCalculator;
import com.perm.constraint.FilingWindowStatus;
import com.perm.constraint.RecruitmentTimeline;
import com.perm.constraint.ResolveOptions;
import com.perm.dates.DateArithmetic;
import com.perm.dates.FederalHolidayCalendar;
import com.perm.deadline.DeadlineActivationEngine;
import com.perm.deadline.DeadlineExtractor;
import com.perm.deadline.DeadlineStatus;
import com.perm.deadline.DeadlineType;
import com.perm.deadline.DefaultDeadlineActivationEngine;
import com.perm.deadline.ExtractedDeadline;
import com.perm.model.CaseDateFacts;
import com.perm.model.DateField;
import com.perm.model.FieldChange;
import com.perm.model.RfeEntry;
import com.perm.model.RfiEntry;
import com.perm.status.AutoStatus;
import com.perm.status.AutoStatusCalculator;
import com.perm.status.RecruitmentCompleteness;
import com.perm.validation.CaseValidator;
import com.perm.validation.DefaultCaseValidator;
import com.perm.validation.ValidationResult;
import com.perm.validation.ValidationRuleFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Single entry point over the PERM deadline rules.
 * <p>
 * All operations are pure functions of their inputs; the engine holds only immutable
 * configuration and is safe to share between threads.
 *
 * <pre>
 * PermRulesEngine engine = PermRulesEngine.defaults();
 * CaseDateFacts updated = engine.applyCascade(facts, FieldChange.of(DateField.PWD_DETERMINATION_DATE, date));
 * ValidationResult result = engine.validateCaseForm(updated);
 * </pre>
 */
public class PermRulesEngine {

    private static final Logger log = LoggerFactory.getLogger(PermRulesEngine.class);

    private final RulesConfig config;
    private final DateArithmetic arithmetic;
    private final CascadeEngine cascadeEngine;
    private final ConstraintResolver constraintResolver;
    private final CaseValidator validator;
    private final DeadlineActivationEngine activationEngine;
    private final FilingWindowCalculator filingWindow;
    private final DeadlineExtractor deadlineExtractor;
    private final RecruitmentCompleteness recruitmentCompleteness;
    private final AutoStatusCalculator autoStatusCalculator;

    public PermRulesEngine(RulesConfig config, DateArithmetic arithmetic, CascadeEngine cascadeEngine,
                           ConstraintResolver constraintResolver, CaseValidator validator,
                           DeadlineActivationEngine activationEngine, FilingWindowCalculator filingWindow,
                           DeadlineExtractor deadlineExtractor, RecruitmentCompleteness recruitmentCompleteness,
                           AutoStatusCalculator autoStatusCalculator) {
        this.config = config;
        this.arithmetic = arithmetic;
        this.cascadeEngine = cascadeEngine;
        this.constraintResolver = constraintResolver;
        this.validator = validator;
        this.activationEngine = activationEngine;
        this.filingWindow = filingWindow;
        this.deadlineExtractor = deadlineExtractor;
        this.recruitmentCompleteness = recruitmentCompleteness;
        this.autoStatusCalculator = autoStatusCalculator;
    }

    /**
     * Wire every component from one configuration.
     */
    public static PermRulesEngine create(RulesConfig config) {
        DateArithmetic arithmetic = new DateArithmetic(new FederalHolidayCalendar(config.extraHolidays()));
        RecruitmentTimeline timeline = new RecruitmentTimeline(arithmetic, config);
        FilingWindowCalculator filingWindow = new FilingWindowCalculator(timeline, config);
        DeadlineActivationEngine activation = new DefaultDeadlineActivationEngine();
        RecruitmentCompleteness completeness = new RecruitmentCompleteness(config);
        PermRulesEngine engine = new PermRulesEngine(
                config,
                arithmetic,
                new DefaultCascadeEngine(CascadeRules.standard(arithmetic, config)),
                new DefaultConstraintResolver(arithmetic, timeline, config),
                new DefaultCaseValidator(new ValidationRuleFactory(arithmetic, timeline, config).createAll()),
                activation,
                filingWindow,
                new DeadlineExtractor(activation, filingWindow, timeline),
                completeness,
                new AutoStatusCalculator(completeness, filingWindow));
        log.info("PERM rules engine created");
        return engine;
    }

    public static PermRulesEngine defaults() {
        return create(RulesConfig.defaults());
    }

    // ==================== Cascade ====================

    public CaseDateFacts applyCascade(CaseDateFacts facts, FieldChange change) {
        return cascadeEngine.applyCascade(facts, change);
    }

    public CaseDateFacts applyCascadeMultiple(CaseDateFacts facts, List<FieldChange> changes) {
        return cascadeEngine.applyCascadeMultiple(facts, changes);
    }

    // ==================== Constraints ====================

    public DateConstraint resolveConstraints(DateField field, CaseDateFacts facts) {
        return constraintResolver.resolveConstraints(field, facts);
    }

    public DateConstraint resolveConstraints(String field, CaseDateFacts facts) {
        return constraintResolver.resolveConstraints(field, facts);
    }

    public DateConstraint resolveConstraints(DateField field, CaseDateFacts facts, ResolveOptions options) {
        return constraintResolver.resolveConstraints(field, facts, options);
    }

    public Optional<FilingWindow> calculateFilingWindow(CaseDateFacts facts) {
        return filingWindow.calculate(facts);
    }

    public FilingWindowStatus filingWindowStatus(CaseDateFacts facts, LocalDate referenceDate) {
        return filingWindow.status(facts, referenceDate);
    }

    // ==================== Validation ====================

    public ValidationResult validateCaseForm(CaseDateFacts facts) {
        return validator.validateCaseForm(facts);
    }

    // ==================== Deadlines ====================

    public DeadlineStatus isDeadlineActive(DeadlineType type, CaseDateFacts facts) {
        return activationEngine.isDeadlineActive(type, facts);
    }

    public DeadlineStatus isDeadlineActive(String type, CaseDateFacts facts) {
        return activationEngine.isDeadlineActive(type, facts);
    }

    public Optional<RfiEntry> getActiveRfiEntry(List<RfiEntry> entries) {
        return activationEngine.getActiveRfiEntry(entries);
    }

    public Optional<RfeEntry> getActiveRfeEntry(List<RfeEntry> entries) {
        return activationEngine.getActiveRfeEntry(entries);
    }

    public boolean hasAnyActiveDeadline(CaseDateFacts facts) {
        return activationEngine.hasAnyActiveDeadline(facts);
    }

    public List<ExtractedDeadline> extractActiveDeadlines(CaseDateFacts facts, LocalDate today) {
        return deadlineExtractor.extractActiveDeadlines(facts, today);
    }

    public boolean shouldRemind(DeadlineType type, CaseDateFacts facts) {
        return deadlineExtractor.shouldRemind(type, facts);
    }

    // ==================== Status ====================

    public boolean isRecruitmentComplete(CaseDateFacts facts) {
        return recruitmentCompleteness.isComplete(facts);
    }

    public AutoStatus calculateAutoStatus(CaseDateFacts facts, LocalDate asOf) {
        return autoStatusCalculator.calculate(facts, asOf);
    }

    public RulesConfig getConfig() {
        return config;
    }

    public DateArithmetic getDateArithmetic() {
        return arithmetic;
    }
}
