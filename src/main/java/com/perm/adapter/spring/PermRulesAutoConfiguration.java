package com.perm.adapter.spring;

import com.perm.PermRulesEngine;
import com.perm.cascade.CascadeEngine;
import com.perm.cascade.CascadeRules;
import com.perm.cascade.DefaultCascadeEngine;
import com.perm.config.ConfigLoader;
import com.perm.config.RulesConfig;
import com.perm.constraint.ConstraintResolver;
import com.perm.constraint.DefaultConstraintResolver;
import com.perm.constraint.FilingWindowCalculator;
import com.perm.constraint.RecruitmentTimeline;
import com.perm.dates.DateArithmetic;
import com.perm.dates.FederalHolidayCalendar;
import com.perm.deadline.DeadlineActivationEngine;
import com.perm.deadline.DeadlineExtractor;
import com.perm.deadline.DeadlineScreening;
import com.perm.deadline.DefaultDeadlineActivationEngine;
import com.perm.status.AutoStatusCalculator;
import com.perm.status.RecruitmentCompleteness;
import com.perm.validation.CaseValidator;
import com.perm.validation.DefaultCaseValidator;
import com.perm.validation.ValidationRuleFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for the PERM rules engine.
 */
@Configuration
@ConditionalOnProperty(prefix = "perm", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(PermRulesProperties.class)
public class PermRulesAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PermRulesAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public RulesConfig rulesConfig(PermRulesProperties properties) {
        log.info("Loading PERM rules configuration from: {}", properties.getConfigPath());
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public DateArithmetic dateArithmetic(RulesConfig config) {
        return new DateArithmetic(new FederalHolidayCalendar(config.extraHolidays()));
    }

    @Bean
    @ConditionalOnMissingBean
    public RecruitmentTimeline recruitmentTimeline(DateArithmetic arithmetic, RulesConfig config) {
        return new RecruitmentTimeline(arithmetic, config);
    }

    @Bean
    @ConditionalOnMissingBean
    public FilingWindowCalculator filingWindowCalculator(RecruitmentTimeline timeline, RulesConfig config) {
        return new FilingWindowCalculator(timeline, config);
    }

    @Bean
    @ConditionalOnMissingBean
    public CascadeEngine cascadeEngine(DateArithmetic arithmetic, RulesConfig config) {
        log.info("Creating CascadeEngine");
        return new DefaultCascadeEngine(CascadeRules.standard(arithmetic, config));
    }

    @Bean
    @ConditionalOnMissingBean
    public ConstraintResolver constraintResolver(DateArithmetic arithmetic, RecruitmentTimeline timeline,
                                                 RulesConfig config) {
        log.info("Creating ConstraintResolver");
        return new DefaultConstraintResolver(arithmetic, timeline, config);
    }

    @Bean
    @ConditionalOnMissingBean
    public CaseValidator caseValidator(DateArithmetic arithmetic, RecruitmentTimeline timeline, RulesConfig config) {
        log.info("Creating CaseValidator");
        return new DefaultCaseValidator(new ValidationRuleFactory(arithmetic, timeline, config).createAll());
    }

    @Bean
    @ConditionalOnMissingBean
    public DeadlineActivationEngine deadlineActivationEngine() {
        log.info("Creating DeadlineActivationEngine");
        return new DefaultDeadlineActivationEngine();
    }

    @Bean
    @ConditionalOnMissingBean
    public DeadlineExtractor deadlineExtractor(DeadlineActivationEngine activationEngine,
                                               FilingWindowCalculator filingWindow, RecruitmentTimeline timeline) {
        return new DeadlineExtractor(activationEngine, filingWindow, timeline);
    }

    @Bean
    @ConditionalOnMissingBean
    public DeadlineScreening deadlineScreening(DeadlineActivationEngine activationEngine, DeadlineExtractor extractor) {
        return new DeadlineScreening(activationEngine, extractor);
    }

    @Bean
    @ConditionalOnMissingBean
    public RecruitmentCompleteness recruitmentCompleteness(RulesConfig config) {
        return new RecruitmentCompleteness(config);
    }

    @Bean
    @ConditionalOnMissingBean
    public AutoStatusCalculator autoStatusCalculator(RecruitmentCompleteness completeness,
                                                     FilingWindowCalculator filingWindow) {
        return new AutoStatusCalculator(completeness, filingWindow);
    }

    @Bean
    @ConditionalOnMissingBean
    public PermRulesEngine permRulesEngine(RulesConfig config, DateArithmetic arithmetic, CascadeEngine cascadeEngine,
                                           ConstraintResolver constraintResolver, CaseValidator validator,
                                           DeadlineActivationEngine activationEngine,
                                           FilingWindowCalculator filingWindow, DeadlineExtractor extractor,
                                           RecruitmentCompleteness completeness,
                                           AutoStatusCalculator autoStatusCalculator) {
        log.info("Creating PermRulesEngine");
        return new PermRulesEngine(config, arithmetic, cascadeEngine, constraintResolver, validator,
                activationEngine, filingWindow, extractor, completeness, autoStatusCalculator);
    }
}
