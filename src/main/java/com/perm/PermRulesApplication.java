package com.perm;

import com.perm.deadline.ExtractedDeadline;
import com.perm.model.CaseDateFacts;
import com.perm.model.CaseFactsFactory;
import com.perm.model.DateField;
import com.perm.model.FieldChange;
import com.perm.spring.EnablePermRules;
import com.perm.validation.ValidationIssue;
import com.perm.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.time.LocalDate;

/**
 * Example Spring Boot application demonstrating the rules engine.
 */
@SpringBootApplication
@EnablePermRules
public class PermRulesApplication {

    private static final Logger log = LoggerFactory.getLogger(PermRulesApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(PermRulesApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(PermRulesEngine engine) {
        return args -> {
            log.info("=== PERM Rules Demo Started ===");

            String json = """
                {
                    "employerName": "Acme Corp",
                    "positionTitle": "Software Engineer",
                    "pwdFilingDate": "2023-11-01",
                    "sundayAdFirstDate": "2024-02-04",
                    "sundayAdSecondDate": "2024-02-11",
                    "sundayAdNewspaper": "The Daily Herald",
                    "jobOrderStartDate": "2024-02-01",
                    "jobOrderEndDate": "2024-03-02",
                    "jobOrderState": "CA",
                    "noticeOfFilingStartDate": "2024-02-01",
                    "noticeOfFilingEndDate": "2024-02-15"
                }
                """;
            CaseDateFacts facts = CaseFactsFactory.fromJson(json);

            // Recording the determination derives the expiration date
            facts = engine.applyCascade(facts, FieldChange.of(DateField.PWD_DETERMINATION_DATE, LocalDate.of(2024, 1, 15)));
            log.info("PWD expires on {}", facts.date(DateField.PWD_EXPIRATION_DATE));

            log.info("ETA 9089 filing constraint: {}", engine.resolveConstraints(DateField.ETA9089_FILING_DATE, facts));

            ValidationResult result = engine.validateCaseForm(facts);
            log.info("Valid: {} ({} errors, {} warnings)", result.isValid(),
                    result.getErrors().size(), result.getWarnings().size());
            for (ValidationIssue issue : result.getErrors()) {
                log.info("  {} {}: {}", issue.ruleId(), issue.field(), issue.message());
            }

            LocalDate today = LocalDate.of(2024, 3, 15);
            log.info("Status as of {}: {}", today, engine.calculateAutoStatus(facts, today));
            for (ExtractedDeadline deadline : engine.extractActiveDeadlines(facts, today)) {
                log.info("  {} on {} ({} days)", deadline.label(), deadline.date(), deadline.daysUntil());
            }

            log.info("=== PERM Rules Demo Finished ===");
        };
    }
}
