package com.perm.config;

import com.perm.dates.IsoDates;
import com.perm.exception.ConfigurationException;
import com.perm.exception.MalformedDateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;

/**
 * Loads rules configuration from YAML files.
 * Missing keys fall back to {@link RulesConfig#defaults()}.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static RulesConfig load(String path) {
        log.info("Loading PERM rules configuration from: {}", path);

        Resource resource = getResource(path);
        if (!resource.exists()) {
            throw new ConfigurationException("Configuration file not found: " + path);
        }
        try (InputStream inputStream = resource.getInputStream()) {
            return parse(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    /**
     * Parse configuration from an already opened YAML stream.
     */
    @SuppressWarnings("unchecked")
    public static RulesConfig parse(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Map<String, Object> root;
        try {
            root = yaml.load(inputStream);
        } catch (RuntimeException e) {
            throw new ConfigurationException("Configuration is not valid YAML: " + e.getMessage(), e);
        }

        if (root == null) {
            throw new ConfigurationException("Configuration file is empty");
        }

        // The rules section may sit at root or under 'perm'
        Map<String, Object> permConfig = root.containsKey("perm")
                ? (Map<String, Object>) root.get("perm")
                : root;

        RulesConfig defaults = RulesConfig.defaults();
        Map<String, Object> window = section(permConfig, "filing-window");
        Map<String, Object> recruitment = section(permConfig, "recruitment");
        Map<String, Object> validity = section(permConfig, "validity");
        Map<String, Object> holidays = section(permConfig, "holidays");

        RulesConfig config = new RulesConfig(
                getInt(window, "wait-days", defaults.filingWindowWaitDays()),
                getInt(window, "close-days", defaults.filingWindowCloseDays()),
                getInt(recruitment, "window-days", defaults.recruitmentWindowDays()),
                getInt(recruitment, "pwd-buffer-days", defaults.pwdRecruitmentBufferDays()),
                getInt(recruitment, "job-order-start-deadline-days", defaults.jobOrderStartDeadlineDays()),
                getInt(recruitment, "job-order-pwd-buffer-days", defaults.jobOrderPwdBufferDays()),
                getInt(recruitment, "first-sunday-ad-deadline-days", defaults.firstSundayAdDeadlineDays()),
                getInt(recruitment, "first-sunday-ad-pwd-buffer-days", defaults.firstSundayAdPwdBufferDays()),
                getInt(recruitment, "sunday-ad-gap-days", defaults.sundayAdGapDays()),
                getInt(recruitment, "job-order-min-days", defaults.jobOrderMinDays()),
                getInt(recruitment, "notice-min-business-days", defaults.noticeMinBusinessDays()),
                getInt(validity, "pwd-years", defaults.pwdValidityYears()),
                getInt(validity, "eta9089-days", defaults.eta9089ValidityDays()),
                getInt(validity, "rfi-response-days", defaults.rfiResponseDays()),
                getInt(recruitment, "min-professional-methods", defaults.minProfessionalMethods()),
                parseHolidays(holidays.get("extra"))
        );

        validate(config);

        log.info("Loaded PERM rules configuration: filing window {}/{} days, recruitment window {} days, {} extra holidays",
                config.filingWindowWaitDays(), config.filingWindowCloseDays(),
                config.recruitmentWindowDays(), config.extraHolidays().size());

        return config;
    }

    private static void validate(RulesConfig config) {
        requirePositive("filing-window.wait-days", config.filingWindowWaitDays());
        requirePositive("filing-window.close-days", config.filingWindowCloseDays());
        requirePositive("recruitment.window-days", config.recruitmentWindowDays());
        requirePositive("recruitment.job-order-min-days", config.jobOrderMinDays());
        requirePositive("recruitment.notice-min-business-days", config.noticeMinBusinessDays());
        requirePositive("validity.pwd-years", config.pwdValidityYears());
        requirePositive("validity.eta9089-days", config.eta9089ValidityDays());
        requirePositive("validity.rfi-response-days", config.rfiResponseDays());
        if (config.filingWindowWaitDays() >= config.filingWindowCloseDays()) {
            throw new ConfigurationException("filing-window.wait-days must be smaller than filing-window.close-days");
        }
        if (config.minProfessionalMethods() < 0 || config.pwdRecruitmentBufferDays() < 0
                || config.jobOrderPwdBufferDays() < 0 || config.firstSundayAdPwdBufferDays() < 0
                || config.sundayAdGapDays() < 0) {
            throw new ConfigurationException("Recruitment buffers and counts must not be negative");
        }
    }

    private static void requirePositive(String key, int value) {
        if (value <= 0) {
            throw new ConfigurationException(key + " must be positive, got " + value);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map)) {
            throw new ConfigurationException("Section '" + key + "' must be a mapping");
        }
        return (Map<String, Object>) value;
    }

    private static List<LocalDate> parseHolidays(Object value) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            throw new ConfigurationException("holidays.extra must be a list of dates");
        }
        List<LocalDate> result = new ArrayList<>();
        for (Object item : (List<?>) value) {
            result.add(toDate(item));
        }
        return result;
    }

    private static LocalDate toDate(Object item) {
        // SnakeYAML resolves unquoted YYYY-MM-DD to a timestamp at UTC midnight
        if (item instanceof Date) {
            return ((Date) item).toInstant().atZone(ZoneOffset.UTC).toLocalDate();
        }
        try {
            return IsoDates.parse(String.valueOf(item));
        } catch (MalformedDateException e) {
            throw new ConfigurationException("Invalid holiday date: " + item, e);
        }
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Value of '" + key + "' is not a number: " + value, e);
        }
    }
}
