package com.ryuqq.provisioner.core.model;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Stable per-deployment token from which every suffixed resource name is derived.
 *
 * <p>A RunSuffix is generated once, when no deployment record exists yet, and is then
 * persisted and reused by every resumed run. It is never regenerated while the record
 * exists, so repeated applies target the same physical resources.</p>
 *
 * <p><strong>Format:</strong> {@code yyyyMMdd-xxxxxxxx} (date + 8 lowercase hex chars),
 * e.g. {@code 20240101-abcd1234}.</p>
 *
 * <p><strong>Immutability:</strong> value cannot change after construction.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class RunSuffix {

    private static final Pattern FORMAT = Pattern.compile("^\\d{8}-[0-9a-f]{8}$");
    private static final DateTimeFormatter DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final String value;

    private RunSuffix(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("RunSuffix cannot be null or blank");
        }
        if (!FORMAT.matcher(value).matches()) {
            throw new IllegalArgumentException(
                "RunSuffix must match yyyyMMdd-xxxxxxxx (current: " + value + ")");
        }
        this.value = value;
    }

    /**
     * Restores a RunSuffix from its persisted form.
     *
     * @param value persisted value
     * @return RunSuffix
     * @throws IllegalArgumentException if the value is blank or malformed
     */
    public static RunSuffix of(String value) {
        return new RunSuffix(value);
    }

    /**
     * Generates a fresh RunSuffix for a new deployment.
     *
     * @param clock clock used for the date part
     * @return new RunSuffix
     */
    public static RunSuffix generate(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        String date = LocalDate.now(clock).format(DATE);
        String token = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        return new RunSuffix(date + "-" + token);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RunSuffix that = (RunSuffix) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
