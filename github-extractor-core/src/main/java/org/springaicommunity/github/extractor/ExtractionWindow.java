package org.springaicommunity.github.extractor;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Optional {@code (since, until)} bound on an extraction scope.
 *
 * <p>
 * Both bounds absent means "all time": no implicit cutoff is applied anywhere. Bounds
 * are inclusive.
 *
 * @param since lower bound, or null
 * @param until upper bound, or null
 */
public record ExtractionWindow(@Nullable OffsetDateTime since, @Nullable OffsetDateTime until) {

	private static final ExtractionWindow UNBOUNDED = new ExtractionWindow(null, null);

	public ExtractionWindow {
		if (since != null && until != null && since.isAfter(until)) {
			throw new ExtractionValidationException("Window start " + since + " is after window end " + until);
		}
	}

	public static ExtractionWindow unbounded() {
		return UNBOUNDED;
	}

	/**
	 * Parse window bounds given as {@code YYYY-MM-DD} (UTC midnight) or a full ISO-8601
	 * date-time. Blank values mean "no bound".
	 * @throws ExtractionValidationException for any other format
	 */
	public static ExtractionWindow parse(@Nullable String since, @Nullable String until) {
		return new ExtractionWindow(parseBound(since), parseBound(until));
	}

	@Nullable
	static OffsetDateTime parseBound(@Nullable String raw) {
		if (raw == null || raw.isBlank()) {
			return null;
		}
		String value = raw.trim();
		try {
			if (value.length() == 10) {
				return LocalDate.parse(value).atStartOfDay().atOffset(ZoneOffset.UTC);
			}
			try {
				return OffsetDateTime.parse(value);
			}
			catch (DateTimeParseException e) {
				return LocalDateTime.parse(value).atOffset(ZoneOffset.UTC);
			}
		}
		catch (DateTimeParseException e) {
			throw new ExtractionValidationException("Invalid date format: " + value + ". Use YYYY-MM-DD or full ISO.");
		}
	}

	public boolean isUnbounded() {
		return since == null && until == null;
	}

	public boolean isFullyBounded() {
		return since != null && until != null;
	}

	public boolean contains(OffsetDateTime instant) {
		if (since != null && instant.isBefore(since)) {
			return false;
		}
		return until == null || !instant.isAfter(until);
	}

	/**
	 * Lower bound as a GitHub API timestamp ({@code 2024-01-01T00:00:00Z}), or null.
	 */
	@Nullable
	public String sinceParam() {
		return since != null ? DateTimeFormatter.ISO_INSTANT.format(since.toInstant()) : null;
	}

	@Nullable
	public String untilParam() {
		return until != null ? DateTimeFormatter.ISO_INSTANT.format(until.toInstant()) : null;
	}

	public String describe() {
		if (isUnbounded()) {
			return "ALL TIME (no date window)";
		}
		return (since != null ? sinceParam() : "-inf") + "  ->  " + (until != null ? untilParam() : "+inf");
	}

}
