package org.springaicommunity.github.extractor;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Typed access to the loosely typed argument map of a submission.
 *
 * <p>
 * Values arrive as decoded JSON: strings, booleans, numbers or lists. Blank strings are
 * treated as absent.
 */
final class ExtractionArgs {

	private static final Pattern GITHUB_NAME = Pattern.compile("[A-Za-z0-9._-]+");

	private final Map<String, ?> values;

	ExtractionArgs(Map<String, ?> values) {
		this.values = values;
	}

	String required(String key) {
		String value = optional(key);
		if (value == null) {
			throw new ExtractionValidationException("'" + key + "' is required");
		}
		return value;
	}

	/**
	 * A required owner or repository name. Names end up in API paths and output file
	 * names, so only GitHub's name characters are allowed and {@code .}/{@code ..} are
	 * refused.
	 */
	String name(String key) {
		return checkName(key, required(key));
	}

	@Nullable
	String optional(String key) {
		Object value = values.get(key);
		if (value == null) {
			return null;
		}
		String text = value.toString().trim();
		return text.isEmpty() ? null : text;
	}

	boolean flag(String key, boolean defaultValue) {
		Object value = values.get(key);
		if (value instanceof Boolean bool) {
			return bool;
		}
		String text = optional(key);
		if (text == null) {
			return defaultValue;
		}
		if ("true".equalsIgnoreCase(text)) {
			return true;
		}
		if ("false".equalsIgnoreCase(text)) {
			return false;
		}
		throw new ExtractionValidationException("'" + key + "' must be true or false, got: " + text);
	}

	/**
	 * Repository names given either as a list or as one comma- and/or space-separated
	 * string.
	 * @throws ExtractionValidationException if no name is given or a name is not a valid
	 * GitHub repository name
	 */
	List<String> repositories(String key) {
		Object value = values.get(key);
		List<String> names = new ArrayList<>();
		if (value instanceof Collection<?> collection) {
			for (Object item : collection) {
				if (item != null) {
					names.addAll(split(item.toString()));
				}
			}
		}
		else if (value != null) {
			names.addAll(split(value.toString()));
		}
		if (names.isEmpty()) {
			throw new ExtractionValidationException("'" + key + "' is required");
		}
		names.forEach(name -> checkName(key, name));
		return List.copyOf(names);
	}

	static String checkName(String key, String name) {
		if (!GITHUB_NAME.matcher(name).matches() || name.equals(".") || name.equals("..")) {
			throw new ExtractionValidationException("Invalid name in '" + key + "': " + name);
		}
		return name;
	}

	private static List<String> split(String raw) {
		return Arrays.stream(raw.replace(',', ' ').trim().split("\\s+")).filter(s -> !s.isEmpty()).toList();
	}

}
