package org.springaicommunity.github.extractor;

import org.jspecify.annotations.Nullable;

/**
 * Redacts bearer credentials for audit records and logs.
 *
 * <p>
 * Credentials longer than 8 characters keep their first and last 4 characters around a
 * fixed {@code ****}; shorter ones are replaced entirely, so the mask never reveals the
 * length or any character of a short credential.
 */
public final class CredentialMasker {

	static final String MASK = "****";

	static final String FULL_MASK = "********";

	private static final int VISIBLE = 4;

	private CredentialMasker() {
	}

	public static String mask(@Nullable String credential) {
		if (credential == null || credential.isEmpty()) {
			return "";
		}
		if (credential.length() <= 2 * VISIBLE) {
			return FULL_MASK;
		}
		return credential.substring(0, VISIBLE) + MASK + credential.substring(credential.length() - VISIBLE);
	}

}
