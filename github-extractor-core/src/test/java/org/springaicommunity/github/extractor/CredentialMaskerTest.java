package org.springaicommunity.github.extractor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CredentialMasker Tests")
class CredentialMaskerTest {

	@Test
	@DisplayName("Should keep the first and last four characters of a long credential")
	void shouldKeepEdgesOfLongCredential() {
		String masked = CredentialMasker.mask("ghp_ABCDEFGHIJKLMNOP");

		assertThat(masked).isEqualTo("ghp_****MNOP");
		assertThat(masked).doesNotContain("ABCDEFGH");
	}

	@ParameterizedTest
	@ValueSource(strings = { "a", "12345", "abcdefgh" })
	@DisplayName("Should reveal nothing of a credential of eight characters or fewer")
	void shouldFullyMaskShortCredential(String credential) {
		String masked = CredentialMasker.mask(credential);

		assertThat(masked).isEqualTo(CredentialMasker.FULL_MASK);
		for (char c : credential.toCharArray()) {
			assertThat(masked).doesNotContain(String.valueOf(c));
		}
	}

	@Test
	@DisplayName("Should mask empty and absent credentials as empty")
	void shouldMaskEmptyAsEmpty() {
		assertThat(CredentialMasker.mask("")).isEmpty();
		assertThat(CredentialMasker.mask(null)).isEmpty();
	}

}
